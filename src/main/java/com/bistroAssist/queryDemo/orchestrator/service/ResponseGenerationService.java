package com.bistroAssist.queryDemo.orchestrator.service;

import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import com.bistroAssist.queryDemo.llm.GenerationOptions;
import com.bistroAssist.queryDemo.llm.GenerationProvider;
import com.bistroAssist.queryDemo.llm.GenerationResult;
import com.bistroAssist.queryDemo.llm.GenerationStream;
import com.bistroAssist.queryDemo.orchestrator.model.GeneratedAnswer;
import com.bistroAssist.queryDemo.orchestrator.model.OrchestrationState;
import com.bistroAssist.queryDemo.rules.model.RuleAction;
import com.bistroAssist.queryDemo.rules.model.RuleActionType;
import com.bistroAssist.queryDemo.rules.model.RuleEvaluationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Response generation service - turns pipeline state into answer text.
 * 
 * Responsibilities:
 * - Call the generation provider with the assembled prompt (single shot or streamed)
 * - Short-circuit blocked answers without calling the provider
 * - Apply post-generation rule actions (content edits, escalation notice, disclaimers)
 * - Produce fallback answers when generation fails
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseGenerationService {

    static final String DEFAULT_REFUSAL =
            "I'm sorry, but I can't help with that request. Please contact us directly and our team will be happy to assist.";
    static final String ESCALATION_NOTICE =
            "I've flagged this conversation for a member of our team, who will follow up with you shortly.";

    private final GenerationProvider generationProvider;
    private final ResponsePromptBuilder promptBuilder;
    private final FallbackResponseCatalog fallbackCatalog;

    /**
     * Generates the answer for a single-shot query. Provider failures propagate to the caller.
     */
    public GeneratedAnswer generate(OrchestrationState state) {
        RuleEvaluationResult rules = rulesOf(state);
        if (rules.hasAction(RuleActionType.BLOCK_RESPONSE)) {
            log.info("Answer blocked by business rule - correlationId: {}", state.getCorrelationId());
            return blockedAnswer(rules);
        }
        GenerationResult result = generationProvider.complete(promptBuilder.buildMessages(state), GenerationOptions.defaults());
        return GeneratedAnswer.builder()
                .text(result.getText())
                .model(result.getModel())
                .promptTokens(result.getPromptTokens())
                .completionTokens(result.getCompletionTokens())
                .build();
    }

    /**
     * Opens a provider stream for the answer. The caller owns and must close the stream.
     */
    public GenerationStream openStream(OrchestrationState state) {
        return generationProvider.stream(promptBuilder.buildMessages(state), GenerationOptions.defaults());
    }

    public GeneratedAnswer blockedAnswer(RuleEvaluationResult rules) {
        String message = rules.firstAction(RuleActionType.BLOCK_RESPONSE)
                .map(action -> action.parameterAsText("message"))
                .filter(text -> !text.isBlank())
                .orElse(DEFAULT_REFUSAL);
        return GeneratedAnswer.builder()
                .text(message)
                .model(GeneratedAnswer.RULES_MODEL)
                .blocked(true)
                .build();
    }

    public GeneratedAnswer fallbackAnswer(OrchestrationState state) {
        QueryIntent intent = state.getIntentResult() != null ? state.getIntentResult().getIntent() : QueryIntent.UNKNOWN;
        BusinessFacts facts = state.getBusinessFacts() != null ? state.getBusinessFacts()
                : state.getContextBundle() != null ? state.getContextBundle().getBusinessFacts() : null;
        return GeneratedAnswer.builder()
                .text(fallbackCatalog.fallbackAnswer(intent, facts != null ? facts.getName() : null))
                .model(GeneratedAnswer.FALLBACK_MODEL)
                .fallback(true)
                .build();
    }

    /**
     * Applies content edits, the escalation notice and disclaimers to generated text.
     * Blocked answers are returned unchanged.
     */
    public String finalizeText(String text, GeneratedAnswer answer, RuleEvaluationResult rules) {
        if (answer != null && answer.isBlocked()) {
            return text;
        }
        return streamPrefix(rules) + text + streamSuffix(rules);
    }

    /**
     * Text to emit before the first generated chunk when streaming.
     */
    public String streamPrefix(RuleEvaluationResult rules) {
        StringBuilder prefix = new StringBuilder();
        for (RuleAction action : rules.actionsOf(RuleActionType.MODIFY_CONTENT)) {
            String prepend = action.parameterAsText("prepend");
            if (prepend != null && !prepend.isBlank()) {
                prefix.append(prepend).append(' ');
            }
        }
        return prefix.toString();
    }

    /**
     * Text to emit after the last generated chunk when streaming.
     */
    public String streamSuffix(RuleEvaluationResult rules) {
        StringBuilder suffix = new StringBuilder();
        for (RuleAction action : rules.actionsOf(RuleActionType.MODIFY_CONTENT)) {
            String append = action.parameterAsText("append");
            if (append != null && !append.isBlank()) {
                suffix.append(' ').append(append);
            }
        }
        if (rules.hasAction(RuleActionType.ESCALATE)) {
            String notice = rules.firstAction(RuleActionType.ESCALATE)
                    .map(action -> action.parameterAsText("message"))
                    .filter(message -> !message.isBlank())
                    .orElse(ESCALATION_NOTICE);
            suffix.append("\n\n").append(notice);
        }
        for (RuleAction action : rules.actionsOf(RuleActionType.ADD_DISCLAIMER)) {
            String disclaimer = action.parameterAsText("text");
            if (disclaimer != null && !disclaimer.isBlank()) {
                suffix.append("\n\n").append(disclaimer);
            }
        }
        return suffix.toString();
    }

    private static RuleEvaluationResult rulesOf(OrchestrationState state) {
        return state.getRuleResult() != null ? state.getRuleResult() : RuleEvaluationResult.empty();
    }
}
