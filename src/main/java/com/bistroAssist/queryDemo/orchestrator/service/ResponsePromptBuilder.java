package com.bistroAssist.queryDemo.orchestrator.service;

import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import com.bistroAssist.queryDemo.context.model.ContextBundle;
import com.bistroAssist.queryDemo.context.model.ContextMatch;
import com.bistroAssist.queryDemo.context.model.ConversationTurn;
import com.bistroAssist.queryDemo.context.model.TurnRole;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.llm.dto.ChatMessage;
import com.bistroAssist.queryDemo.orchestrator.model.OrchestrationState;
import com.bistroAssist.queryDemo.orchestrator.prompt.AnswerSystemPrompt;
import com.bistroAssist.queryDemo.rules.model.RuleAction;
import com.bistroAssist.queryDemo.rules.model.RuleActionType;
import com.bistroAssist.queryDemo.rules.model.RuleEvaluationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the chat messages for answer generation.
 * 
 * Message order: system prompt (business facts, matched content, intent, rule instructions),
 * then the conversation history, then the customer's query.
 */
@Component
public class ResponsePromptBuilder {

    public List<ChatMessage> buildMessages(OrchestrationState state) {
        ContextBundle bundle = state.getContextBundle() != null ? state.getContextBundle() : ContextBundle.empty();
        RuleEvaluationResult rules = state.getRuleResult() != null ? state.getRuleResult() : RuleEvaluationResult.empty();

        List<ChatMessage> messages = new ArrayList<>();
        BusinessFacts facts = bundle.getBusinessFacts() != null ? bundle.getBusinessFacts() : state.getBusinessFacts();
        messages.add(ChatMessage.system(buildSystemPrompt(bundle, facts, state.getIntentResult(), rules)));
        for (ConversationTurn turn : bundle.getConversationHistory()) {
            messages.add(turn.role() == TurnRole.USER
                    ? ChatMessage.user(turn.content())
                    : ChatMessage.assistant(turn.content()));
        }
        messages.add(ChatMessage.user(state.getQueryText()));
        return messages;
    }

    String buildSystemPrompt(ContextBundle bundle, BusinessFacts facts, IntentResult intent, RuleEvaluationResult rules) {
        StringBuilder prompt = new StringBuilder(AnswerSystemPrompt.SYSTEM_PROMPT
                .replace("{business_name}", facts != null && facts.getName() != null ? facts.getName() : "this business")
                .replace("{business_type}", describeType(facts))
                .replace("{business_description}", facts != null && facts.getDescription() != null
                        ? facts.getDescription() : "its products and services"));

        if (facts != null) {
            prompt.append(AnswerSystemPrompt.BUSINESS_SECTION.replace("{business_info}", formatFacts(facts)));
        }
        if (bundle.totalMatches() > 0) {
            prompt.append(AnswerSystemPrompt.CONTEXT_SECTION.replace("{context}", formatMatches(bundle)));
        }
        if (intent != null) {
            prompt.append(AnswerSystemPrompt.INTENT_SECTION
                    .replace("{intent}", intent.getIntent().name())
                    .replace("{confidence}", String.format(Locale.ROOT, "%.2f", intent.getConfidence())));
        }

        String style = formatStyle(rules);
        if (!style.isEmpty()) {
            prompt.append(AnswerSystemPrompt.STYLE_SECTION.replace("{style}", style));
        }
        rules.firstAction(RuleActionType.APPLY_TEMPLATE)
                .map(action -> action.parameterAsText("template"))
                .ifPresent(template -> prompt.append(AnswerSystemPrompt.TEMPLATE_SECTION.replace("{template}", template)));
        return prompt.toString();
    }

    private static String describeType(BusinessFacts facts) {
        if (facts == null) {
            return "local";
        }
        if (facts.getCuisine() != null) {
            return facts.getCuisine() + " " + (facts.getIndustry() != null ? facts.getIndustry() : "restaurant");
        }
        return facts.getIndustry() != null ? facts.getIndustry() : "local";
    }

    private static String formatFacts(BusinessFacts facts) {
        List<String> lines = new ArrayList<>();
        lines.add("Name: " + facts.getName());
        if (facts.getLocation() != null && !facts.getLocation().formatted().isEmpty()) {
            lines.add("Address: " + facts.getLocation().formatted());
            if (!facts.getLocation().getDeliveryAreas().isEmpty()) {
                lines.add("Delivery areas: " + String.join(", ", facts.getLocation().getDeliveryAreas()));
            }
        }
        if (facts.getPhone() != null) {
            lines.add("Phone: " + facts.getPhone());
        }
        if (facts.getWebsite() != null) {
            lines.add("Website: " + facts.getWebsite());
        }
        if (!facts.getOperatingHours().isEmpty()) {
            StringBuilder hours = new StringBuilder("Hours:");
            for (Map.Entry<String, String> entry : facts.getOperatingHours().entrySet()) {
                hours.append("\n  ").append(entry.getKey()).append(": ").append(entry.getValue());
            }
            lines.add(hours.toString());
        }
        if (!facts.getSpecials().isEmpty()) {
            lines.add("Current specials: " + String.join("; ", facts.getSpecials()));
        }
        if (facts.getCustomInstructions() != null) {
            lines.add("Special instructions: " + facts.getCustomInstructions());
        }
        return String.join("\n", lines);
    }

    private static String formatMatches(ContextBundle bundle) {
        StringBuilder context = new StringBuilder();
        appendMatches(context, "Menu", bundle.getMenuMatches());
        appendMatches(context, "Policies", bundle.getPolicyMatches());
        appendMatches(context, "FAQs", bundle.getFaqMatches());
        return context.toString().trim();
    }

    private static void appendMatches(StringBuilder context, String heading, List<? extends ContextMatch> matches) {
        if (matches.isEmpty()) {
            return;
        }
        context.append(heading).append(":\n");
        for (ContextMatch match : matches) {
            context.append("- ").append(match.title()).append(": ").append(match.snippet()).append('\n');
        }
    }

    private static String formatStyle(RuleEvaluationResult rules) {
        List<String> lines = new ArrayList<>();
        for (RuleAction action : rules.actionsOf(RuleActionType.SET_RESPONSE_STYLE)) {
            action.getParameters().forEach((key, value) -> lines.add("- " + key + ": " + value));
        }
        for (RuleAction action : rules.actionsOf(RuleActionType.MODIFY_CONTENT)) {
            String instruction = action.parameterAsText("instruction");
            if (instruction != null) {
                lines.add("- " + instruction);
            }
        }
        return String.join("\n", lines);
    }
}
