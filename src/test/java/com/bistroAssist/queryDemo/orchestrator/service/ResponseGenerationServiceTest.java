package com.bistroAssist.queryDemo.orchestrator.service;

import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import com.bistroAssist.queryDemo.context.model.ContextBundle;
import com.bistroAssist.queryDemo.context.model.ConversationTurn;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import com.bistroAssist.queryDemo.llm.GenerationProvider;
import com.bistroAssist.queryDemo.llm.dto.ChatMessage;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryRequest;
import com.bistroAssist.queryDemo.orchestrator.model.GeneratedAnswer;
import com.bistroAssist.queryDemo.orchestrator.model.OrchestrationState;
import com.bistroAssist.queryDemo.rules.model.RuleAction;
import com.bistroAssist.queryDemo.rules.model.RuleActionType;
import com.bistroAssist.queryDemo.rules.model.RuleEvaluationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResponseGenerationServiceTest {

    @Mock
    private GenerationProvider generationProvider;

    private ResponsePromptBuilder promptBuilder;
    private ResponseGenerationService service;

    @BeforeEach
    void setUp() {
        promptBuilder = new ResponsePromptBuilder();
        service = new ResponseGenerationService(generationProvider, promptBuilder, new FallbackResponseCatalog());
    }

    @Test
    void contentEditsWrapTheGeneratedText() {
        RuleEvaluationResult rules = RuleEvaluationResult.builder()
                .appliedActions(List.of(
                        action(RuleActionType.MODIFY_CONTENT, Map.of("prepend", "Ciao!", "append", "Grazie.")),
                        action(RuleActionType.ADD_DISCLAIMER, Map.of("text", "Prices may change."))))
                .build();

        String text = service.finalizeText("We have lasagna.", GeneratedAnswer.builder().text("We have lasagna.").build(), rules);

        assertEquals("Ciao! We have lasagna. Grazie.\n\nPrices may change.", text);
    }

    @Test
    void blockedAnswerUsesDefaultRefusalAndIsNotEdited() {
        RuleEvaluationResult rules = RuleEvaluationResult.builder()
                .appliedActions(List.of(
                        action(RuleActionType.BLOCK_RESPONSE, Map.of()),
                        action(RuleActionType.ADD_DISCLAIMER, Map.of("text", "ignored"))))
                .build();

        GeneratedAnswer blocked = service.blockedAnswer(rules);

        assertTrue(blocked.isBlocked());
        assertEquals(ResponseGenerationService.DEFAULT_REFUSAL, blocked.getText());
        assertEquals(blocked.getText(), service.finalizeText(blocked.getText(), blocked, rules));
    }

    @Test
    void blockedStateNeverReachesTheProvider() {
        OrchestrationState state = state("Tell me a secret");
        state.setRuleResult(RuleEvaluationResult.builder()
                .appliedActions(List.of(action(RuleActionType.BLOCK_RESPONSE, Map.of("message", "No."))))
                .build());

        assertEquals("No.", service.generate(state).getText());
        verifyNoInteractions(generationProvider);
    }

    @Test
    void fallbackNamesTheBusiness() {
        OrchestrationState state = state("What's on the menu?");
        state.setIntentResult(IntentResult.builder().intent(QueryIntent.MENU_INQUIRY).confidence(0.8).build());
        state.setBusinessFacts(BusinessFacts.builder().name("Green Bowl").build());

        GeneratedAnswer fallback = service.fallbackAnswer(state);

        assertTrue(fallback.isFallback());
        assertTrue(fallback.getText().contains("our menu at Green Bowl"));
    }

    @Test
    void messagesCarrySystemPromptHistoryThenQuery() {
        // Given
        OrchestrationState state = state("Are you open on Monday?");
        state.setIntentResult(IntentResult.builder().intent(QueryIntent.HOURS_POLICY).confidence(0.6).build());
        state.setBusinessFacts(BusinessFacts.builder().name("Bella Vista").cuisine("Italian")
                .operatingHour("monday", "closed").build());
        state.setContextBundle(ContextBundle.builder()
                .conversationHistory(List.of(
                        ConversationTurn.user("Hi", QueryIntent.GENERAL_CHAT, Instant.EPOCH),
                        ConversationTurn.assistant("Hello! How can I help?", Instant.EPOCH)))
                .build());
        state.setRuleResult(RuleEvaluationResult.builder()
                .appliedActions(List.of(action(RuleActionType.SET_RESPONSE_STYLE, Map.of("tone", "warm"))))
                .build());

        // When
        List<ChatMessage> messages = promptBuilder.buildMessages(state);

        // Then
        assertEquals(List.of("system", "user", "assistant", "user"), messages.stream().map(ChatMessage::getRole).toList());
        String system = messages.get(0).getContent();
        assertTrue(system.contains("Bella Vista, a Italian restaurant business"));
        assertTrue(system.contains("monday: closed"));
        assertTrue(system.contains("HOURS_POLICY (confidence 0.60)"));
        assertTrue(system.contains("- tone: warm"));
        assertEquals("Are you open on Monday?", messages.get(3).getContent());
    }

    private static OrchestrationState state(String query) {
        return OrchestrationState.builder()
                .correlationId("corr-1")
                .businessId("bella-vista")
                .request(QueryRequest.builder().query(query).build())
                .build();
    }

    private static RuleAction action(RuleActionType type, Map<String, Object> parameters) {
        return RuleAction.builder().type(type).parameters(parameters).build();
    }
}
