package com.bistroAssist.queryDemo.intent;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.intent.model.IntentPatternStats;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import com.bistroAssist.queryDemo.llm.exception.UpstreamProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IntentClassifierTest {

    @Mock
    private LlmIntentClassifier llmClassifier;

    private IntentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new IntentClassifier(new RuleBasedIntentScorer(), llmClassifier, new AssistantProperties());
    }

    @Test
    void confidentRuleResultSkipsTheModel() {
        // When
        IntentResult result = classifier.classify("What are your hours?");

        // Then
        assertEquals(QueryIntent.HOURS_POLICY, result.getIntent());
        verifyNoInteractions(llmClassifier);
    }

    @Test
    void weakRuleResultAsksTheModel() {
        // Given
        when(llmClassifier.classify(anyString())).thenReturn(IntentResult.builder()
                .intent(QueryIntent.LOCATION_INFO).confidence(0.9).reasoning("asks for parking").build());

        // When
        IntentResult result = classifier.classify("Is there parking nearby?");

        // Then
        assertEquals(QueryIntent.LOCATION_INFO, result.getIntent());
        assertEquals(0.9, result.getConfidence(), 1e-9);
    }

    @Test
    void modelFailureFallsBackToHalvedRuleConfidence() {
        when(llmClassifier.classify(anyString())).thenThrow(new UpstreamProviderException("boom", true));

        IntentResult result = classifier.classify("Any special today?");

        assertEquals(QueryIntent.MENU_INQUIRY, result.getIntent());
        assertEquals(0.1, result.getConfidence(), 1e-9);
        assertEquals("Fallback detection due to classifier error", result.getReasoning());
    }

    @Test
    void agreeingResultsAreAveragedAndBoosted() {
        IntentResult rule = IntentResult.builder().intent(QueryIntent.MENU_INQUIRY).confidence(0.4).build();
        IntentResult model = IntentResult.builder().intent(QueryIntent.MENU_INQUIRY).confidence(0.8).build();

        IntentResult combined = classifier.combine(rule, model);

        assertEquals(QueryIntent.MENU_INQUIRY, combined.getIntent());
        assertEquals(0.7, combined.getConfidence(), 1e-9);
    }

    @Test
    void disagreeingResultsKeepTheMoreConfident() {
        IntentResult rule = IntentResult.builder().intent(QueryIntent.MENU_INQUIRY).confidence(0.45).build();
        IntentResult model = IntentResult.builder().intent(QueryIntent.PRICING_QUESTION).confidence(0.4).build();

        assertSame(rule, classifier.combine(rule, model));
    }

    @Test
    void boostedConfidenceNeverExceedsOne() {
        IntentResult rule = IntentResult.builder().intent(QueryIntent.GENERAL_CHAT).confidence(0.95).build();
        IntentResult model = IntentResult.builder().intent(QueryIntent.GENERAL_CHAT).confidence(1.0).build();

        assertEquals(1.0, classifier.combine(rule, model).getConfidence());
    }

    @Test
    void statsCoverEveryCataloguedIntent() {
        Map<QueryIntent, IntentPatternStats> stats = classifier.intentStats();

        assertEquals(7, stats.size());
        assertFalse(stats.containsKey(QueryIntent.UNKNOWN));
        assertTrue(stats.get(QueryIntent.MENU_INQUIRY).keywordCount() > 0);
        assertTrue(stats.values().stream().allMatch(s -> s.keywordCount() + s.patternCount() > 0));
        verifyNoInteractions(llmClassifier);
    }
}
