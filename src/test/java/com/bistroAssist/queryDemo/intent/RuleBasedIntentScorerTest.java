package com.bistroAssist.queryDemo.intent;

import com.bistroAssist.queryDemo.intent.model.IntentPattern;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedIntentScorerTest {

    private final RuleBasedIntentScorer scorer = new RuleBasedIntentScorer();

    @Test
    void hoursQuestionIsConfidentlyHoursPolicy() {
        IntentResult result = scorer.score("What are your hours?");

        assertEquals(QueryIntent.HOURS_POLICY, result.getIntent());
        assertTrue(result.getConfidence() >= 0.5, "confidence " + result.getConfidence());
    }

    @Test
    void noSignalIsUnknownWithZeroConfidence() {
        IntentResult result = scorer.score("qwerty zxcv");

        assertEquals(QueryIntent.UNKNOWN, result.getIntent());
        assertEquals(0.0, result.getConfidence());
    }

    @Test
    void confidenceIsCappedAtOne() {
        IntentResult result = scorer.score("Is the pasta gluten free? I am allergic to dairy and nuts, vegan diet");

        assertEquals(QueryIntent.DIETARY_RESTRICTIONS, result.getIntent());
        assertEquals(1.0, result.getConfidence());
    }

    @Test
    void tiesKeepCatalogOrderAndRunnersUpBecomeAlternatives() {
        RuleBasedIntentScorer custom = new RuleBasedIntentScorer(List.of(
                new IntentPattern(QueryIntent.MENU_INQUIRY, List.of("special"), List.of()),
                new IntentPattern(QueryIntent.PRICING_QUESTION, List.of("special"), List.of()),
                new IntentPattern(QueryIntent.GENERAL_CHAT, List.of("hello"), List.of(Pattern.compile("^hello")))));

        IntentResult result = custom.score("Any special today?");

        assertEquals(QueryIntent.MENU_INQUIRY, result.getIntent());
        assertEquals(0.2, result.getConfidence(), 1e-9);
        assertEquals(1, result.getAlternatives().size());
        assertEquals(QueryIntent.PRICING_QUESTION, result.getAlternatives().get(0).intent());
    }
}
