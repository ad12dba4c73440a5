package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import com.bistroAssist.queryDemo.rules.model.ConditionOperator;
import com.bistroAssist.queryDemo.rules.model.RuleCondition;
import com.bistroAssist.queryDemo.rules.model.RuleContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionEvaluatorTest {

    private RuleFieldResolver resolver;
    private ConditionEvaluator evaluator;
    private JsonNode tree;

    @BeforeEach
    void setUp() {
        resolver = new RuleFieldResolver(new ObjectMapper());
        evaluator = new ConditionEvaluator(resolver);
        tree = resolver.toTree(RuleContext.builder()
                .businessId("bella-vista")
                .queryText("Is the Tiramisu gluten free?")
                .intent(QueryIntent.DIETARY_RESTRICTIONS)
                .intentConfidence(0.75)
                .turnCount(3)
                .context(Map.of("menu", List.of(Map.of("title", "Tiramisu", "confidence", 0.9))))
                .customer(Map.of("preferences", Map.of("diet", "vegan", "allergies", List.of("nuts", "soy"))))
                .build());
    }

    @Test
    void equalsComparesTextAndNumbers() {
        assertTrue(matches("intent", ConditionOperator.EQUALS, "DIETARY_RESTRICTIONS"));
        assertTrue(matches("turnCount", ConditionOperator.EQUALS, 3));
        assertTrue(matches("turnCount", ConditionOperator.EQUALS, "3"));
        assertFalse(matches("intent", ConditionOperator.EQUALS, "dietary_restrictions"));
        assertTrue(evaluator.matches(condition("intent", ConditionOperator.EQUALS, "dietary_restrictions", false), tree));
    }

    @Test
    void containsChecksSubstringsAndArrayElements() {
        assertTrue(matches("queryText", ConditionOperator.CONTAINS, "gluten"));
        assertFalse(matches("queryText", ConditionOperator.CONTAINS, "GLUTEN"));
        assertTrue(matches("customer.preferences.allergies", ConditionOperator.CONTAINS, "nuts"));
        assertFalse(matches("customer.preferences.allergies", ConditionOperator.CONTAINS, "nut"));
    }

    @Test
    void prefixSuffixAndRegex() {
        assertTrue(matches("queryText", ConditionOperator.STARTS_WITH, "Is the"));
        assertTrue(matches("queryText", ConditionOperator.ENDS_WITH, "free?"));
        assertTrue(matches("queryText", ConditionOperator.REGEX, "gluten\\s+free"));
        assertFalse(matches("queryText", ConditionOperator.REGEX, "(unclosed"));
    }

    @Test
    void numericComparisonsIgnoreNonNumbers() {
        assertTrue(matches("intentConfidence", ConditionOperator.GREATER_THAN, 0.5));
        assertTrue(matches("intentConfidence", ConditionOperator.LESS_THAN, 0.8));
        assertFalse(matches("queryText", ConditionOperator.GREATER_THAN, 1));
    }

    @Test
    void membershipOperatorsNeedLists() {
        assertTrue(matches("customer.preferences.diet", ConditionOperator.IN, List.of("vegan", "vegetarian")));
        assertTrue(matches("intent", ConditionOperator.NOT_IN, List.of("GENERAL_CHAT")));
        assertFalse(matches("intent", ConditionOperator.IN, "DIETARY_RESTRICTIONS"));
    }

    @Test
    void dotPathsReachNestedValuesAndArrayIndexes() {
        assertTrue(matches("context.menu.0.title", ConditionOperator.EQUALS, "Tiramisu"));
        assertTrue(matches("context.menu.0.confidence", ConditionOperator.GREATER_THAN, 0.8));
    }

    @Test
    void missingFieldNeverMatches() {
        assertFalse(matches("customer.loyaltyTier", ConditionOperator.EQUALS, "gold"));
        assertFalse(matches("customer.loyaltyTier", ConditionOperator.NOT_IN, List.of("gold")));
        assertFalse(matches("sessionId", ConditionOperator.EQUALS, "abc"));
    }

    private boolean matches(String field, ConditionOperator operator, Object value) {
        return evaluator.matches(condition(field, operator, value, true), tree);
    }

    private static RuleCondition condition(String field, ConditionOperator operator, Object value, boolean caseSensitive) {
        return RuleCondition.builder()
                .field(field)
                .operator(operator)
                .value(value)
                .caseSensitive(caseSensitive)
                .build();
    }
}
