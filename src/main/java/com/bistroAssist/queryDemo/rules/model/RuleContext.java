package com.bistroAssist.queryDemo.rules.model;

import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Facts about one query that rule conditions are evaluated against.
 * Condition fields address these properties by dot path.
 */
@Value
@Builder
public class RuleContext {
    String businessId;
    String queryText;
    QueryIntent intent;
    double intentConfidence;
    String sessionId;
    int turnCount;

    /**
     * Retrieved context: {@code menu}, {@code policies}, {@code faqs}, {@code businessFacts}.
     */
    @Builder.Default
    Map<String, Object> context = Map.of();

    /**
     * Caller-supplied customer facts (preferences and the like).
     */
    @Builder.Default
    Map<String, Object> customer = Map.of();
}
