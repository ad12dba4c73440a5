package com.bistroAssist.queryDemo.intent.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Classification outcome for one query. Confidence is always within [0, 1].
 */
@Value
@Builder(toBuilder = true)
public class IntentResult {

    QueryIntent intent;
    double confidence;

    @Singular
    List<Alternative> alternatives;

    String reasoning;

    public static IntentResult unknown(double confidence, String reasoning) {
        return IntentResult.builder()
                .intent(QueryIntent.UNKNOWN)
                .confidence(confidence)
                .reasoning(reasoning)
                .build();
    }

    public record Alternative(QueryIntent intent, double confidence) {
    }
}
