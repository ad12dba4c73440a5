package com.bistroAssist.queryDemo.intent;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.intent.model.IntentPatternStats;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Intent classifier - two-stage classification of customer queries.
 * 
 * Stage 1 scores the query against keyword and regex patterns. When that result is below
 * the configured threshold, stage 2 asks the language model and the two results are combined:
 * - both above 0.3 and agreeing: averaged and boosted by 0.1
 * - both above 0.3 and disagreeing: the more confident one wins
 * - otherwise: the more confident one wins
 * 
 * If stage 2 fails, the stage-1 result is returned at half confidence (never below 0.1).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentClassifier {

    private static final double COMBINATION_FLOOR = 0.3;
    private static final double AGREEMENT_BOOST = 0.1;
    private static final double FALLBACK_FLOOR = 0.1;

    private final RuleBasedIntentScorer ruleBasedScorer;
    private final LlmIntentClassifier llmClassifier;
    private final AssistantProperties properties;

    public IntentResult classify(String text) {
        IntentResult ruleResult = ruleBasedScorer.score(text);
        double threshold = properties.getIntent().getConfidenceThreshold();

        if (ruleResult.getConfidence() >= threshold) {
            log.debug("Rule-based intent accepted - intent: {}, confidence: {}", ruleResult.getIntent(), ruleResult.getConfidence());
            return ruleResult;
        }

        IntentResult modelResult;
        try {
            modelResult = llmClassifier.classify(text);
        } catch (Exception e) {
            log.warn("Model intent classification failed, using rule-based result - error: {}", e.getMessage());
            return ruleResult.toBuilder()
                    .confidence(Math.max(FALLBACK_FLOOR, ruleResult.getConfidence() * 0.5))
                    .reasoning("Fallback detection due to classifier error")
                    .build();
        }

        IntentResult combined = combine(ruleResult, modelResult);
        log.debug("Intent combined - rule: {}/{}, model: {}/{}, result: {}/{}",
                ruleResult.getIntent(), ruleResult.getConfidence(),
                modelResult.getIntent(), modelResult.getConfidence(),
                combined.getIntent(), combined.getConfidence());
        return combined;
    }

    IntentResult combine(IntentResult ruleResult, IntentResult modelResult) {
        boolean bothConfident = ruleResult.getConfidence() > COMBINATION_FLOOR
                && modelResult.getConfidence() > COMBINATION_FLOOR;

        if (bothConfident && ruleResult.getIntent() == modelResult.getIntent()) {
            double confidence = Math.min(1.0,
                    (ruleResult.getConfidence() + modelResult.getConfidence()) / 2 + AGREEMENT_BOOST);
            return ruleResult.toBuilder()
                    .confidence(confidence)
                    .reasoning(String.format(Locale.ROOT, "Combined detection: rule-based (%.2f) + model (%.2f)",
                            ruleResult.getConfidence(), modelResult.getConfidence()))
                    .build();
        }

        if (modelResult.getConfidence() > ruleResult.getConfidence()) {
            return modelResult.toBuilder()
                    .clearAlternatives()
                    .alternatives(ruleResult.getAlternatives())
                    .build();
        }
        return ruleResult;
    }

    /**
     * Keyword and pattern counts per intent, for diagnostics.
     */
    public Map<QueryIntent, IntentPatternStats> intentStats() {
        return ruleBasedScorer.patternCounts();
    }
}
