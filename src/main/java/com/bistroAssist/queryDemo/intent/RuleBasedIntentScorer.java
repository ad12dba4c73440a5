package com.bistroAssist.queryDemo.intent;

import com.bistroAssist.queryDemo.intent.model.IntentPattern;
import com.bistroAssist.queryDemo.intent.model.IntentPatternStats;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores a query against {@link IntentPatternCatalog}: one point per keyword found,
 * two per matching regex, normalised as min(1, score / 5).
 */
@Component
public class RuleBasedIntentScorer {

    private static final int KEYWORD_WEIGHT = 1;
    private static final int REGEX_WEIGHT = 2;
    private static final double NORMALIZER = 5.0;
    private static final int MAX_ALTERNATIVES = 3;
    private static final double MIN_ALTERNATIVE_CONFIDENCE = 0.1;

    private final List<IntentPattern> patterns;

    public RuleBasedIntentScorer() {
        this(IntentPatternCatalog.PATTERNS);
    }

    RuleBasedIntentScorer(List<IntentPattern> patterns) {
        this.patterns = patterns;
    }

    public IntentResult score(String text) {
        String lowered = text == null ? "" : text.toLowerCase(Locale.ROOT);

        List<Scored> scored = new ArrayList<>();
        for (IntentPattern pattern : patterns) {
            int score = 0;
            for (String keyword : pattern.keywords()) {
                if (lowered.contains(keyword.toLowerCase(Locale.ROOT))) {
                    score += KEYWORD_WEIGHT;
                }
            }
            for (var regex : pattern.patterns()) {
                if (regex.matcher(lowered).find()) {
                    score += REGEX_WEIGHT;
                }
            }
            scored.add(new Scored(pattern.intent(), score));
        }

        // stable: ties keep catalog order
        scored.sort(Comparator.comparingInt(Scored::score).reversed());

        if (scored.isEmpty() || scored.get(0).score() == 0) {
            return IntentResult.unknown(0.0, "No rule-based signal");
        }

        Scored best = scored.get(0);
        double confidence = normalize(best.score());
        IntentResult.IntentResultBuilder builder = IntentResult.builder()
                .intent(best.intent())
                .confidence(confidence)
                .reasoning(String.format(Locale.ROOT, "Rule-based detection with %.2f confidence", confidence));

        scored.stream()
                .skip(1)
                .limit(MAX_ALTERNATIVES)
                .map(s -> new IntentResult.Alternative(s.intent(), normalize(s.score())))
                .filter(alt -> alt.confidence() > MIN_ALTERNATIVE_CONFIDENCE)
                .forEach(builder::alternative);

        return builder.build();
    }

    /**
     * Keyword and pattern counts per intent.
     */
    public Map<QueryIntent, IntentPatternStats> patternCounts() {
        Map<QueryIntent, IntentPatternStats> counts = new EnumMap<>(QueryIntent.class);
        for (IntentPattern pattern : patterns) {
            counts.put(pattern.intent(), new IntentPatternStats(pattern.keywords().size(), pattern.patterns().size()));
        }
        return counts;
    }

    private static double normalize(int score) {
        return Math.min(1.0, score / NORMALIZER);
    }

    private record Scored(QueryIntent intent, int score) {
    }
}
