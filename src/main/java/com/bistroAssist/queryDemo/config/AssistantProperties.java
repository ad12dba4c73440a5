package com.bistroAssist.queryDemo.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline settings bound from the {@code assistant.*} keys of application.yaml.
 * 
 * Every nested group carries its defaults, so a plain {@code new AssistantProperties()}
 * is a valid configuration for tests and hand-wired setups.
 */
@Data
@ConfigurationProperties(prefix = "assistant")
public class AssistantProperties {

    private Pipeline pipeline = new Pipeline();
    private Intent intent = new Intent();
    private Retrieval retrieval = new Retrieval();
    private Vectorizer vectorizer = new Vectorizer();
    private Embedding embedding = new Embedding();
    private Rules rules = new Rules();
    private Session session = new Session();

    @Data
    public static class Pipeline {
        /**
         * Upper bound for one query, from validation to the last generated token.
         * Values outside 1-30 seconds are clamped by the orchestrator.
         */
        private Duration timeout = Duration.ofSeconds(10);
        private int maxQueryLength = 2000;
        private int rateLimitPerMinute = 60;
        private boolean analyticsEnabled = true;
    }

    @Data
    public static class Intent {
        /**
         * Rule-based results at or above this confidence skip the language model.
         */
        private double confidenceThreshold = 0.5;
        private String model = "gpt-4o-mini";
    }

    @Data
    public static class Retrieval {
        private int topN = 5;
        private double minScore = 0.7;
        private int snippetLength = 400;
        private int historyLimit = 10;
    }

    @Data
    public static class Vectorizer {
        private int maxTokens = 8000;
    }

    @Data
    public static class Embedding {
        private int dimension = 1536;
        private String model = "text-embedding-3-small";
    }

    @Data
    public static class Rules {
        private Duration cacheTtl = Duration.ofMinutes(5);

        /**
         * Groups of action types that cannot coexist in one answer.
         * An empty parameter list means any two actions of the group collide;
         * otherwise they collide only when they set a listed parameter to different values.
         */
        private List<ConflictClass> conflictClasses = defaultConflictClasses();

        private static List<ConflictClass> defaultConflictClasses() {
            List<ConflictClass> classes = new ArrayList<>();
            classes.add(new ConflictClass("tone", List.of("set_response_style"), List.of("tone")));
            classes.add(new ConflictClass("escalation", List.of("escalate", "block_response"), List.of()));
            return classes;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConflictClass {
        private String name;
        private List<String> actionTypes = new ArrayList<>();
        private List<String> parameterKeys = new ArrayList<>();
    }

    @Data
    public static class Session {
        private Duration idleTtl = Duration.ofMinutes(30);
        private long maxSessions = 10_000;
        private int maxStoredTurns = 50;
    }
}
