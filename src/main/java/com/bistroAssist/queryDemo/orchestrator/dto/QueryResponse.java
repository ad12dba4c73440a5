package com.bistroAssist.queryDemo.orchestrator.dto;

import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for customer queries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryResponse {

    private String response;
    private double confidence;

    /**
     * Content ids of the matched menu items, policies and FAQs.
     */
    private List<String> sources;

    private QueryIntent intent;
    private List<String> suggestedFollowUps;
    private Usage usage;
    private SessionInfo session;
    private Metadata metadata;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Usage {
        private int promptTokens;
        private int completionTokens;
        private int totalTokens;
        private double estimatedCost;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class SessionInfo {
        private String sessionId;
        private int turnCount;
        private Instant expiresAt;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Metadata {
        private String correlationId;
        private List<String> contextSources;
        private String model;
        private long processingTimeMs;
        private int appliedRules;
        private int conflictsResolved;
        private boolean escalated;
        private boolean fallback;
        private double intentConfidence;
    }
}
