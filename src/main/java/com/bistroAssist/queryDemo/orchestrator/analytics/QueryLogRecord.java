package com.bistroAssist.queryDemo.orchestrator.analytics;

import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import com.bistroAssist.queryDemo.orchestrator.model.PipelineStage;
import com.bistroAssist.queryDemo.orchestrator.model.StepMetric;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One analytics entry per processed query, written whatever the outcome.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryLogRecord {

    String correlationId;
    String businessId;
    String sessionId;

    /**
     * Masked.
     */
    String customerId;

    String queryText;
    QueryIntent intent;
    double intentConfidence;
    int responseLength;
    double confidence;
    String model;
    List<String> contextSources;
    int appliedRules;
    boolean escalated;
    boolean streaming;
    int promptTokens;
    int completionTokens;
    double estimatedCost;
    long processingTimeMs;
    QueryStatus status;
    PipelineStage failedStage;
    String errorMessage;
    List<StepMetric> steps;
    Instant timestamp;
}
