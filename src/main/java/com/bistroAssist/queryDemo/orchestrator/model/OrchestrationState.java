package com.bistroAssist.queryDemo.orchestrator.model;

import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import com.bistroAssist.queryDemo.context.model.ContextBundle;
import com.bistroAssist.queryDemo.context.model.ConversationSession;
import com.bistroAssist.queryDemo.intent.model.IntentResult;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryRequest;
import com.bistroAssist.queryDemo.rules.model.RuleEvaluationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Orchestration state - everything one query accumulates on its way through the pipeline.
 * Confined to the query; never shared between requests.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrchestrationState {

    private String correlationId;
    private String businessId;
    private QueryRequest request;

    @Builder.Default
    private volatile PipelineStage stage = PipelineStage.VALIDATING;

    @Builder.Default
    private ProcessingMetrics metrics = new ProcessingMetrics();

    private Instant startedAt;

    private ConversationSession session;
    private BusinessFacts businessFacts;
    private IntentResult intentResult;

    /**
     * Retrieved context; empty when retrieval failed.
     */
    private ContextBundle contextBundle;

    /**
     * Rule outcome; empty when evaluation failed.
     */
    private RuleEvaluationResult ruleResult;

    private GeneratedAnswer answer;

    /**
     * Set when the caller stopped waiting (timeout or cancellation); later stages must not publish results.
     */
    private volatile boolean abandoned;

    public String getQueryText() {
        return request != null ? request.getQuery() : null;
    }
}
