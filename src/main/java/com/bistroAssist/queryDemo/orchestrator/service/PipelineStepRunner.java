package com.bistroAssist.queryDemo.orchestrator.service;

import com.bistroAssist.queryDemo.orchestrator.model.OrchestrationState;
import com.bistroAssist.queryDemo.orchestrator.model.PipelineStage;
import com.bistroAssist.queryDemo.orchestrator.model.StepMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs pipeline stages and records a {@link StepMetric} for each one.
 */
@Slf4j
@Component
public class PipelineStepRunner {

    private final Clock clock;

    public PipelineStepRunner(Clock clock) {
        this.clock = clock;
    }

    /**
     * Runs a stage whose failure aborts the query. The exception is recorded and rethrown.
     */
    public <T> T runStep(OrchestrationState state, PipelineStage stage, Supplier<T> step) {
        state.setStage(stage);
        Instant start = clock.instant();
        try {
            T result = step.get();
            record(state, stage, start, null);
            return result;
        } catch (RuntimeException e) {
            record(state, stage, start, e);
            state.setStage(PipelineStage.FAILED);
            throw e;
        }
    }

    public void runAction(OrchestrationState state, PipelineStage stage, Runnable step) {
        runStep(state, stage, () -> {
            step.run();
            return null;
        });
    }

    /**
     * Runs a stage that degrades instead of failing: on error the fallback value is used.
     */
    public <T> T runDegradableStep(OrchestrationState state, PipelineStage stage, Supplier<T> step,
                                   Function<RuntimeException, T> fallback) {
        state.setStage(stage);
        Instant start = clock.instant();
        try {
            T result = step.get();
            record(state, stage, start, null);
            return result;
        } catch (RuntimeException e) {
            record(state, stage, start, e);
            log.warn("Step {} degraded - correlationId: {}, businessId: {}, error: {}",
                    stage, state.getCorrelationId(), state.getBusinessId(), e.toString());
            return fallback.apply(e);
        }
    }

    private void record(OrchestrationState state, PipelineStage stage, Instant start, RuntimeException error) {
        state.getMetrics().record(new StepMetric(stage.name(), start, clock.instant(), error == null,
                error != null ? error.getClass().getSimpleName() + ": " + error.getMessage() : null));
    }
}
