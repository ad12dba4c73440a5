package com.bistroAssist.queryDemo.orchestrator.analytics;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands analytics records to the sink off the request path.
 */
@Slf4j
@Component
public class AnalyticsDispatcher {

    private final AnalyticsSink sink;
    private final Executor executor;
    private final boolean enabled;

    public AnalyticsDispatcher(AnalyticsSink sink,
                               @Qualifier("analyticsExecutor") Executor executor,
                               AssistantProperties properties) {
        this.sink = sink;
        this.executor = executor;
        this.enabled = properties.getPipeline().isAnalyticsEnabled();
    }

    public void dispatch(QueryLogRecord record) {
        submit(record, () -> sink.log(record));
    }

    public void dispatchError(QueryLogRecord record, Throwable error) {
        submit(record, () -> sink.logError(record, error));
    }

    private void submit(QueryLogRecord record, Runnable write) {
        if (!enabled) {
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.error("Analytics sink failed - correlationId: {}, businessId: {}",
                            record.getCorrelationId(), record.getBusinessId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Analytics record dropped, executor saturated - correlationId: {}", record.getCorrelationId(), e);
        }
    }
}
