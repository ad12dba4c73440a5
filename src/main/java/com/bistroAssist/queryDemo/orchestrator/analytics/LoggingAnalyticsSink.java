package com.bistroAssist.queryDemo.orchestrator.analytics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes analytics records as JSON lines to the dedicated {@code analytics} logger.
 */
@Component
public class LoggingAnalyticsSink implements AnalyticsSink {

    private static final Logger ANALYTICS = LoggerFactory.getLogger("analytics");

    private final ObjectMapper objectMapper;

    public LoggingAnalyticsSink(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void log(QueryLogRecord record) {
        ANALYTICS.info(toJson(record));
    }

    @Override
    public void logError(QueryLogRecord record, Throwable error) {
        ANALYTICS.error("{} - error: {}", toJson(record), error != null ? error.toString() : "unknown");
    }

    private String toJson(QueryLogRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize query log record " + record.getCorrelationId(), e);
        }
    }
}
