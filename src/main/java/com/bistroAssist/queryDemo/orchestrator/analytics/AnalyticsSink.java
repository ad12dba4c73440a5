package com.bistroAssist.queryDemo.orchestrator.analytics;

/**
 * Destination for query analytics. Implementations may throw; callers never let a sink failure
 * change the outcome of a query.
 */
public interface AnalyticsSink {

    void log(QueryLogRecord record);

    void logError(QueryLogRecord record, Throwable error);
}
