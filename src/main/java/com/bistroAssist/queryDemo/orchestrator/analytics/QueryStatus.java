package com.bistroAssist.queryDemo.orchestrator.analytics;

public enum QueryStatus {
    SUCCESS,
    FALLBACK,
    BLOCKED,
    CANCELLED,
    REJECTED,
    TIMEOUT,
    ERROR
}
