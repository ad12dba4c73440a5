package com.bistroAssist.queryDemo.orchestrator.model;

import java.time.Duration;
import java.time.Instant;

public record StepMetric(String stepName, Instant start, Instant end, boolean success, String error) {

    public long durationMs() {
        return Duration.between(start, end).toMillis();
    }
}
