package com.bistroAssist.queryDemo.orchestrator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only step timings of one query.
 */
public class ProcessingMetrics {

    private final List<StepMetric> steps = new ArrayList<>();

    public synchronized void record(StepMetric metric) {
        steps.add(metric);
    }

    public synchronized List<StepMetric> getSteps() {
        return List.copyOf(steps);
    }
}
