package com.bistroAssist.queryDemo.orchestrator.model;

public enum PipelineStage {
    VALIDATING,
    RATE_LIMITING,
    SESSION_RESOLVING,
    INTENT_CLASSIFYING,
    CONTEXT_RETRIEVING,
    RULES_EVALUATING,
    GENERATING,
    LOGGING,
    DONE,
    FAILED
}
