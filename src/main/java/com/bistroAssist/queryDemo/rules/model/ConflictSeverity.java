package com.bistroAssist.queryDemo.rules.model;

public enum ConflictSeverity {
    LOW,
    MEDIUM,
    HIGH
}
