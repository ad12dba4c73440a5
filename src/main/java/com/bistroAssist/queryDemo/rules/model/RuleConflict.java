package com.bistroAssist.queryDemo.rules.model;

public record RuleConflict(String conflictingRuleId, ConflictType conflictType, String description,
                           ConflictSeverity severity) {
}
