package com.bistroAssist.queryDemo.rules.exception;

import com.bistroAssist.queryDemo.rules.model.RuleConflict;

import java.util.List;

/**
 * Thrown when a write collides with existing rules (high-severity conflict)
 * or with a concurrent update (stale expected version).
 */
public class RuleConflictException extends RuntimeException {

    private final List<RuleConflict> conflicts;

    public RuleConflictException(String message) {
        this(message, List.of());
    }

    public RuleConflictException(String message, List<RuleConflict> conflicts) {
        super(message);
        this.conflicts = List.copyOf(conflicts);
    }

    public List<RuleConflict> getConflicts() {
        return conflicts;
    }
}
