package com.bistroAssist.queryDemo.rules.model;

public enum ConflictType {
    /**
     * Colliding actions on rules of different priority; evaluation resolves them.
     */
    ACTION_CONTRADICTION,
    /**
     * Colliding actions on rules of equal priority; evaluation keeps whichever was accumulated first.
     */
    PRIORITY_CONFLICT
}
