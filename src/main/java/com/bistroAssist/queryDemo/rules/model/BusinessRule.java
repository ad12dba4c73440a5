package com.bistroAssist.queryDemo.rules.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A business rule: when any condition matches, its actions shape the answer.
 * Instances are immutable; every update produces a new version.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BusinessRule {

    String ruleId;
    String businessId;
    RuleCategory category;
    String ruleType;
    String name;
    String description;

    /**
     * 1-100, higher wins conflicts.
     */
    int priority;

    @Builder.Default
    List<RuleCondition> conditions = List.of();

    @Builder.Default
    List<RuleAction> actions = List.of();

    boolean active;
    long version;
    Instant createdAt;
    Instant updatedAt;
    String createdBy;

    @Builder.Default
    List<String> tags = List.of();
}
