package com.bistroAssist.queryDemo.rules.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class RuleEvaluationResult {

    @Builder.Default
    List<BusinessRule> applicableRules = List.of();

    @Builder.Default
    List<RuleAction> appliedActions = List.of();

    int conflictsResolved;
    long executionTimeMs;

    public static RuleEvaluationResult empty() {
        return RuleEvaluationResult.builder().build();
    }

    public boolean hasAction(RuleActionType type) {
        return appliedActions.stream().anyMatch(a -> a.getType() == type);
    }

    public List<RuleAction> actionsOf(RuleActionType type) {
        return appliedActions.stream().filter(a -> a.getType() == type).toList();
    }

    public Optional<RuleAction> firstAction(RuleActionType type) {
        return appliedActions.stream().filter(a -> a.getType() == type).findFirst();
    }
}
