package com.bistroAssist.queryDemo.rules.model;

import java.util.List;

public record RuleTestResult(String testCase, boolean ruleApplied, List<RuleAction> actualActions,
                             boolean passed, long executionTimeMs) {
}
