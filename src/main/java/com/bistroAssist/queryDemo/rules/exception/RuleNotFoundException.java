package com.bistroAssist.queryDemo.rules.exception;

public class RuleNotFoundException extends RuntimeException {

    public RuleNotFoundException(String ruleId) {
        super("Rule " + ruleId + " not found");
    }
}
