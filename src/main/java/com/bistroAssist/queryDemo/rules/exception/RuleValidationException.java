package com.bistroAssist.queryDemo.rules.exception;

import java.util.List;

public class RuleValidationException extends RuntimeException {

    private final List<String> errors;

    public RuleValidationException(List<String> errors) {
        super("Rule validation failed: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
