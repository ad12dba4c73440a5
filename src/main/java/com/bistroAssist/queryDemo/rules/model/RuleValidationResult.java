package com.bistroAssist.queryDemo.rules.model;

import java.util.List;

public record RuleValidationResult(List<String> errors, List<String> warnings) {

    public boolean isValid() {
        return errors.isEmpty();
    }
}
