package com.bistroAssist.queryDemo.rules.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class RuleAction {

    RuleActionType type;

    @Builder.Default
    Map<String, Object> parameters = Map.of();

    /**
     * Ordering hint among actions of the same rule; conflicts are decided by rule priority.
     */
    Integer priority;

    public String parameterAsText(String key) {
        Object value = parameters != null ? parameters.get(key) : null;
        return value != null ? value.toString() : null;
    }
}
