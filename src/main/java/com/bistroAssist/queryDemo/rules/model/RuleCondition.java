package com.bistroAssist.queryDemo.rules.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single test against the rule context.
 */
@Value
@Builder
@Jacksonized
public class RuleCondition {

    /**
     * Dot path into the rule context, e.g. {@code intent} or {@code customer.preferences.diet}.
     */
    String field;

    ConditionOperator operator;

    /**
     * Comparison operand; a list for {@code in} and {@code not_in}.
     */
    Object value;

    @Builder.Default
    boolean caseSensitive = true;
}
