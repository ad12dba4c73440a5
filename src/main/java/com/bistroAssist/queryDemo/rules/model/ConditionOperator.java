package com.bistroAssist.queryDemo.rules.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConditionOperator {
    @JsonProperty("equals") EQUALS,
    @JsonProperty("contains") CONTAINS,
    @JsonProperty("starts_with") STARTS_WITH,
    @JsonProperty("ends_with") ENDS_WITH,
    @JsonProperty("regex") REGEX,
    @JsonProperty("greater_than") GREATER_THAN,
    @JsonProperty("less_than") LESS_THAN,
    @JsonProperty("in") IN,
    @JsonProperty("not_in") NOT_IN
}
