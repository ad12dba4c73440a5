package com.bistroAssist.queryDemo.rules.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RuleCategory {
    @JsonProperty("response_behavior") RESPONSE_BEHAVIOR,
    @JsonProperty("content_restrictions") CONTENT_RESTRICTIONS,
    @JsonProperty("business_logic") BUSINESS_LOGIC,
    @JsonProperty("quality_controls") QUALITY_CONTROLS
}
