package com.bistroAssist.queryDemo.rules.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * What a matching rule does to the answer.
 */
public enum RuleActionType {
    @JsonProperty("set_response_style") SET_RESPONSE_STYLE("set_response_style"),
    @JsonProperty("add_disclaimer") ADD_DISCLAIMER("add_disclaimer"),
    @JsonProperty("escalate") ESCALATE("escalate"),
    @JsonProperty("modify_content") MODIFY_CONTENT("modify_content"),
    @JsonProperty("apply_template") APPLY_TEMPLATE("apply_template"),
    @JsonProperty("block_response") BLOCK_RESPONSE("block_response");

    private final String wireName;

    RuleActionType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<RuleActionType> fromWireName(String name) {
        for (RuleActionType type : values()) {
            if (type.wireName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
