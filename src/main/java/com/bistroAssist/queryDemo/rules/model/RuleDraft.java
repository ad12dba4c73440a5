package com.bistroAssist.queryDemo.rules.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Rule fields as submitted for create, update or dry run.
 * On update, null fields keep their current value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleDraft {

    private String ruleId;
    private String businessId;
    private RuleCategory category;
    private String ruleType;
    private String name;
    private String description;
    private Integer priority;
    private List<RuleCondition> conditions;
    private List<RuleAction> actions;
    private Boolean active;
    private String createdBy;
    private List<String> tags;

    /**
     * Update only: the version the caller last read. A mismatch rejects the update.
     */
    private Long expectedVersion;
}
