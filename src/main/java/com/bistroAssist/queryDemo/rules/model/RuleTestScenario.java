package com.bistroAssist.queryDemo.rules.model;

import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Sample query used to dry-run a candidate rule.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleTestScenario {

    private String name;
    private String queryText;
    private QueryIntent intent;
    private Double intentConfidence;
    private String sessionId;
    private Integer turnCount;
    private Map<String, Object> context;
    private Map<String, Object> customer;

    /**
     * Whether the candidate rule is expected to apply; defaults to true.
     */
    private Boolean expectApplied;

    /**
     * Action types expected among the applied actions; null skips the check.
     */
    private List<RuleActionType> expectedActionTypes;
}
