package com.bistroAssist.queryDemo.gateway.dto;

import com.bistroAssist.queryDemo.rules.model.RuleDraft;
import com.bistroAssist.queryDemo.rules.model.RuleTestScenario;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A candidate rule and the scenarios to evaluate it against, without saving it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleDryRunRequest {

    @NotNull(message = "rule is required")
    private RuleDraft rule;

    @NotEmpty(message = "at least one scenario is required")
    private List<RuleTestScenario> scenarios;
}
