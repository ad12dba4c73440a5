package com.bistroAssist.queryDemo.gateway.controller;

import com.bistroAssist.queryDemo.gateway.dto.RuleDryRunRequest;
import com.bistroAssist.queryDemo.rules.BusinessRulesEngine;
import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.bistroAssist.queryDemo.rules.model.RuleDraft;
import com.bistroAssist.queryDemo.rules.model.RuleTestResult;
import com.bistroAssist.queryDemo.rules.model.RuleWriteResult;
import com.bistroAssist.queryDemo.rules.exception.RuleValidationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Business rule administration for one business.
 */
@RestController
@RequestMapping("/api/v1/businesses/{businessId}/rules")
@RequiredArgsConstructor
public class RuleController {

    private final BusinessRulesEngine rulesEngine;

    @GetMapping
    public List<BusinessRule> list(@PathVariable String businessId) {
        return rulesEngine.getRules(businessId);
    }

    @PostMapping
    public ResponseEntity<RuleWriteResult> create(@PathVariable String businessId, @RequestBody RuleDraft draft) {
        draft.setBusinessId(businessId);
        return ResponseEntity.status(HttpStatus.CREATED).body(rulesEngine.createRule(draft));
    }

    @PutMapping("/{ruleId}")
    public RuleWriteResult update(@PathVariable String businessId, @PathVariable String ruleId,
                                  @RequestBody RuleDraft changes) {
        requireSameBusiness(businessId, changes);
        return rulesEngine.updateRule(ruleId, changes);
    }

    @DeleteMapping("/{ruleId}")
    public BusinessRule deactivate(@PathVariable String businessId, @PathVariable String ruleId) {
        return rulesEngine.deactivateRule(ruleId);
    }

    /**
     * Evaluates a candidate rule against test scenarios without saving it.
     */
    @PostMapping("/dry-run")
    public List<RuleTestResult> dryRun(@PathVariable String businessId, @Valid @RequestBody RuleDryRunRequest request) {
        request.getRule().setBusinessId(businessId);
        return rulesEngine.dryRun(request.getRule(), request.getScenarios());
    }

    private static void requireSameBusiness(String businessId, RuleDraft changes) {
        if (changes.getBusinessId() != null && !changes.getBusinessId().equals(businessId)) {
            throw new RuleValidationException(List.of("Business ID in body does not match the path"));
        }
    }
}
