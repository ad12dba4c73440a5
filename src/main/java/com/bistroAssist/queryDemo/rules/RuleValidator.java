package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.bistroAssist.queryDemo.rules.model.ConditionOperator;
import com.bistroAssist.queryDemo.rules.model.RuleAction;
import com.bistroAssist.queryDemo.rules.model.RuleActionType;
import com.bistroAssist.queryDemo.rules.model.RuleCondition;
import com.bistroAssist.queryDemo.rules.model.RuleValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Structural validation of business rules. Collects every problem rather than stopping at the first.
 */
@Component
public class RuleValidator {

    static final String CONDITION_REQUIRED = "At least one condition is required";
    static final String ACTION_REQUIRED = "At least one action is required";

    public RuleValidationResult validate(BusinessRule rule) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (isBlank(rule.getBusinessId())) {
            errors.add("Business ID is required");
        }
        if (rule.getCategory() == null) {
            errors.add("Category is required");
        }
        if (isBlank(rule.getRuleType())) {
            errors.add("Rule type is required");
        }
        if (rule.getPriority() < 1 || rule.getPriority() > 100) {
            errors.add("Priority must be between 1 and 100");
        }
        if (rule.getConditions() == null || rule.getConditions().isEmpty()) {
            errors.add(CONDITION_REQUIRED);
        }
        if (rule.getActions() == null || rule.getActions().isEmpty()) {
            errors.add(ACTION_REQUIRED);
        }

        if (rule.getConditions() != null) {
            for (RuleCondition condition : rule.getConditions()) {
                validateCondition(condition, errors);
            }
        }
        if (rule.getActions() != null) {
            for (RuleAction action : rule.getActions()) {
                validateAction(action, errors, warnings);
            }
        }
        if (isBlank(rule.getName())) {
            warnings.add("Rule has no name");
        }

        return new RuleValidationResult(List.copyOf(errors), List.copyOf(warnings));
    }

    private void validateCondition(RuleCondition condition, List<String> errors) {
        if (condition == null) {
            errors.add("Condition must not be null");
            return;
        }
        if (isBlank(condition.getField())) {
            errors.add("Condition field is required");
        }
        if (condition.getOperator() == null) {
            errors.add("Condition operator is required");
        }
        if (condition.getValue() == null) {
            errors.add("Condition value is required");
            return;
        }
        if ((condition.getOperator() == ConditionOperator.IN || condition.getOperator() == ConditionOperator.NOT_IN)
                && !(condition.getValue() instanceof Collection)) {
            errors.add("Condition value for " + condition.getOperator().name().toLowerCase() + " must be a list");
        }
        if (condition.getOperator() == ConditionOperator.REGEX) {
            try {
                Pattern.compile(condition.getValue().toString());
            } catch (PatternSyntaxException e) {
                errors.add("Invalid regex pattern: " + condition.getValue());
            }
        }
    }

    private void validateAction(RuleAction action, List<String> errors, List<String> warnings) {
        if (action == null) {
            errors.add("Action must not be null");
            return;
        }
        if (action.getType() == null) {
            errors.add("Action type is required");
        }
        if (action.getParameters() == null) {
            errors.add("Action parameters are required");
            return;
        }
        if (action.getType() == RuleActionType.ADD_DISCLAIMER && isBlank(action.parameterAsText("text"))) {
            warnings.add("add_disclaimer action has no 'text' parameter");
        }
        if (action.getType() == RuleActionType.SET_RESPONSE_STYLE && action.getParameters().isEmpty()) {
            warnings.add("set_response_style action has no parameters");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
