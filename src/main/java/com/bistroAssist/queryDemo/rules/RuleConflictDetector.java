package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.bistroAssist.queryDemo.rules.model.ConflictSeverity;
import com.bistroAssist.queryDemo.rules.model.ConflictType;
import com.bistroAssist.queryDemo.rules.model.RuleAction;
import com.bistroAssist.queryDemo.rules.model.RuleConflict;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds active rules whose actions collide with a rule about to be written.
 */
@Component
@RequiredArgsConstructor
public class RuleConflictDetector {

    private final ActionConflictPolicy actionConflictPolicy;
    private final ConflictSeverityPolicy severityPolicy;

    public List<RuleConflict> detect(BusinessRule candidate, List<BusinessRule> activeRules) {
        List<RuleConflict> conflicts = new ArrayList<>();
        if (!candidate.isActive()) {
            return conflicts;
        }
        for (BusinessRule existing : activeRules) {
            if (existing.getRuleId() != null && existing.getRuleId().equals(candidate.getRuleId())) {
                continue;
            }
            String collision = firstCollision(candidate, existing);
            if (collision == null) {
                continue;
            }
            ConflictSeverity severity = severityPolicy.severityOf(candidate, existing);
            ConflictType type = candidate.getPriority() == existing.getPriority()
                    ? ConflictType.PRIORITY_CONFLICT
                    : ConflictType.ACTION_CONTRADICTION;
            conflicts.add(new RuleConflict(existing.getRuleId(), type,
                    collision + " with rule '" + describe(existing) + "' (priority " + existing.getPriority() + ")",
                    severity));
        }
        return conflicts;
    }

    private String firstCollision(BusinessRule candidate, BusinessRule existing) {
        for (RuleAction mine : candidate.getActions()) {
            for (RuleAction theirs : existing.getActions()) {
                if (actionConflictPolicy.conflicts(mine, theirs)) {
                    return "Action " + mine.getType().getWireName() + " conflicts with " + theirs.getType().getWireName();
                }
            }
        }
        return null;
    }

    private static String describe(BusinessRule rule) {
        return rule.getName() != null ? rule.getName() : rule.getRuleId();
    }
}
