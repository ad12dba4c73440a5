package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.bistroAssist.queryDemo.rules.model.ConflictSeverity;
import org.springframework.stereotype.Component;

/**
 * Same priority is HIGH (evaluation cannot order the two), a gap under 10 is MEDIUM, anything wider is LOW.
 */
@Component
public class PriorityGapSeverityPolicy implements ConflictSeverityPolicy {

    private static final int NARROW_GAP = 10;

    @Override
    public ConflictSeverity severityOf(BusinessRule candidate, BusinessRule existing) {
        int gap = Math.abs(candidate.getPriority() - existing.getPriority());
        if (gap == 0) {
            return ConflictSeverity.HIGH;
        }
        if (gap < NARROW_GAP) {
            return ConflictSeverity.MEDIUM;
        }
        return ConflictSeverity.LOW;
    }
}
