package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.bistroAssist.queryDemo.rules.model.ConflictSeverity;

/**
 * Grades a conflict between a rule being written and an existing active rule.
 * {@link ConflictSeverity#HIGH} blocks the write.
 */
public interface ConflictSeverityPolicy {

    ConflictSeverity severityOf(BusinessRule candidate, BusinessRule existing);
}
