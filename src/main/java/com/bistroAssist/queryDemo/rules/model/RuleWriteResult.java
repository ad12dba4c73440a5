package com.bistroAssist.queryDemo.rules.model;

import java.util.List;

/**
 * A saved rule together with the non-blocking conflicts found while saving it.
 */
public record RuleWriteResult(BusinessRule rule, List<RuleConflict> warnings) {
}
