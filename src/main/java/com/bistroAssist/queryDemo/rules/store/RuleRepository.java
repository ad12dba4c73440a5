package com.bistroAssist.queryDemo.rules.store;

import com.bistroAssist.queryDemo.rules.model.BusinessRule;

import java.util.List;
import java.util.Optional;

public interface RuleRepository {

    Optional<BusinessRule> findById(String ruleId);

    /**
     * All rules of a business, active or not.
     */
    List<BusinessRule> findByBusiness(String businessId);

    List<BusinessRule> findActiveByBusiness(String businessId);

    /**
     * Inserts a rule that must not exist yet.
     */
    BusinessRule insert(BusinessRule rule);

    /**
     * Replaces a rule only if its stored version still equals {@code currentVersion}.
     *
     * @return true if the replacement happened
     */
    boolean replace(BusinessRule rule, long currentVersion);
}
