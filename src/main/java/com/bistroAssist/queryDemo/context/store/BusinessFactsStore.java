package com.bistroAssist.queryDemo.context.store;

import com.bistroAssist.queryDemo.context.model.BusinessFacts;

import java.util.Optional;

/**
 * Read access to business profiles.
 */
public interface BusinessFactsStore {

    Optional<BusinessFacts> findBusiness(String businessId);

    default boolean exists(String businessId) {
        return findBusiness(businessId).isPresent();
    }
}
