package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Active rules per business, cached with a time-to-live.
 * 
 * Entries hold immutable rule lists, each rule carrying the version it was loaded at.
 * Writers must call {@link #invalidate(String)} after the repository write.
 */
@Slf4j
@Component
public class RuleCache {

    private final Cache<String, List<BusinessRule>> cache;

    @Autowired
    public RuleCache(AssistantProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    public RuleCache(AssistantProperties properties, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getRules().getCacheTtl())
                .ticker(ticker)
                .maximumSize(10_000)
                .build();
    }

    /**
     * Returns the cached active rules for a business, loading them when absent or expired.
     */
    public List<BusinessRule> getActiveRules(String businessId, Function<String, List<BusinessRule>> loader) {
        return cache.get(businessId, id -> {
            List<BusinessRule> loaded = List.copyOf(loader.apply(id));
            log.debug("Loaded rules into cache - businessId: {}, rules: {}", id, loaded.size());
            return loaded;
        });
    }

    public void invalidate(String businessId) {
        cache.invalidate(businessId);
        log.debug("Invalidated rule cache - businessId: {}", businessId);
    }
}
