package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class RuleCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final AtomicInteger loads = new AtomicInteger();
    private final Function<String, List<BusinessRule>> loader = businessId -> {
        loads.incrementAndGet();
        return List.of(BusinessRule.builder().ruleId("r-" + loads.get()).businessId(businessId).build());
    };

    private RuleCache cache;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        properties.getRules().setCacheTtl(Duration.ofMinutes(5));
        Ticker ticker = nanos::get;
        cache = new RuleCache(properties, ticker);
    }

    @Test
    void rulesAreServedFromCacheWithinTtl() {
        cache.getActiveRules("bella-vista", loader);
        nanos.addAndGet(Duration.ofMinutes(4).toNanos());
        List<BusinessRule> rules = cache.getActiveRules("bella-vista", loader);

        assertEquals(1, loads.get());
        assertEquals("r-1", rules.get(0).getRuleId());
    }

    @Test
    void expiredEntryIsReloaded() {
        cache.getActiveRules("bella-vista", loader);
        nanos.addAndGet(Duration.ofMinutes(5).plusSeconds(1).toNanos());

        List<BusinessRule> rules = cache.getActiveRules("bella-vista", loader);

        assertEquals(2, loads.get());
        assertEquals("r-2", rules.get(0).getRuleId());
    }

    @Test
    void invalidationForcesReloadForThatBusinessOnly() {
        cache.getActiveRules("bella-vista", loader);
        cache.getActiveRules("green-bowl", loader);

        cache.invalidate("bella-vista");
        cache.getActiveRules("bella-vista", loader);
        cache.getActiveRules("green-bowl", loader);

        assertEquals(3, loads.get());
    }
}
