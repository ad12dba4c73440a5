package com.bistroAssist.queryDemo.rules.store;

import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.bistroAssist.queryDemo.util.JsonFileLoader;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rule storage held in memory, optionally seeded from a classpath JSON array.
 */
@Slf4j
@Repository
public class InMemoryRuleRepository implements RuleRepository {

    private static final Comparator<BusinessRule> STORAGE_ORDER = Comparator
            .comparing(BusinessRule::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(BusinessRule::getRuleId);

    private final Map<String, BusinessRule> rules = new ConcurrentHashMap<>();

    public InMemoryRuleRepository() {
    }

    @Autowired
    public InMemoryRuleRepository(ObjectMapper objectMapper,
                                  @Value("${assistant.data.rules-file:data/rules.json}") String seedPath) {
        seed(objectMapper, seedPath);
    }

    @Override
    public Optional<BusinessRule> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public List<BusinessRule> findByBusiness(String businessId) {
        return rules.values().stream()
                .filter(r -> r.getBusinessId().equals(businessId))
                .sorted(STORAGE_ORDER)
                .toList();
    }

    @Override
    public List<BusinessRule> findActiveByBusiness(String businessId) {
        return rules.values().stream()
                .filter(r -> r.getBusinessId().equals(businessId) && r.isActive())
                .sorted(STORAGE_ORDER)
                .toList();
    }

    @Override
    public BusinessRule insert(BusinessRule rule) {
        BusinessRule previous = rules.putIfAbsent(rule.getRuleId(), rule);
        if (previous != null) {
            throw new IllegalStateException("Rule " + rule.getRuleId() + " already exists");
        }
        return rule;
    }

    @Override
    public boolean replace(BusinessRule rule, long currentVersion) {
        boolean[] replaced = {false};
        rules.computeIfPresent(rule.getRuleId(), (id, stored) -> {
            if (stored.getVersion() != currentVersion) {
                return stored;
            }
            replaced[0] = true;
            return rule;
        });
        return replaced[0];
    }

    private void seed(ObjectMapper objectMapper, String seedPath) {
        if (seedPath == null || seedPath.isBlank()) {
            return;
        }
        try {
            List<BusinessRule> seeded = objectMapper.readValue(JsonFileLoader.loadAsString(seedPath),
                    new TypeReference<List<BusinessRule>>() {});
            seeded.forEach(rule -> rules.put(rule.getRuleId(), rule));
            log.info("Seeded business rules - file: {}, count: {}", seedPath, seeded.size());
        } catch (IOException e) {
            log.warn("No rule seed loaded - file: {}, error: {}", seedPath, e.getMessage());
        }
    }
}
