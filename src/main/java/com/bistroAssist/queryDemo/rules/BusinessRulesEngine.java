package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import com.bistroAssist.queryDemo.rules.exception.RuleConflictException;
import com.bistroAssist.queryDemo.rules.exception.RuleNotFoundException;
import com.bistroAssist.queryDemo.rules.exception.RuleValidationException;
import com.bistroAssist.queryDemo.rules.model.BusinessRule;
import com.bistroAssist.queryDemo.rules.model.ConflictSeverity;
import com.bistroAssist.queryDemo.rules.model.RuleAction;
import com.bistroAssist.queryDemo.rules.model.RuleActionType;
import com.bistroAssist.queryDemo.rules.model.RuleConflict;
import com.bistroAssist.queryDemo.rules.model.RuleContext;
import com.bistroAssist.queryDemo.rules.model.RuleDraft;
import com.bistroAssist.queryDemo.rules.model.RuleEvaluationResult;
import com.bistroAssist.queryDemo.rules.model.RuleTestResult;
import com.bistroAssist.queryDemo.rules.model.RuleTestScenario;
import com.bistroAssist.queryDemo.rules.model.RuleValidationResult;
import com.bistroAssist.queryDemo.rules.model.RuleWriteResult;
import com.bistroAssist.queryDemo.rules.store.RuleRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Business rules engine - evaluates and administers per-business response rules.
 * 
 * Evaluation:
 * - Loads active rules from the TTL cache
 * - A rule applies when at least one of its conditions matches
 * - Applicable rules are walked by priority (descending, stable) accumulating actions
 * - Colliding actions are resolved in favour of the higher-priority rule; ties keep the accumulated action
 * 
 * Administration:
 * - create, update (optimistic, versioned), deactivate, list and dry-run rules
 * - every write invalidates the business's cached rules
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BusinessRulesEngine {

    private static final Comparator<BusinessRule> BY_PRIORITY_DESC =
            Comparator.comparingInt(BusinessRule::getPriority).reversed();

    private final RuleRepository ruleRepository;
    private final RuleCache ruleCache;
    private final RuleFieldResolver fieldResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final ActionConflictPolicy actionConflictPolicy;
    private final RuleValidator ruleValidator;
    private final RuleConflictDetector conflictDetector;
    private final Clock clock;

    /**
     * Evaluates the active rules of the context's business.
     * Failures while loading rules yield an empty result.
     *
     * @param context Facts about the current query
     * @return Applicable rules, resolved actions and the number of conflicts resolved
     */
    public RuleEvaluationResult evaluate(RuleContext context) {
        long start = System.currentTimeMillis();
        List<BusinessRule> rules;
        try {
            rules = ruleCache.getActiveRules(context.getBusinessId(), ruleRepository::findActiveByBusiness);
        } catch (Exception e) {
            log.error("Failed to load rules, continuing without them - businessId: {}, error: {}",
                    context.getBusinessId(), e.getMessage(), e);
            return RuleEvaluationResult.empty();
        }

        RuleEvaluationResult result = evaluateAgainst(rules, context, start);
        log.debug("Rules evaluated - businessId: {}, applicable: {}, actions: {}, conflictsResolved: {}",
                context.getBusinessId(), result.getApplicableRules().size(),
                result.getAppliedActions().size(), result.getConflictsResolved());
        return result;
    }

    /**
     * Validates and stores a new rule (version 1).
     *
     * @throws RuleValidationException if the draft is structurally invalid
     * @throws RuleConflictException   if it collides with an active rule at HIGH severity
     */
    public RuleWriteResult createRule(RuleDraft draft) {
        Instant now = clock.instant();
        BusinessRule candidate = BusinessRule.builder()
                .ruleId(draft.getRuleId() != null && !draft.getRuleId().isBlank() ? draft.getRuleId() : generateRuleId())
                .businessId(draft.getBusinessId())
                .category(draft.getCategory())
                .ruleType(draft.getRuleType())
                .name(draft.getName())
                .description(draft.getDescription())
                .priority(draft.getPriority() != null ? draft.getPriority() : 0)
                .conditions(draft.getConditions())
                .actions(draft.getActions())
                .active(draft.getActive() == null || draft.getActive())
                .version(1)
                .createdAt(now)
                .updatedAt(now)
                .createdBy(draft.getCreatedBy())
                .tags(draft.getTags() != null ? draft.getTags() : List.of())
                .build();

        requireValid(candidate);
        List<RuleConflict> warnings = checkConflicts(candidate);

        try {
            ruleRepository.insert(candidate);
        } catch (IllegalStateException e) {
            throw new RuleConflictException("Rule " + candidate.getRuleId() + " already exists");
        }
        ruleCache.invalidate(candidate.getBusinessId());

        log.info("Rule created - ruleId: {}, businessId: {}, priority: {}, warnings: {}",
                candidate.getRuleId(), candidate.getBusinessId(), candidate.getPriority(), warnings.size());
        return new RuleWriteResult(candidate, warnings);
    }

    /**
     * Applies the non-null fields of {@code changes} to a rule and bumps its version.
     *
     * @throws RuleNotFoundException   if the rule does not exist
     * @throws RuleValidationException if the merged rule is invalid
     * @throws RuleConflictException   on a HIGH-severity conflict or a stale expected version
     */
    public RuleWriteResult updateRule(String ruleId, RuleDraft changes) {
        BusinessRule existing = ruleRepository.findById(ruleId)
                .orElseThrow(() -> new RuleNotFoundException(ruleId));

        if (changes.getExpectedVersion() != null && changes.getExpectedVersion() != existing.getVersion()) {
            throw new RuleConflictException("Rule " + ruleId + " was modified concurrently: expected version "
                    + changes.getExpectedVersion() + ", current version " + existing.getVersion());
        }
        if (changes.getBusinessId() != null && !changes.getBusinessId().equals(existing.getBusinessId())) {
            throw new RuleValidationException(List.of("Business ID of an existing rule cannot change"));
        }

        BusinessRule updated = merge(existing, changes).toBuilder()
                .version(existing.getVersion() + 1)
                .updatedAt(clock.instant())
                .build();

        requireValid(updated);
        List<RuleConflict> warnings = checkConflicts(updated);

        if (!ruleRepository.replace(updated, existing.getVersion())) {
            throw new RuleConflictException("Rule " + ruleId + " was modified concurrently");
        }
        ruleCache.invalidate(updated.getBusinessId());

        log.info("Rule updated - ruleId: {}, businessId: {}, version: {}", ruleId, updated.getBusinessId(), updated.getVersion());
        return new RuleWriteResult(updated, warnings);
    }

    /**
     * Marks a rule inactive. Deactivating an inactive rule is a no-op that returns it unchanged.
     */
    public BusinessRule deactivateRule(String ruleId) {
        BusinessRule existing = ruleRepository.findById(ruleId)
                .orElseThrow(() -> new RuleNotFoundException(ruleId));
        if (!existing.isActive()) {
            return existing;
        }
        BusinessRule deactivated = existing.toBuilder()
                .active(false)
                .version(existing.getVersion() + 1)
                .updatedAt(clock.instant())
                .build();
        if (!ruleRepository.replace(deactivated, existing.getVersion())) {
            throw new RuleConflictException("Rule " + ruleId + " was modified concurrently");
        }
        ruleCache.invalidate(existing.getBusinessId());
        log.info("Rule deactivated - ruleId: {}, businessId: {}", ruleId, existing.getBusinessId());
        return deactivated;
    }

    public List<BusinessRule> getRules(String businessId) {
        return ruleRepository.findByBusiness(businessId);
    }

    /**
     * Evaluates a candidate rule, alongside the business's other active rules, against sample queries.
     * Nothing is saved.
     *
     * @throws RuleValidationException if the candidate is invalid
     */
    public List<RuleTestResult> dryRun(RuleDraft draft, List<RuleTestScenario> scenarios) {
        BusinessRule candidate = BusinessRule.builder()
                .ruleId(draft.getRuleId() != null ? draft.getRuleId() : "candidate")
                .businessId(draft.getBusinessId())
                .category(draft.getCategory())
                .ruleType(draft.getRuleType())
                .name(draft.getName())
                .description(draft.getDescription())
                .priority(draft.getPriority() != null ? draft.getPriority() : 0)
                .conditions(draft.getConditions())
                .actions(draft.getActions())
                .active(true)
                .version(0)
                .build();
        requireValid(candidate);

        List<BusinessRule> rules = new ArrayList<>();
        for (BusinessRule rule : ruleRepository.findActiveByBusiness(candidate.getBusinessId())) {
            if (!rule.getRuleId().equals(candidate.getRuleId())) {
                rules.add(rule);
            }
        }
        rules.add(candidate);

        List<RuleTestResult> results = new ArrayList<>();
        for (RuleTestScenario scenario : scenarios) {
            long start = System.currentTimeMillis();
            String testCase = scenario.getName() != null ? scenario.getName() : "Test " + (results.size() + 1);
            RuleContext context = RuleContext.builder()
                    .businessId(candidate.getBusinessId())
                    .queryText(scenario.getQueryText() != null ? scenario.getQueryText() : "")
                    .intent(scenario.getIntent() != null ? scenario.getIntent() : QueryIntent.UNKNOWN)
                    .intentConfidence(scenario.getIntentConfidence() != null ? scenario.getIntentConfidence() : 0.0)
                    .sessionId(scenario.getSessionId())
                    .turnCount(scenario.getTurnCount() != null ? scenario.getTurnCount() : 0)
                    .context(scenario.getContext() != null ? scenario.getContext() : Map.of())
                    .customer(scenario.getCustomer() != null ? scenario.getCustomer() : Map.of())
                    .build();

            RuleEvaluationResult evaluation = evaluateAgainst(rules, context, start);
            boolean applied = evaluation.getApplicableRules().stream()
                    .anyMatch(r -> r.getRuleId().equals(candidate.getRuleId()));
            boolean expectApplied = scenario.getExpectApplied() == null || scenario.getExpectApplied();
            List<RuleActionType> actualTypes = evaluation.getAppliedActions().stream().map(RuleAction::getType).toList();
            boolean passed = applied == expectApplied
                    && (scenario.getExpectedActionTypes() == null || actualTypes.containsAll(scenario.getExpectedActionTypes()));

            results.add(new RuleTestResult(testCase, applied, evaluation.getAppliedActions(), passed,
                    System.currentTimeMillis() - start));
        }
        log.info("Rule dry run - businessId: {}, scenarios: {}, passed: {}", candidate.getBusinessId(),
                results.size(), results.stream().filter(RuleTestResult::passed).count());
        return results;
    }

    private RuleEvaluationResult evaluateAgainst(List<BusinessRule> rules, RuleContext context, long start) {
        JsonNode tree = fieldResolver.toTree(context);

        List<BusinessRule> applicable = rules.stream()
                .filter(rule -> appliesTo(rule, tree))
                .sorted(BY_PRIORITY_DESC)
                .toList();

        List<AccumulatedAction> accumulated = new ArrayList<>();
        int conflictsResolved = 0;
        for (BusinessRule rule : applicable) {
            for (RuleAction action : rule.getActions()) {
                boolean keepNew = true;
                for (int i = accumulated.size() - 1; i >= 0; i--) {
                    AccumulatedAction existing = accumulated.get(i);
                    if (!actionConflictPolicy.conflicts(action, existing.action())) {
                        continue;
                    }
                    conflictsResolved++;
                    if (rule.getPriority() > existing.rulePriority()) {
                        accumulated.remove(i);
                    } else {
                        keepNew = false;
                        break;
                    }
                }
                if (keepNew) {
                    accumulated.add(new AccumulatedAction(action, rule.getPriority()));
                }
            }
        }

        return RuleEvaluationResult.builder()
                .applicableRules(applicable)
                .appliedActions(accumulated.stream().map(AccumulatedAction::action).toList())
                .conflictsResolved(conflictsResolved)
                .executionTimeMs(System.currentTimeMillis() - start)
                .build();
    }

    private boolean appliesTo(BusinessRule rule, JsonNode tree) {
        return rule.getConditions().stream().anyMatch(condition -> conditionEvaluator.matches(condition, tree));
    }

    private void requireValid(BusinessRule rule) {
        RuleValidationResult validation = ruleValidator.validate(rule);
        if (!validation.isValid()) {
            log.warn("Rule validation failed - ruleId: {}, errors: {}", rule.getRuleId(), validation.errors());
            throw new RuleValidationException(validation.errors());
        }
    }

    private List<RuleConflict> checkConflicts(BusinessRule candidate) {
        List<RuleConflict> conflicts = conflictDetector.detect(candidate,
                ruleRepository.findActiveByBusiness(candidate.getBusinessId()));
        List<RuleConflict> blocking = conflicts.stream()
                .filter(c -> c.severity() == ConflictSeverity.HIGH)
                .toList();
        if (!blocking.isEmpty()) {
            throw new RuleConflictException("High severity conflicts detected: "
                    + String.join(", ", blocking.stream().map(RuleConflict::description).toList()), blocking);
        }
        return conflicts;
    }

    private static BusinessRule merge(BusinessRule existing, RuleDraft changes) {
        BusinessRule.BusinessRuleBuilder builder = existing.toBuilder();
        if (changes.getCategory() != null) {
            builder.category(changes.getCategory());
        }
        if (changes.getRuleType() != null) {
            builder.ruleType(changes.getRuleType());
        }
        if (changes.getName() != null) {
            builder.name(changes.getName());
        }
        if (changes.getDescription() != null) {
            builder.description(changes.getDescription());
        }
        if (changes.getPriority() != null) {
            builder.priority(changes.getPriority());
        }
        if (changes.getConditions() != null) {
            builder.conditions(changes.getConditions());
        }
        if (changes.getActions() != null) {
            builder.actions(changes.getActions());
        }
        if (changes.getActive() != null) {
            builder.active(changes.getActive());
        }
        if (changes.getTags() != null) {
            builder.tags(changes.getTags());
        }
        return builder.build();
    }

    private static String generateRuleId() {
        return "rule_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    private record AccumulatedAction(RuleAction action, int rulePriority) {
    }
}
