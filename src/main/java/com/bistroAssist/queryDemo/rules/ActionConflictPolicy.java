package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.rules.model.RuleAction;
import com.bistroAssist.queryDemo.rules.model.RuleActionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether two rule actions can coexist in one answer, using the conflict classes
 * configured under {@code assistant.rules.conflict-classes}.
 */
@Slf4j
@Component
public class ActionConflictPolicy {

    private final List<ResolvedClass> conflictClasses;

    public ActionConflictPolicy(AssistantProperties properties) {
        List<ResolvedClass> resolved = new ArrayList<>();
        for (AssistantProperties.ConflictClass configured : properties.getRules().getConflictClasses()) {
            Set<RuleActionType> types = EnumSet.noneOf(RuleActionType.class);
            for (String typeName : configured.getActionTypes()) {
                RuleActionType.fromWireName(typeName).ifPresentOrElse(types::add,
                        () -> log.warn("Ignoring unknown action type in conflict class - class: {}, type: {}",
                                configured.getName(), typeName));
            }
            List<String> keys = configured.getParameterKeys() != null ? List.copyOf(configured.getParameterKeys()) : List.of();
            resolved.add(new ResolvedClass(configured.getName(), types, keys));
        }
        this.conflictClasses = List.copyOf(resolved);
        log.info("Loaded action conflict classes - count: {}", conflictClasses.size());
    }

    public boolean conflicts(RuleAction first, RuleAction second) {
        if (first == null || second == null || first.getType() == null || second.getType() == null) {
            return false;
        }
        for (ResolvedClass conflictClass : conflictClasses) {
            if (!conflictClass.types().contains(first.getType()) || !conflictClass.types().contains(second.getType())) {
                continue;
            }
            if (conflictClass.parameterKeys().isEmpty()) {
                return true;
            }
            for (String key : conflictClass.parameterKeys()) {
                Object a = first.getParameters() != null ? first.getParameters().get(key) : null;
                Object b = second.getParameters() != null ? second.getParameters().get(key) : null;
                if (a != null && b != null && !Objects.equals(a, b)) {
                    return true;
                }
            }
        }
        return false;
    }

    private record ResolvedClass(String name, Set<RuleActionType> types, List<String> parameterKeys) {
    }
}
