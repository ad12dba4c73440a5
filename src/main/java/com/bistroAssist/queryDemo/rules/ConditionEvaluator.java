package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.rules.model.RuleCondition;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates single rule conditions against a rule context tree.
 * A missing field, a non-numeric operand for a numeric operator or an invalid regex never matches.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConditionEvaluator {

    private static final int MAX_CACHED_PATTERNS = 1_000;

    private final RuleFieldResolver fieldResolver;
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public boolean matches(RuleCondition condition, JsonNode contextTree) {
        if (condition == null || condition.getOperator() == null) {
            return false;
        }
        JsonNode actual = fieldResolver.resolve(contextTree, condition.getField());
        if (actual == null) {
            return false;
        }
        Object expected = condition.getValue();
        boolean caseSensitive = condition.isCaseSensitive();

        return switch (condition.getOperator()) {
            case EQUALS -> equalsValue(actual, expected, caseSensitive);
            case CONTAINS -> contains(actual, expected, caseSensitive);
            case STARTS_WITH -> expected != null
                    && normalize(text(actual), caseSensitive).startsWith(normalize(expected.toString(), caseSensitive));
            case ENDS_WITH -> expected != null
                    && normalize(text(actual), caseSensitive).endsWith(normalize(expected.toString(), caseSensitive));
            case REGEX -> regex(actual, expected, caseSensitive);
            case GREATER_THAN -> {
                Integer cmp = compareNumbers(actual, expected);
                yield cmp != null && cmp > 0;
            }
            case LESS_THAN -> {
                Integer cmp = compareNumbers(actual, expected);
                yield cmp != null && cmp < 0;
            }
            case IN -> isList(expected) && anyEquals(actual, asList(expected), caseSensitive);
            case NOT_IN -> isList(expected) && !anyEquals(actual, asList(expected), caseSensitive);
        };
    }

    private boolean equalsValue(JsonNode actual, Object expected, boolean caseSensitive) {
        if (expected == null) {
            return false;
        }
        Double actualNumber = toNumber(actual);
        Double expectedNumber = toNumber(expected);
        if (actual.isNumber() && expectedNumber != null && actualNumber != null) {
            return Double.compare(actualNumber, expectedNumber) == 0;
        }
        return normalize(text(actual), caseSensitive).equals(normalize(expected.toString(), caseSensitive));
    }

    private boolean contains(JsonNode actual, Object expected, boolean caseSensitive) {
        if (expected == null) {
            return false;
        }
        String needle = normalize(expected.toString(), caseSensitive);
        if (actual.isArray()) {
            for (JsonNode element : actual) {
                if (element.isValueNode() && normalize(element.asText(), caseSensitive).equals(needle)) {
                    return true;
                }
            }
            return false;
        }
        return normalize(text(actual), caseSensitive).contains(needle);
    }

    private boolean regex(JsonNode actual, Object expected, boolean caseSensitive) {
        if (expected == null) {
            return false;
        }
        Pattern pattern = compile(expected.toString(), caseSensitive);
        return pattern != null && pattern.matcher(text(actual)).find();
    }

    private Pattern compile(String regex, boolean caseSensitive) {
        String key = (caseSensitive ? "s:" : "i:") + regex;
        Pattern cached = patternCache.get(key);
        if (cached != null) {
            return cached;
        }
        try {
            Pattern compiled = Pattern.compile(regex, caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            if (patternCache.size() < MAX_CACHED_PATTERNS) {
                patternCache.put(key, compiled);
            }
            return compiled;
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex in rule condition - pattern: {}, error: {}", regex, e.getDescription());
            return null;
        }
    }

    /**
     * @return the comparison, or null when either side is not numeric
     */
    private Integer compareNumbers(JsonNode actual, Object expected) {
        Double a = toNumber(actual);
        Double b = toNumber(expected);
        if (a == null || b == null) {
            return null;
        }
        return Double.compare(a, b);
    }

    private boolean anyEquals(JsonNode actual, List<Object> candidates, boolean caseSensitive) {
        for (Object candidate : candidates) {
            if (equalsValue(actual, candidate, caseSensitive)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isList(Object value) {
        return value instanceof Collection || (value != null && value.getClass().isArray());
    }

    private static List<Object> asList(Object value) {
        List<Object> list = new ArrayList<>();
        if (value instanceof Collection) {
            list.addAll((Collection<?>) value);
        } else if (value instanceof Object[]) {
            list.addAll(List.of((Object[]) value));
        }
        return list;
    }

    private static Double toNumber(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            return parse(node.asText());
        }
        return null;
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            return parse((String) value);
        }
        return null;
    }

    private static Double parse(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static String normalize(String value, boolean caseSensitive) {
        return caseSensitive ? value : value.toLowerCase(Locale.ROOT);
    }
}
