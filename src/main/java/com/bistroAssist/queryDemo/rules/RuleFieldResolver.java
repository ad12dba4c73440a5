package com.bistroAssist.queryDemo.rules;

import com.bistroAssist.queryDemo.rules.model.RuleContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves dot paths such as {@code context.businessFacts.location.city} against a rule context.
 * Numeric segments index into arrays.
 */
@Component
@RequiredArgsConstructor
public class RuleFieldResolver {

    private final ObjectMapper objectMapper;

    /**
     * Converts the context to a tree once per evaluation.
     */
    public JsonNode toTree(RuleContext context) {
        return objectMapper.valueToTree(context);
    }

    /**
     * @return the node at {@code path}, or null when any segment is missing or the value is JSON null
     */
    public JsonNode resolve(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return null;
        }
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current == null) {
                return null;
            }
            if (current.isArray() && isIndex(segment)) {
                current = current.get(Integer.parseInt(segment));
            } else if (current.isObject()) {
                current = current.get(segment);
            } else {
                return null;
            }
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return null;
        }
        return current;
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
