package com.bistroAssist.queryDemo.context.model;

import java.util.Map;

public record MenuMatch(String embeddingId, String contentId, String title, double similarity,
                        double confidence, String snippet, Map<String, Object> metadata) implements ContextMatch {
}
