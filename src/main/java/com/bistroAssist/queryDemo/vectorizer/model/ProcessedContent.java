package com.bistroAssist.queryDemo.vectorizer.model;

import java.util.Map;

/**
 * Normalized text ready for embedding.
 *
 * @param text          cleaned and possibly truncated text
 * @param tokenEstimate ceil(chars / 4) of {@code text}
 * @param metadata      content type tag, salient source fields and lengths
 */
public record ProcessedContent(String text, int tokenEstimate, Map<String, Object> metadata) {
}
