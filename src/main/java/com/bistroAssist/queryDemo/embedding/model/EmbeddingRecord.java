package com.bistroAssist.queryDemo.embedding.model;

import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Stored vector for one content item. Records are never mutated; an update swaps in a new instance.
 */
@Value
@Builder(toBuilder = true)
public class EmbeddingRecord {
    String id;
    String businessId;
    ContentType contentType;
    String contentId;
    String normalizedText;
    float[] vector;
    Map<String, Object> metadata;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;

    public boolean isLive() {
        return deletedAt == null;
    }
}
