package com.bistroAssist.queryDemo.embedding;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.embedding.exception.InvalidDimensionException;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingMatch;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingRecord;
import com.bistroAssist.queryDemo.embedding.model.SearchOptions;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory vector index, partitioned by business.
 * 
 * Responsibilities:
 * - Keep exactly one live record per (business, content type, content id)
 * - Soft-delete records when content is removed
 * - Brute-force cosine search over the live records of one business
 * 
 * Each key's record is swapped atomically with {@link ConcurrentHashMap#compute},
 * so concurrent searches see either the old or the new record, never a mix.
 */
@Slf4j
@Component
public class EmbeddingIndex {

    private final Map<String, ConcurrentHashMap<String, EmbeddingRecord>> recordsByBusiness = new ConcurrentHashMap<>();
    private final int dimension;
    private final Clock clock;

    public EmbeddingIndex(AssistantProperties properties, Clock clock) {
        this.dimension = properties.getEmbedding().getDimension();
        this.clock = clock;
    }

    /**
     * Inserts or replaces the live record for a content item.
     *
     * @throws InvalidDimensionException if the vector length differs from the configured dimension;
     *                                   nothing is written in that case
     */
    public EmbeddingRecord upsert(String businessId, ContentType contentType, String contentId,
                                  float[] vector, String normalizedText, Map<String, Object> metadata) {
        requireDimension(vector);
        float[] stored = Arrays.copyOf(vector, vector.length);
        Map<String, Object> storedMetadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();

        ConcurrentHashMap<String, EmbeddingRecord> records =
                recordsByBusiness.computeIfAbsent(businessId, k -> new ConcurrentHashMap<>());

        EmbeddingRecord result = records.compute(key(contentType, contentId), (key, existing) -> {
            Instant now = clock.instant();
            if (existing != null && existing.isLive()) {
                return existing.toBuilder()
                        .vector(stored)
                        .normalizedText(normalizedText)
                        .metadata(storedMetadata)
                        .updatedAt(now)
                        .build();
            }
            return EmbeddingRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .businessId(businessId)
                    .contentType(contentType)
                    .contentId(contentId)
                    .vector(stored)
                    .normalizedText(normalizedText)
                    .metadata(storedMetadata)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        });

        log.debug("Upserted embedding - businessId: {}, type: {}, contentId: {}, id: {}",
                businessId, contentType, contentId, result.getId());
        return result;
    }

    /**
     * Soft-deletes the live record for a content item.
     *
     * @return true if a live record was marked deleted
     */
    public boolean delete(String businessId, ContentType contentType, String contentId) {
        ConcurrentHashMap<String, EmbeddingRecord> records = recordsByBusiness.get(businessId);
        if (records == null) {
            return false;
        }
        boolean[] deleted = {false};
        records.computeIfPresent(key(contentType, contentId), (key, existing) -> {
            if (!existing.isLive()) {
                return existing;
            }
            deleted[0] = true;
            return existing.toBuilder().deletedAt(clock.instant()).build();
        });
        if (deleted[0]) {
            log.debug("Soft-deleted embedding - businessId: {}, type: {}, contentId: {}", businessId, contentType, contentId);
        }
        return deleted[0];
    }

    /**
     * Finds live records of a business most similar to the query vector.
     * Results are at or above {@code minScore}, sorted by similarity then recency, at most {@code limit}.
     */
    public List<EmbeddingMatch> search(String businessId, float[] queryVector, SearchOptions options) {
        requireDimension(queryVector);
        ConcurrentHashMap<String, EmbeddingRecord> records = recordsByBusiness.get(businessId);
        if (records == null || options.getLimit() <= 0) {
            return List.of();
        }
        return records.values().stream()
                .filter(EmbeddingRecord::isLive)
                .filter(r -> options.getContentType() == null || r.getContentType() == options.getContentType())
                .map(r -> new EmbeddingMatch(r, cosine(queryVector, r.getVector())))
                .filter(m -> m.similarity() >= options.getMinScore())
                .sorted(Comparator.comparingDouble(EmbeddingMatch::similarity).reversed()
                        .thenComparing((EmbeddingMatch m) -> m.record().getUpdatedAt(), Comparator.reverseOrder()))
                .limit(options.getLimit())
                .collect(Collectors.toList());
    }

    /**
     * Live record count per content type for one business.
     */
    public Map<ContentType, Long> stats(String businessId) {
        Map<ContentType, Long> counts = new EnumMap<>(ContentType.class);
        for (ContentType type : ContentType.values()) {
            counts.put(type, 0L);
        }
        ConcurrentHashMap<String, EmbeddingRecord> records = recordsByBusiness.get(businessId);
        if (records != null) {
            records.values().stream()
                    .filter(EmbeddingRecord::isLive)
                    .forEach(r -> counts.merge(r.getContentType(), 1L, Long::sum));
        }
        return counts;
    }

    public int getDimension() {
        return dimension;
    }

    private void requireDimension(float[] vector) {
        int actual = vector != null ? vector.length : 0;
        if (actual != dimension) {
            throw new InvalidDimensionException(dimension, actual);
        }
    }

    private static String key(ContentType contentType, String contentId) {
        return contentType.name() + ":" + contentId;
    }

    // cosine that works on float[]
    static double cosine(float[] a, float[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
