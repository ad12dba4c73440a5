package com.bistroAssist.queryDemo.embedding;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.embedding.exception.InvalidDimensionException;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingMatch;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingRecord;
import com.bistroAssist.queryDemo.embedding.model.SearchOptions;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingIndexTest {

    private static final String BUSINESS = "bella-vista";

    private EmbeddingIndex index;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        properties.getEmbedding().setDimension(3);
        index = new EmbeddingIndex(properties, Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void wrongDimensionIsRejectedAndNothingIsWritten() {
        index.upsert(BUSINESS, ContentType.MENU, "m1", new float[]{1, 0, 0}, "Margherita", Map.of());

        assertThrows(InvalidDimensionException.class,
                () -> index.upsert(BUSINESS, ContentType.MENU, "m1", new float[]{0, 1}, "changed", Map.of()));
        assertThrows(InvalidDimensionException.class,
                () -> index.upsert(BUSINESS, ContentType.MENU, "m2", new float[]{0, 1, 0, 0}, "new", Map.of()));

        List<EmbeddingMatch> matches = index.search(BUSINESS, new float[]{1, 0, 0},
                SearchOptions.builder().minScore(0.0).limit(10).build());
        assertEquals(1, matches.size());
        assertEquals("Margherita", matches.get(0).record().getNormalizedText());
        assertEquals(1L, index.stats(BUSINESS).get(ContentType.MENU));
    }

    @Test
    void searchIsSortedDescendingAndRespectsMinScore() {
        index.upsert(BUSINESS, ContentType.MENU, "exact", new float[]{1, 0, 0}, "exact", Map.of());
        index.upsert(BUSINESS, ContentType.MENU, "close", new float[]{0.9f, 0.3f, 0}, "close", Map.of());
        index.upsert(BUSINESS, ContentType.MENU, "far", new float[]{0, 1, 0}, "far", Map.of());
        index.upsert(BUSINESS, ContentType.FAQ, "faq", new float[]{1, 0.1f, 0}, "faq", Map.of());

        List<EmbeddingMatch> matches = index.search(BUSINESS, new float[]{1, 0, 0},
                SearchOptions.builder().contentType(ContentType.MENU).minScore(0.7).build());

        assertEquals(List.of("exact", "close"), matches.stream().map(m -> m.record().getContentId()).toList());
        for (int i = 0; i < matches.size(); i++) {
            assertTrue(matches.get(i).similarity() >= 0.7);
            if (i > 0) {
                assertTrue(matches.get(i - 1).similarity() >= matches.get(i).similarity());
            }
        }
    }

    @Test
    void upsertKeepsIdentityOfLiveRecord() {
        EmbeddingRecord first = index.upsert(BUSINESS, ContentType.POLICY, "p1", new float[]{1, 0, 0}, "v1", Map.of());
        EmbeddingRecord second = index.upsert(BUSINESS, ContentType.POLICY, "p1", new float[]{0, 1, 0}, "v2", Map.of());

        assertEquals(first.getId(), second.getId());
        assertEquals("v2", second.getNormalizedText());
        assertEquals(1L, index.stats(BUSINESS).get(ContentType.POLICY));
    }

    @Test
    void deletedRecordsAreHiddenAndReinsertGetsNewId() {
        EmbeddingRecord original = index.upsert(BUSINESS, ContentType.FAQ, "f1", new float[]{1, 0, 0}, "faq", Map.of());

        assertTrue(index.delete(BUSINESS, ContentType.FAQ, "f1"));
        assertFalse(index.delete(BUSINESS, ContentType.FAQ, "f1"));
        assertTrue(index.search(BUSINESS, new float[]{1, 0, 0}, SearchOptions.builder().minScore(0.0).build()).isEmpty());

        EmbeddingRecord reinserted = index.upsert(BUSINESS, ContentType.FAQ, "f1", new float[]{1, 0, 0}, "faq", Map.of());
        assertNotEquals(original.getId(), reinserted.getId());
    }

    @Test
    void zeroVectorHasZeroSimilarity() {
        assertEquals(0.0, EmbeddingIndex.cosine(new float[]{0, 0, 0}, new float[]{1, 0, 0}));
        assertEquals(1.0, EmbeddingIndex.cosine(new float[]{2, 0, 0}, new float[]{1, 0, 0}), 1e-9);
    }

    @Test
    void searchIsScopedToBusiness() {
        index.upsert("other", ContentType.MENU, "m1", new float[]{1, 0, 0}, "other", Map.of());

        assertTrue(index.search(BUSINESS, new float[]{1, 0, 0}, SearchOptions.builder().minScore(0.0).build()).isEmpty());
    }
}
