package com.bistroAssist.queryDemo.embedding;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingRecord;
import com.bistroAssist.queryDemo.llm.exception.ProviderQuotaExceededException;
import com.bistroAssist.queryDemo.vectorizer.ContentVectorizer;
import com.bistroAssist.queryDemo.vectorizer.exception.InvalidContentException;
import com.bistroAssist.queryDemo.vectorizer.model.ContentItem;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock
    private EmbeddingProvider embeddingProvider;

    private EmbeddingIndex embeddingIndex;
    private EmbeddingService embeddingService;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        properties.getEmbedding().setDimension(3);
        embeddingIndex = new EmbeddingIndex(properties, Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
        embeddingService = new EmbeddingService(new ContentVectorizer(properties), embeddingProvider, embeddingIndex);
    }

    @Test
    void indexContentEmbedsNormalizedTextAndStoresSearchableMetadata() {
        // Given
        when(embeddingProvider.embed(anyString())).thenReturn(new float[]{1, 0, 0});
        ContentItem item = ContentItem.builder()
                .businessId("bella-vista")
                .contentType(ContentType.FAQ)
                .contentId("faq-1")
                .rawField("question", "Do   you deliver?")
                .rawField("answer", "Yes, within 5 miles.")
                .build();

        // When
        EmbeddingRecord record = embeddingService.indexContent(item);

        // Then
        verify(embeddingProvider).embed("Question: Do you deliver? - Answer: Yes, within 5 miles.");
        assertEquals("faq-1", record.getContentId());
        assertEquals("do you deliver?", record.getMetadata().get("searchable"));
        assertEquals(1L, embeddingIndex.stats("bella-vista").get(ContentType.FAQ));
    }

    @Test
    void invalidContentNeverReachesTheProvider() {
        ContentItem item = ContentItem.builder()
                .businessId("bella-vista")
                .contentType(ContentType.POLICY)
                .contentId("p-1")
                .rawField("title", "Refunds")
                .build();

        assertThrows(InvalidContentException.class, () -> embeddingService.indexContent(item));
        verifyNoInteractions(embeddingProvider);
    }

    @Test
    void providerFailureLeavesIndexUntouched() {
        when(embeddingProvider.embed(anyString())).thenThrow(new ProviderQuotaExceededException("Quota exceeded"));
        ContentItem item = ContentItem.builder()
                .businessId("bella-vista")
                .contentType(ContentType.MENU)
                .contentId("m-1")
                .rawField("name", "Lasagna")
                .build();

        assertThrows(ProviderQuotaExceededException.class, () -> embeddingService.indexContent(item));
        assertEquals(0L, embeddingIndex.stats("bella-vista").get(ContentType.MENU));
    }

    @Test
    void queryIsCleanedBeforeEmbedding() {
        when(embeddingProvider.embed("vegan options?")).thenReturn(new float[]{0, 1, 0});

        assertArrayEquals(new float[]{0, 1, 0}, embeddingService.embedQuery("  vegan \n options?  "));
    }

    @Test
    void blankQueryIsRejected() {
        assertThrows(InvalidContentException.class, () -> embeddingService.embedQuery("   "));
        verifyNoInteractions(embeddingProvider);
    }
}
