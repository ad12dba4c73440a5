package com.bistroAssist.queryDemo.context;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.context.exception.ContextRetrievalException;
import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import com.bistroAssist.queryDemo.context.model.ContextBundle;
import com.bistroAssist.queryDemo.context.model.ConversationTurn;
import com.bistroAssist.queryDemo.context.store.BusinessFactsStore;
import com.bistroAssist.queryDemo.context.store.ConversationStore;
import com.bistroAssist.queryDemo.embedding.EmbeddingIndex;
import com.bistroAssist.queryDemo.embedding.EmbeddingService;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingMatch;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingRecord;
import com.bistroAssist.queryDemo.intent.model.QueryIntent;
import com.bistroAssist.queryDemo.llm.exception.ProviderQuotaExceededException;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContextRetrieverTest {

    private static final String BUSINESS = "bella-vista";
    private static final float[] QUERY_VECTOR = {1, 0, 0};

    @Mock
    private EmbeddingService embeddingService;

    @Mock
    private BusinessFactsStore businessFactsStore;

    @Mock
    private ConversationStore conversationStore;

    private EmbeddingIndex embeddingIndex;
    private ContextRetriever retriever;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        properties.getEmbedding().setDimension(3);
        embeddingIndex = new EmbeddingIndex(properties, Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
        retriever = new ContextRetriever(embeddingService, embeddingIndex, businessFactsStore, conversationStore,
                properties, Runnable::run);
    }

    @Test
    void bundleCarriesEveryLookup() {
        // Given
        when(embeddingService.embedQuery("vegan pizza")).thenReturn(QUERY_VECTOR);
        embeddingIndex.upsert(BUSINESS, ContentType.MENU, "m-1", new float[]{1, 0.1f, 0},
                "Vegan pizza - Category: Pizza", Map.of("name", "Vegan pizza"));
        embeddingIndex.upsert(BUSINESS, ContentType.FAQ, "f-1", new float[]{0.9f, 0.2f, 0},
                "Question: Is the pizza vegan? - Answer: Ask for the vegan base.", Map.of("question", "Is the pizza vegan?"));
        embeddingIndex.upsert(BUSINESS, ContentType.POLICY, "p-1", new float[]{0, 1, 0},
                "Refunds - Within 7 days", Map.of("title", "Refunds"));
        when(businessFactsStore.findBusiness(BUSINESS)).thenReturn(Optional.of(BusinessFacts.builder()
                .businessId(BUSINESS).name("Bella Vista").build()));
        List<ConversationTurn> history = List.of(
                ConversationTurn.user("hi", QueryIntent.GENERAL_CHAT, Instant.parse("2024-03-01T11:59:00Z")));
        when(conversationStore.getHistory(BUSINESS, "session-1234", 10)).thenReturn(history);

        // When
        ContextBundle bundle = retriever.retrieve(BUSINESS, "vegan pizza", "session-1234");

        // Then
        assertEquals(1, bundle.getMenuMatches().size());
        assertEquals("Vegan pizza", bundle.getMenuMatches().get(0).title());
        assertEquals(1, bundle.getFaqMatches().size());
        assertTrue(bundle.getPolicyMatches().isEmpty());
        assertEquals("Bella Vista", bundle.getBusinessFacts().getName());
        assertEquals(history, bundle.getConversationHistory());
        assertEquals(List.of("m-1", "f-1"), bundle.sourceIds());
        assertEquals(List.of("menu", "faqs", "business_data", "conversation"), bundle.contributingSources());
    }

    @Test
    void failedLookupDegradesToEmptyWithoutFailingTheRest() {
        // Given
        when(embeddingService.embedQuery("lasagna")).thenReturn(QUERY_VECTOR);
        embeddingIndex.upsert(BUSINESS, ContentType.MENU, "m-2", new float[]{1, 0, 0},
                "Lasagna - Category: Pasta", Map.of("name", "Lasagna"));
        when(businessFactsStore.findBusiness(BUSINESS)).thenThrow(new IllegalStateException("store offline"));

        // When
        ContextBundle bundle = retriever.retrieve(BUSINESS, "lasagna", null);

        // Then
        assertNull(bundle.getBusinessFacts());
        assertEquals(1, bundle.getMenuMatches().size());
        assertTrue(bundle.getConversationHistory().isEmpty());
        verifyNoInteractions(conversationStore);
    }

    @Test
    void embeddingFailureAbortsRetrieval() {
        when(embeddingService.embedQuery(anyString())).thenThrow(new ProviderQuotaExceededException("Quota exceeded"));

        ContextRetrievalException ex = assertThrows(ContextRetrievalException.class,
                () -> retriever.retrieve(BUSINESS, "anything", null));

        assertInstanceOf(ProviderQuotaExceededException.class, ex.getCause());
    }

    @Test
    void confidenceBoostsVerbatimMatchesAndFaqs() {
        EmbeddingRecord faq = EmbeddingRecord.builder()
                .contentType(ContentType.FAQ)
                .normalizedText("Question: Do you deliver? - Answer: Yes")
                .build();

        double confidence = ContextRetriever.confidence(new EmbeddingMatch(faq, 0.7), "Do you deliver?", "deliver");

        assertEquals(1.0, confidence, 1e-9);
        assertEquals(0.85, ContextRetriever.confidence(new EmbeddingMatch(faq, 0.7), null, "deliver"), 1e-9);
    }

    @Test
    void snippetIsCentredOnTheQueryAndBounded() {
        String content = "a".repeat(200) + " tiramisu " + "b".repeat(200);

        String snippet = ContextRetriever.snippet(content, "tiramisu", 60);

        assertTrue(snippet.length() <= 60);
        assertTrue(snippet.contains("tiramisu"));
        assertTrue(snippet.startsWith("...") && snippet.endsWith("..."));
        assertEquals("short", ContextRetriever.snippet("short", "x", 60));
    }
}
