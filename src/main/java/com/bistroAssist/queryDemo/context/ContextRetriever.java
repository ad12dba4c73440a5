package com.bistroAssist.queryDemo.context;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.context.exception.ContextRetrievalException;
import com.bistroAssist.queryDemo.context.model.BusinessFacts;
import com.bistroAssist.queryDemo.context.model.ContextBundle;
import com.bistroAssist.queryDemo.context.model.ConversationTurn;
import com.bistroAssist.queryDemo.context.model.FaqMatch;
import com.bistroAssist.queryDemo.context.model.MenuMatch;
import com.bistroAssist.queryDemo.context.model.PolicyMatch;
import com.bistroAssist.queryDemo.context.store.BusinessFactsStore;
import com.bistroAssist.queryDemo.context.store.ConversationStore;
import com.bistroAssist.queryDemo.embedding.EmbeddingIndex;
import com.bistroAssist.queryDemo.embedding.EmbeddingService;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingMatch;
import com.bistroAssist.queryDemo.embedding.model.EmbeddingRecord;
import com.bistroAssist.queryDemo.embedding.model.SearchOptions;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Context retriever - gathers everything the answer needs for one query.
 * 
 * Responsibilities:
 * - Embed the query (the only failure that aborts retrieval)
 * - Search menu, policies and FAQs in parallel with the business profile and history lookups
 * - Score matches and cut snippets around the query text
 * - Degrade each failed lookup to an empty result
 */
@Slf4j
@Service
public class ContextRetriever {

    private static final double CONTENT_MATCH_BOOST = 0.1;
    private static final double TITLE_MATCH_BOOST = 0.15;
    private static final double FAQ_BOOST = 0.05;
    private static final String ELLIPSIS = "...";

    private final EmbeddingService embeddingService;
    private final EmbeddingIndex embeddingIndex;
    private final BusinessFactsStore businessFactsStore;
    private final ConversationStore conversationStore;
    private final AssistantProperties properties;
    private final Executor executor;

    public ContextRetriever(EmbeddingService embeddingService,
                            EmbeddingIndex embeddingIndex,
                            BusinessFactsStore businessFactsStore,
                            ConversationStore conversationStore,
                            AssistantProperties properties,
                            @Qualifier("contextRetrievalExecutor") Executor executor) {
        this.embeddingService = embeddingService;
        this.embeddingIndex = embeddingIndex;
        this.businessFactsStore = businessFactsStore;
        this.conversationStore = conversationStore;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Retrieves context for a query.
     *
     * @param businessId Business the query is addressed to
     * @param query      Customer query text
     * @param sessionId  Session id, or null for no history
     * @return Bundle with every lookup that succeeded
     * @throws ContextRetrievalException if the query cannot be embedded
     */
    public ContextBundle retrieve(String businessId, String query, String sessionId) {
        float[] queryVector;
        try {
            queryVector = embeddingService.embedQuery(query);
        } catch (Exception e) {
            log.error("Failed to embed query - businessId: {}, error: {}", businessId, e.getMessage());
            throw new ContextRetrievalException("Failed to generate query embedding: " + e.getMessage(), e);
        }

        AssistantProperties.Retrieval settings = properties.getRetrieval();

        CompletableFuture<List<MenuMatch>> menu = lookup("menu", businessId,
                () -> search(businessId, queryVector, ContentType.MENU, settings).stream()
                        .map(m -> toMenuMatch(m, query, settings.getSnippetLength()))
                        .sorted(Comparator.comparingDouble(MenuMatch::confidence).reversed())
                        .toList(),
                List.of());
        CompletableFuture<List<PolicyMatch>> policies = lookup("policies", businessId,
                () -> search(businessId, queryVector, ContentType.POLICY, settings).stream()
                        .map(m -> toPolicyMatch(m, query, settings.getSnippetLength()))
                        .sorted(Comparator.comparingDouble(PolicyMatch::confidence).reversed())
                        .toList(),
                List.of());
        CompletableFuture<List<FaqMatch>> faqs = lookup("faqs", businessId,
                () -> search(businessId, queryVector, ContentType.FAQ, settings).stream()
                        .map(m -> toFaqMatch(m, query, settings.getSnippetLength()))
                        .sorted(Comparator.comparingDouble(FaqMatch::confidence).reversed())
                        .toList(),
                List.of());
        CompletableFuture<BusinessFacts> facts = lookup("business_data", businessId,
                () -> businessFactsStore.findBusiness(businessId).orElse(null),
                null);
        CompletableFuture<List<ConversationTurn>> history = lookup("conversation", businessId,
                () -> sessionId == null
                        ? List.<ConversationTurn>of()
                        : conversationStore.getHistory(businessId, sessionId, settings.getHistoryLimit()),
                List.of());

        CompletableFuture.allOf(menu, policies, faqs, facts, history).join();

        ContextBundle bundle = ContextBundle.builder()
                .menuMatches(menu.join())
                .policyMatches(policies.join())
                .faqMatches(faqs.join())
                .businessFacts(facts.join())
                .conversationHistory(history.join())
                .build();

        log.debug("Context retrieved - businessId: {}, menu: {}, policies: {}, faqs: {}, facts: {}, history: {}",
                businessId, bundle.getMenuMatches().size(), bundle.getPolicyMatches().size(),
                bundle.getFaqMatches().size(), bundle.getBusinessFacts() != null, bundle.getConversationHistory().size());
        return bundle;
    }

    private <T> CompletableFuture<T> lookup(String source, String businessId, Supplier<T> supplier, T fallback) {
        return CompletableFuture.supplyAsync(supplier, executor)
                .exceptionally(e -> {
                    log.warn("Context lookup failed, continuing without it - source: {}, businessId: {}, error: {}",
                            source, businessId, e.getMessage());
                    return fallback;
                });
    }

    private List<EmbeddingMatch> search(String businessId, float[] queryVector, ContentType type,
                                        AssistantProperties.Retrieval settings) {
        return embeddingIndex.search(businessId, queryVector, SearchOptions.builder()
                .contentType(type)
                .limit(settings.getTopN())
                .minScore(settings.getMinScore())
                .build());
    }

    private MenuMatch toMenuMatch(EmbeddingMatch match, String query, int snippetLength) {
        EmbeddingRecord record = match.record();
        String title = metadataText(record, "name");
        return new MenuMatch(record.getId(), record.getContentId(), title, match.similarity(),
                confidence(match, title, query), snippet(record.getNormalizedText(), query, snippetLength),
                record.getMetadata());
    }

    private PolicyMatch toPolicyMatch(EmbeddingMatch match, String query, int snippetLength) {
        EmbeddingRecord record = match.record();
        String title = metadataText(record, "title");
        return new PolicyMatch(record.getId(), record.getContentId(), title, match.similarity(),
                confidence(match, title, query), snippet(record.getNormalizedText(), query, snippetLength),
                record.getMetadata());
    }

    private FaqMatch toFaqMatch(EmbeddingMatch match, String query, int snippetLength) {
        EmbeddingRecord record = match.record();
        String title = metadataText(record, "question");
        return new FaqMatch(record.getId(), record.getContentId(), title, match.similarity(),
                confidence(match, title, query), snippet(record.getNormalizedText(), query, snippetLength),
                record.getMetadata());
    }

    /**
     * Similarity, boosted when the query appears verbatim in the content or title, and for FAQs.
     * Clamped to [0, 1].
     */
    static double confidence(EmbeddingMatch match, String title, String query) {
        double confidence = match.similarity();
        String queryLower = query.toLowerCase(Locale.ROOT);
        String content = match.record().getNormalizedText();
        if (content != null && content.toLowerCase(Locale.ROOT).contains(queryLower)) {
            confidence += CONTENT_MATCH_BOOST;
        }
        if (title != null && title.toLowerCase(Locale.ROOT).contains(queryLower)) {
            confidence += TITLE_MATCH_BOOST;
        }
        if (match.record().getContentType() == ContentType.FAQ) {
            confidence += FAQ_BOOST;
        }
        return Math.min(1.0, Math.max(0.0, confidence));
    }

    /**
     * Cuts at most {@code maxLength} characters (ellipses included), centred on the query when it occurs.
     */
    static String snippet(String content, String query, int maxLength) {
        if (content == null) {
            return "";
        }
        if (content.length() <= maxLength) {
            return content;
        }
        int window = Math.max(1, maxLength - 2 * ELLIPSIS.length());
        int queryIndex = content.toLowerCase(Locale.ROOT).indexOf(query.toLowerCase(Locale.ROOT));
        if (queryIndex < 0) {
            return content.substring(0, Math.max(1, maxLength - ELLIPSIS.length())) + ELLIPSIS;
        }
        int centre = queryIndex + query.length() / 2;
        int start = Math.max(0, Math.min(centre - window / 2, content.length() - window));
        int end = Math.min(content.length(), start + window);

        StringBuilder snippet = new StringBuilder();
        if (start > 0) {
            snippet.append(ELLIPSIS);
        }
        snippet.append(content, start, end);
        if (end < content.length()) {
            snippet.append(ELLIPSIS);
        }
        return snippet.toString();
    }

    private static String metadataText(EmbeddingRecord record, String key) {
        Object value = record.getMetadata() != null ? record.getMetadata().get(key) : null;
        return value != null ? value.toString() : null;
    }
}
