package com.bistroAssist.queryDemo.embedding;

import com.bistroAssist.queryDemo.embedding.model.EmbeddingRecord;
import com.bistroAssist.queryDemo.vectorizer.ContentVectorizer;
import com.bistroAssist.queryDemo.vectorizer.exception.InvalidContentException;
import com.bistroAssist.queryDemo.vectorizer.model.ContentItem;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import com.bistroAssist.queryDemo.vectorizer.model.ProcessedContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedding service - keeps the index in step with business content.
 * 
 * Responsibilities:
 * - Vectorize, embed and upsert content on create/update
 * - Soft-delete embeddings when content is removed
 * - Embed free-text queries for search
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingService {

    private final ContentVectorizer contentVectorizer;
    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingIndex embeddingIndex;

    /**
     * Vectorizes, embeds and stores one content item, replacing any previous version.
     *
     * @throws InvalidContentException if the item lacks required fields
     * @throws com.bistroAssist.queryDemo.llm.exception.UpstreamProviderException if embedding fails
     */
    public EmbeddingRecord indexContent(ContentItem item) {
        if (item.getBusinessId() == null || item.getBusinessId().isBlank()) {
            throw new InvalidContentException("businessId is required");
        }
        if (item.getContentId() == null || item.getContentId().isBlank()) {
            throw new InvalidContentException("contentId is required");
        }
        ProcessedContent processed = contentVectorizer.process(item.getContentType(), item.getRawFields());
        float[] vector = embeddingProvider.embed(processed.text());

        Map<String, Object> metadata = new LinkedHashMap<>(processed.metadata());
        metadata.put("searchable", contentVectorizer.extractSearchableContent(item.getContentType(), item.getRawFields()));
        metadata.put("tokenEstimate", processed.tokenEstimate());

        EmbeddingRecord record = embeddingIndex.upsert(item.getBusinessId(), item.getContentType(),
                item.getContentId(), vector, processed.text(), metadata);
        log.info("Indexed content - businessId: {}, type: {}, contentId: {}, tokens: {}",
                item.getBusinessId(), item.getContentType(), item.getContentId(), processed.tokenEstimate());
        return record;
    }

    public boolean removeContent(String businessId, ContentType contentType, String contentId) {
        boolean removed = embeddingIndex.delete(businessId, contentType, contentId);
        log.info("Removed content - businessId: {}, type: {}, contentId: {}, removed: {}",
                businessId, contentType, contentId, removed);
        return removed;
    }

    /**
     * Embeds a query after applying the same cleaning as indexed content.
     */
    public float[] embedQuery(String queryText) {
        String cleaned = contentVectorizer.clean(queryText);
        if (cleaned.isEmpty()) {
            throw new InvalidContentException("Query text is empty");
        }
        return embeddingProvider.embed(cleaned);
    }
}
