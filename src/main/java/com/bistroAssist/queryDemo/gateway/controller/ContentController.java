package com.bistroAssist.queryDemo.gateway.controller;

import com.bistroAssist.queryDemo.embedding.EmbeddingIndex;
import com.bistroAssist.queryDemo.embedding.EmbeddingService;
import com.bistroAssist.queryDemo.gateway.dto.ContentIndexResponse;
import com.bistroAssist.queryDemo.gateway.dto.ContentUpsertRequest;
import com.bistroAssist.queryDemo.vectorizer.exception.InvalidContentException;
import com.bistroAssist.queryDemo.vectorizer.model.ContentItem;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * Keeps the embedding index in step with business content changes.
 */
@RestController
@RequestMapping("/api/v1/businesses/{businessId}/content")
@RequiredArgsConstructor
public class ContentController {

    private final EmbeddingService embeddingService;
    private final EmbeddingIndex embeddingIndex;

    @PutMapping("/{type}/{contentId}")
    public ContentIndexResponse upsert(@PathVariable String businessId, @PathVariable String type,
                                       @PathVariable String contentId, @Valid @RequestBody ContentUpsertRequest request) {
        ContentItem item = ContentItem.builder()
                .businessId(businessId)
                .contentType(parseType(type))
                .contentId(contentId)
                .rawFields(request.getFields())
                .build();
        return ContentIndexResponse.from(embeddingService.indexContent(item));
    }

    @DeleteMapping("/{type}/{contentId}")
    public ResponseEntity<Void> remove(@PathVariable String businessId, @PathVariable String type,
                                       @PathVariable String contentId) {
        boolean removed = embeddingService.removeContent(businessId, parseType(type), contentId);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    /**
     * Live embedding counts per content type.
     */
    @GetMapping("/stats")
    public Map<ContentType, Long> stats(@PathVariable String businessId) {
        return embeddingIndex.stats(businessId);
    }

    private static ContentType parseType(String type) {
        try {
            return ContentType.valueOf(type.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidContentException("Unknown content type: " + type);
        }
    }
}
