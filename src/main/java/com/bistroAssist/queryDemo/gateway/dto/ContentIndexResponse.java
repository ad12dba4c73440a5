package com.bistroAssist.queryDemo.gateway.dto;

import com.bistroAssist.queryDemo.embedding.model.EmbeddingRecord;
import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContentIndexResponse {

    private String embeddingId;
    private String businessId;
    private ContentType contentType;
    private String contentId;
    private String normalizedText;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;

    public static ContentIndexResponse from(EmbeddingRecord record) {
        return ContentIndexResponse.builder()
                .embeddingId(record.getId())
                .businessId(record.getBusinessId())
                .contentType(record.getContentType())
                .contentId(record.getContentId())
                .normalizedText(record.getNormalizedText())
                .metadata(record.getMetadata())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
