package com.bistroAssist.queryDemo.embedding.model;

import com.bistroAssist.queryDemo.vectorizer.model.ContentType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchOptions {

    /**
     * Restricts the search to one content type; null searches all types.
     */
    ContentType contentType;

    @Builder.Default
    int limit = 5;

    @Builder.Default
    double minScore = 0.7;
}
