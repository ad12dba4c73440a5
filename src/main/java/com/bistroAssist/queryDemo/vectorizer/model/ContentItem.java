package com.bistroAssist.queryDemo.vectorizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One piece of business content as submitted for indexing.
 * Immutable: a change in content is a new item that supersedes the old one.
 */
@Value
@Builder
public class ContentItem {
    String businessId;
    ContentType contentType;
    String contentId;

    @Singular
    Map<String, Object> rawFields;
}
