package com.bistroAssist.queryDemo.context.model;

import java.util.Map;

/**
 * An embedding search hit shaped for prompt building.
 */
public interface ContextMatch {

    String embeddingId();

    String contentId();

    /**
     * Human-readable title of the matched item (dish name, policy title, FAQ question).
     */
    String title();

    double similarity();

    double confidence();

    String snippet();

    Map<String, Object> metadata();
}
