package com.bistroAssist.queryDemo.vectorizer.model;

/**
 * Kinds of business content that can be vectorized and searched.
 */
public enum ContentType {
    MENU,
    POLICY,
    FAQ,
    BUSINESS
}
