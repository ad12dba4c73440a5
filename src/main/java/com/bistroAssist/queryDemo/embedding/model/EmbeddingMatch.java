package com.bistroAssist.queryDemo.embedding.model;

/**
 * A search hit with its cosine similarity to the query vector.
 */
public record EmbeddingMatch(EmbeddingRecord record, double similarity) {
}
