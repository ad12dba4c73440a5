package com.bistroAssist.queryDemo.embedding;

/**
 * Turns text into a fixed-length vector.
 * Failures surface as {@link com.bistroAssist.queryDemo.llm.exception.UpstreamProviderException}.
 */
public interface EmbeddingProvider {

    float[] embed(String text);
}
