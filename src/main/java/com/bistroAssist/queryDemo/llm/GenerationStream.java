package com.bistroAssist.queryDemo.llm;

import java.util.Iterator;

/**
 * Text chunks of one streamed completion, in arrival order.
 * 
 * {@link #close()} may be called from another thread while a consumer is blocked in
 * {@link #hasNext()}; it releases the underlying connection and never throws.
 */
public interface GenerationStream extends Iterator<String>, AutoCloseable {

    @Override
    void close();

    default String model() {
        return null;
    }

    /**
     * Prompt tokens reported by the provider, or 0 when it did not report usage.
     */
    default int promptTokens() {
        return 0;
    }

    default int completionTokens() {
        return 0;
    }
}
