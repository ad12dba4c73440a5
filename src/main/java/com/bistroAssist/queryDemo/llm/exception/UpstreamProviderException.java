package com.bistroAssist.queryDemo.llm.exception;

/**
 * Failure reported by (or while talking to) an embedding or generation provider.
 * Subclasses narrow the cause; {@link #isRetryable()} decides whether the call is retried.
 */
public class UpstreamProviderException extends RuntimeException {

    private final boolean retryable;

    public UpstreamProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public UpstreamProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
