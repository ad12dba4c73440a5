package com.bistroAssist.queryDemo.context.exception;

/**
 * Raised when no context can be retrieved at all (the query could not be embedded).
 */
public class ContextRetrievalException extends RuntimeException {

    public ContextRetrievalException(String message) {
        super(message);
    }

    public ContextRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
