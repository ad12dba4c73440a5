package com.bistroAssist.queryDemo.vectorizer.exception;

/**
 * Thrown when content lacks the fields its type requires.
 */
public class InvalidContentException extends RuntimeException {

    public InvalidContentException(String message) {
        super(message);
    }

    public InvalidContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
