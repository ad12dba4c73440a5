package com.bistroAssist.queryDemo.orchestrator.exception;

import java.util.List;

/**
 * Thrown when a query request fails input validation.
 */
public class QueryValidationException extends RuntimeException {

    private final List<String> errors;

    public QueryValidationException(List<String> errors) {
        super("Invalid query: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
