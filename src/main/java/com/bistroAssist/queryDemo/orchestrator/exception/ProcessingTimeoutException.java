package com.bistroAssist.queryDemo.orchestrator.exception;

import java.time.Duration;

/**
 * Thrown when a query does not finish within the pipeline timeout.
 */
public class ProcessingTimeoutException extends RuntimeException {

    public ProcessingTimeoutException(Duration timeout) {
        super("Query processing exceeded " + timeout.toMillis() + " ms");
    }
}
