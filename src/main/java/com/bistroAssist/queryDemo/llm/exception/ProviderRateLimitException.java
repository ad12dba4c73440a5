package com.bistroAssist.queryDemo.llm.exception;

public class ProviderRateLimitException extends UpstreamProviderException {

    public ProviderRateLimitException(String message) {
        super(message, true);
    }

    public ProviderRateLimitException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
