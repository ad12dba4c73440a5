package com.bistroAssist.queryDemo.llm.exception;

public class InvalidApiKeyException extends UpstreamProviderException {

    public InvalidApiKeyException(String message) {
        super(message, false);
    }

    public InvalidApiKeyException(String message, Throwable cause) {
        super(message, false, cause);
    }
}
