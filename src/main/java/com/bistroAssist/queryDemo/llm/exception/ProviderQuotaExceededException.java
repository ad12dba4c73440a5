package com.bistroAssist.queryDemo.llm.exception;

public class ProviderQuotaExceededException extends UpstreamProviderException {

    public ProviderQuotaExceededException(String message) {
        super(message, false);
    }

    public ProviderQuotaExceededException(String message, Throwable cause) {
        super(message, false, cause);
    }
}
