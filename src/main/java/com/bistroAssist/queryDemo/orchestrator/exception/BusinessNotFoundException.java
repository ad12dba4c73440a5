package com.bistroAssist.queryDemo.orchestrator.exception;

public class BusinessNotFoundException extends RuntimeException {

    public BusinessNotFoundException(String businessId) {
        super("Business " + businessId + " not found");
    }
}
