package com.bistroAssist.queryDemo.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating correlation IDs for request tracking.
 */
@Service
public class CorrelationIdService {

    /**
     * Reuses the caller's correlation id when it sent a usable one.
     * 
     * @param incoming Value of the X-Correlation-ID header, may be null
     * @return Correlation id for this request
     */
    public String resolveCorrelationId(String incoming) {
        if (incoming != null && !incoming.isBlank() && incoming.length() <= 64) {
            return incoming.trim();
        }
        return UUID.randomUUID().toString();
    }
}
