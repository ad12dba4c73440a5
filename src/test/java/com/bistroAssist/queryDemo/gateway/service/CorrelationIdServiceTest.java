package com.bistroAssist.queryDemo.gateway.service;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdServiceTest {

    private final CorrelationIdService service = new CorrelationIdService();

    @Test
    void incomingIdIsReused() {
        assertEquals("req-42", service.resolveCorrelationId(" req-42 "));
    }

    @Test
    void missingOrOversizedIdIsReplaced() {
        assertDoesNotThrow(() -> UUID.fromString(service.resolveCorrelationId(null)));
        assertDoesNotThrow(() -> UUID.fromString(service.resolveCorrelationId("  ")));
        assertNotEquals("x".repeat(65), service.resolveCorrelationId("x".repeat(65)));
    }
}
