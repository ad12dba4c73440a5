package com.bistroAssist.queryDemo.gateway.service;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.gateway.streaming.SseQueryEventChannel;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryRequest;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryResponse;
import com.bistroAssist.queryDemo.orchestrator.service.QueryOrchestratorService;
import com.bistroAssist.queryDemo.orchestrator.streaming.StreamHandle;
import com.bistroAssist.queryDemo.util.CustomerIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;

/**
 * Gateway service - HTTP-facing entry for customer queries.
 * 
 * Responsibilities:
 * - Resolve the correlation id
 * - Take the customer id from the trusted header when the body has none
 * - Forward to the orchestrator (single shot or streamed over SSE)
 */
@Slf4j
@Service
public class GatewayService {

    private static final Duration EMITTER_GRACE = Duration.ofSeconds(5);

    private final CorrelationIdService correlationIdService;
    private final QueryOrchestratorService orchestratorService;
    private final long emitterTimeoutMs;

    public GatewayService(CorrelationIdService correlationIdService,
                          QueryOrchestratorService orchestratorService,
                          AssistantProperties properties) {
        this.correlationIdService = correlationIdService;
        this.orchestratorService = orchestratorService;
        this.emitterTimeoutMs = properties.getPipeline().getTimeout().plus(EMITTER_GRACE).toMillis();
    }

    public QueryResponse processQuery(String businessId, QueryRequest request, String customerIdHeader,
                                      String correlationIdHeader) {
        String correlationId = correlationIdService.resolveCorrelationId(correlationIdHeader);
        applyCustomerHeader(request, customerIdHeader);

        log.info("Query request received - correlationId: {}, businessId: {}, customerId: {}, sessionId: {}",
                correlationId, businessId, CustomerIdMasker.mask(request.getCustomerId()), request.getSessionId());

        return orchestratorService.processQuery(businessId, request, correlationId);
    }

    /**
     * Starts a streamed answer. Validation and rate-limit errors are thrown before the emitter is returned.
     */
    public SseEmitter streamQuery(String businessId, QueryRequest request, String customerIdHeader,
                                  String correlationIdHeader) {
        String correlationId = correlationIdService.resolveCorrelationId(correlationIdHeader);
        applyCustomerHeader(request, customerIdHeader);

        log.info("Streaming query request received - correlationId: {}, businessId: {}, customerId: {}, sessionId: {}",
                correlationId, businessId, CustomerIdMasker.mask(request.getCustomerId()), request.getSessionId());

        SseEmitter emitter = new SseEmitter(emitterTimeoutMs);
        SseQueryEventChannel channel = new SseQueryEventChannel(emitter, correlationId);
        StreamHandle handle = orchestratorService.processStreamingQuery(businessId, request, channel, correlationId);
        log.debug("Streaming started - correlationId: {}", handle.getCorrelationId());
        return emitter;
    }

    private static void applyCustomerHeader(QueryRequest request, String customerIdHeader) {
        if (request.getCustomerId() == null && customerIdHeader != null && !customerIdHeader.isBlank()) {
            request.setCustomerId(customerIdHeader.trim());
        }
    }
}
