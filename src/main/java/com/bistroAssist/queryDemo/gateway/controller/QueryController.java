package com.bistroAssist.queryDemo.gateway.controller;

import com.bistroAssist.queryDemo.gateway.service.GatewayService;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryRequest;
import com.bistroAssist.queryDemo.orchestrator.dto.QueryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Query REST controller - thin HTTP layer for customer queries.
 * 
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract HTTP headers
 * - Delegate to GatewayService
 */
@RestController
@RequestMapping("/api/v1/businesses/{businessId}")
@RequiredArgsConstructor
public class QueryController {

    private static final String CUSTOMER_ID_HEADER = "X-Customer-ID";
    private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final GatewayService gatewayService;

    /**
     * Answers a customer query in one response.
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(
            @PathVariable String businessId,
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = CUSTOMER_ID_HEADER, required = false) String customerIdHeader,
            @RequestHeader(value = CORRELATION_ID_HEADER, required = false) String correlationIdHeader) {

        QueryResponse response = gatewayService.processQuery(businessId, request, customerIdHeader, correlationIdHeader);
        return ResponseEntity.ok()
                .header(CORRELATION_ID_HEADER, response.getMetadata().getCorrelationId())
                .body(response);
    }

    /**
     * Streams the answer as server-sent events: {@code chunk}* then {@code done} or {@code error}.
     */
    @PostMapping(value = "/query/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamQuery(
            @PathVariable String businessId,
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = CUSTOMER_ID_HEADER, required = false) String customerIdHeader,
            @RequestHeader(value = CORRELATION_ID_HEADER, required = false) String correlationIdHeader) {

        return gatewayService.streamQuery(businessId, request, customerIdHeader, correlationIdHeader);
    }
}
