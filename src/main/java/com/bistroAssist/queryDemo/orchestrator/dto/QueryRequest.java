package com.bistroAssist.queryDemo.orchestrator.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for customer queries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryRequest {

    @NotBlank(message = "query cannot be blank")
    private String query;

    /**
     * Existing conversation to continue; a new session is started when absent.
     */
    private String sessionId;

    private String customerId;

    /**
     * Customer preferences exposed to business rules as {@code customer.preferences.*}.
     */
    private Map<String, Object> preferences;

    /**
     * Extra request facts exposed to business rules under {@code context.*}.
     */
    private Map<String, Object> context;
}
