package com.bistroAssist.queryDemo.gateway.controller;

import com.bistroAssist.queryDemo.embedding.exception.InvalidDimensionException;
import com.bistroAssist.queryDemo.llm.exception.UpstreamProviderException;
import com.bistroAssist.queryDemo.orchestrator.exception.BusinessNotFoundException;
import com.bistroAssist.queryDemo.orchestrator.exception.ProcessingTimeoutException;
import com.bistroAssist.queryDemo.orchestrator.exception.QueryValidationException;
import com.bistroAssist.queryDemo.orchestrator.exception.RateLimitExceededException;
import com.bistroAssist.queryDemo.rules.exception.RuleConflictException;
import com.bistroAssist.queryDemo.rules.exception.RuleNotFoundException;
import com.bistroAssist.queryDemo.rules.exception.RuleValidationException;
import com.bistroAssist.queryDemo.rules.model.RuleConflict;
import com.bistroAssist.queryDemo.vectorizer.exception.InvalidContentException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Global exception handler - maps domain exceptions to {@code {code, message}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        String message = details.isEmpty() ? "Validation failed" : details.get(0);

        log.warn("Validation error: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message, details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", "Request body is malformed", null));
    }

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<ErrorResponse> handleQueryValidation(QueryValidationException ex) {
        log.warn("Query validation failed: {}", ex.getErrors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", ex.getMessage(), ex.getErrors()));
    }

    @ExceptionHandler(RuleValidationException.class)
    public ResponseEntity<ErrorResponse> handleRuleValidation(RuleValidationException ex) {
        log.warn("Rule validation failed: {}", ex.getErrors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", ex.getMessage(), ex.getErrors()));
    }

    @ExceptionHandler({InvalidContentException.class, InvalidDimensionException.class})
    public ResponseEntity<ErrorResponse> handleInvalidContent(RuntimeException ex) {
        log.warn("Invalid content: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", ex.getMessage(), null));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitExceeded(RateLimitExceededException ex) {
        log.warn("Rate limit exceeded: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(new ErrorResponse("RATE_LIMIT_EXCEEDED", ex.getMessage(), null));
    }

    @ExceptionHandler({BusinessNotFoundException.class, RuleNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", ex.getMessage(), null));
    }

    @ExceptionHandler(RuleConflictException.class)
    public ResponseEntity<ErrorResponse> handleRuleConflict(RuleConflictException ex) {
        log.warn("Rule conflict: {}", ex.getMessage());
        List<String> details = ex.getConflicts().stream().map(RuleConflict::description).toList();
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("RULE_CONFLICT", ex.getMessage(), details.isEmpty() ? null : details));
    }

    @ExceptionHandler(UpstreamProviderException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamProviderException ex) {
        log.error("Upstream provider error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("UPSTREAM_ERROR", "The AI provider is unavailable, please retry later", null));
    }

    @ExceptionHandler(ProcessingTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(ProcessingTimeoutException ex) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(new ErrorResponse("PROCESSING_TIMEOUT", ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred", null));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ErrorResponse(String code, String message, List<String> details) {}
}
