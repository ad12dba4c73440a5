package com.bistroAssist.queryDemo.config;

import com.bistroAssist.queryDemo.llm.exception.UpstreamProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
public class ResilienceConfig {

    /**
     * Retry policy for embedding and generation calls.
     * Only provider errors flagged retryable (rate limits, 5xx, I/O) are retried;
     * quota and credential failures surface on the first attempt.
     */
    @Bean
    public Retry providerRetry(
            @Value("${openai.api.retry.max-attempts:3}") int maxAttempts,
            @Value("${openai.api.retry.initial-backoff:500ms}") Duration initialBackoff) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0))
                .retryOnException(ex -> ex instanceof UpstreamProviderException
                        && ((UpstreamProviderException) ex).isRetryable())
                .build();
        Retry retry = Retry.of("provider", config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Provider call failed, retrying - attempt: {}, wait: {}ms, error: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
