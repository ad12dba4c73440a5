package com.bistroAssist.queryDemo.orchestrator.admission;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory sliding window rate limiter.
 * 
 * Rate limit: {@code assistant.pipeline.rate-limit-per-minute} requests per minute per caller key.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    // In-memory store: caller key -> request timestamps inside the window
    private final Map<String, RequestWindow> windows = new ConcurrentHashMap<>();

    private final int maxRequestsPerWindow;
    private final Clock clock;

    public RateLimiter(AssistantProperties properties, Clock clock) {
        this.maxRequestsPerWindow = Math.max(1, properties.getPipeline().getRateLimitPerMinute());
        this.clock = clock;
    }

    /**
     * Checks and, when allowed, counts one request for the key.
     * 
     * @param key Caller key, e.g. business id plus customer or session id
     * @return Result with the remaining quota or the seconds until a slot frees up
     */
    public RateLimitResult tryAcquire(String key) {
        RequestWindow window = windows.computeIfAbsent(key, k -> new RequestWindow());
        Instant now = clock.instant();
        RateLimitResult result = window.tryAdd(now, maxRequestsPerWindow);
        if (!result.allowed()) {
            log.warn("Rate limit exceeded - key: {}, retryAfterSeconds: {}", key, result.retryAfterSeconds());
        }
        return result;
    }

    /**
     * Tracks the request window for one caller key.
     */
    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();

        synchronized RateLimitResult tryAdd(Instant now, int limit) {
            Instant cutoff = now.minus(WINDOW);
            while (!requests.isEmpty() && !requests.peekFirst().isAfter(cutoff)) {
                requests.pollFirst();
            }
            if (requests.size() >= limit) {
                Instant oldest = requests.peekFirst();
                long waitMillis = Duration.between(now, oldest.plus(WINDOW)).toMillis();
                return new RateLimitResult(false, 0, Math.max(1, (waitMillis + 999) / 1000));
            }
            requests.addLast(now);
            return new RateLimitResult(true, limit - requests.size(), 0);
        }
    }
}
