package com.bistroAssist.queryDemo.orchestrator.admission;

/**
 * Outcome of a rate limit check. {@code retryAfterSeconds} is 0 when allowed.
 */
public record RateLimitResult(boolean allowed, int remaining, long retryAfterSeconds) {
}
