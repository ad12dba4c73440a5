package com.bistroAssist.queryDemo.orchestrator.admission;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        AssistantProperties properties = new AssistantProperties();
        properties.getPipeline().setRateLimitPerMinute(3);
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        rateLimiter = new RateLimiter(properties, clock);
    }

    @Test
    void requestsBeyondTheLimitAreRejectedWithRetryAfter() {
        assertEquals(2, rateLimiter.tryAcquire("bella-vista:cust1").remaining());
        clock.advance(Duration.ofSeconds(10));
        rateLimiter.tryAcquire("bella-vista:cust1");
        assertEquals(0, rateLimiter.tryAcquire("bella-vista:cust1").remaining());

        RateLimitResult rejected = rateLimiter.tryAcquire("bella-vista:cust1");

        assertFalse(rejected.allowed());
        assertEquals(50, rejected.retryAfterSeconds());
    }

    @Test
    void windowSlides() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("bella-vista:cust1");
        }
        assertFalse(rateLimiter.tryAcquire("bella-vista:cust1").allowed());

        clock.advance(Duration.ofSeconds(60));

        assertTrue(rateLimiter.tryAcquire("bella-vista:cust1").allowed());
    }

    @Test
    void keysAreIndependent() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("bella-vista:cust1");
        }

        assertTrue(rateLimiter.tryAcquire("bella-vista:cust2").allowed());
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
