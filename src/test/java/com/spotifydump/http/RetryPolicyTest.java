package com.spotifydump.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultsMatchDocumentedValues() {
        RetryPolicy p = RetryPolicy.defaults();
        assertEquals(5, p.maxRetries());
        assertEquals(Duration.ofSeconds(1), p.initialDelay());
        assertEquals(Duration.ofSeconds(60), p.maxDelay());
        assertFalse(p.retryNetworkFailures());
    }

    @Test
    void backoffDoublesAndCaps() {
        RetryPolicy p = RetryPolicy.defaults();
        assertEquals(Duration.ofSeconds(1), p.backoffDelay(0));
        assertEquals(Duration.ofSeconds(2), p.backoffDelay(1));
        assertEquals(Duration.ofSeconds(16), p.backoffDelay(4));
        assertEquals(Duration.ofSeconds(32), p.backoffDelay(5));
        assertEquals(Duration.ofSeconds(60), p.backoffDelay(6));
        assertEquals(Duration.ofSeconds(60), p.backoffDelay(200));
    }

    @Test
    void backoffIsNonDecreasing() {
        RetryPolicy p = new RetryPolicy(10, Duration.ofMillis(300), Duration.ofMillis(5000), false, 0);
        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 70; attempt++) {
            Duration d = p.backoffDelay(attempt);
            assertTrue(d.compareTo(previous) >= 0, "attempt " + attempt);
            assertTrue(d.compareTo(p.maxDelay()) <= 0, "attempt " + attempt);
            previous = d;
        }
    }

    @Test
    void retryableStatuses() {
        for (int code : new int[]{429, 500, 502, 503, 504}) {
            assertTrue(RetryPolicy.isRetryable(code));
        }
        for (int code : new int[]{200, 401, 403, 404, 501}) {
            assertFalse(RetryPolicy.isRetryable(code));
        }
    }

    @Test
    void rateLimitDelayRoundsUpAndCaps() {
        RetryPolicy p = RetryPolicy.defaults();
        assertEquals(Duration.ofMillis(1500), p.rateLimitDelay(1.5));
        assertEquals(Duration.ZERO, p.rateLimitDelay(-3));
        assertEquals(Duration.ofSeconds(60), p.rateLimitDelay(3600));
    }

    @Test
    void negativeValuesAreClamped() {
        RetryPolicy p = new RetryPolicy(-1, Duration.ofMillis(-5), null, false, -2);
        assertEquals(0, p.maxRetries());
        assertEquals(RetryPolicy.DEFAULT_INITIAL_DELAY, p.initialDelay());
        assertEquals(RetryPolicy.DEFAULT_MAX_DELAY, p.maxDelay());
        assertEquals(0, p.maxRateLimitWaits());
    }

    @Test
    void freeRateLimitWaitsAreUncappedUnlessConfigured() {
        assertEquals(RetryPolicy.UNLIMITED_RATE_LIMIT_WAITS, RetryPolicy.defaults().maxRateLimitWaits());
        assertTrue(RetryPolicy.defaults().allowsFreeRateLimitWait(10_000));

        RetryPolicy capped = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(60), false, 3);
        assertTrue(capped.allowsFreeRateLimitWait(2));
        assertFalse(capped.allowsFreeRateLimitWait(3));
    }
}
