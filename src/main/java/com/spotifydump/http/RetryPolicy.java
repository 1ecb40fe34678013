package com.spotifydump.http;

import java.time.Duration;
import java.util.Set;

/**
 * Retry settings for a single API call.
 *
 * @param maxRetries            extra attempts allowed for 5xx and unhinted 429 responses
 * @param initialDelay          base of the exponential backoff
 * @param maxDelay              cap for every wait, including {@code Retry-After}
 * @param retryNetworkFailures  whether transport failures (no response) are retried like 5xx
 * @param maxRateLimitWaits     {@code Retry-After} waits that are free of the attempt budget,
 *                              {@code 0} for no cap; past a cap, 429s are counted like any other
 *                              retryable status
 */
public record RetryPolicy(int maxRetries,
                          Duration initialDelay,
                          Duration maxDelay,
                          boolean retryNetworkFailures,
                          int maxRateLimitWaits) {

    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    public static final int UNLIMITED_RATE_LIMIT_WAITS = 0;

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RATE_LIMIT_WAITS = UNLIMITED_RATE_LIMIT_WAITS;

    public RetryPolicy {
        maxRetries = Math.max(0, maxRetries);
        initialDelay = (initialDelay == null || initialDelay.isNegative()) ? DEFAULT_INITIAL_DELAY : initialDelay;
        maxDelay = (maxDelay == null || maxDelay.isNegative()) ? DEFAULT_MAX_DELAY : maxDelay;
        maxRateLimitWaits = Math.max(0, maxRateLimitWaits);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, false, DEFAULT_MAX_RATE_LIMIT_WAITS);
    }

    /**
     * Whether another {@code Retry-After} wait may be taken without touching the attempt budget.
     */
    public boolean allowsFreeRateLimitWait(int waitsSoFar) {
        return maxRateLimitWaits == UNLIMITED_RATE_LIMIT_WAITS || waitsSoFar < maxRateLimitWaits;
    }

    public static boolean isRetryable(int status) {
        return RETRYABLE_STATUSES.contains(status);
    }

    /**
     * {@code min(initialDelay * 2^attempt, maxDelay)}, attempt counted from zero.
     */
    public Duration backoffDelay(int attempt) {
        int safeAttempt = Math.max(0, attempt);
        long initialMillis = initialDelay.toMillis();
        long maxMillis = maxDelay.toMillis();
        if (safeAttempt >= 62 || initialMillis > (maxMillis >> Math.min(safeAttempt, 62))) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(initialMillis << safeAttempt, maxMillis));
    }

    /**
     * Wait requested by a {@code Retry-After} header, capped at {@code maxDelay}.
     */
    public Duration rateLimitDelay(double retryAfterSeconds) {
        long millis = (long) Math.ceil(Math.max(0.0, retryAfterSeconds) * 1000.0);
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }
}
