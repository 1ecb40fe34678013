package com.spotifydump.http;

import org.slf4j.event.Level;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Runs a single-call operation under a {@link RetryPolicy}.
 *
 * <p>Returns the first response that needs no further attempt, or the last response once the
 * budget is spent. It never turns a status code into an exception; callers inspect the result.
 * Transport failures propagate immediately unless the policy opts into retrying them.</p>
 */
public class RetryingExecutor {

    /**
     * One network round-trip.
     */
    @FunctionalInterface
    public interface ApiCall {
        ApiResponse call() throws IOException, InterruptedException;
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final FetchEventSink events;

    public RetryingExecutor(RetryPolicy policy) {
        this(policy, Sleeper.THREAD, FetchEventSink.NOOP);
    }

    public RetryingExecutor(RetryPolicy policy, Sleeper sleeper, FetchEventSink events) {
        this.policy = policy == null ? RetryPolicy.defaults() : policy;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
        this.events = events == null ? FetchEventSink.NOOP : events;
    }

    public ApiResponse execute(ApiCall call) throws IOException, InterruptedException {
        return execute(call, FetchCancellation.none());
    }

    /**
     * @param cancellation checked before every extra attempt; when it fires the last response is returned
     */
    public ApiResponse execute(ApiCall call, FetchCancellation cancellation) throws IOException, InterruptedException {
        int attempt = 0;
        int rateLimitWaits = 0;
        while (true) {
            ApiResponse response;
            try {
                response = call.call();
            } catch (IOException e) {
                if (!policy.retryNetworkFailures() || attempt >= policy.maxRetries() || cancellation.isCancelled()) {
                    throw e;
                }
                Duration wait = policy.backoffDelay(attempt);
                events.emit(Level.WARN, "retry.network", fields(
                        "attempt", attempt + 1, "error", e.getMessage(), "waitMs", wait.toMillis()));
                sleeper.sleep(wait);
                attempt++;
                continue;
            }

            int status = response.statusCode();
            if (!RetryPolicy.isRetryable(status)) {
                return response;
            }
            if (cancellation.isCancelled()) {
                return response;
            }

            if (status == 429 && policy.allowsFreeRateLimitWait(rateLimitWaits)) {
                OptionalDouble retryAfter = parseRetryAfter(response);
                if (retryAfter.isPresent()) {
                    Duration wait = policy.rateLimitDelay(retryAfter.getAsDouble());
                    events.emit(Level.WARN, "retry.rate_limited", fields(
                            "retryAfter", retryAfter.getAsDouble(), "waitMs", wait.toMillis()));
                    sleeper.sleep(wait);
                    rateLimitWaits++;
                    continue;
                }
            }

            if (attempt >= policy.maxRetries()) {
                events.emit(Level.ERROR, "retry.exhausted", fields(
                        "attempts", attempt + 1, "status", status));
                return response;
            }

            Duration wait = policy.backoffDelay(attempt);
            events.emit(Level.WARN, "retry.backoff", fields(
                    "attempt", attempt + 1, "status", status, "waitMs", wait.toMillis()));
            sleeper.sleep(wait);
            attempt++;
        }
    }

    static OptionalDouble parseRetryAfter(ApiResponse response) {
        String raw = response.header("Retry-After").orElse(null);
        if (raw == null || raw.isBlank()) {
            return OptionalDouble.empty();
        }
        try {
            double seconds = Double.parseDouble(raw.trim());
            if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(Math.max(0.0, seconds));
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by the API; fall back to exponential backoff
            return OptionalDouble.empty();
        }
    }

    private static Map<String, Object> fields(Object... kv) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            out.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return out;
    }
}
