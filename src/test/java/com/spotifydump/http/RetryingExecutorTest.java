package com.spotifydump.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryingExecutorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final List<String> events = new ArrayList<>();

    private RetryingExecutor executor(RetryPolicy policy) {
        return new RetryingExecutor(policy, sleeps::add, (level, event, fields) -> events.add(event));
    }

    private static RetryPolicy policy(int maxRetries, long initialMs, long maxMs) {
        return new RetryPolicy(maxRetries, Duration.ofMillis(initialMs), Duration.ofMillis(maxMs), false, 20);
    }

    private static ApiResponse status(int code) {
        return ApiResponse.of(code, "{}");
    }

    private static ApiResponse rateLimited(String retryAfter) {
        return new ApiResponse(429, Map.of("Retry-After", List.of(retryAfter)), "{}");
    }

    private static final class Script implements RetryingExecutor.ApiCall {
        private final Deque<Object> steps = new ArrayDeque<>();
        private final AtomicInteger calls = new AtomicInteger();

        Script then(Object step) {
            steps.add(step);
            return this;
        }

        @Override
        public ApiResponse call() throws IOException {
            calls.incrementAndGet();
            Object step = steps.size() > 1 ? steps.poll() : steps.peek();
            if (step instanceof IOException e) {
                throw e;
            }
            return (ApiResponse) step;
        }

        int calls() {
            return calls.get();
        }
    }

    @Test
    @DisplayName("non-retryable statuses pass through on the first attempt")
    void nonRetryableStatusesPassThrough() throws Exception {
        for (int code : new int[]{200, 204, 400, 401, 403, 404}) {
            sleeps.clear();
            Script script = new Script().then(status(code));
            ApiResponse resp = executor(RetryPolicy.defaults()).execute(script);
            assertEquals(code, resp.statusCode());
            assertEquals(1, script.calls(), "status " + code);
            assertTrue(sleeps.isEmpty());
        }
    }

    @Test
    void serverErrorsBackOffExponentiallyUntilSuccess() throws Exception {
        Script script = new Script().then(status(503)).then(status(502)).then(status(500)).then(status(200));

        ApiResponse resp = executor(policy(5, 1000, 60000)).execute(script);

        assertEquals(200, resp.statusCode());
        assertEquals(4, script.calls());
        assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000), Duration.ofMillis(4000)), sleeps);
    }

    @Test
    void exhaustedRetriesReturnLastResponseWithBoundedNonDecreasingWaits() throws Exception {
        Script script = new Script().then(status(504));

        ApiResponse resp = executor(policy(5, 1000, 3000)).execute(script);

        assertEquals(504, resp.statusCode());
        assertEquals(6, script.calls());
        assertEquals(5, sleeps.size());
        for (int i = 0; i < sleeps.size(); i++) {
            assertTrue(sleeps.get(i).toMillis() <= 3000);
            if (i > 0) {
                assertTrue(sleeps.get(i).compareTo(sleeps.get(i - 1)) >= 0);
            }
        }
        assertEquals(Duration.ofMillis(3000), sleeps.get(4));
        assertTrue(events.contains("retry.exhausted"));
    }

    @Test
    void rateLimitWaitsDoNotConsumeAttemptBudget() throws Exception {
        Script script = new Script()
                .then(rateLimited("2"))
                .then(rateLimited("1"))
                .then(rateLimited("0.5"))
                .then(status(200));

        ApiResponse resp = executor(policy(0, 1000, 60000)).execute(script);

        assertEquals(200, resp.statusCode());
        assertEquals(4, script.calls());
        assertEquals(List.of(Duration.ofMillis(2000), Duration.ofMillis(1000), Duration.ofMillis(500)), sleeps);
        assertTrue(events.contains("retry.rate_limited"));
    }

    @Test
    void retryAfterIsCappedAtMaxDelay() throws Exception {
        Script script = new Script().then(rateLimited("600")).then(status(200));

        executor(policy(5, 1000, 60000)).execute(script);

        assertEquals(List.of(Duration.ofSeconds(60)), sleeps);
    }

    @Test
    void rateLimitWithoutRetryAfterUsesBackoff() throws Exception {
        Script script = new Script().then(status(429));

        ApiResponse resp = executor(policy(2, 100, 60000)).execute(script);

        assertEquals(429, resp.statusCode());
        assertEquals(3, script.calls());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void unparseableRetryAfterFallsBackToBackoff() throws Exception {
        Script script = new Script().then(rateLimited("Wed, 21 Oct 2015 07:28:00 GMT")).then(status(200));

        executor(policy(3, 250, 60000)).execute(script);

        assertEquals(List.of(Duration.ofMillis(250)), sleeps);
    }

    @Test
    void defaultPolicyWaitsOutAnyNumberOfRateLimits() throws Exception {
        Script script = new Script();
        for (int i = 0; i < 30; i++) {
            script.then(rateLimited("1"));
        }
        script.then(status(200));

        ApiResponse resp = executor(RetryPolicy.defaults()).execute(script);

        assertEquals(200, resp.statusCode());
        assertEquals(31, script.calls());
        assertEquals(30, sleeps.size());
        assertFalse(events.contains("retry.exhausted"));
    }

    @Test
    void rateLimitWaitsBeyondCapCountAgainstBudget() throws Exception {
        RetryPolicy capped = new RetryPolicy(1, Duration.ofMillis(10), Duration.ofMillis(1000), false, 2);
        Script script = new Script().then(rateLimited("1"));

        ApiResponse resp = executor(capped).execute(script);

        assertEquals(429, resp.statusCode());
        // two free waits, then one counted retry, then give up
        assertEquals(4, script.calls());
        assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(1000), Duration.ofMillis(10)), sleeps);
    }

    @Test
    void networkFailurePropagatesImmediatelyByDefault() {
        Script script = new Script().then(new ConnectException("refused"));

        assertThrows(ConnectException.class, () -> executor(RetryPolicy.defaults()).execute(script));
        assertEquals(1, script.calls());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void networkFailureIsRetriedWhenEnabled() throws Exception {
        RetryPolicy retryNetwork = new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(1000), true, 20);
        Script script = new Script().then(new ConnectException("refused")).then(new ConnectException("refused")).then(status(200));

        ApiResponse resp = executor(retryNetwork).execute(script);

        assertEquals(200, resp.statusCode());
        assertEquals(3, script.calls());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeps);
    }

    @Test
    void networkFailureRethrownAfterBudgetWhenEnabled() {
        RetryPolicy retryNetwork = new RetryPolicy(1, Duration.ofMillis(10), Duration.ofMillis(1000), true, 20);
        Script script = new Script().then(new ConnectException("refused"));

        assertThrows(ConnectException.class, () -> executor(retryNetwork).execute(script));
        assertEquals(2, script.calls());
    }

    @Test
    void cancellationStopsFurtherAttempts() throws Exception {
        FetchCancellation cancellation = new FetchCancellation();
        RetryingExecutor.ApiCall call = new RetryingExecutor.ApiCall() {
            int calls;

            @Override
            public ApiResponse call() {
                calls++;
                cancellation.cancel();
                return status(503);
            }
        };

        ApiResponse resp = executor(policy(5, 10, 100)).execute(call, cancellation);

        assertEquals(503, resp.statusCode());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void eventsCarryLevelsThroughSink() throws Exception {
        List<Level> levels = new ArrayList<>();
        RetryingExecutor exec = new RetryingExecutor(policy(1, 1, 1), d -> { }, (level, event, fields) -> levels.add(level));

        exec.execute(new Script().then(status(500)));

        assertEquals(List.of(Level.WARN, Level.ERROR), levels);
    }
}
