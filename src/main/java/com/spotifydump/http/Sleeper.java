package com.spotifydump.http;

import java.time.Duration;

/**
 * Blocks the calling thread. Swapped out in tests to observe backoff delays without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

    void sleep(Duration duration) throws InterruptedException;
}
