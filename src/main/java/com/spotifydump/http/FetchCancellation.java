package com.spotifydump.http;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by a fetch session and its workers.
 * Once cancelled, no new page requests, retries or worker dispatches are started;
 * requests already in flight finish or time out on their own.
 */
public final class FetchCancellation {

    private static final FetchCancellation NONE = new FetchCancellation(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final boolean cancellable;

    public FetchCancellation() {
        this(true);
    }

    private FetchCancellation(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * A signal that can never fire.
     */
    public static FetchCancellation none() {
        return NONE;
    }

    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
