package com.spotifydump.http;

import java.io.IOException;

/**
 * Performs exactly one network call per invocation. Implementations never retry
 * and never look at the status code.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * @throws IOException on connection failures and timeouts (no response at all)
     */
    ApiResponse execute(ApiRequest request) throws IOException, InterruptedException;
}
