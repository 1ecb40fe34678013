package com.spotifydump.spotify;

import java.util.Map;

/**
 * One page request. Built fresh for every call.
 */
public record PageRequest(String url, Map<String, String> headers) {

    public PageRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static PageRequest bearer(String url, String token) {
        return new PageRequest(url, Map.of("Authorization", "Bearer " + token));
    }
}
