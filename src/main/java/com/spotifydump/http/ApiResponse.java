package com.spotifydump.http;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Normalized HTTP response: status code, headers and raw body. No interpretation of the status.
 */
public record ApiResponse(int statusCode, Map<String, List<String>> headers, String body) {

    public ApiResponse {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    copy.put(name, List.copyOf(values));
                }
            });
        }
        headers = copy;
        body = body == null ? "" : body;
    }

    public static ApiResponse of(int statusCode, String body) {
        return new ApiResponse(statusCode, Map.of(), body);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * First value of the given header, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }
}
