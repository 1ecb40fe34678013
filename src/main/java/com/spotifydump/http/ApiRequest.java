package com.spotifydump.http;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single outbound HTTP call. {@code formBody} is only used for POST requests.
 */
public record ApiRequest(String method, URI uri, Map<String, String> headers, Map<String, String> formBody) {

    public ApiRequest {
        method = (method == null || method.isBlank()) ? "GET" : method.trim().toUpperCase();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        formBody = formBody == null ? null : new LinkedHashMap<>(formBody);
    }

    public static ApiRequest get(String url, Map<String, String> headers) {
        return new ApiRequest("GET", URI.create(url), headers, null);
    }

    public static ApiRequest postForm(String url, Map<String, String> headers, Map<String, String> formBody) {
        return new ApiRequest("POST", URI.create(url), headers, formBody);
    }
}
