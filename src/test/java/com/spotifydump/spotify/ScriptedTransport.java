package com.spotifydump.spotify;

import com.spotifydump.http.ApiRequest;
import com.spotifydump.http.ApiResponse;
import com.spotifydump.http.HttpTransport;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test transport answering from per-URL queues. The last queued answer for a URL repeats.
 */
final class ScriptedTransport implements HttpTransport {

    private final Map<String, Deque<Object>> answers = new HashMap<>();
    private final List<ApiRequest> requests = Collections.synchronizedList(new ArrayList<>());

    ScriptedTransport on(String url, int status, String body) {
        answers.computeIfAbsent(url, k -> new ArrayDeque<>()).add(ApiResponse.of(status, body));
        return this;
    }

    ScriptedTransport fail(String url, IOException error) {
        answers.computeIfAbsent(url, k -> new ArrayDeque<>()).add(error);
        return this;
    }

    @Override
    public synchronized ApiResponse execute(ApiRequest request) throws IOException {
        requests.add(request);
        Deque<Object> queue = answers.get(request.uri().toString());
        if (queue == null || queue.isEmpty()) {
            return ApiResponse.of(404, "{\"error\":{\"status\":404}}");
        }
        Object answer = queue.size() > 1 ? queue.poll() : queue.peek();
        if (answer instanceof IOException e) {
            throw e;
        }
        return (ApiResponse) answer;
    }

    List<String> requestedUrls() {
        synchronized (requests) {
            return requests.stream().map(r -> r.uri().toString()).toList();
        }
    }

    List<ApiRequest> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }
}
