package com.spotifydump.spotify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spotifydump.http.ApiRequest;
import com.spotifydump.http.ApiResponse;
import com.spotifydump.http.FetchCancellation;
import com.spotifydump.http.FetchEventSink;
import com.spotifydump.http.HttpTransport;
import com.spotifydump.http.RetryingExecutor;
import org.slf4j.event.Level;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a paginated collection and returns every item in server order.
 *
 * <p>Two addressing modes are supported: following the absolute {@code next} URL of each page,
 * and rebuilding the request from a fixed base URL plus the {@code cursors.after} token.
 * Termination is driven by the cursor only; an empty page with a cursor is followed.</p>
 *
 * <p>Status codes are checked before the body is read. A failure on any page discards what was
 * accumulated so far.</p>
 */
public class Paginator {

    private final HttpTransport transport;
    private final RetryingExecutor retry;
    private final ObjectMapper mapper;
    private final FetchEventSink events;

    public Paginator(HttpTransport transport, RetryingExecutor retry, ObjectMapper mapper, FetchEventSink events) {
        this.transport = transport;
        this.retry = retry;
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.events = events == null ? FetchEventSink.NOOP : events;
    }

    /**
     * Next-URL mode: follows {@code next} until it is null.
     */
    public List<JsonNode> collect(String token, String startUrl, FetchCancellation cancellation) throws FetchException {
        List<JsonNode> accumulated = new ArrayList<>();
        String url = startUrl;
        while (url != null) {
            JsonNode root = fetchRoot(PageRequest.bearer(url, token), cancellation);
            PageResult page = nextUrlPage(root, accumulated.size());
            accumulated.addAll(page.items());
            pageEvent(url, page);
            url = page.cursor();
        }
        return accumulated;
    }

    /**
     * Cursor mode: appends {@code after=<token>} to {@code baseUrl} until no token comes back.
     *
     * @param containerKey field wrapping {@code items} and {@code cursors}, e.g. {@code artists};
     *                     {@code null} when they sit at the top level
     */
    public List<JsonNode> collectByCursor(String token, String baseUrl, String containerKey,
                                          FetchCancellation cancellation) throws FetchException {
        List<JsonNode> accumulated = new ArrayList<>();
        String url = baseUrl;
        while (url != null) {
            JsonNode root = fetchRoot(PageRequest.bearer(url, token), cancellation);
            JsonNode container = containerKey == null ? root : root.path(containerKey);
            PageResult page = cursorPage(container, accumulated.size());
            accumulated.addAll(page.items());
            pageEvent(url, page);
            url = page.hasNext() ? withQueryParam(baseUrl, "after", page.cursor()) : null;
        }
        return accumulated;
    }

    /**
     * Issues one request through the retry policy and returns the parsed body of a 2xx response.
     */
    JsonNode fetchRoot(PageRequest request, FetchCancellation cancellation) throws FetchException {
        if (cancellation.isCancelled()) {
            throw FetchException.cancelled();
        }
        ApiRequest apiRequest = ApiRequest.get(request.url(), request.headers());
        ApiResponse response;
        try {
            response = retry.execute(() -> transport.execute(apiRequest), cancellation);
        } catch (IOException e) {
            throw FetchException.networkError(request.url(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FetchException.cancelled();
        }

        if (!response.isSuccessful()) {
            if (cancellation.isCancelled()) {
                throw FetchException.cancelled();
            }
            throw FetchException.forStatus(response.statusCode(), request.url());
        }

        try {
            JsonNode root = mapper.readTree(response.body());
            if (root == null || root.isMissingNode() || !root.isObject()) {
                throw FetchException.invalidResponse(request.url(), null);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw FetchException.invalidResponse(request.url(), e);
        }
    }

    static PageResult nextUrlPage(JsonNode root, int fetchedBefore) {
        List<JsonNode> items = items(root);
        return new PageResult(items, textOrNull(root.get("next")), fetchedBefore + items.size());
    }

    static PageResult cursorPage(JsonNode container, int fetchedBefore) {
        List<JsonNode> items = items(container);
        String after = textOrNull(container.path("cursors").get("after"));
        return new PageResult(items, after, fetchedBefore + items.size());
    }

    static String withQueryParam(String url, String name, String value) {
        String sep = url.contains("?") ? "&" : "?";
        return url + sep + name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static List<JsonNode> items(JsonNode container) {
        List<JsonNode> out = new ArrayList<>();
        JsonNode items = container == null ? null : container.get("items");
        if (items != null && items.isArray()) {
            items.forEach(out::add);
        }
        return out;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private void pageEvent(String url, PageResult page) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("url", url);
        fields.put("items", page.items().size());
        fields.put("fetched", page.fetchedSoFar());
        fields.put("more", page.hasNext());
        events.emit(Level.DEBUG, "fetch.page", fields);
    }
}
