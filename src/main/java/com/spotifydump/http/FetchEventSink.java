package com.spotifydump.http;

import org.slf4j.event.Level;

import java.util.Map;

/**
 * Structured observability callback injected into the fetch engine. The owner decides
 * where events go and which levels are kept; the engine never touches global logger state.
 */
@FunctionalInterface
public interface FetchEventSink {

    FetchEventSink NOOP = (level, event, fields) -> { };

    /**
     * @param level  severity of the event
     * @param event  dotted event name, e.g. {@code retry.backoff}
     * @param fields ordered key/value details
     */
    void emit(Level level, String event, Map<String, Object> fields);
}
