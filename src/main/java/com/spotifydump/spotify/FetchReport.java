package com.spotifydump.spotify;

import com.spotifydump.http.FetchEventSink;
import org.slf4j.event.Level;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

final class FetchReport {

    private FetchReport() {}

    static void done(FetchEventSink events, String resource, int count, long startNanos) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("resource", resource);
        fields.put("count", count);
        fields.put("elapsedMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        events.emit(Level.INFO, "fetch.done", fields);
    }
}
