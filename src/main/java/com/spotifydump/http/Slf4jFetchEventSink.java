package com.spotifydump.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Forwards fetch events to SLF4J, dropping everything below the configured threshold.
 */
public final class Slf4jFetchEventSink implements FetchEventSink {

    private static final Logger log = LoggerFactory.getLogger("com.spotifydump.fetch");

    private final Level threshold;
    private final Logger logger;

    public Slf4jFetchEventSink(Level threshold) {
        this(threshold, log);
    }

    Slf4jFetchEventSink(Level threshold, Logger logger) {
        this.threshold = threshold == null ? Level.WARN : threshold;
        this.logger = logger;
    }

    public Level getThreshold() {
        return threshold;
    }

    public boolean accepts(Level level) {
        // ERROR=40 ... TRACE=0
        return level != null && level.toInt() >= threshold.toInt();
    }

    @Override
    public void emit(Level level, String event, Map<String, Object> fields) {
        if (!accepts(level)) {
            return;
        }
        logger.atLevel(level).log("{} {}", event, format(fields));
    }

    static String format(Map<String, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return "";
        }
        return fields.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }

    /**
     * Parses a level name such as {@code warn}; unknown values fall back to the default.
     */
    public static Level parseLevel(String value, Level def) {
        if (value == null || value.isBlank()) {
            return def;
        }
        try {
            return Level.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return def;
        }
    }
}
