package com.spotifydump;

import com.spotifydump.http.RetryPolicy;
import com.spotifydump.http.Slf4jFetchEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

/**
 * Runtime settings. Sources, lowest precedence first: {@code ~/.spotify-dump/spotify.properties},
 * {@code .env} in the working directory, process environment.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private static final Path CONFIG_FILE = Path.of(System.getProperty("user.home"), ".spotify-dump", "spotify.properties");
    private static final Path DOT_ENV_FILE = Path.of(".env");

    static final String API_URL = "SPOTIFY_API_URL";
    static final String ACCESS_TOKEN = "SPOTIFY_ACCESS_TOKEN";
    static final String FETCH_WORKERS = "SPOTIFY_FETCH_WORKERS";
    static final String RETRY_MAX = "SPOTIFY_RETRY_MAX";
    static final String RETRY_INITIAL_DELAY_MS = "SPOTIFY_RETRY_INITIAL_DELAY_MS";
    static final String RETRY_MAX_DELAY_MS = "SPOTIFY_RETRY_MAX_DELAY_MS";
    static final String RETRY_NETWORK_FAILURES = "SPOTIFY_RETRY_NETWORK_FAILURES";
    static final String RATE_LIMIT_MAX_WAITS = "SPOTIFY_RATE_LIMIT_MAX_WAITS";
    static final String LOG_LEVEL = "SPOTIFY_LOG_LEVEL";

    static final List<String> KNOWN_KEYS = List.of(
            API_URL, ACCESS_TOKEN, FETCH_WORKERS, RETRY_MAX, RETRY_INITIAL_DELAY_MS,
            RETRY_MAX_DELAY_MS, RETRY_NETWORK_FAILURES, RATE_LIMIT_MAX_WAITS, LOG_LEVEL);

    public static final String DEFAULT_API_URL = "https://api.spotify.com";

    private static Properties props = new Properties();
    private static boolean initialized;

    private Config() {}

    private static synchronized void loadIfNeeded() {
        if (initialized) return;
        loadFromPropertiesIfPresent(CONFIG_FILE);
        loadFromDotEnvIfPresent(DOT_ENV_FILE);
        for (String key : KNOWN_KEYS) {
            String value = System.getenv(key);
            if (value != null && !value.isBlank()) {
                props.setProperty(key, value.trim());
            }
        }
        initialized = true;
    }

    static synchronized void loadFromPropertiesIfPresent(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return;
        }
        Properties fileProps = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            fileProps.load(in);
        } catch (IOException e) {
            log.warn("Could not read config file {}: {}", file, e.getMessage());
            return;
        }
        for (String key : KNOWN_KEYS) {
            String value = fileProps.getProperty(key);
            if (value != null && !value.isBlank()) {
                props.setProperty(key, value.trim());
            }
        }
    }

    static synchronized void loadFromDotEnvIfPresent(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return;
        }
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring(7).trim();
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).trim();
            if (!KNOWN_KEYS.contains(key)) continue;
            String value = stripQuotes(line.substring(eq + 1).trim());
            if (!value.isBlank()) {
                props.setProperty(key, value);
            }
        }
    }

    static synchronized void reset() {
        props = new Properties();
        initialized = false;
    }

    static synchronized void markInitialized() {
        initialized = true;
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static synchronized String get(String key) {
        loadIfNeeded();
        return props.getProperty(key);
    }

    private static int getInt(String key, int def) {
        String v = get(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}, using {}", key, v, def);
            return def;
        }
    }

    private static long getLong(String key, long def) {
        String v = get(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}, using {}", key, v, def);
            return def;
        }
    }

    public static String getApiUrl() {
        String v = get(API_URL);
        if (v == null || v.isBlank()) {
            return DEFAULT_API_URL;
        }
        String trimmed = v.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? DEFAULT_API_URL : trimmed;
    }

    public static String getAccessToken() {
        return get(ACCESS_TOKEN);
    }

    public static int getFetchWorkers() {
        return Math.max(1, getInt(FETCH_WORKERS, 10));
    }

    public static int getRetryMax() {
        return Math.max(0, getInt(RETRY_MAX, 5));
    }

    public static long getRetryInitialDelayMs() {
        return Math.max(0L, getLong(RETRY_INITIAL_DELAY_MS, 1000L));
    }

    public static long getRetryMaxDelayMs() {
        return Math.max(0L, getLong(RETRY_MAX_DELAY_MS, 60000L));
    }

    public static boolean isRetryNetworkFailures() {
        String v = get(RETRY_NETWORK_FAILURES);
        return v != null && (v.trim().equalsIgnoreCase("true") || v.trim().equals("1"));
    }

    public static int getRateLimitMaxWaits() {
        return Math.max(0, getInt(RATE_LIMIT_MAX_WAITS, RetryPolicy.DEFAULT_MAX_RATE_LIMIT_WAITS));
    }

    public static Level getLogLevel() {
        return Slf4jFetchEventSink.parseLevel(get(LOG_LEVEL), Level.ERROR);
    }
}
