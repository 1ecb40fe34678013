package com.spotifydump.spotify;

import java.io.IOException;
import java.util.OptionalInt;

/**
 * Terminal failure of a fetch. The {@link Kind} tells callers what went wrong; the status code is
 * present whenever the failure came from an HTTP response.
 */
public class FetchException extends Exception {

    public enum Kind {
        UNAUTHORIZED,
        FORBIDDEN,
        RATE_LIMITED,
        SERVER_ERROR,
        HTTP_ERROR,
        NETWORK_ERROR,
        INVALID_RESPONSE,
        CANCELLED
    }

    private final Kind kind;
    private final int statusCode;

    public FetchException(Kind kind, int statusCode, String message) {
        this(kind, statusCode, message, null);
    }

    public FetchException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind() {
        return kind;
    }

    public OptionalInt getStatusCode() {
        return statusCode > 0 ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    /**
     * Maps a non-2xx status (after retries) to the matching failure.
     */
    public static FetchException forStatus(int status, String url) {
        if (status == 401) {
            return new UnauthorizedException();
        }
        if (status == 403) {
            return new ForbiddenException();
        }
        if (status == 429) {
            return new FetchException(Kind.RATE_LIMITED, status, "Rate limit not lifted for " + url);
        }
        if (status >= 500) {
            return new FetchException(Kind.SERVER_ERROR, status, "Server error " + status + " for " + url);
        }
        return new FetchException(Kind.HTTP_ERROR, status, "HTTP " + status + " for " + url);
    }

    public static FetchException networkError(String url, IOException cause) {
        String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new FetchException(Kind.NETWORK_ERROR, 0, "Network failure for " + url + ": " + detail, cause);
    }

    public static FetchException invalidResponse(String url, Throwable cause) {
        return new FetchException(Kind.INVALID_RESPONSE, 0, "Unreadable response body from " + url, cause);
    }

    public static FetchException cancelled() {
        return new FetchException(Kind.CANCELLED, 0, "Fetch cancelled");
    }
}
