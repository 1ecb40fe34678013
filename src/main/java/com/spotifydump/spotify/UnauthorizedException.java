package com.spotifydump.spotify;

/**
 * 401: the access token is expired or invalid. The whole session is unusable.
 */
public class UnauthorizedException extends FetchException {

    public UnauthorizedException() {
        super(Kind.UNAUTHORIZED, 401, "Access token expired or invalid");
    }
}
