package com.spotifydump.spotify;

/**
 * 403: the user is not allowed to use this app, typically because they are not registered as a
 * tester in the Spotify developer dashboard.
 */
public class ForbiddenException extends FetchException {

    public ForbiddenException() {
        super(Kind.FORBIDDEN, 403, "User not registered in Spotify Developer Dashboard");
    }
}
