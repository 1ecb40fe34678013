package com.spotifydump.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotifydump.http.FetchCancellation;
import com.spotifydump.http.FetchEventSink;
import com.spotifydump.spotify.model.FollowedArtist;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads followed artists. This endpoint pages by {@code after} cursor and nests
 * {@code items}/{@code cursors} under {@code artists}.
 */
public class FollowedArtistFetcher {

    static final String PATH = "/v1/me/following?type=artist&limit=50";
    static final String CONTAINER = "artists";

    private final Paginator paginator;
    private final String apiBase;
    private final FetchEventSink events;

    public FollowedArtistFetcher(Paginator paginator, String apiBase, FetchEventSink events) {
        this.paginator = paginator;
        this.apiBase = apiBase;
        this.events = events == null ? FetchEventSink.NOOP : events;
    }

    public List<FollowedArtist> fetch(String token, FetchCancellation cancellation) throws FetchException {
        long start = System.nanoTime();
        List<JsonNode> raw = paginator.collectByCursor(token, apiBase + PATH, CONTAINER, cancellation);
        List<FollowedArtist> artists = new ArrayList<>(raw.size());
        for (JsonNode item : raw) {
            artists.add(LibraryNormalizer.followedArtist(item));
        }
        FetchReport.done(events, "artists", artists.size(), start);
        return artists;
    }
}
