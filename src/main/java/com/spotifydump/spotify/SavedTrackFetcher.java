package com.spotifydump.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotifydump.http.FetchCancellation;
import com.spotifydump.http.FetchEventSink;
import com.spotifydump.spotify.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the user's liked songs ({@code /v1/me/tracks}).
 */
public class SavedTrackFetcher {

    static final String PATH = "/v1/me/tracks?limit=50";

    private static final Logger log = LoggerFactory.getLogger(SavedTrackFetcher.class);

    private final Paginator paginator;
    private final String apiBase;
    private final FetchEventSink events;

    public SavedTrackFetcher(Paginator paginator, String apiBase, FetchEventSink events) {
        this.paginator = paginator;
        this.apiBase = apiBase;
        this.events = events == null ? FetchEventSink.NOOP : events;
    }

    public List<Track> fetch(String token, FetchCancellation cancellation) throws FetchException {
        long start = System.nanoTime();
        List<JsonNode> raw = paginator.collect(token, apiBase + PATH, cancellation);
        List<Track> tracks = new ArrayList<>(raw.size());
        for (JsonNode item : raw) {
            if (!LibraryNormalizer.hasTrack(item)) {
                log.debug("Skipping saved item without track payload");
                continue;
            }
            tracks.add(LibraryNormalizer.savedTrack(item));
        }
        FetchReport.done(events, "saved_tracks", tracks.size(), start);
        return tracks;
    }
}
