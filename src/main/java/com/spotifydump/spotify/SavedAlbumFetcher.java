package com.spotifydump.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotifydump.http.FetchCancellation;
import com.spotifydump.http.FetchEventSink;
import com.spotifydump.spotify.model.SavedAlbum;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the user's saved albums ({@code /v1/me/albums}).
 */
public class SavedAlbumFetcher {

    static final String PATH = "/v1/me/albums?limit=50";

    private final Paginator paginator;
    private final String apiBase;
    private final FetchEventSink events;

    public SavedAlbumFetcher(Paginator paginator, String apiBase, FetchEventSink events) {
        this.paginator = paginator;
        this.apiBase = apiBase;
        this.events = events == null ? FetchEventSink.NOOP : events;
    }

    public List<SavedAlbum> fetch(String token, FetchCancellation cancellation) throws FetchException {
        long start = System.nanoTime();
        List<JsonNode> raw = paginator.collect(token, apiBase + PATH, cancellation);
        List<SavedAlbum> albums = new ArrayList<>(raw.size());
        for (JsonNode item : raw) {
            albums.add(LibraryNormalizer.savedAlbum(item));
        }
        FetchReport.done(events, "albums", albums.size(), start);
        return albums;
    }
}
