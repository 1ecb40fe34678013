package com.spotifydump.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotifydump.http.FetchCancellation;
import com.spotifydump.http.FetchEventSink;
import com.spotifydump.spotify.model.Playlist;
import com.spotifydump.spotify.model.PlaylistInfo;
import com.spotifydump.spotify.model.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the user's playlists: the metadata listing first, then every playlist's tracks
 * through {@link PlaylistFanOut}.
 */
public class PlaylistFetcher {

    static final String PLAYLISTS_PATH = "/v1/me/playlists?limit=50";
    static final String TRACK_FIELDS =
            "items(added_at,track(name,duration_ms,album(name,release_date,images),artists(name))),next";

    private static final Logger log = LoggerFactory.getLogger(PlaylistFetcher.class);

    private final Paginator paginator;
    private final String apiBase;
    private final FetchEventSink events;
    private final int workers;

    public PlaylistFetcher(Paginator paginator, String apiBase, FetchEventSink events, int workers) {
        this.paginator = paginator;
        this.apiBase = apiBase;
        this.events = events == null ? FetchEventSink.NOOP : events;
        this.workers = workers;
    }

    public List<Playlist> fetch(String token, FetchCancellation cancellation) throws FetchException {
        long start = System.nanoTime();
        List<PlaylistInfo> infos = fetchMetadata(token, cancellation);
        PlaylistFanOut fanOut = new PlaylistFanOut(this::fetchTracks, workers, events);
        List<Playlist> playlists = fanOut.fetchAll(infos, token, cancellation);
        FetchReport.done(events, "playlists", playlists.size(), start);
        return playlists;
    }

    /**
     * Top-level listing only; tracks are not loaded. 401/403 here abort the call.
     */
    public List<PlaylistInfo> fetchMetadata(String token, FetchCancellation cancellation) throws FetchException {
        List<JsonNode> raw = paginator.collect(token, apiBase + PLAYLISTS_PATH, cancellation);
        List<PlaylistInfo> infos = new ArrayList<>(raw.size());
        for (JsonNode item : raw) {
            infos.add(LibraryNormalizer.playlistInfo(item));
        }
        return infos;
    }

    /**
     * All tracks of one playlist in server order. Items without a track object are dropped.
     */
    public List<Track> fetchTracks(String token, String playlistId, FetchCancellation cancellation) throws FetchException {
        List<JsonNode> raw = paginator.collect(token, tracksUrl(playlistId), cancellation);
        List<Track> tracks = new ArrayList<>(raw.size());
        for (JsonNode item : raw) {
            if (!LibraryNormalizer.hasTrack(item)) {
                log.debug("Skipping empty item in playlist {}", playlistId);
                continue;
            }
            tracks.add(LibraryNormalizer.savedTrack(item));
        }
        return tracks;
    }

    String tracksUrl(String playlistId) {
        String id = URLEncoder.encode(playlistId == null ? "" : playlistId, StandardCharsets.UTF_8);
        return apiBase + "/v1/playlists/" + id + "/tracks?fields=" + TRACK_FIELDS;
    }
}
