package com.spotifydump.spotify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spotifydump.Config;
import com.spotifydump.http.FetchCancellation;
import com.spotifydump.http.FetchEventSink;
import com.spotifydump.http.HttpTransport;
import com.spotifydump.http.JdkHttpTransport;
import com.spotifydump.http.RetryPolicy;
import com.spotifydump.http.RetryingExecutor;
import com.spotifydump.http.Slf4jFetchEventSink;
import com.spotifydump.http.Sleeper;
import com.spotifydump.spotify.model.FollowedArtist;
import com.spotifydump.spotify.model.LibrarySnapshot;
import com.spotifydump.spotify.model.Playlist;
import com.spotifydump.spotify.model.SavedAlbum;
import com.spotifydump.spotify.model.Track;

import java.time.Duration;
import java.util.List;

/**
 * Entry points of the export engine, one per resource kind.
 *
 * <p>Each call takes the bearer token, reads the whole collection and returns normalized
 * records in server order. {@link UnauthorizedException} and {@link ForbiddenException} abort the
 * call; inside the playlist fan-out the same statuses only mark the affected playlist.</p>
 *
 * Usage:
 * <pre>
 *   SpotifyLibraryClient client = SpotifyLibraryClient.fromConfig();
 *   List&lt;Track&gt; liked = client.getSavedTracks(token);
 * </pre>
 */
public class SpotifyLibraryClient {

    private final SavedTrackFetcher savedTracks;
    private final PlaylistFetcher playlists;
    private final SavedAlbumFetcher savedAlbums;
    private final FollowedArtistFetcher followedArtists;

    public SpotifyLibraryClient(String apiBase, HttpTransport transport, RetryPolicy policy, int workers,
                                FetchEventSink events) {
        this(apiBase, transport, new RetryingExecutor(policy, Sleeper.THREAD, events), workers, events);
    }

    public SpotifyLibraryClient(String apiBase, HttpTransport transport, RetryingExecutor retry, int workers,
                                FetchEventSink events) {
        String base = normalizeBase(apiBase);
        FetchEventSink sink = events == null ? FetchEventSink.NOOP : events;
        Paginator paginator = new Paginator(transport, retry, new ObjectMapper(), sink);
        this.savedTracks = new SavedTrackFetcher(paginator, base, sink);
        this.playlists = new PlaylistFetcher(paginator, base, sink, Math.max(1, workers));
        this.savedAlbums = new SavedAlbumFetcher(paginator, base, sink);
        this.followedArtists = new FollowedArtistFetcher(paginator, base, sink);
    }

    public static SpotifyLibraryClient fromConfig() {
        return fromConfig(new Slf4jFetchEventSink(Config.getLogLevel()));
    }

    public static SpotifyLibraryClient fromConfig(FetchEventSink events) {
        RetryPolicy policy = new RetryPolicy(
                Config.getRetryMax(),
                Duration.ofMillis(Config.getRetryInitialDelayMs()),
                Duration.ofMillis(Config.getRetryMaxDelayMs()),
                Config.isRetryNetworkFailures(),
                Config.getRateLimitMaxWaits());
        return new SpotifyLibraryClient(Config.getApiUrl(), new JdkHttpTransport(), policy,
                Config.getFetchWorkers(), events);
    }

    public List<Track> getSavedTracks(String token) throws FetchException {
        return getSavedTracks(token, FetchCancellation.none());
    }

    public List<Track> getSavedTracks(String token, FetchCancellation cancellation) throws FetchException {
        return savedTracks.fetch(requireToken(token), cancellation);
    }

    public List<Playlist> getUserPlaylists(String token) throws FetchException {
        return getUserPlaylists(token, FetchCancellation.none());
    }

    public List<Playlist> getUserPlaylists(String token, FetchCancellation cancellation) throws FetchException {
        return playlists.fetch(requireToken(token), cancellation);
    }

    public List<SavedAlbum> getSavedAlbums(String token) throws FetchException {
        return getSavedAlbums(token, FetchCancellation.none());
    }

    public List<SavedAlbum> getSavedAlbums(String token, FetchCancellation cancellation) throws FetchException {
        return savedAlbums.fetch(requireToken(token), cancellation);
    }

    public List<FollowedArtist> getFollowedArtists(String token) throws FetchException {
        return getFollowedArtists(token, FetchCancellation.none());
    }

    public List<FollowedArtist> getFollowedArtists(String token, FetchCancellation cancellation) throws FetchException {
        return followedArtists.fetch(requireToken(token), cancellation);
    }

    public LibrarySnapshot exportLibrary(String token) throws FetchException {
        return exportLibrary(token, FetchCancellation.none());
    }

    /**
     * Runs the four fetches one after another. The first terminal failure aborts the export.
     */
    public LibrarySnapshot exportLibrary(String token, FetchCancellation cancellation) throws FetchException {
        List<Track> tracks = getSavedTracks(token, cancellation);
        List<Playlist> lists = getUserPlaylists(token, cancellation);
        List<SavedAlbum> albums = getSavedAlbums(token, cancellation);
        List<FollowedArtist> artists = getFollowedArtists(token, cancellation);
        return new LibrarySnapshot(tracks, lists, albums, artists);
    }

    private static String requireToken(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        return token.trim();
    }

    static String normalizeBase(String apiBase) {
        if (apiBase == null || apiBase.isBlank()) {
            return Config.DEFAULT_API_URL;
        }
        String base = apiBase.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
