package com.spotifydump.spotify;

import com.spotifydump.http.FetchCancellation;
import com.spotifydump.http.FetchEventSink;
import com.spotifydump.spotify.model.Playlist;
import com.spotifydump.spotify.model.PlaylistInfo;
import com.spotifydump.spotify.model.Track;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads the tracks of many playlists in parallel on a bounded pool.
 *
 * <p>The output has one record per input playlist, in input order. Each worker writes into the
 * slot of its input index. A failing playlist, including 401/403 on its track listing, yields a
 * record with no tracks and an {@code error} text; its siblings are not affected.</p>
 */
public class PlaylistFanOut {

    public static final int DEFAULT_WORKERS = 10;

    /**
     * Loads the full track listing of one playlist.
     */
    @FunctionalInterface
    public interface TrackLoader {
        List<Track> load(String token, String playlistId, FetchCancellation cancellation) throws FetchException;
    }

    private final TrackLoader loader;
    private final int workers;
    private final FetchEventSink events;

    public PlaylistFanOut(TrackLoader loader, int workers, FetchEventSink events) {
        this.loader = loader;
        this.workers = Math.max(1, workers);
        this.events = events == null ? FetchEventSink.NOOP : events;
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * @throws FetchException only with kind {@code CANCELLED}; per-playlist failures are annotated instead
     */
    public List<Playlist> fetchAll(List<PlaylistInfo> playlists, String token, FetchCancellation cancellation)
            throws FetchException {
        if (playlists == null || playlists.isEmpty()) {
            return List.of();
        }

        int poolSize = Math.min(workers, playlists.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        Playlist[] slots = new Playlist[playlists.size()];
        List<Future<Playlist>> futures = new ArrayList<>(playlists.size());
        try {
            for (PlaylistInfo info : playlists) {
                if (cancellation.isCancelled()) {
                    throw FetchException.cancelled();
                }
                futures.add(pool.submit(() -> fetchOne(info, token, cancellation)));
            }
            for (int i = 0; i < futures.size(); i++) {
                slots[i] = futures.get(i).get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw FetchException.cancelled();
        } catch (ExecutionException e) {
            // fetchOne handles exceptions itself, so only errors get here
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Playlist worker failed", cause);
        } finally {
            pool.shutdown();
        }

        if (cancellation.isCancelled()) {
            throw FetchException.cancelled();
        }
        return List.of(slots);
    }

    private Playlist fetchOne(PlaylistInfo info, String token, FetchCancellation cancellation) {
        if (cancellation.isCancelled()) {
            return Playlist.failed(info, "cancelled");
        }
        try {
            return Playlist.of(info, loader.load(token, info.id(), cancellation));
        } catch (FetchException e) {
            if (e.getKind() == FetchException.Kind.CANCELLED) {
                return Playlist.failed(info, "cancelled");
            }
            return failed(info, describe(e), e.getKind().name(), e);
        } catch (RuntimeException e) {
            return failed(info, describe(e), "UNEXPECTED", e);
        }
    }

    // the only report of a failed playlist
    private Playlist failed(PlaylistInfo info, String error, String kind, Exception cause) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("playlist", info.id());
        fields.put("kind", kind);
        fields.put("error", error);
        fields.put("exception", cause.getClass().getSimpleName());
        if (cause.getMessage() != null && !cause.getMessage().equals(error)) {
            fields.put("detail", cause.getMessage());
        }
        events.emit(Level.WARN, "playlist.failed", fields);
        return Playlist.failed(info, error);
    }

    static String describe(Exception e) {
        if (e instanceof FetchException fe && fe.getStatusCode().isPresent()) {
            return "HTTP Error " + fe.getStatusCode().getAsInt();
        }
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "playlist-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
