package com.spotifydump.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.spotifydump.spotify.model.AlbumRef;
import com.spotifydump.spotify.model.ArtistCredit;
import com.spotifydump.spotify.model.FollowedArtist;
import com.spotifydump.spotify.model.PlaylistInfo;
import com.spotifydump.spotify.model.SavedAlbum;
import com.spotifydump.spotify.model.Track;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw Web API objects into the normalized records. Missing optional fields become
 * {@code null} or empty lists; nothing here throws on incomplete input.
 */
public final class LibraryNormalizer {

    private LibraryNormalizer() {}

    /**
     * Milliseconds to {@code M:SS}, or {@code H:MM:SS} from one hour on. {@code null} stays {@code null}.
     */
    public static String formatDuration(Long millis) {
        if (millis == null) {
            return null;
        }
        long totalSeconds = Math.max(0L, millis) / 1000;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, seconds);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, seconds);
    }

    public static Track track(JsonNode track, String addedAt) {
        JsonNode album = track == null ? null : track.get("album");
        AlbumRef albumRef = new AlbumRef(
                optText(album, "name"),
                optText(album, "release_date"),
                firstImageUrl(album));
        Long durationMs = (track != null && track.path("duration_ms").isNumber())
                ? track.get("duration_ms").asLong()
                : null;
        return new Track(
                optText(track, "name"),
                albumRef,
                artists(track),
                formatDuration(durationMs),
                addedAt);
    }

    /**
     * Saved-track and playlist-track items both wrap the track next to {@code added_at}.
     */
    public static Track savedTrack(JsonNode item) {
        return track(item.get("track"), optText(item, "added_at"));
    }

    public static boolean hasTrack(JsonNode item) {
        JsonNode track = item == null ? null : item.get("track");
        return track != null && track.isObject();
    }

    public static SavedAlbum savedAlbum(JsonNode item) {
        JsonNode album = item.get("album");
        Integer totalTracks = (album != null && album.path("total_tracks").isNumber())
                ? album.get("total_tracks").asInt()
                : null;
        return new SavedAlbum(
                optText(album, "name"),
                artists(album),
                optText(album, "release_date"),
                totalTracks,
                firstImageUrl(album),
                optText(item, "added_at"));
    }

    public static FollowedArtist followedArtist(JsonNode artist) {
        List<String> genres = new ArrayList<>();
        JsonNode genreNodes = artist.get("genres");
        if (genreNodes != null && genreNodes.isArray()) {
            for (JsonNode g : genreNodes) {
                if (g != null && g.isTextual()) {
                    genres.add(g.asText());
                }
            }
        }
        int followers = artist.path("followers").path("total").asInt(0);
        return new FollowedArtist(optText(artist, "name"), genres, firstImageUrl(artist), followers);
    }

    public static PlaylistInfo playlistInfo(JsonNode playlist) {
        JsonNode owner = playlist.get("owner");
        String ownerName = optText(owner, "display_name");
        if (ownerName == null || ownerName.isEmpty()) {
            ownerName = optText(owner, "id");
        }
        return new PlaylistInfo(
                optText(playlist, "id"),
                optText(playlist, "name"),
                optText(playlist, "description"),
                ownerName,
                firstImageUrl(playlist));
    }

    static List<ArtistCredit> artists(JsonNode parent) {
        List<ArtistCredit> out = new ArrayList<>();
        JsonNode artists = parent == null ? null : parent.get("artists");
        if (artists != null && artists.isArray()) {
            for (JsonNode artist : artists) {
                out.add(new ArtistCredit(optText(artist, "name")));
            }
        }
        return out;
    }

    static String firstImageUrl(JsonNode parent) {
        JsonNode images = parent == null ? null : parent.get("images");
        if (images == null || !images.isArray() || images.size() == 0) {
            return null;
        }
        return optText(images.get(0), "url");
    }

    static String optText(JsonNode node, String field) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        return v.asText();
    }
}
