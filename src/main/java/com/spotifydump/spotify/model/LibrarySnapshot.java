package com.spotifydump.spotify.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Everything exported from one library, in the order each listing was returned.
 */
@JsonPropertyOrder({"saved_tracks", "playlists", "albums", "artists"})
public record LibrarySnapshot(
        @JsonProperty("saved_tracks") List<Track> savedTracks,
        @JsonProperty("playlists") List<Playlist> playlists,
        @JsonProperty("albums") List<SavedAlbum> albums,
        @JsonProperty("artists") List<FollowedArtist> artists
) {
    public LibrarySnapshot {
        savedTracks = savedTracks != null ? List.copyOf(savedTracks) : List.of();
        playlists = playlists != null ? List.copyOf(playlists) : List.of();
        albums = albums != null ? List.copyOf(albums) : List.of();
        artists = artists != null ? List.copyOf(artists) : List.of();
    }
}
