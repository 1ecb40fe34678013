package com.spotifydump.spotify.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Playlist with its tracks in server order. When the track listing could not be loaded,
 * {@code tracks} is empty and {@code error} describes the failure.
 */
@JsonPropertyOrder({"id", "name", "description", "owner", "image_url", "tracks", "error"})
public record Playlist(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("owner") String owner,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("tracks") List<Track> tracks,
        @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String error
) {
    public Playlist {
        tracks = tracks != null ? Collections.unmodifiableList(new ArrayList<>(tracks)) : List.of();
    }

    public static Playlist of(PlaylistInfo info, List<Track> tracks) {
        return new Playlist(info.id(), info.name(), info.description(), info.owner(), info.imageUrl(), tracks, null);
    }

    public static Playlist failed(PlaylistInfo info, String error) {
        return new Playlist(info.id(), info.name(), info.description(), info.owner(), info.imageUrl(), List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }
}
