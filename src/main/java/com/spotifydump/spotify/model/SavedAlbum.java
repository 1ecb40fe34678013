package com.spotifydump.spotify.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonPropertyOrder({"name", "artists", "release_date", "total_tracks", "image_url", "added_at"})
public record SavedAlbum(
        @JsonProperty("name") String name,
        @JsonProperty("artists") List<ArtistCredit> artists,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("total_tracks") Integer totalTracks,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("added_at") String addedAt
) {
    public SavedAlbum {
        artists = artists != null ? Collections.unmodifiableList(new ArrayList<>(artists)) : List.of();
    }
}
