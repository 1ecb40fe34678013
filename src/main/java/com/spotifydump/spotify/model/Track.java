package com.spotifydump.spotify.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalized track. {@code duration} is formatted as {@code M:SS} or {@code H:MM:SS};
 * {@code addedAt} is the raw timestamp from the saved-tracks or playlist listing.
 */
@JsonPropertyOrder({"name", "album", "artists", "duration", "added_at"})
public record Track(
        @JsonProperty("name") String name,
        @JsonProperty("album") AlbumRef album,
        @JsonProperty("artists") List<ArtistCredit> artists,
        @JsonProperty("duration") String duration,
        @JsonProperty("added_at") String addedAt
) {
    public Track {
        album = album != null ? album : new AlbumRef(null, null, null);
        artists = artists != null ? Collections.unmodifiableList(new ArrayList<>(artists)) : List.of();
    }

    public List<String> artistNames() {
        return artists.stream().map(ArtistCredit::name).toList();
    }
}
