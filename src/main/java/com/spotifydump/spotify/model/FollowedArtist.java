package com.spotifydump.spotify.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"name", "genres", "image_url", "followers"})
public record FollowedArtist(
        @JsonProperty("name") String name,
        @JsonProperty("genres") List<String> genres,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("followers") int followers
) {
    public FollowedArtist {
        genres = genres != null ? List.copyOf(genres) : List.of();
    }
}
