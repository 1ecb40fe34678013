package com.spotifydump.spotify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Album a track belongs to.
 */
public record AlbumRef(
        @JsonProperty("name") String name,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("image_url") String imageUrl
) {}
