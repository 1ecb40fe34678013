package com.spotifydump.spotify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ArtistCredit(@JsonProperty("name") String name) {}
