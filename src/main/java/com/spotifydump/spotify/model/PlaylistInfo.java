package com.spotifydump.spotify.model;

/**
 * Playlist metadata from the top-level listing, before its tracks are loaded.
 */
public record PlaylistInfo(String id, String name, String description, String owner, String imageUrl) {}
