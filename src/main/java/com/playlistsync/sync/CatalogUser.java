package com.playlistsync.sync;

/**
 * The signed-in destination user.
 */
public record CatalogUser(String id, String displayName) {}
