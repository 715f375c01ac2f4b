package com.playlistsync.sync;

/**
 * Playlist owned by (or visible to) the signed-in destination user.
 */
public record CatalogPlaylist(String id, String name, int trackCount) {}
