package com.playlistsync.source;

import com.playlistsync.sync.SourceTrack;

import java.util.List;

/**
 * Immutable record representing a scraped source playlist: its display name, the page it was read from,
 * and its tracks in page order.
 */
public record SourcePlaylist(String name, String url, List<SourceTrack> tracks) {
    public SourcePlaylist {
        name = name == null ? "" : name;
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
    }
}
