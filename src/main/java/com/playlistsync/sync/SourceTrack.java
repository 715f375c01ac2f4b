package com.playlistsync.sync;

/**
 * Immutable record representing one entry of the source playlist.
 * <p>
 * Source tracks carry no destination-native identifier; they are resolved against the
 * destination catalog by {@link TrackMatcher}. Position in the source list is significant
 * for progress reporting, so collections of source tracks are always order-preserving.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public record SourceTrack(String title, String artist) {
    public SourceTrack {
        title = title == null ? "" : title;
        artist = artist == null ? "" : artist;
    }
}
