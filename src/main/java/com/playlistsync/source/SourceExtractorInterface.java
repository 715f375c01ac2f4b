package com.playlistsync.source;

/**
 * Interface for reading a track list from a public source playlist page.
 */
public interface SourceExtractorInterface {
    /**
     * Loads the playlist page and extracts its name and tracks.
     * @param playlistUrl public playlist URL
     * @return playlist with at least one track
     * @throws SourceExtractionException if the URL is not supported, the page cannot be loaded,
     *         or no tracks could be found on it
     */
    SourcePlaylist extract(String playlistUrl);
}
