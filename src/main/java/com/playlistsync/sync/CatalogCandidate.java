package com.playlistsync.sync;

/**
 * A track as returned by the destination catalog, either from a search or from a
 * playlist listing. Listing entries for local files have no catalog id, so {@code id}
 * may be null there; search results always carry one.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public record CatalogCandidate(String id, String name, String artist, String uri) {

    /**
     * Normalized dedup key of this candidate.
     * @return {@code normalize(name) + "|||" + normalize(artist)}
     */
    public String normalizedKey() {
        return TrackNormalizer.key(name, artist);
    }
}
