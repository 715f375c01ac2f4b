package com.playlistsync.sync;

import java.util.List;

/**
 * Remote operations on the destination catalog used by the sync engine and the CLI.
 * <p>
 * Every implementation must apply the rate-limit policy of {@link SpotifyApiClient}: HTTP 429 is
 * waited out and retried, any other failure surfaces as {@link CatalogApiException}.
 */
public interface CatalogClientInterface {
    /**
     * Fetches one page of a playlist listing.
     * @param playlistId destination playlist id
     * @param nextUrl cursor returned by the previous page, or null for the first page
     * @return the page, whose {@code next} is null on the last page
     */
    PlaylistItemsPage getPlaylistItems(String playlistId, String nextUrl);

    /**
     * Searches the catalog for tracks.
     * @param query structured ({@code track:x artist:y}) or free-text query
     * @param limit maximum number of results
     * @return candidates in remote relevance order, possibly empty
     */
    List<CatalogCandidate> searchTracks(String query, int limit);

    /**
     * Appends tracks to a playlist in one call.
     * @param uris at most {@link SyncSettings#MAX_BATCH_SIZE} track URIs
     */
    void addItems(String playlistId, List<String> uris);

    /**
     * Creates a private playlist for the signed-in user.
     */
    CatalogPlaylist createPlaylist(String name);

    CatalogUser getCurrentUser();

    /**
     * Lists all playlists of the signed-in user, following pagination.
     */
    List<CatalogPlaylist> getUserPlaylists();
}
