package com.playlistsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link DestinationIndex} of a playlist by walking its listing page by page.
 * <p>
 * Pages are fetched strictly one after another because each cursor is only known once the
 * previous page has arrived. Entries without a catalog id (local files) are ignored. A failed
 * page fails the whole build; rate limiting is absorbed by the catalog client.
 */
public class DestinationIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DestinationIndexBuilder.class);

    private final CatalogClientInterface catalogClient;

    public DestinationIndexBuilder(CatalogClientInterface catalogClient) {
        this.catalogClient = catalogClient;
    }

    /**
     * @param playlistId destination playlist id
     * @return index of everything currently in the playlist
     * @throws CatalogApiException if any page request fails
     */
    public DestinationIndex buildIndex(String playlistId) {
        DestinationIndex index = new DestinationIndex();
        String cursor = null;
        int pages = 0;
        int skippedLocal = 0;
        do {
            PlaylistItemsPage page = catalogClient.getPlaylistItems(playlistId, cursor);
            pages++;
            for (CatalogCandidate entry : page.items()) {
                if (entry.id() == null || entry.id().isBlank()) {
                    skippedLocal++;
                    continue;
                }
                index.add(entry);
            }
            cursor = page.hasNext() ? page.next() : null;
        } while (cursor != null);

        logger.info("Playlist {} currently has {} tracks ({} pages, {} entries without catalog id)",
            playlistId, index.idCount(), pages, skippedLocal);
        return index;
    }
}
