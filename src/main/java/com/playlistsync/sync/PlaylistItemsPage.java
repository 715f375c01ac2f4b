package com.playlistsync.sync;

import java.util.List;

/**
 * One page of a playlist listing.
 *
 * @param items entries on this page, in playlist order
 * @param next absolute URL of the following page, or null on the last page
 */
public record PlaylistItemsPage(List<CatalogCandidate> items, String next) {
    public PlaylistItemsPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasNext() {
        return next != null && !next.isBlank();
    }
}
