package com.playlistsync.sync;

import java.util.HashSet;
import java.util.Set;

/**
 * Point-in-time snapshot of a destination playlist, used for duplicate detection.
 * <p>
 * Holds the catalog ids already in the playlist and the normalized {@code title|||artist} keys of
 * those entries. The index is owned by a single sync run: it is built once by
 * {@link DestinationIndexBuilder} and then grown in place by {@link PlaylistSyncService} as tracks
 * are queued, so two source tracks resolving to the same catalog track are only added once.
 * Not thread-safe.
 */
public final class DestinationIndex {
    private final Set<String> ids = new HashSet<>();
    private final Set<String> normalizedKeys = new HashSet<>();

    /**
     * Records a playlist entry or a queued candidate. A null id only contributes its key.
     */
    public void add(CatalogCandidate track) {
        if (track == null) return;
        if (track.id() != null && !track.id().isBlank()) {
            ids.add(track.id());
        }
        normalizedKeys.add(track.normalizedKey());
    }

    public boolean containsId(String id) {
        return id != null && ids.contains(id);
    }

    public boolean containsKey(String normalizedKey) {
        return normalizedKey != null && normalizedKeys.contains(normalizedKey);
    }

    public int idCount() {
        return ids.size();
    }

    public int keyCount() {
        return normalizedKeys.size();
    }

    /** @return read-only view of the ids */
    public Set<String> ids() {
        return java.util.Collections.unmodifiableSet(ids);
    }

    /** @return read-only view of the normalized keys */
    public Set<String> normalizedKeys() {
        return java.util.Collections.unmodifiableSet(normalizedKeys);
    }
}
