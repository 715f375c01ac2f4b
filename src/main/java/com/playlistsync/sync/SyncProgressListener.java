package com.playlistsync.sync;

import java.util.List;

/**
 * Receives a snapshot of every outcome after each state transition of a sync run.
 * <p>
 * Invoked synchronously on the sync thread; implementations that may be slow should be wrapped in a
 * {@link QueuedProgressPublisher}.
 */
@FunctionalInterface
public interface SyncProgressListener {

    SyncProgressListener NONE = (outcomes, currentIndex) -> { };

    /**
     * @param outcomes immutable snapshot, index-aligned with the source list
     * @param currentIndex index of the track whose status just changed
     */
    void onProgress(List<SyncOutcome> outcomes, int currentIndex);
}
