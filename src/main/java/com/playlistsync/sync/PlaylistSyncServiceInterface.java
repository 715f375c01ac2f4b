package com.playlistsync.sync;

import java.util.List;

/**
 * Interface for reconciling a source track list against a destination playlist.
 */
public interface PlaylistSyncServiceInterface {
    /**
     * Runs a full sync without cancellation support.
     * @see #sync(List, String, SyncProgressListener, CancellationSignal)
     */
    default SyncSummary sync(List<SourceTrack> sourceTracks, String destinationPlaylistId, SyncProgressListener onProgress) {
        return sync(sourceTracks, destinationPlaylistId, onProgress, CancellationSignal.none());
    }

    /**
     * Matches every source track against the catalog, skips tracks already in the destination, and
     * appends the rest in batches.
     * @param sourceTracks tracks to sync, in source order
     * @param destinationPlaylistId destination playlist id
     * @param onProgress called after every state transition
     * @param cancellation checked between tracks and between commit batches
     * @return summary of the run; {@code committed} is false if the run was cancelled
     * @throws SyncException if the destination playlist could not be read or credentials were rejected
     * @throws SyncCommitException if appending the matched tracks failed
     */
    SyncSummary sync(List<SourceTrack> sourceTracks, String destinationPlaylistId,
                     SyncProgressListener onProgress, CancellationSignal cancellation);
}
