package com.playlistsync.sync;

/**
 * Every source track was classified but appending the matched tracks to the destination failed.
 * <p>
 * The attached summary has {@code committed == false}; its {@code found} outcomes were matched but
 * may not be present in the destination playlist. {@link #getBatchesCommitted()} tells how many
 * full batches were appended before the failure.
 */
public class SyncCommitException extends SyncException {
    private final transient SyncSummary summary;
    private final int batchesCommitted;

    public SyncCommitException(String message, SyncSummary summary, int batchesCommitted, Throwable cause) {
        super(message, cause);
        this.summary = summary;
        this.batchesCommitted = batchesCommitted;
    }

    public SyncSummary getSummary() {
        return summary;
    }

    public int getBatchesCommitted() {
        return batchesCommitted;
    }
}
