package com.playlistsync.sync;

/**
 * Immutable per-track result of a sync run.
 * <p>
 * A new instance is produced for every transition via {@link #advance(TrackStatus, CatalogCandidate)};
 * snapshots handed to progress listeners therefore never change underneath them.
 * {@code matchedCandidate} is non-null iff the status is {@link TrackStatus#FOUND} or {@link TrackStatus#SKIPPED}.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public record SyncOutcome(SourceTrack sourceTrack, TrackStatus status, CatalogCandidate matchedCandidate) {

    public SyncOutcome {
        if (sourceTrack == null) throw new IllegalArgumentException("sourceTrack cannot be null");
        if (status == null) throw new IllegalArgumentException("status cannot be null");
        boolean needsCandidate = status == TrackStatus.FOUND || status == TrackStatus.SKIPPED;
        if (needsCandidate != (matchedCandidate != null)) {
            throw new IllegalArgumentException("matchedCandidate must be set iff status is found or skipped (status=" + status.label() + ")");
        }
    }

    public static SyncOutcome pending(SourceTrack track) {
        return new SyncOutcome(track, TrackStatus.PENDING, null);
    }

    /**
     * Returns the outcome after a forward transition.
     * @param next new status
     * @param candidate matched candidate, required for found/skipped and ignored otherwise
     * @return new outcome instance
     * @throws IllegalStateException if the transition would regress or leave a terminal status
     */
    public SyncOutcome advance(TrackStatus next, CatalogCandidate candidate) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal status transition " + status.label() + " -> " + (next == null ? "null" : next.label())
                + " for '" + sourceTrack.title() + "'");
        }
        boolean keepCandidate = next == TrackStatus.FOUND || next == TrackStatus.SKIPPED;
        return new SyncOutcome(sourceTrack, next, keepCandidate ? candidate : null);
    }
}
