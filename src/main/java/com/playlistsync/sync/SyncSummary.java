package com.playlistsync.sync;

import java.util.List;

/**
 * Immutable result of one sync run.
 * <p>
 * {@code added} counts tracks classified as {@link TrackStatus#FOUND}. Whether those tracks actually
 * reached the destination playlist is stated by {@code committed}: it is false when the run was
 * cancelled before the commit phase or when a commit batch failed (see {@link SyncCommitException}).
 *
 * @param total number of source tracks
 * @param added tracks matched and queued for addition
 * @param skipped tracks already present in the destination
 * @param notFound tracks with no catalog match
 * @param committed true iff every queued track was appended to the destination
 * @param cancelled true iff the run stopped early on request
 * @param outcomes per-track outcomes, index-aligned with the source list
 * @author Playlist Sync Team
 * @since 1.0
 */
public record SyncSummary(
    int total,
    int added,
    int skipped,
    int notFound,
    boolean committed,
    boolean cancelled,
    List<SyncOutcome> outcomes
) {
    public SyncSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    /**
     * Builds a summary by counting the terminal statuses in {@code outcomes}.
     */
    public static SyncSummary of(List<SyncOutcome> outcomes, boolean committed, boolean cancelled) {
        int added = 0;
        int skipped = 0;
        int notFound = 0;
        for (SyncOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case FOUND -> added++;
                case SKIPPED -> skipped++;
                case NOT_FOUND -> notFound++;
                default -> { }
            }
        }
        return new SyncSummary(outcomes.size(), added, skipped, notFound, committed, cancelled, outcomes);
    }

    /**
     * @return number of outcomes still pending or searching (non-zero only for cancelled runs)
     */
    public int unresolved() {
        return total - added - skipped - notFound;
    }

    public SyncSummary withCommitted(boolean value) {
        return new SyncSummary(total, added, skipped, notFound, value, cancelled, outcomes);
    }
}
