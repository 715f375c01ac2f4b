package com.playlistsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sync orchestrator: drives the per-track loop of a run.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Builds the {@link DestinationIndex} once. Failure aborts the run with {@link SyncException}.</li>
 *   <li>For each source track, in order: marks it searching, resolves it with {@link TrackMatcher}, then
 *       classifies it as not found, skipped (catalog id or normalized key already in the index) or found.
 *       Found tracks are queued and inserted into the index immediately so later duplicates in the same
 *       source list are skipped.</li>
 *   <li>Waits the configured pacing delay after every track regardless of outcome.</li>
 *   <li>Appends queued URIs in batches of {@link SyncSettings#batchSize()}, sequentially and in queue order.</li>
 * </ul>
 * Progress is reported after every transition. Cancellation is honored before each track and each batch;
 * a cancelled run performs no further network calls and returns with {@code committed == false}.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class PlaylistSyncService implements PlaylistSyncServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistSyncService.class);

    private final CatalogClientInterface catalogClient;
    private final DestinationIndexBuilder indexBuilder;
    private final TrackMatcher trackMatcher;
    private final SyncSettings settings;
    private final Sleeper sleeper;

    public PlaylistSyncService(CatalogClientInterface catalogClient, SyncSettings settings) {
        this(catalogClient, new DestinationIndexBuilder(catalogClient), new TrackMatcher(catalogClient), settings, Sleeper.SYSTEM);
    }

    public PlaylistSyncService(CatalogClientInterface catalogClient, DestinationIndexBuilder indexBuilder,
                               TrackMatcher trackMatcher, SyncSettings settings, Sleeper sleeper) {
        this.catalogClient = catalogClient;
        this.indexBuilder = indexBuilder;
        this.trackMatcher = trackMatcher;
        this.settings = settings == null ? SyncSettings.defaults() : settings;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    @Override
    public SyncSummary sync(List<SourceTrack> sourceTracks, String destinationPlaylistId,
                            SyncProgressListener onProgress, CancellationSignal cancellation) {
        if (sourceTracks == null) throw new IllegalArgumentException("sourceTracks cannot be null");
        if (destinationPlaylistId == null || destinationPlaylistId.isBlank()) {
            throw new IllegalArgumentException("destinationPlaylistId cannot be blank");
        }
        SyncProgressListener listener = onProgress == null ? SyncProgressListener.NONE : onProgress;
        CancellationSignal cancel = cancellation == null ? CancellationSignal.none() : cancellation;

        logger.info("Fetching existing tracks from playlist {}...", destinationPlaylistId);
        DestinationIndex index;
        try {
            index = indexBuilder.buildIndex(destinationPlaylistId);
        } catch (CatalogApiException e) {
            logger.error("Could not read destination playlist {}: {}", destinationPlaylistId, e.getMessage());
            throw new SyncException("Failed to read destination playlist " + destinationPlaylistId + ": " + e.getMessage(), e);
        }

        List<SyncOutcome> outcomes = new ArrayList<>(sourceTracks.size());
        for (SourceTrack track : sourceTracks) {
            outcomes.add(SyncOutcome.pending(track));
        }
        List<String> toAdd = new ArrayList<>();

        logger.info("Searching catalog for {} source tracks...", sourceTracks.size());
        for (int i = 0; i < sourceTracks.size(); i++) {
            if (cancel.isCancelled()) {
                logger.info("Sync cancelled after {} of {} tracks; nothing will be added", i, sourceTracks.size());
                return SyncSummary.of(outcomes, false, true);
            }
            classify(i, outcomes, index, toAdd, listener);
            pace();
        }

        SyncSummary classified = SyncSummary.of(outcomes, false, false);
        return commit(destinationPlaylistId, toAdd, classified, cancel);
    }

    private void classify(int i, List<SyncOutcome> outcomes, DestinationIndex index, List<String> toAdd,
                          SyncProgressListener listener) {
        SourceTrack track = outcomes.get(i).sourceTrack();
        transition(outcomes, i, TrackStatus.SEARCHING, null, listener);

        CatalogCandidate match;
        try {
            match = trackMatcher.match(track.title(), track.artist());
        } catch (CatalogAuthenticationException e) {
            throw new SyncException("Spotify rejected the stored credentials while searching for '" + track.title()
                + "'. Sign in again and retry.", e);
        }

        if (match == null) {
            transition(outcomes, i, TrackStatus.NOT_FOUND, null, listener);
            return;
        }
        if (index.containsId(match.id())) {
            transition(outcomes, i, TrackStatus.SKIPPED, match, listener);
            return;
        }
        // Same song under a different catalog id (single vs. album release, etc.)
        String key = match.normalizedKey();
        if (index.containsKey(key)) {
            transition(outcomes, i, TrackStatus.SKIPPED, match, listener);
            return;
        }

        toAdd.add(match.uri());
        index.add(match);
        transition(outcomes, i, TrackStatus.FOUND, match, listener);
    }

    private void transition(List<SyncOutcome> outcomes, int i, TrackStatus next, CatalogCandidate candidate,
                            SyncProgressListener listener) {
        outcomes.set(i, outcomes.get(i).advance(next, candidate));
        listener.onProgress(Collections.unmodifiableList(new ArrayList<>(outcomes)), i);
    }

    private SyncSummary commit(String playlistId, List<String> toAdd, SyncSummary classified, CancellationSignal cancel) {
        int batchSize = settings.batchSize();
        int batches = 0;
        for (int start = 0; start < toAdd.size(); start += batchSize) {
            if (cancel.isCancelled()) {
                logger.info("Sync cancelled before commit; {} of {} tracks were appended", start, toAdd.size());
                return new SyncSummary(classified.total(), classified.added(), classified.skipped(), classified.notFound(),
                    false, true, classified.outcomes());
            }
            List<String> batch = toAdd.subList(start, Math.min(start + batchSize, toAdd.size()));
            try {
                catalogClient.addItems(playlistId, new ArrayList<>(batch));
            } catch (CatalogApiException e) {
                logger.error("Appending batch {} to playlist {} failed: {}", batches + 1, playlistId, e.getMessage());
                throw new SyncCommitException("Tracks were matched but could not be added to playlist " + playlistId
                    + " (" + start + " of " + toAdd.size() + " appended): " + e.getMessage(), classified, batches, e);
            }
            batches++;
        }
        logger.info("Sync complete: {} added, {} already present, {} not found ({} total)",
            classified.added(), classified.skipped(), classified.notFound(), classified.total());
        return classified.withCommitted(true);
    }

    private void pace() {
        try {
            sleeper.sleep(settings.pacingDelay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException("Sync interrupted", e);
        }
    }
}
