package com.playlistsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes one log line per resolved track, e.g. {@code ADD: Song - Artist -> Song by Artist [3/40]}.
 */
public class LoggingProgressListener implements SyncProgressListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onProgress(List<SyncOutcome> outcomes, int currentIndex) {
        SyncOutcome outcome = outcomes.get(currentIndex);
        SourceTrack track = outcome.sourceTrack();
        String suffix = " [" + (currentIndex + 1) + "/" + outcomes.size() + "]";
        switch (outcome.status()) {
            case FOUND -> logger.info("ADD: {} - {} -> {} by {}{}", track.title(), track.artist(),
                outcome.matchedCandidate().name(), outcome.matchedCandidate().artist(), suffix);
            case SKIPPED -> logger.info("SKIP (dup): {} - {}{}", track.title(), track.artist(), suffix);
            case NOT_FOUND -> logger.info("NOT FOUND: {} - {}{}", track.title(), track.artist(), suffix);
            case SEARCHING -> logger.debug("Searching: {} - {}{}", track.title(), track.artist(), suffix);
            default -> { }
        }
    }
}
