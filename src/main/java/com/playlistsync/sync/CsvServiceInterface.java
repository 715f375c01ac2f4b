package com.playlistsync.sync;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for exporting sync results to CSV files.
 */
public interface CsvServiceInterface {
    /**
     * Writes one row per source track of a sync run.
     * @param summary Result of the run
     * @param filename Output filename, relative to the report directory
     * @return Path of the written file
     * @throws IOException if file writing fails
     */
    Path writeSyncReport(SyncSummary summary, String filename) throws IOException;
}
