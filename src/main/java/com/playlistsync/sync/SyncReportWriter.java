package com.playlistsync.sync;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for exporting sync outcomes to CSV files using OpenCSV.
 * <p>
 * Each row holds the 1-based source position, the source title and artist, the final status label
 * and, for found or skipped tracks, the matched catalog track. Files are written into the report
 * directory, which is created if missing.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class SyncReportWriter implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(SyncReportWriter.class);

    static final List<String> CSV_FIELDS = List.of(
        "Position", "SourceTitle", "SourceArtist", "Status", "MatchedTitle", "MatchedArtist", "MatchedId", "MatchedUri");

    private final Path reportDir;

    public SyncReportWriter(Path reportDir) {
        if (reportDir == null) throw new IllegalArgumentException("reportDir cannot be null");
        this.reportDir = reportDir;
    }

    @Override
    public Path writeSyncReport(SyncSummary summary, String filename) throws IOException {
        if (summary == null) {
            logger.warn("Attempted to write null sync summary to CSV: {}", filename);
            throw new IllegalArgumentException("Summary cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(reportDir);
        Path target = reportDir.resolve(Utils.sanitizeFilename(filename));
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_FIELDS.toArray(String[]::new));
            List<SyncOutcome> outcomes = summary.outcomes();
            for (int i = 0; i < outcomes.size(); i++) {
                SyncOutcome outcome = outcomes.get(i);
                CatalogCandidate match = outcome.matchedCandidate();
                writer.writeNext(new String[]{
                    Integer.toString(i + 1),
                    safe(outcome.sourceTrack().title()),
                    safe(outcome.sourceTrack().artist()),
                    outcome.status().label(),
                    match == null ? "" : safe(match.name()),
                    match == null ? "" : safe(match.artist()),
                    match == null ? "" : safe(match.id()),
                    match == null ? "" : safe(match.uri())
                });
            }
        }
        logger.info("Wrote {} sync outcomes to CSV file: {}", summary.outcomes().size(), target);
        return target;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
