package com.playlistsync.sync;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteSyncReport() throws Exception {
        CatalogCandidate match = new CatalogCandidate("id1", "Song One", "Artist One", "spotify:track:id1");
        SyncSummary summary = SyncSummary.of(List.of(
            new SyncOutcome(new SourceTrack("Song One", "Artist One"), TrackStatus.FOUND, match),
            new SyncOutcome(new SourceTrack("Missing, Song", "Nobody"), TrackStatus.NOT_FOUND, null)), true, false);

        Path reportDir = tempDir.resolve("reports");
        Path written = new SyncReportWriter(reportDir).writeSyncReport(summary, "Road Trip: 2024.csv");

        assertEquals(reportDir.resolve("Road_Trip__2024.csv"), written);
        try (Reader in = Files.newBufferedReader(written, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            List<String[]> rows = reader.readAll();
            assertEquals(3, rows.size());
            assertArrayEquals(SyncReportWriter.CSV_FIELDS.toArray(new String[0]), rows.get(0));
            assertArrayEquals(new String[]{"1", "Song One", "Artist One", "found", "Song One", "Artist One", "id1", "spotify:track:id1"}, rows.get(1));
            assertArrayEquals(new String[]{"2", "Missing, Song", "Nobody", "not_found", "", "", "", ""}, rows.get(2));
        }
    }

    @Test
    void testRejectsInvalidArguments() {
        SyncReportWriter writer = new SyncReportWriter(tempDir);
        assertThrows(IllegalArgumentException.class, () -> writer.writeSyncReport(null, "x.csv"));
        assertThrows(IllegalArgumentException.class, () -> writer.writeSyncReport(SyncSummary.of(List.of(), true, false), " "));
    }
}
