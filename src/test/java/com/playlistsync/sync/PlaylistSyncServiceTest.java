package com.playlistsync.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlaylistSyncServiceTest {
    private static final String DEST = "dest";

    private CatalogClientInterface client;
    private final List<Duration> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        client = mock(CatalogClientInterface.class);
        when(client.getPlaylistItems(DEST, null)).thenReturn(new PlaylistItemsPage(List.of(), null));
    }

    private PlaylistSyncService service(SyncSettings settings) {
        return new PlaylistSyncService(client, new DestinationIndexBuilder(client), new TrackMatcher(client), settings, sleeps::add);
    }

    private PlaylistSyncService service() {
        return service(SyncSettings.defaults());
    }

    private void destinationContains(CatalogCandidate... tracks) {
        when(client.getPlaylistItems(DEST, null)).thenReturn(new PlaylistItemsPage(List.of(tracks), null));
    }

    private void searchReturns(String title, String artist, CatalogCandidate... results) {
        when(client.searchTracks("track:" + title + " artist:" + artist, TrackMatcher.STRUCTURED_LIMIT)).thenReturn(List.of(results));
    }

    private static CatalogCandidate candidate(String id, String name, String artist) {
        return new CatalogCandidate(id, name, artist, "spotify:track:" + id);
    }

    private static List<TrackStatus> statuses(SyncSummary summary) {
        List<TrackStatus> result = new ArrayList<>();
        summary.outcomes().forEach(o -> result.add(o.status()));
        return result;
    }

    @Test
    void testClassifiesFoundSkippedAndNotFound() {
        destinationContains(candidate("c2", "Song B", "Artist B"));
        searchReturns("Song A", "Artist A", candidate("c1", "Song A", "Artist A"));
        searchReturns("Song B", "Artist B", candidate("c2", "Song B", "Artist B"));
        List<SourceTrack> source = List.of(
            new SourceTrack("Song A", "Artist A"),
            new SourceTrack("Song B", "Artist B"),
            new SourceTrack("Song C", "Artist C"));

        SyncSummary summary = service().sync(source, DEST, SyncProgressListener.NONE);

        assertEquals(List.of(TrackStatus.FOUND, TrackStatus.SKIPPED, TrackStatus.NOT_FOUND), statuses(summary));
        assertEquals(3, summary.total());
        assertEquals(1, summary.added());
        assertEquals(1, summary.skipped());
        assertEquals(1, summary.notFound());
        assertTrue(summary.committed());
        assertFalse(summary.cancelled());
        assertEquals(summary.total(), summary.added() + summary.skipped() + summary.notFound());
        verify(client).addItems(DEST, List.of("spotify:track:c1"));
        verify(client).searchTracks("Song C Artist C", TrackMatcher.FALLBACK_LIMIT);
    }

    @Test
    void testWithinRunDuplicateIsAddedOnce() {
        searchReturns("Song A", "Artist A", candidate("c1", "Song A", "Artist A"));
        searchReturns("Song A (Remastered)", "Artist A", candidate("c1", "Song A", "Artist A"));
        List<SourceTrack> source = List.of(
            new SourceTrack("Song A", "Artist A"),
            new SourceTrack("Song A (Remastered)", "Artist A"));

        SyncSummary summary = service().sync(source, DEST, SyncProgressListener.NONE);

        assertEquals(List.of(TrackStatus.FOUND, TrackStatus.SKIPPED), statuses(summary));
        verify(client, times(1)).addItems(DEST, List.of("spotify:track:c1"));
    }

    @Test
    void testNormalizedKeyDetectsExistingTrackUnderOtherId() {
        destinationContains(candidate("d1", "Song (feat. X)", "Artist"));
        searchReturns("song", "ARTIST", candidate("c9", "song", "ARTIST"));

        SyncSummary summary = service().sync(List.of(new SourceTrack("song", "ARTIST")), DEST, SyncProgressListener.NONE);

        assertEquals(List.of(TrackStatus.SKIPPED), statuses(summary));
        assertEquals("c9", summary.outcomes().get(0).matchedCandidate().id());
        verify(client, never()).addItems(anyString(), anyList());
    }

    @Test
    void testCommitsInBatchesOfOneHundred() {
        when(client.searchTracks(anyString(), eq(TrackMatcher.STRUCTURED_LIMIT))).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            String title = query.substring("track:".length(), query.indexOf(" artist:"));
            return List.of(candidate("id-" + title, title, "Band"));
        });
        List<SourceTrack> source = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            source.add(new SourceTrack("T" + i, "Band"));
        }

        SyncSummary summary = service().sync(source, DEST, SyncProgressListener.NONE);

        assertEquals(150, summary.added());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> batches = ArgumentCaptor.forClass(List.class);
        verify(client, times(2)).addItems(eq(DEST), batches.capture());
        assertEquals(100, batches.getAllValues().get(0).size());
        assertEquals(50, batches.getAllValues().get(1).size());
        assertEquals("spotify:track:id-T0", batches.getAllValues().get(0).get(0));
        assertEquals("spotify:track:id-T149", batches.getAllValues().get(1).get(49));
    }

    @Test
    void testConfiguredBatchSize() {
        when(client.searchTracks(anyString(), eq(TrackMatcher.STRUCTURED_LIMIT))).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            String title = query.substring("track:".length(), query.indexOf(" artist:"));
            return List.of(candidate("id-" + title, title, "Band"));
        });
        List<SourceTrack> source = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            source.add(new SourceTrack("T" + i, "Band"));
        }

        service(SyncSettings.defaults().withBatchSize(2)).sync(source, DEST, SyncProgressListener.NONE);

        verify(client, times(3)).addItems(eq(DEST), anyList());
    }

    @Test
    void testPacesAfterEveryTrack() {
        searchReturns("Song A", "Artist A", candidate("c1", "Song A", "Artist A"));
        List<SourceTrack> source = List.of(
            new SourceTrack("Song A", "Artist A"),
            new SourceTrack("Nope", "Nobody"),
            new SourceTrack("Nope 2", "Nobody"));

        service().sync(source, DEST, SyncProgressListener.NONE);

        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(100), Duration.ofMillis(100)), sleeps);
    }

    @Test
    void testProgressIsReportedAfterEveryTransitionInOrder() {
        searchReturns("Song A", "Artist A", candidate("c1", "Song A", "Artist A"));
        List<String> events = new ArrayList<>();
        List<List<SyncOutcome>> snapshots = new ArrayList<>();
        SyncProgressListener listener = (outcomes, i) -> {
            events.add(i + ":" + outcomes.get(i).status().label());
            snapshots.add(outcomes);
        };

        service().sync(List.of(new SourceTrack("Song A", "Artist A"), new SourceTrack("Song B", "Artist B")), DEST, listener);

        assertEquals(List.of("0:searching", "0:found", "1:searching", "1:not_found"), events);
        assertEquals(TrackStatus.PENDING, snapshots.get(0).get(1).status());
        assertEquals(TrackStatus.SEARCHING, snapshots.get(0).get(0).status());
        assertThrows(UnsupportedOperationException.class, () -> snapshots.get(0).add(snapshots.get(0).get(0)));
    }

    @Test
    void testCancellationBetweenTracksStopsFurtherCalls() {
        searchReturns("Song A", "Artist A", candidate("c1", "Song A", "Artist A"));
        searchReturns("Song B", "Artist B", candidate("c2", "Song B", "Artist B"));
        CancellationSignal cancellation = new CancellationSignal();
        SyncProgressListener cancelAfterFirst = (outcomes, i) -> {
            if (i == 0 && outcomes.get(0).status().isTerminal()) cancellation.cancel();
        };

        SyncSummary summary = service().sync(List.of(new SourceTrack("Song A", "Artist A"), new SourceTrack("Song B", "Artist B")),
            DEST, cancelAfterFirst, cancellation);

        assertTrue(summary.cancelled());
        assertFalse(summary.committed());
        assertEquals(List.of(TrackStatus.FOUND, TrackStatus.PENDING), statuses(summary));
        assertEquals(1, summary.unresolved());
        verify(client, never()).searchTracks(eq("track:Song B artist:Artist B"), anyInt());
        verify(client, never()).addItems(anyString(), anyList());
    }

    @Test
    void testCancellationBeforeCommitAddsNothing() {
        searchReturns("Song A", "Artist A", candidate("c1", "Song A", "Artist A"));
        CancellationSignal cancellation = new CancellationSignal();
        SyncProgressListener cancelOnLast = (outcomes, i) -> {
            if (outcomes.get(i).status().isTerminal()) cancellation.cancel();
        };

        SyncSummary summary = service().sync(List.of(new SourceTrack("Song A", "Artist A")), DEST, cancelOnLast, cancellation);

        assertTrue(summary.cancelled());
        assertFalse(summary.committed());
        assertEquals(1, summary.added());
        verify(client, never()).addItems(anyString(), anyList());
    }

    @Test
    void testCommitFailureReportsUncommittedSummary() {
        searchReturns("Song A", "Artist A", candidate("c1", "Song A", "Artist A"));
        doThrow(new CatalogApiException(500, "/playlists/dest/items", "boom")).when(client).addItems(eq(DEST), anyList());

        SyncCommitException e = assertThrows(SyncCommitException.class,
            () -> service().sync(List.of(new SourceTrack("Song A", "Artist A")), DEST, SyncProgressListener.NONE));

        assertFalse(e.getSummary().committed());
        assertEquals(1, e.getSummary().added());
        assertEquals(0, e.getBatchesCommitted());
        assertTrue(e.getCause() instanceof CatalogApiException);
    }

    @Test
    void testUnreadableDestinationAbortsBeforeMatching() {
        when(client.getPlaylistItems(DEST, null)).thenThrow(new CatalogApiException(404, "/playlists/dest/items", "not found"));

        assertThrows(SyncException.class,
            () -> service().sync(List.of(new SourceTrack("Song A", "Artist A")), DEST, SyncProgressListener.NONE));
        verify(client, never()).searchTracks(anyString(), anyInt());
    }

    @Test
    void testRejectedCredentialsAbortTheRun() {
        when(client.searchTracks(anyString(), anyInt())).thenThrow(new CatalogAuthenticationException("/search", "expired"));

        SyncException e = assertThrows(SyncException.class,
            () -> service().sync(List.of(new SourceTrack("Song A", "Artist A")), DEST, SyncProgressListener.NONE));
        assertTrue(e.getCause() instanceof CatalogAuthenticationException);
        verify(client, never()).addItems(anyString(), anyList());
    }

    @Test
    void testEmptySourceCommitsNothing() {
        SyncSummary summary = service().sync(List.of(), DEST, SyncProgressListener.NONE);

        assertEquals(0, summary.total());
        assertTrue(summary.committed());
        verify(client, never()).addItems(any(), any());
    }

    @Test
    void testRejectsInvalidArguments() {
        PlaylistSyncService service = service();
        assertThrows(IllegalArgumentException.class, () -> service.sync(null, DEST, SyncProgressListener.NONE));
        assertThrows(IllegalArgumentException.class, () -> service.sync(List.of(), " ", SyncProgressListener.NONE));
    }
}
