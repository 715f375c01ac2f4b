package com.playlistsync.sync;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DestinationIndexBuilderTest {

    @Test
    void testBuildsIndexAcrossPages() {
        CatalogClientInterface client = mock(CatalogClientInterface.class);
        when(client.getPlaylistItems("dest", null)).thenReturn(new PlaylistItemsPage(List.of(
            new CatalogCandidate("a", "Song (feat. X)", "Artist", "spotify:track:a"),
            new CatalogCandidate(null, "Local File", "Me", "spotify:local:x")), "cursor-2"));
        when(client.getPlaylistItems("dest", "cursor-2")).thenReturn(new PlaylistItemsPage(List.of(
            new CatalogCandidate("b", "Other", "Band", "spotify:track:b")), null));

        DestinationIndex index = new DestinationIndexBuilder(client).buildIndex("dest");

        assertEquals(2, index.idCount());
        assertTrue(index.containsId("a"));
        assertTrue(index.containsId("b"));
        assertTrue(index.containsKey("song|||artist"));
        assertFalse(index.containsKey(TrackNormalizer.key("Local File", "Me")));
        verify(client, times(2)).getPlaylistItems(eq("dest"), any());
    }

    @Test
    void testEmptyPlaylist() {
        CatalogClientInterface client = mock(CatalogClientInterface.class);
        when(client.getPlaylistItems("dest", null)).thenReturn(new PlaylistItemsPage(List.of(), null));

        DestinationIndex index = new DestinationIndexBuilder(client).buildIndex("dest");

        assertEquals(0, index.idCount());
        assertEquals(0, index.keyCount());
    }

    @Test
    void testPageFailurePropagates() {
        CatalogClientInterface client = mock(CatalogClientInterface.class);
        when(client.getPlaylistItems("dest", null)).thenReturn(new PlaylistItemsPage(List.of(), "cursor-2"));
        when(client.getPlaylistItems("dest", "cursor-2")).thenThrow(new CatalogApiException(404, "/playlists/dest/items", "gone"));

        assertThrows(CatalogApiException.class, () -> new DestinationIndexBuilder(client).buildIndex("dest"));
    }
}
