package com.playlistsync.source;

import com.microsoft.playwright.PlaywrightException;
import com.playlistsync.sync.Utils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlaywrightPageLoaderTest {

    @Test
    void testHttpErrorIsNotRetried() {
        int[] calls = {0};
        SourceExtractionException e = assertThrows(SourceExtractionException.class, () ->
            Utils.retryPlaywrightAction(() -> {
                calls[0]++;
                throw new SourceExtractionException("Failed to fetch Apple Music page: HTTP 404 for x");
            }, 3, "loading x", d -> fail("should not back off"), PlaywrightPageLoader.RETRYABLE));

        assertEquals(1, calls[0]);
        assertTrue(e.getMessage().contains("HTTP 404"));
    }

    @Test
    void testBrowserFailuresAreRetried() {
        assertTrue(PlaywrightPageLoader.RETRYABLE.test(new PlaywrightException("Timeout 30000ms exceeded")));
        assertFalse(PlaywrightPageLoader.RETRYABLE.test(new SourceExtractionException("HTTP 500")));
    }
}
