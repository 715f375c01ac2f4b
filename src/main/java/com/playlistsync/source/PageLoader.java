package com.playlistsync.source;

/**
 * Fetches the rendered HTML of a page.
 */
@FunctionalInterface
public interface PageLoader {
    /**
     * @return page HTML
     * @throws SourceExtractionException if the page could not be loaded
     */
    String load(String url);
}
