package com.playlistsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Resolves a source track to a destination catalog candidate using a two-tier search.
 * <p>
 * Tier 1 issues a field-scoped query ({@code track:<title> artist:<artist>}) for up to
 * {@value #STRUCTURED_LIMIT} candidates and returns the first one whose normalized title and artist
 * each contain, or are contained in, the source's; if none qualifies the top result is used. Tier 2,
 * a free-text query for up to {@value #FALLBACK_LIMIT} candidates, runs only when tier 1 returned
 * nothing. Remote relevance order is never re-ranked.
 * <p>
 * A failed search degrades the track to "not found" instead of failing the run. Authentication
 * failures are the exception: they are rethrown because every following call would fail too.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class TrackMatcher {
    private static final Logger logger = LoggerFactory.getLogger(TrackMatcher.class);

    static final int STRUCTURED_LIMIT = 5;
    static final int FALLBACK_LIMIT = 3;

    private final CatalogClientInterface catalogClient;

    public TrackMatcher(CatalogClientInterface catalogClient) {
        this.catalogClient = catalogClient;
    }

    /**
     * @param title source title
     * @param artist source artist
     * @return best candidate, or null if nothing was found or the search failed
     * @throws CatalogAuthenticationException if the catalog rejected our credentials
     */
    public CatalogCandidate match(String title, String artist) {
        try {
            List<CatalogCandidate> structured = catalogClient.searchTracks("track:" + title + " artist:" + artist, STRUCTURED_LIMIT);
            if (!structured.isEmpty()) {
                return pickBest(title, artist, structured);
            }
            List<CatalogCandidate> fallback = catalogClient.searchTracks(title + " " + artist, FALLBACK_LIMIT);
            if (!fallback.isEmpty()) {
                logger.debug("'{}' by '{}' only found by free-text search", title, artist);
                return fallback.get(0);
            }
            return null;
        } catch (CatalogAuthenticationException e) {
            throw e;
        } catch (CatalogApiException e) {
            logger.warn("Search failed for \"{}\" - \"{}\": {}", title, artist, e.getMessage());
            return null;
        }
    }

    private CatalogCandidate pickBest(String title, String artist, List<CatalogCandidate> candidates) {
        String normTitle = TrackNormalizer.normalize(title);
        String normArtist = TrackNormalizer.normalize(artist);
        for (CatalogCandidate candidate : candidates) {
            if (TrackNormalizer.looselyEquals(normTitle, TrackNormalizer.normalize(candidate.name()))
                && TrackNormalizer.looselyEquals(normArtist, TrackNormalizer.normalize(candidate.artist()))) {
                return candidate;
            }
        }
        // No strong match: fall back to the catalog's own top result.
        CatalogCandidate top = candidates.get(0);
        logger.debug("No close match for '{}' by '{}'; using top result '{}' by '{}'", title, artist, top.name(), top.artist());
        return top;
    }
}
