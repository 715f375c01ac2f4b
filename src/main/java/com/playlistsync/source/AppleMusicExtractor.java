package com.playlistsync.source;

import com.playlistsync.sync.SourceTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Source extractor for public Apple Music playlist pages.
 * <p>
 * Validates the URL, loads the page through a {@link PageLoader} (Playwright by default) and hands the
 * HTML to {@link AppleMusicPageParser}. An empty result is reported as an error since a sync of zero
 * tracks is never what the user intended.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class AppleMusicExtractor implements SourceExtractorInterface {
    private static final Logger logger = LoggerFactory.getLogger(AppleMusicExtractor.class);

    static final String APPLE_MUSIC_HOST = "music.apple.com";
    static final String NO_TRACKS_MESSAGE = "No tracks found. The playlist may be empty or private.";

    private final PageLoader pageLoader;
    private final AppleMusicPageParser parser;

    public AppleMusicExtractor(boolean headless) {
        this(new PlaywrightPageLoader(headless), new AppleMusicPageParser());
    }

    public AppleMusicExtractor(PageLoader pageLoader, AppleMusicPageParser parser) {
        this.pageLoader = pageLoader;
        this.parser = parser == null ? new AppleMusicPageParser() : parser;
    }

    @Override
    public SourcePlaylist extract(String playlistUrl) {
        if (playlistUrl == null || !playlistUrl.contains(APPLE_MUSIC_HOST)) {
            throw new SourceExtractionException("Invalid Apple Music URL: " + playlistUrl);
        }
        logger.info("Scraping Apple Music playlist: {}", playlistUrl);
        String html = pageLoader.load(playlistUrl);
        String name = parser.extractPlaylistName(html);
        List<SourceTrack> tracks = parser.extractTracks(html);
        if (tracks.isEmpty()) {
            logger.warn("Could not extract tracks from {}. The page structure may have changed.", playlistUrl);
            throw new SourceExtractionException(NO_TRACKS_MESSAGE);
        }
        logger.info("Found {} tracks in Apple Music playlist '{}'", tracks.size(), name);
        return new SourcePlaylist(name, playlistUrl, tracks);
    }
}
