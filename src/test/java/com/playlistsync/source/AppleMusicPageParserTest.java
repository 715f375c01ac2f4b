package com.playlistsync.source;

import com.playlistsync.sync.SourceTrack;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppleMusicPageParserTest {
    private final AppleMusicPageParser parser = new AppleMusicPageParser();

    static String page(String name) throws IOException {
        try (InputStream in = AppleMusicPageParserTest.class.getResourceAsStream("/pages/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testSerializedServerData() throws IOException {
        List<SourceTrack> tracks = parser.extractTracks(page("serialized-data.html"));

        assertEquals(List.of(
            new SourceTrack("Song One", "Artist One"),
            new SourceTrack("Don’t Stop", "Artist Two"),
            new SourceTrack("Song Three", "")), tracks);
    }

    @Test
    void testJsonLdFallback() throws IOException {
        String html = page("json-ld.html");
        assertTrue(parser.extractFromSerializedData(Jsoup.parse(html)).isEmpty());

        List<SourceTrack> tracks = parser.extractTracks(html);

        assertEquals(List.of(
            new SourceTrack("Calm", "Ambient Co"),
            new SourceTrack("Drift", "Wave"),
            new SourceTrack("Untitled Artist", "")), tracks);
    }

    @Test
    void testMetaTagFallback() throws IOException {
        List<SourceTrack> tracks = parser.extractTracks(page("meta-only.html"));

        assertEquals(2, tracks.size());
        assertEquals("https://music.apple.com/us/song/first/111", tracks.get(0).title());
        assertEquals("", tracks.get(0).artist());
    }

    @Test
    void testNoTracks() throws IOException {
        assertTrue(parser.extractTracks(page("empty.html")).isEmpty());
        assertTrue(parser.extractTracks(null).isEmpty());
        assertTrue(parser.extractTracks("").isEmpty());
    }

    @Test
    void testPlaylistName() throws IOException {
        assertEquals("Road Trip & Friends", parser.extractPlaylistName(page("serialized-data.html")));
        assertEquals("Chill Evening - Playlist", parser.extractPlaylistName(page("json-ld.html")));
        assertEquals("Apple Music", parser.extractPlaylistName(page("empty.html")));
        assertEquals("", parser.extractPlaylistName(page("meta-only.html")));
    }

    @Test
    void testMetaAttributesAreDecodedInAnyOrder() throws IOException {
        String html = page("meta-attributes.html");

        assertEquals("Don't Stop Me Now \u2019n\u2019 More & Friends", parser.extractPlaylistName(html));
        assertEquals(List.of(
            new SourceTrack("Don't Stop Me Now", ""),
            new SourceTrack("Rock \u2019n\u2019 Roll", ""),
            new SourceTrack("Tom & Jerry \"Live\"", "")), parser.extractTracks(html));
    }

    @Test
    void testTitleTagFallbackDecodesEntities() {
        String html = "<html><head><title>Summer &#8217;24 &amp; Beyond - Apple Music</title></head></html>";

        assertEquals("Summer \u201924 & Beyond", parser.extractPlaylistName(html));
    }

    @Test
    void testReversedOgTitleWinsOverTitleTag() {
        String html = "<html><head><title>Other - Apple Music</title>"
            + "<meta content=\"Road Trip\" property=\"og:title\"></head></html>";

        assertEquals("Road Trip", parser.extractPlaylistName(html));
    }
}
