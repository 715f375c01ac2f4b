package com.playlistsync.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.playlistsync.sync.SourceTrack;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the playlist name and tracks from the HTML of a public Apple Music playlist page.
 * The markup is parsed with jsoup; attribute values and text come back entity-decoded.
 * <p>
 * Strategies, tried in order until one yields tracks:
 * <ol>
 *   <li>Serialized server data: JSON embedded in {@code <script>} tags, walked recursively for
 *       track-lockup items ({@code title} + {@code subtitleLinks[0].title}).</li>
 *   <li>JSON-LD {@code MusicPlaylist} structured data.</li>
 *   <li>{@code <meta property="music:song">} tags (title only).</li>
 * </ol>
 * The parser never throws on malformed markup or JSON; unreadable blobs are logged and skipped.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class AppleMusicPageParser {
    private static final Logger logger = LoggerFactory.getLogger(AppleMusicPageParser.class);

    private static final Pattern INTENT_BLOB = Pattern.compile("\\[\\{\"intent\".*?\\}\\](?=\\s*(<|$))", Pattern.DOTALL);
    private static final String LD_JSON_TYPE = "application/ld+json";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Runs the strategies in order and returns the first non-empty result.
     * @param html page HTML (may be null)
     * @return tracks in page order, possibly empty
     */
    public List<SourceTrack> extractTracks(String html) {
        if (html == null || html.isBlank()) return List.of();
        Document doc = Jsoup.parse(html);
        List<SourceTrack> tracks = extractFromSerializedData(doc);
        if (!tracks.isEmpty()) {
            logger.debug("Extracted {} tracks from serialized server data", tracks.size());
            return tracks;
        }
        tracks = extractFromJsonLd(doc);
        if (!tracks.isEmpty()) {
            logger.debug("Extracted {} tracks from JSON-LD", tracks.size());
            return tracks;
        }
        tracks = extractFromMetaTags(doc);
        if (!tracks.isEmpty()) {
            logger.debug("Extracted {} tracks from music:song meta tags", tracks.size());
        }
        return tracks;
    }

    /**
     * Playlist name from {@code og:title}, else from {@code <title>} with its last " - " suffix removed.
     * @return name, or empty string if the page has neither
     */
    public String extractPlaylistName(String html) {
        if (html == null || html.isBlank()) return "";
        Document doc = Jsoup.parse(html);
        String ogTitle = metaContents(doc, "og:title").stream().findFirst().orElse("");
        if (!ogTitle.isEmpty()) return ogTitle;
        String text = doc.title().trim();
        int sep = text.lastIndexOf(" - ");
        return sep > 0 ? text.substring(0, sep).trim() : text;
    }

    // --- Strategy 1: serialized server data ---

    List<SourceTrack> extractFromSerializedData(Document doc) {
        List<SourceTrack> tracks = new ArrayList<>();
        for (Element script : doc.select("script")) {
            String text = script.data();
            if (text == null || text.trim().length() < 10) continue;

            List<JsonNode> blobs = new ArrayList<>();
            Matcher intent = INTENT_BLOB.matcher(text);
            while (intent.find()) {
                JsonNode blob = readJson(intent.group());
                if (blob != null) blobs.add(blob);
            }
            if (blobs.isEmpty()) {
                String stripped = text.trim();
                if (stripped.startsWith("[") || stripped.startsWith("{")) {
                    JsonNode blob = readJson(stripped);
                    if (blob != null) blobs.add(blob);
                }
            }
            for (JsonNode blob : blobs) {
                walkForTracks(blob, tracks);
            }
        }
        return tracks;
    }

    private void walkForTracks(JsonNode node, List<SourceTrack> tracks) {
        if (node == null) return;
        if (node.isObject()) {
            String id = node.path("id").asText("");
            String title = node.hasNonNull("title") && node.get("title").isTextual() ? node.get("title").asText() : null;
            JsonNode subtitleLinks = node.get("subtitleLinks");

            if (id.contains("track-lockup") && title != null && !title.isEmpty() && isPresent(subtitleLinks)) {
                tracks.add(new SourceTrack(title, firstSubtitle(subtitleLinks)));
                return;
            }
            if ("trackLockup".equals(node.path("itemKind").asText()) && title != null && !title.isEmpty()) {
                tracks.add(new SourceTrack(title, firstSubtitle(subtitleLinks)));
                return;
            }
            Iterator<JsonNode> values = node.elements();
            while (values.hasNext()) {
                walkForTracks(values.next(), tracks);
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                walkForTracks(item, tracks);
            }
        }
    }

    private static boolean isPresent(JsonNode node) {
        if (node == null || node.isNull()) return false;
        if (node.isContainerNode()) return node.size() > 0;
        return !node.asText("").isEmpty();
    }

    private static String firstSubtitle(JsonNode subtitleLinks) {
        if (subtitleLinks != null && subtitleLinks.isArray() && subtitleLinks.size() > 0) {
            return subtitleLinks.get(0).path("title").asText("");
        }
        return "";
    }

    // --- Strategy 2: JSON-LD ---

    List<SourceTrack> extractFromJsonLd(Document doc) {
        List<SourceTrack> tracks = new ArrayList<>();
        for (Element script : doc.select("script")) {
            if (!LD_JSON_TYPE.equalsIgnoreCase(script.attr("type").trim())) continue;
            JsonNode data = readJson(script.data().trim());
            if (data == null || !data.isObject() || !"MusicPlaylist".equals(data.path("@type").asText())) continue;
            for (JsonNode item : data.path("track")) {
                String name = item.path("name").asText("");
                if (name.isEmpty()) continue;
                JsonNode by = item.path("byArtist");
                String artist = "";
                if (by.isObject()) {
                    artist = by.path("name").asText("");
                } else if (by.isArray() && by.size() > 0) {
                    artist = by.get(0).path("name").asText("");
                }
                tracks.add(new SourceTrack(name, artist));
            }
        }
        return tracks;
    }

    // --- Strategy 3: meta tags ---

    List<SourceTrack> extractFromMetaTags(Document doc) {
        List<SourceTrack> tracks = new ArrayList<>();
        for (String content : metaContents(doc, "music:song")) {
            tracks.add(new SourceTrack(content, ""));
        }
        return tracks;
    }

    // Non-empty, trimmed content of every <meta property=...> with the given property, in page order.
    private static List<String> metaContents(Document doc, String property) {
        List<String> contents = new ArrayList<>();
        for (Element meta : doc.select("meta[property]")) {
            if (!property.equalsIgnoreCase(meta.attr("property").trim())) continue;
            String content = meta.attr("content").trim();
            if (!content.isEmpty()) contents.add(content);
        }
        return contents;
    }

    private JsonNode readJson(String text) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            logger.debug("Skipping unparseable JSON blob ({} chars): {}", text.length(), e.getOriginalMessage());
            return null;
        }
    }
}
