package com.playlistsync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the Spotify Web API.
 * <p>
 * Workflow for every call:
 * <ul>
 *   <li>Obtains a bearer token from the {@link AuthServiceInterface} (refreshed transparently).</li>
 *   <li>Issues the request with the JDK {@link HttpClient} and parses the JSON body with Jackson.</li>
 *   <li>On HTTP 429 waits for the server-supplied {@code Retry-After} seconds (or the configured default)
 *       and re-issues the identical request. There is no backoff growth; the number of waits is capped only
 *       when {@link SyncSettings#maxRateLimitRetries()} is non-negative.</li>
 *   <li>On HTTP 401 invalidates the cached credentials and throws {@link CatalogAuthenticationException}.</li>
 *   <li>Any other non-2xx status or transport error throws {@link CatalogApiException}; nothing else is retried.</li>
 * </ul>
 * Calls are blocking and meant to be issued sequentially from one thread.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class SpotifyApiClient implements CatalogClientInterface {
    private static final Logger logger = LoggerFactory.getLogger(SpotifyApiClient.class);

    static final int PLAYLIST_PAGE_SIZE = 100;
    static final int USER_PLAYLIST_PAGE_SIZE = 50;
    /** Upper bound for a single server-requested wait. */
    static final Duration MAX_RETRY_AFTER = Duration.ofHours(1);
    // Spotify has served playlist entries under both "item" and "track"; ask for either.
    static final String PLAYLIST_ITEM_FIELDS = "items(item(id,name,uri,artists(name)),track(id,name,uri,artists(name))),next";

    private final AuthServiceInterface authService;
    private final SyncSettings settings;
    private final HttpClient http;
    private final Sleeper sleeper;
    private final ObjectMapper mapper = new ObjectMapper();

    public SpotifyApiClient(AuthServiceInterface authService, SyncSettings settings) {
        this(authService, settings, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Sleeper.SYSTEM);
    }

    public SpotifyApiClient(AuthServiceInterface authService, SyncSettings settings, HttpClient http, Sleeper sleeper) {
        if (authService == null) throw new IllegalArgumentException("authService cannot be null");
        this.authService = authService;
        this.settings = settings == null ? SyncSettings.defaults() : settings;
        this.http = http;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    // --- Playlist listing ---

    @Override
    public PlaylistItemsPage getPlaylistItems(String playlistId, String nextUrl) {
        String url;
        if (nextUrl != null && !nextUrl.isBlank()) {
            url = requireApiUrl(nextUrl);
        } else {
            url = settings.apiBase() + "/playlists/" + encode(playlistId) + "/items?limit=" + PLAYLIST_PAGE_SIZE
                + "&fields=" + encode(PLAYLIST_ITEM_FIELDS);
        }
        JsonNode root = send("GET", url, null);
        List<CatalogCandidate> items = new ArrayList<>();
        for (JsonNode entry : root.path("items")) {
            JsonNode track = entry.hasNonNull("item") ? entry.get("item") : entry.path("track");
            if (track.isMissingNode() || track.isNull()) {
                logger.debug("Playlist {} entry without track payload; ignoring", playlistId);
                continue;
            }
            items.add(toCandidate(track));
        }
        return new PlaylistItemsPage(items, textOrNull(root, "next"));
    }

    // --- Search ---

    @Override
    public List<CatalogCandidate> searchTracks(String query, int limit) {
        String url = settings.apiBase() + "/search?q=" + encode(query) + "&type=track&limit=" + limit;
        JsonNode root = send("GET", url, null);
        List<CatalogCandidate> results = new ArrayList<>();
        for (JsonNode track : root.path("tracks").path("items")) {
            if (track == null || track.isNull()) continue;
            results.add(toCandidate(track));
        }
        return results;
    }

    // --- Playlist mutation ---

    @Override
    public void addItems(String playlistId, List<String> uris) {
        if (uris == null || uris.isEmpty()) return;
        if (uris.size() > SyncSettings.MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("At most " + SyncSettings.MAX_BATCH_SIZE + " URIs per call, got " + uris.size());
        }
        ObjectNode body = mapper.createObjectNode();
        ArrayNode array = body.putArray("uris");
        uris.forEach(array::add);
        send("POST", settings.apiBase() + "/playlists/" + encode(playlistId) + "/items", body.toString());
        logger.debug("Appended {} tracks to playlist {}", uris.size(), playlistId);
    }

    @Override
    public CatalogPlaylist createPlaylist(String name) {
        ObjectNode body = mapper.createObjectNode();
        body.put("name", name);
        body.put("public", false);
        JsonNode created = send("POST", settings.apiBase() + "/me/playlists", body.toString());
        logger.info("Created playlist '{}' ({})", created.path("name").asText(name), created.path("id").asText());
        return new CatalogPlaylist(created.path("id").asText(), created.path("name").asText(name), 0);
    }

    // --- User ---

    @Override
    public CatalogUser getCurrentUser() {
        JsonNode me = send("GET", settings.apiBase() + "/me", null);
        String id = me.path("id").asText();
        String displayName = textOrNull(me, "display_name");
        return new CatalogUser(id, displayName == null || displayName.isBlank() ? id : displayName);
    }

    @Override
    public List<CatalogPlaylist> getUserPlaylists() {
        List<CatalogPlaylist> playlists = new ArrayList<>();
        String url = settings.apiBase() + "/me/playlists?limit=" + USER_PLAYLIST_PAGE_SIZE;
        while (url != null) {
            JsonNode root = send("GET", url, null);
            for (JsonNode p : root.path("items")) {
                if (p == null || p.isNull()) continue;
                JsonNode counts = p.hasNonNull("tracks") ? p.get("tracks") : p.path("items");
                playlists.add(new CatalogPlaylist(p.path("id").asText(), p.path("name").asText(), counts.path("total").asInt(0)));
            }
            String next = textOrNull(root, "next");
            url = next == null ? null : requireApiUrl(next);
        }
        return playlists;
    }

    // --- Transport ---

    /**
     * Sends a request, waiting out 429 responses, and returns the parsed JSON body.
     */
    private JsonNode send(String method, String url, String jsonBody) {
        String path = describe(url);
        int rateLimitWaits = 0;
        while (true) {
            HttpResponse<String> response;
            try {
                response = http.send(buildRequest(method, url, jsonBody), HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                throw new CatalogApiException(CatalogApiException.NO_STATUS, path,
                    "Spotify API request failed: " + method + " " + path + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CatalogApiException(CatalogApiException.NO_STATUS, path, "Interrupted during " + method + " " + path, e);
            }

            int status = response.statusCode();
            if (status == 429) {
                if (!settings.hasUnboundedRetries() && rateLimitWaits >= settings.maxRateLimitRetries()) {
                    throw new RateLimitExceededException(path, rateLimitWaits);
                }
                Duration wait = retryAfter(response);
                logger.warn("Rate limited on {} {}; retrying in {} ms", method, path, wait.toMillis());
                pause(wait, path);
                rateLimitWaits++;
                continue;
            }
            if (status == 401) {
                logger.error("Spotify API 401 on {} {}; clearing stored credentials", method, path);
                authService.invalidate();
                throw new CatalogAuthenticationException(path, "Spotify API error 401: " + path);
            }
            if (status < 200 || status >= 300) {
                logger.error("Spotify API {} on {} {}: {}", status, method, path, abbreviate(response.body()));
                throw new CatalogApiException(status, path, "Spotify API error " + status + ": " + path);
            }
            return parse(response.body(), status, path);
        }
    }

    private HttpRequest buildRequest(String method, String url, String jsonBody) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(Duration.ofSeconds(30))
            .header("Authorization", "Bearer " + authService.getAccessToken());
        if (jsonBody != null) {
            builder.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private Duration retryAfter(HttpResponse<String> response) {
        String header = response.headers().firstValue("Retry-After").orElse(null);
        if (header != null) {
            try {
                long seconds = Long.parseLong(header.trim());
                if (seconds >= 0) return Duration.ofSeconds(Math.min(seconds, MAX_RETRY_AFTER.getSeconds()));
            } catch (NumberFormatException e) {
                logger.debug("Unparseable Retry-After '{}'; using default", header);
            }
        }
        return settings.defaultRetryAfter();
    }

    private void pause(Duration wait, String path) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogApiException(CatalogApiException.NO_STATUS, path, "Interrupted while waiting out rate limit on " + path, e);
        }
    }

    private JsonNode parse(String body, int status, String path) {
        if (body == null || body.isBlank()) return mapper.createObjectNode();
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CatalogApiException(status, path, "Malformed JSON from Spotify API: " + path, e);
        }
    }

    // Bearer tokens must never be sent to a host outside the configured API base.
    private String requireApiUrl(String url) {
        if (!url.startsWith(settings.apiBase() + "/")) {
            throw new CatalogApiException(CatalogApiException.NO_STATUS, url, "Refusing to follow pagination link outside API base: " + url);
        }
        return url;
    }

    private String describe(String url) {
        String path = url.startsWith(settings.apiBase()) ? url.substring(settings.apiBase().length()) : url;
        int q = path.indexOf('?');
        return q >= 0 ? path.substring(0, q) : path;
    }

    private static CatalogCandidate toCandidate(JsonNode track) {
        JsonNode artists = track.path("artists");
        String artist = artists.isArray() && artists.size() > 0 ? artists.get(0).path("name").asText("") : "";
        return new CatalogCandidate(textOrNull(track, "id"), track.path("name").asText(""), artist, textOrNull(track, "uri"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String encode(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
