package com.playlistsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Credential provider for the Spotify Web API using the Authorization Code flow with PKCE.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #authorize()} creates a code verifier and S256 challenge, sends the user to the authorize
 *       page through an {@link AuthorizationCodeReceiver}, and exchanges the returned code for tokens.</li>
 *   <li>Tokens are kept in memory and persisted as JSON to {@code <dataDir>/spotify-token.json} so later
 *       runs do not need a new sign-in.</li>
 *   <li>{@link #getAccessToken()} refreshes the token when it expires within {@link #REFRESH_MARGIN}.
 *       A failed refresh clears the stored state and is terminal.</li>
 *   <li>{@link #invalidate()} deletes the stored state; the API client calls it after a 401.</li>
 * </ul>
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class SpotifyAuthService implements AuthServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(SpotifyAuthService.class);

    static final String SCOPES = "playlist-read-private playlist-modify-public playlist-modify-private";
    static final String TOKEN_FILE = "spotify-token.json";
    static final Duration REFRESH_MARGIN = Duration.ofSeconds(60);
    private static final String VERIFIER_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int VERIFIER_LENGTH = 128;
    private static final SecureRandom RANDOM = new SecureRandom();

    /** Persisted token state; {@code expiresAt} is epoch milliseconds. */
    record StoredToken(String accessToken, String refreshToken, long expiresAt) {}

    private final SyncSettings settings;
    private final HttpClient http;
    private final AuthorizationCodeReceiver codeReceiver;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Path tokenFile;
    private StoredToken token;

    public SpotifyAuthService(SyncSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
            new BrowserAuthorizationCodeReceiver(), Clock.systemUTC());
    }

    public SpotifyAuthService(SyncSettings settings, HttpClient http, AuthorizationCodeReceiver codeReceiver, Clock clock) {
        this.settings = settings == null ? SyncSettings.defaults() : settings;
        this.http = http;
        this.codeReceiver = codeReceiver;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.tokenFile = this.settings.dataDir().resolve(TOKEN_FILE);
        this.token = loadToken();
    }

    // --- PKCE helpers ---

    /**
     * @return random verifier of {@value #VERIFIER_LENGTH} alphanumeric characters
     */
    public static String generateCodeVerifier() {
        StringBuilder sb = new StringBuilder(VERIFIER_LENGTH);
        for (int i = 0; i < VERIFIER_LENGTH; i++) {
            sb.append(VERIFIER_CHARS.charAt(RANDOM.nextInt(VERIFIER_CHARS.length())));
        }
        return sb.toString();
    }

    /**
     * @return base64url(SHA-256(verifier)) without padding
     */
    public static String codeChallenge(String verifier) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(verifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Builds the authorize page URL for the given challenge.
     */
    public String buildAuthorizeUrl(String challenge) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", requireClientId());
        params.put("response_type", "code");
        params.put("redirect_uri", settings.redirectUri());
        params.put("scope", SCOPES);
        params.put("code_challenge_method", "S256");
        params.put("code_challenge", challenge);
        return settings.accountsBase() + "/authorize?" + formEncode(params);
    }

    // --- AuthServiceInterface ---

    @Override
    public synchronized void authorize() {
        String verifier = generateCodeVerifier();
        String authorizeUrl = buildAuthorizeUrl(codeChallenge(verifier));
        logger.info("Opening Spotify sign-in...");
        String redirected = codeReceiver.awaitRedirect(authorizeUrl, settings.redirectUri());
        Map<String, String> query = parseQuery(redirected);
        if (query.containsKey("error")) {
            throw new CatalogAuthenticationException("/authorize", "Spotify sign-in was not completed: " + query.get("error"));
        }
        String code = query.get("code");
        if (code == null || code.isBlank()) {
            throw new CatalogAuthenticationException("/authorize", "No authorization code in redirect URL");
        }
        exchangeCode(code, verifier);
    }

    /**
     * Exchanges an authorization code for tokens and stores them.
     */
    public synchronized void exchangeCode(String code, String verifier) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", requireClientId());
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", settings.redirectUri());
        form.put("code_verifier", verifier);
        JsonNode data = postTokenRequest(form, "Token exchange failed");
        storeToken(data, null);
        logger.info("Signed in to Spotify; token stored at {}", tokenFile);
    }

    @Override
    public synchronized String getAccessToken() {
        if (token == null) {
            throw new CatalogAuthenticationException("/api/token", "Not signed in to Spotify. Run the 'login' command first.");
        }
        if (clock.millis() > token.expiresAt() - REFRESH_MARGIN.toMillis()) {
            refreshAccessToken();
        }
        return token.accessToken();
    }

    @Override
    public synchronized void invalidate() {
        token = null;
        try {
            Files.deleteIfExists(tokenFile);
            logger.info("Cleared stored Spotify credentials");
        } catch (IOException e) {
            logger.warn("Failed to delete token file {}: {}", tokenFile, e.getMessage());
        }
    }

    @Override
    public synchronized boolean isAuthenticated() {
        return token != null && token.accessToken() != null && !token.accessToken().isBlank();
    }

    // --- Token lifecycle ---

    private void refreshAccessToken() {
        String refreshToken = token.refreshToken();
        if (refreshToken == null || refreshToken.isBlank()) {
            invalidate();
            throw new CatalogAuthenticationException("/api/token", "Access token expired and no refresh token is stored");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.put("client_id", requireClientId());
        JsonNode data;
        try {
            data = postTokenRequest(form, "Token refresh failed");
        } catch (CatalogAuthenticationException e) {
            invalidate();
            throw e;
        }
        storeToken(data, refreshToken);
        logger.debug("Refreshed Spotify access token");
    }

    /**
     * @throws CatalogAuthenticationException if the token endpoint rejects the request
     * @throws CatalogApiException if the endpoint could not be reached
     */
    private JsonNode postTokenRequest(Map<String, String> form, String failureMessage) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(settings.accountsBase() + "/api/token"))
            .timeout(Duration.ofSeconds(30))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
            .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            // transport failure: the stored refresh token is still good, so this is not an auth error
            throw new CatalogApiException(CatalogApiException.NO_STATUS, "/api/token", failureMessage + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogApiException(CatalogApiException.NO_STATUS, "/api/token", failureMessage + ": interrupted", e);
        }
        JsonNode body;
        try {
            body = response.body() == null || response.body().isBlank() ? mapper.createObjectNode() : mapper.readTree(response.body());
        } catch (IOException e) {
            logger.debug("Token endpoint returned non-JSON body: {}", e.getMessage());
            body = mapper.createObjectNode();
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            String description = body.path("error_description").asText(body.path("error").asText(""));
            logger.error("{} ({}): {}", failureMessage, response.statusCode(), description);
            throw new CatalogAuthenticationException("/api/token", description.isBlank() ? failureMessage : failureMessage + ": " + description);
        }
        if (!body.hasNonNull("access_token")) {
            throw new CatalogAuthenticationException("/api/token", failureMessage + ": response has no access_token");
        }
        return body;
    }

    private void storeToken(JsonNode data, String previousRefreshToken) {
        String refresh = data.hasNonNull("refresh_token") ? data.get("refresh_token").asText() : previousRefreshToken;
        long expiresAt = clock.millis() + data.path("expires_in").asLong(3600) * 1000L;
        token = new StoredToken(data.get("access_token").asText(), refresh, expiresAt);
        saveToken();
    }

    private void saveToken() {
        try {
            Files.createDirectories(tokenFile.getParent());
            ObjectNode node = mapper.createObjectNode();
            node.put("access_token", token.accessToken());
            node.put("refresh_token", token.refreshToken());
            node.put("expires_at", token.expiresAt());
            Files.writeString(tokenFile, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node));
        } catch (IOException e) {
            logger.warn("Failed to persist token to {}: {}. Sign-in will be needed next run.", tokenFile, e.getMessage());
        }
    }

    private StoredToken loadToken() {
        if (!Files.exists(tokenFile)) return null;
        try {
            JsonNode node = mapper.readTree(tokenFile.toFile());
            String access = node.path("access_token").asText("");
            if (access.isBlank()) return null;
            String refresh = node.hasNonNull("refresh_token") ? node.get("refresh_token").asText() : null;
            return new StoredToken(access, refresh, node.path("expires_at").asLong(0));
        } catch (IOException e) {
            logger.warn("Stored token file {} is unreadable ({}); ignoring it", tokenFile, e.getMessage());
            return null;
        }
    }

    private String requireClientId() {
        String clientId = settings.clientId();
        if (clientId == null || clientId.isBlank()) {
            throw new CatalogAuthenticationException("/authorize", "SPOTIFY_CLIENT_ID is not set");
        }
        return clientId;
    }

    // --- URL helpers ---

    static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    static Map<String, String> parseQuery(String url) {
        Map<String, String> result = new LinkedHashMap<>();
        if (url == null) return result;
        int q = url.indexOf('?');
        if (q < 0) return result;
        String query = url.substring(q + 1);
        int hash = query.indexOf('#');
        if (hash >= 0) query = query.substring(0, hash);
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            result.put(key, value);
        }
        return result;
    }
}
