package com.playlistsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Runtime configuration, read from environment variables with JVM system properties as fallback.
 * <p>
 * Keys and defaults:
 * <ul>
 *   <li>{@code SPOTIFY_CLIENT_ID} - OAuth client id (no default; required for sign-in)</li>
 *   <li>{@code SPOTIFY_REDIRECT_URI} - {@value #DEFAULT_REDIRECT_URI}</li>
 *   <li>{@code SPOTIFY_API_BASE} - {@value #DEFAULT_API_BASE}</li>
 *   <li>{@code SPOTIFY_ACCOUNTS_BASE} - {@value #DEFAULT_ACCOUNTS_BASE}</li>
 *   <li>{@code SYNC_DATA_DIR} - {@code sync-data}; token file and CSV reports live here</li>
 *   <li>{@code SYNC_PACING_MS} - 100; delay after every track</li>
 *   <li>{@code SYNC_BATCH_SIZE} - 100; URIs per append call, clamped to 1..100</li>
 *   <li>{@code SYNC_RETRY_AFTER_DEFAULT_SECONDS} - 1; used when a 429 carries no Retry-After</li>
 *   <li>{@code SYNC_MAX_RATE_LIMIT_RETRIES} - -1 (unbounded)</li>
 *   <li>{@code SYNC_PROGRESS_QUEUE_CAPACITY} - 64</li>
 *   <li>{@code SYNC_HEADLESS} - true; browser mode used to load source pages</li>
 * </ul>
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public record SyncSettings(
    String clientId,
    String redirectUri,
    String apiBase,
    String accountsBase,
    Path dataDir,
    Duration pacingDelay,
    int batchSize,
    Duration defaultRetryAfter,
    int maxRateLimitRetries,
    int progressQueueCapacity,
    boolean headless
) {
    private static final Logger logger = LoggerFactory.getLogger(SyncSettings.class);

    public static final String DEFAULT_REDIRECT_URI = "http://127.0.0.1:8888/callback";
    public static final String DEFAULT_API_BASE = "https://api.spotify.com/v1";
    public static final String DEFAULT_ACCOUNTS_BASE = "https://accounts.spotify.com";
    /** Largest number of URIs the append endpoint accepts per call. */
    public static final int MAX_BATCH_SIZE = 100;
    /** Retry cap value meaning "retry 429 responses forever". */
    public static final int UNBOUNDED_RETRIES = -1;

    public SyncSettings {
        apiBase = stripTrailingSlash(apiBase);
        accountsBase = stripTrailingSlash(accountsBase);
        batchSize = Math.max(1, Math.min(MAX_BATCH_SIZE, batchSize));
        progressQueueCapacity = Math.max(1, progressQueueCapacity);
        if (pacingDelay == null || pacingDelay.isNegative()) pacingDelay = Duration.ZERO;
        if (defaultRetryAfter == null || defaultRetryAfter.isNegative()) defaultRetryAfter = Duration.ofSeconds(1);
    }

    public static SyncSettings defaults() {
        return new SyncSettings(null, DEFAULT_REDIRECT_URI, DEFAULT_API_BASE, DEFAULT_ACCOUNTS_BASE,
            Paths.get("sync-data"), Duration.ofMillis(100), MAX_BATCH_SIZE, Duration.ofSeconds(1),
            UNBOUNDED_RETRIES, 64, true);
    }

    /**
     * Reads all settings from the environment / system properties.
     */
    public static SyncSettings fromEnvironment() {
        SyncSettings d = defaults();
        return new SyncSettings(
            envOrProp("SPOTIFY_CLIENT_ID", null),
            envOrProp("SPOTIFY_REDIRECT_URI", d.redirectUri()),
            envOrProp("SPOTIFY_API_BASE", d.apiBase()),
            envOrProp("SPOTIFY_ACCOUNTS_BASE", d.accountsBase()),
            Paths.get(envOrProp("SYNC_DATA_DIR", d.dataDir().toString())),
            Duration.ofMillis(intSetting("SYNC_PACING_MS", 100)),
            intSetting("SYNC_BATCH_SIZE", MAX_BATCH_SIZE),
            Duration.ofSeconds(intSetting("SYNC_RETRY_AFTER_DEFAULT_SECONDS", 1)),
            intSetting("SYNC_MAX_RATE_LIMIT_RETRIES", UNBOUNDED_RETRIES),
            intSetting("SYNC_PROGRESS_QUEUE_CAPACITY", 64),
            Boolean.parseBoolean(envOrProp("SYNC_HEADLESS", "true"))
        );
    }

    /**
     * Returns the environment variable {@code key}, else the system property, else {@code defaultVal}.
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    private static int intSetting(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    private static String stripTrailingSlash(String s) {
        if (s == null) return null;
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    public boolean hasUnboundedRetries() {
        return maxRateLimitRetries < 0;
    }

    public SyncSettings withClientId(String value) {
        return new SyncSettings(value, redirectUri, apiBase, accountsBase, dataDir, pacingDelay, batchSize,
            defaultRetryAfter, maxRateLimitRetries, progressQueueCapacity, headless);
    }

    public SyncSettings withEndpoints(String newApiBase, String newAccountsBase) {
        return new SyncSettings(clientId, redirectUri, newApiBase, newAccountsBase, dataDir, pacingDelay, batchSize,
            defaultRetryAfter, maxRateLimitRetries, progressQueueCapacity, headless);
    }

    public SyncSettings withDataDir(Path value) {
        return new SyncSettings(clientId, redirectUri, apiBase, accountsBase, value, pacingDelay, batchSize,
            defaultRetryAfter, maxRateLimitRetries, progressQueueCapacity, headless);
    }

    public SyncSettings withBatchSize(int value) {
        return new SyncSettings(clientId, redirectUri, apiBase, accountsBase, dataDir, pacingDelay, value,
            defaultRetryAfter, maxRateLimitRetries, progressQueueCapacity, headless);
    }

    public SyncSettings withMaxRateLimitRetries(int value) {
        return new SyncSettings(clientId, redirectUri, apiBase, accountsBase, dataDir, pacingDelay, batchSize,
            defaultRetryAfter, value, progressQueueCapacity, headless);
    }
}
