package com.playlistsync.sync;

/**
 * Raised only when a finite rate-limit retry cap is configured and a call is still answered with
 * HTTP 429 after that many waits. With the default (unbounded) policy it never occurs.
 */
public class RateLimitExceededException extends CatalogApiException {
    public RateLimitExceededException(String path, int attempts) {
        super(429, path, "Still rate limited after " + attempts + " retries: " + path);
    }
}
