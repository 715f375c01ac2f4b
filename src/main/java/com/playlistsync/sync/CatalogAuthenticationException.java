package com.playlistsync.sync;

/**
 * The destination rejected our credentials (HTTP 401), or no valid token could be obtained.
 * Cached credentials have already been invalidated when this is thrown.
 */
public class CatalogAuthenticationException extends CatalogApiException {
    public CatalogAuthenticationException(String path, String message) {
        super(401, path, message);
    }

    public CatalogAuthenticationException(String path, String message, Throwable cause) {
        super(401, path, message, cause);
    }
}
