package com.playlistsync.sync;

/**
 * Failure of a single destination catalog call: a non-success HTTP response other than 429,
 * or a transport error (status {@value #NO_STATUS}).
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class CatalogApiException extends RuntimeException {
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String path;

    public CatalogApiException(int statusCode, String path, String message) {
        super(message);
        this.statusCode = statusCode;
        this.path = path;
    }

    public CatalogApiException(int statusCode, String path, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.path = path;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getPath() {
        return path;
    }
}
