package com.playlistsync.source;

/**
 * Extraction of a source playlist failed. The message is meant to be shown to the user as is.
 */
public class SourceExtractionException extends RuntimeException {
    public SourceExtractionException(String message) {
        super(message);
    }

    public SourceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
