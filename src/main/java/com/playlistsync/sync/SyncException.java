package com.playlistsync.sync;

/**
 * Run-fatal sync failure. No summary is available when this is thrown.
 */
public class SyncException extends RuntimeException {
    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
