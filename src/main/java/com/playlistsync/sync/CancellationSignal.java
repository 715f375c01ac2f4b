package com.playlistsync.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a sync run. May be set from any thread; the run checks it
 * before each track and before each commit batch, and stops before issuing further network calls.
 */
public final class CancellationSignal {
    private final AtomicBoolean requested = new AtomicBoolean(false);

    /** A signal that is never raised. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        requested.set(true);
    }

    public boolean isCancelled() {
        return requested.get();
    }
}
