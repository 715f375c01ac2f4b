package com.playlistsync.sync;

import java.time.Duration;

/**
 * Blocking delay used for request pacing and Retry-After waits.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        long millis = duration.toMillis();
        if (millis > 0) Thread.sleep(millis);
    };

    void sleep(Duration duration) throws InterruptedException;
}
