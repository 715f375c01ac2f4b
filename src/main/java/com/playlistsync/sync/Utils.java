package com.playlistsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Utility class for common helper methods used in page loading and file operations.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\\\s]", "_");
    }

    /**
     * Retries a Playwright action up to maxRetries times with exponential backoff (2s, 4s, ...).
     * @return Result of action, or null if all attempts fail
     */
    public static <T> T retryPlaywrightAction(Callable<T> action, int maxRetries, String actionDesc) {
        return retryPlaywrightAction(action, maxRetries, actionDesc, Sleeper.SYSTEM);
    }

    /**
     * Same as {@link #retryPlaywrightAction(Callable, int, String)} with an explicit sleeper for the backoff.
     * Gives up early, returning null, if the thread is interrupted while backing off.
     */
    public static <T> T retryPlaywrightAction(Callable<T> action, int maxRetries, String actionDesc, Sleeper sleeper) {
        return retryPlaywrightAction(action, maxRetries, actionDesc, sleeper, e -> true);
    }

    /**
     * Retries only failures accepted by {@code retryable}; any other runtime exception is rethrown at once.
     * @param retryable decides whether a failure is transient
     * @return Result of action, or null if all attempts fail
     */
    public static <T> T retryPlaywrightAction(Callable<T> action, int maxRetries, String actionDesc, Sleeper sleeper,
                                              Predicate<Exception> retryable) {
        int attempts = 0;
        while (attempts < maxRetries) {
            try {
                return action.call();
            } catch (Exception e) {
                if (e instanceof RuntimeException && !retryable.test(e)) {
                    throw (RuntimeException) e;
                }
                attempts++;
                logger.warn("Failed {} (attempt {}): {}", actionDesc, attempts, e.getMessage());
                if (attempts >= maxRetries) break;
                try {
                    sleeper.sleep(Duration.ofSeconds((long) Math.pow(2, attempts)));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while retrying {}", actionDesc);
                    return null;
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, maxRetries);
        return null;
    }
}
