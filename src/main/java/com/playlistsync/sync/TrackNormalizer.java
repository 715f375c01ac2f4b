package com.playlistsync.sync;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes track titles and artist names for fuzzy comparison between catalogs.
 * <p>
 * Workflow, applied in order:
 * <ul>
 *   <li>Lowercase and trim.</li>
 *   <li>Remove bracketed featuring credits such as {@code (feat. X)} or {@code [ft. X]}, wherever they appear.</li>
 *   <li>Remove an unbracketed trailing featuring credit ({@code feat. X ...}) up to the end of the string.</li>
 *   <li>Unify apostrophe variants (straight, right single quote, grave accent).</li>
 *   <li>Collapse whitespace and trim again.</li>
 * </ul>
 * The same normalization backs both candidate matching ({@link TrackMatcher}) and dedup keys
 * ({@link DestinationIndex}); keys must only ever be built through {@link #key(String, String)}.
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public final class TrackNormalizer {
    private TrackNormalizer() {}

    /** Separator between normalized title and artist inside a dedup key. */
    public static final String KEY_SEPARATOR = "|||";

    private static final Pattern BRACKETED_FEATURE = Pattern.compile("\\s*[(\\[](feat\\.?|ft\\.?|featuring).*?[)\\]]");
    private static final Pattern TRAILING_FEATURE = Pattern.compile("\\s*(feat\\.?|ft\\.?|featuring)\\s+.*$");
    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Normalizes a title or artist string. Null is treated as the empty string.
     * @param s raw value
     * @return normalized value, never null
     */
    public static String normalize(String s) {
        if (s == null) return "";
        String result = s.toLowerCase(Locale.ROOT).trim();
        result = BRACKETED_FEATURE.matcher(result).replaceAll("");
        result = TRAILING_FEATURE.matcher(result).replaceAll("");
        result = APOSTROPHES.matcher(result).replaceAll("'");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.trim();
    }

    /**
     * Builds the identifier-less dedup key for a title/artist pair.
     */
    public static String key(String title, String artist) {
        return normalize(title) + KEY_SEPARATOR + normalize(artist);
    }

    /**
     * Bidirectional substring relation on already-normalized values: true if either contains the other.
     */
    public static boolean looselyEquals(String normalizedA, String normalizedB) {
        return normalizedA.contains(normalizedB) || normalizedB.contains(normalizedA);
    }
}
