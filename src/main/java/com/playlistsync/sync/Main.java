package com.playlistsync.sync;

import com.playlistsync.source.AppleMusicExtractor;
import com.playlistsync.source.SourceExtractionException;
import com.playlistsync.source.SourceExtractorInterface;
import com.playlistsync.source.SourcePlaylist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Main entry point for the playlist sync tool.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code login} - signs in to Spotify and stores the token</li>
 *   <li>{@code playlists} - lists the signed-in user's playlists</li>
 *   <li>{@code create <name>} - creates a private playlist</li>
 *   <li>{@code sync [appleMusicUrl] [spotifyPlaylistId]} - syncs an Apple Music playlist into a Spotify
 *       playlist. Missing arguments are read from {@code APPLE_MUSIC_URL} and {@code SPOTIFY_PLAYLIST_ID};
 *       without a playlist id a new playlist named after the source is created.</li>
 * </ul>
 *
 * @author Playlist Sync Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    private static final long SHUTDOWN_WAIT_MS = 10_000;
    private static volatile boolean finished;

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        SyncSettings settings = SyncSettings.fromEnvironment();
        AuthServiceInterface authService = new SpotifyAuthService(settings);
        CatalogClientInterface catalogClient = new SpotifyApiClient(authService, settings);
        SourceExtractorInterface extractor = new AppleMusicExtractor(settings.headless());
        CancellationSignal cancellation = new CancellationSignal();
        installShutdownHook(cancellation, Thread.currentThread());

        Main app = new Main(settings, authService, catalogClient, extractor,
            new PlaylistSyncService(catalogClient, settings), new SyncReportWriter(settings.dataDir()), System.out);
        int code = app.run(args, cancellation);
        finished = true;
        exit(code, cancellation, System::exit);
    }

    /**
     * Ends the process with {@code code} unless a shutdown is already under way. After Ctrl-C the
     * shutdown hook is waiting for main to return, and {@code System.exit} would block on it.
     */
    static void exit(int code, CancellationSignal cancellation, IntConsumer exiter) {
        if (cancellation.isCancelled()) {
            logger.debug("Shutdown in progress, returning exit code {} to the hook", code);
            return;
        }
        exiter.accept(code);
    }

    private final SyncSettings settings;
    private final AuthServiceInterface authService;
    private final CatalogClientInterface catalogClient;
    private final SourceExtractorInterface extractor;
    private final PlaylistSyncServiceInterface syncService;
    private final CsvServiceInterface csvService;
    private final PrintStream out;

    Main(SyncSettings settings, AuthServiceInterface authService, CatalogClientInterface catalogClient,
         SourceExtractorInterface extractor, PlaylistSyncServiceInterface syncService, CsvServiceInterface csvService,
         PrintStream out) {
        this.settings = settings;
        this.authService = authService;
        this.catalogClient = catalogClient;
        this.extractor = extractor;
        this.syncService = syncService;
        this.csvService = csvService;
        this.out = out;
    }

    /**
     * Dispatches one command.
     * @return process exit code
     */
    int run(String[] args, CancellationSignal cancellation) {
        String mode = args != null && args.length > 0 ? args[0].trim().toLowerCase() : "";
        try {
            switch (mode) {
                case "login":
                    return login();
                case "playlists":
                    return listPlaylists();
                case "create":
                    return create(arg(args, 1, null));
                case "sync":
                    return sync(arg(args, 1, SyncSettings.envOrProp("APPLE_MUSIC_URL", null)),
                        arg(args, 2, SyncSettings.envOrProp("SPOTIFY_PLAYLIST_ID", null)), cancellation);
                default:
                    printUsage();
                    return EXIT_USAGE;
            }
        } catch (CatalogAuthenticationException e) {
            logger.error("Spotify authentication failed: {}", e.getMessage());
            out.println("Not signed in to Spotify (" + e.getMessage() + "). Run 'login' and try again.");
            return EXIT_FAILURE;
        } catch (CatalogApiException | SyncException | SourceExtractionException e) {
            logger.error("{} failed: {}", mode, e.getMessage());
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int login() {
        authService.authorize();
        CatalogUser user = catalogClient.getCurrentUser();
        out.println("Signed in as " + user.displayName());
        return EXIT_OK;
    }

    private int listPlaylists() {
        List<CatalogPlaylist> playlists = catalogClient.getUserPlaylists();
        if (playlists.isEmpty()) {
            out.println("No playlists found.");
            return EXIT_OK;
        }
        for (CatalogPlaylist p : playlists) {
            out.printf("%s  %s (%d tracks)%n", p.id(), p.name(), p.trackCount());
        }
        return EXIT_OK;
    }

    private int create(String name) {
        if (name == null || name.isBlank()) {
            out.println("Usage: create <name>");
            return EXIT_USAGE;
        }
        CatalogPlaylist created = catalogClient.createPlaylist(name.trim());
        out.println("Created playlist " + created.name() + " (" + created.id() + ")");
        return EXIT_OK;
    }

    private int sync(String appleMusicUrl, String playlistId, CancellationSignal cancellation) {
        if (appleMusicUrl == null || appleMusicUrl.isBlank()) {
            out.println("Usage: sync <appleMusicUrl> [spotifyPlaylistId] (or set APPLE_MUSIC_URL)");
            return EXIT_USAGE;
        }
        if (!authService.isAuthenticated()) {
            out.println("Not signed in to Spotify. Run 'login' first.");
            return EXIT_FAILURE;
        }

        SourcePlaylist source = extractor.extract(appleMusicUrl);
        out.println("Found " + source.tracks().size() + " tracks in \"" + source.name() + "\"");

        String destination = playlistId;
        if (destination == null || destination.isBlank()) {
            String name = source.name() == null || source.name().isBlank() ? "Apple Music import" : source.name();
            destination = catalogClient.createPlaylist(name).id();
            out.println("Created destination playlist " + name + " (" + destination + ")");
        }

        SyncSummary summary;
        try (QueuedProgressPublisher publisher = new QueuedProgressPublisher(new LoggingProgressListener(),
                settings.progressQueueCapacity())) {
            summary = syncService.sync(source.tracks(), destination, publisher, cancellation);
        } catch (SyncCommitException e) {
            logger.error("Commit failed after {} batches: {}", e.getBatchesCommitted(), e.getMessage());
            printSummary(e.getSummary());
            writeReport(e.getSummary(), source.name());
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        printSummary(summary);
        writeReport(summary, source.name());
        return summary.cancelled() ? EXIT_FAILURE : EXIT_OK;
    }

    void printSummary(SyncSummary summary) {
        out.println();
        out.println("=".repeat(40));
        out.println("Total tracks:    " + summary.total());
        out.println("Added:           " + summary.added() + (summary.committed() ? "" : " (not written)"));
        out.println("Already present: " + summary.skipped());
        out.println("Not found:       " + summary.notFound());
        if (summary.cancelled()) {
            out.println("Cancelled with " + summary.unresolved() + " tracks unprocessed.");
        }
        if (summary.notFound() > 0) {
            out.println();
            out.println("Not found:");
            for (SyncOutcome outcome : summary.outcomes()) {
                if (outcome.status() == TrackStatus.NOT_FOUND) {
                    out.println("  - " + outcome.sourceTrack().title() + " - " + outcome.sourceTrack().artist());
                }
            }
        }
    }

    private void writeReport(SyncSummary summary, String playlistName) {
        String base = playlistName == null || playlistName.isBlank() ? "sync" : playlistName;
        try {
            Path written = csvService.writeSyncReport(summary, base + "-sync-report.csv");
            out.println("Report written to " + written);
        } catch (IOException e) {
            logger.error("Failed to write sync report for '{}': {}", base, e.getMessage());
        }
    }

    private void printUsage() {
        out.println("Usage:");
        out.println("  login                                  sign in to Spotify");
        out.println("  playlists                              list your Spotify playlists");
        out.println("  create <name>                          create a private playlist");
        out.println("  sync [appleMusicUrl] [playlistId]      sync an Apple Music playlist into Spotify");
    }

    private static String arg(String[] args, int i, String fallback) {
        return args != null && args.length > i && !args[i].isBlank() ? args[i].trim() : fallback;
    }

    // Ctrl-C cancels the run; the hook waits for the summary to be printed before the JVM exits.
    private static void installShutdownHook(CancellationSignal cancellation, Thread mainThread) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finished || !mainThread.isAlive()) return;
            cancellation.cancel();
            logger.info("Cancellation requested; finishing current step...");
            try {
                mainThread.join(SHUTDOWN_WAIT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sync-shutdown"));
    }
}
