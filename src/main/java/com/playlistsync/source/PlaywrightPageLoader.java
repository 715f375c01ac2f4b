package com.playlistsync.source;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import com.playlistsync.sync.Sleeper;
import com.playlistsync.sync.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Loads a page in Chromium through Playwright and returns its HTML after the DOM is ready.
 * Each attempt uses a fresh browser; up to {@value #MAX_ATTEMPTS} attempts with exponential backoff.
 * A non-OK HTTP status fails immediately with that status in the message.
 */
public class PlaywrightPageLoader implements PageLoader {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightPageLoader.class);

    static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
        + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final int MAX_ATTEMPTS = 3;
    private static final int NAVIGATION_TIMEOUT_MS = 30_000;
    /** HTTP error statuses are reported as-is; only browser and navigation failures are retried. */
    static final Predicate<Exception> RETRYABLE = e -> !(e instanceof SourceExtractionException);

    private final boolean headless;

    public PlaywrightPageLoader(boolean headless) {
        this.headless = headless;
    }

    @Override
    public String load(String url) {
        String html = Utils.retryPlaywrightAction(() -> loadOnce(url), MAX_ATTEMPTS, "loading " + url, Sleeper.SYSTEM, RETRYABLE);
        if (html == null) {
            throw new SourceExtractionException("Failed to fetch Apple Music page: " + url);
        }
        return html;
    }

    private String loadOnce(String url) {
        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            BrowserContext context = browser.newContext(new Browser.NewContextOptions().setUserAgent(USER_AGENT));
            Page page = context.newPage();
            Response response = page.navigate(url, new Page.NavigateOptions().setTimeout(NAVIGATION_TIMEOUT_MS));
            if (response != null && !response.ok()) {
                throw new SourceExtractionException("Failed to fetch Apple Music page: HTTP " + response.status() + " for " + url);
            }
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
            String html = page.content();
            logger.debug("Loaded {} ({} chars)", url, html.length());
            browser.close();
            return html;
        }
    }
}
