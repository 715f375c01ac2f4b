package com.playlistsync.sync;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Captures the OAuth redirect in a visible Playwright browser.
 * <p>
 * The redirect URI is intercepted with a route handler, so nothing needs to listen on it: the handler
 * records the URL and answers with a short confirmation page. If no browser can be launched (for example
 * on a headless server), the authorize URL is logged and the user pastes the redirected URL on stdin.
 */
public class BrowserAuthorizationCodeReceiver implements AuthorizationCodeReceiver {
    private static final Logger logger = LoggerFactory.getLogger(BrowserAuthorizationCodeReceiver.class);

    private static final long LOGIN_TIMEOUT_MS = 5 * 60_000;
    private static final int POLL_MS = 500;

    @Override
    public String awaitRedirect(String authorizeUrl, String redirectUri) {
        try (Playwright playwright = Playwright.create()) {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(false));
            BrowserContext context = browser.newContext();
            AtomicReference<String> redirected = new AtomicReference<>();
            context.route(url -> url.startsWith(redirectUri), (Route route) -> {
                redirected.set(route.request().url());
                route.fulfill(new Route.FulfillOptions()
                    .setStatus(200)
                    .setContentType("text/html")
                    .setBody("<html><body><p>Signed in. You can close this window.</p></body></html>"));
            });
            Page page = context.newPage();
            page.navigate(authorizeUrl);
            logger.info("Complete the Spotify sign-in in the opened browser window.");

            long deadline = System.currentTimeMillis() + LOGIN_TIMEOUT_MS;
            while (redirected.get() == null && System.currentTimeMillis() < deadline) {
                if (page.isClosed()) {
                    throw new CatalogAuthenticationException("/authorize", "Browser window was closed before sign-in completed");
                }
                // route handlers are dispatched while Playwright waits
                page.waitForTimeout(POLL_MS);
            }
            browser.close();
            if (redirected.get() == null) {
                throw new CatalogAuthenticationException("/authorize", "Timed out after " + LOGIN_TIMEOUT_MS + " ms waiting for Spotify sign-in");
            }
            return redirected.get();
        } catch (PlaywrightException e) {
            logger.warn("Could not drive a browser for sign-in ({}); falling back to manual copy/paste.", e.getMessage());
            return awaitPastedRedirect(authorizeUrl, redirectUri);
        }
    }

    private String awaitPastedRedirect(String authorizeUrl, String redirectUri) {
        logger.info("Open this URL in a browser and sign in:\n{}", authorizeUrl);
        System.out.println("After signing in, paste the full URL you were redirected to (starts with " + redirectUri + "):");
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null || !line.trim().startsWith(redirectUri)) {
                throw new CatalogAuthenticationException("/authorize", "No redirect URL was entered");
            }
            return line.trim();
        } catch (IOException e) {
            throw new CatalogAuthenticationException("/authorize", "Failed to read redirect URL: " + e.getMessage(), e);
        }
    }
}
