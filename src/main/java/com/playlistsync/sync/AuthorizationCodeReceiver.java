package com.playlistsync.sync;

/**
 * Sends the user to the authorize URL and returns the URL the browser was redirected to.
 */
@FunctionalInterface
public interface AuthorizationCodeReceiver {
    /**
     * @param authorizeUrl fully built authorize URL
     * @param redirectUri registered redirect URI; the returned URL starts with it
     * @return redirected URL including its query string
     * @throws CatalogAuthenticationException if the user aborted or no redirect was observed
     */
    String awaitRedirect(String authorizeUrl, String redirectUri);
}
