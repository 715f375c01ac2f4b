package com.playlistsync.sync;

/**
 * Credential provider for the destination catalog (OAuth Authorization Code + PKCE).
 * <p>
 * Callers ask for a bearer token before every request; implementations refresh it transparently
 * and never hand out an empty or expired token.
 */
public interface AuthServiceInterface {
    /**
     * Returns a currently valid bearer token, refreshing it first if it is about to expire.
     * @return access token
     * @throws CatalogAuthenticationException if no token is stored or refresh failed terminally
     */
    String getAccessToken();

    /**
     * Drops cached credentials, forcing a new sign-in. Called after the API answers 401.
     */
    void invalidate();

    /**
     * @return true if a token (possibly expired but refreshable) is stored
     */
    boolean isAuthenticated();

    /**
     * Runs the interactive sign-in workflow and stores the resulting tokens.
     * @throws CatalogAuthenticationException if the user aborted or the code exchange failed
     */
    void authorize();
}
