package com.questrail.possync.realtime.auth;

import java.util.Optional;

/**
 * Read-only view of the application's session and token manager.
 *
 * <p>The connection never refreshes or stores credentials itself. It reads the
 * current values on connect, before each reconnect attempt, on each polling
 * request and whenever the refresh signal fires. When the server warns that
 * the token is about to expire it calls {@link #requestRefresh()} and waits for
 * the refresh signal. Implementations must be safe to call from the
 * connection's event loop and must not block.</p>
 */
public interface CredentialSource
{
    /**
     * Current bearer token, empty when signed out.
     */
    Optional<String> currentToken();

    /**
     * Id of the signed-in user, empty when signed out.
     */
    Optional<String> currentUserId();

    /**
     * Restaurant the user is working in. Empty for users who have not
     * finished onboarding.
     */
    Optional<String> currentTenantId();

    /**
     * Asks the token manager to refresh the bearer token. The manager answers
     * later, off this call, by firing
     * {@link com.questrail.possync.api.RealtimeConnection#credentialRefreshed()}.
     * The default does nothing, leaving the token to expire and the server to
     * reject it.
     */
    default void requestRefresh()
    {
    }
}
