package com.questrail.possync.api;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time view of a connection, suitable for rendering a connectivity
 * banner.
 *
 * @param state          current lifecycle state
 * @param attemptCount   reconnect attempts made in the current episode
 * @param maxAttempts    configured reconnect ceiling
 * @param pollingActive  {@code true} while the REST polling fallback is running
 * @param targetAddress  socket address of the current connection, if any
 * @param lastError      most recent connectivity error, if any
 */
public record ConnectionStatus(
        ConnectionState state,
        int attemptCount,
        int maxAttempts,
        boolean pollingActive,
        Optional<URI> targetAddress,
        Optional<ConnectivityError> lastError
) {
    public ConnectionStatus {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(targetAddress, "targetAddress");
        Objects.requireNonNull(lastError, "lastError");
    }

    public boolean isConnected()
    {
        return state == ConnectionState.CONNECTED;
    }
}
