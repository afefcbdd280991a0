package com.questrail.possync.realtime.internal.state;

import com.questrail.possync.api.ConnectionState;
import com.questrail.possync.api.ConnectivityError;
import com.questrail.possync.realtime.model.Credential;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionSnapshot
 * -----------------------------------------------------------------------------
 * Immutable view of one supervised connection.
 *
 * <h2>Socket generations</h2>
 * Every socket the supervisor creates is stamped with a new
 * {@code socketGeneration}. The generation is also advanced whenever the
 * supervisor itself retires a socket (disconnect, heartbeat loss, in-band auth
 * rejection, connect timeout), so late callbacks from that socket no longer
 * match and are dropped.
 *
 * <h2>Polling flag</h2>
 * {@code pollingActive} is tracked separately from the state because an
 * explicit retry out of POLLING_FALLBACK keeps the poller running until the
 * new socket opens.
 */
public final class ConnectionSnapshot
{
    private final ConnectionState state;
    private final URI targetAddress;
    private final RetryState retry;
    private final long connectionStartNanos;
    private final long socketGeneration;
    private final Credential credential;
    private final ConnectivityError lastError;
    private final boolean pollingActive;
    private final Instant lastTransition;

    private ConnectionSnapshot(ConnectionState state,
                               URI targetAddress,
                               RetryState retry,
                               long connectionStartNanos,
                               long socketGeneration,
                               Credential credential,
                               ConnectivityError lastError,
                               boolean pollingActive,
                               Instant lastTransition) {
        this.state = Objects.requireNonNull(state, "state");
        this.targetAddress = targetAddress;
        this.retry = Objects.requireNonNull(retry, "retry");
        this.connectionStartNanos = connectionStartNanos;
        this.socketGeneration = socketGeneration;
        this.credential = credential;
        this.lastError = lastError;
        this.pollingActive = pollingActive;
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    public static ConnectionSnapshot initial(Instant now) {
        return new ConnectionSnapshot(ConnectionState.DISCONNECTED, null, RetryState.none(),
                0L, 0L, null, null, false, now);
    }

    public ConnectionState state() {
        return state;
    }

    public Optional<URI> targetAddress() {
        return Optional.ofNullable(targetAddress);
    }

    public RetryState retry() {
        return retry;
    }

    public long connectionStartNanos() {
        return connectionStartNanos;
    }

    public long socketGeneration() {
        return socketGeneration;
    }

    public Optional<Credential> credential() {
        return Optional.ofNullable(credential);
    }

    public Optional<ConnectivityError> lastError() {
        return Optional.ofNullable(lastError);
    }

    public boolean pollingActive() {
        return pollingActive;
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    // ---------------------------------------------------------------------
    // Withers
    // ---------------------------------------------------------------------

    public ConnectionSnapshot withState(ConnectionState newState, Instant now) {
        return new ConnectionSnapshot(newState, targetAddress, retry, connectionStartNanos,
                socketGeneration, credential, lastError, pollingActive, now);
    }

    /**
     * Stamps a new socket attempt: next generation, target and start time.
     */
    public ConnectionSnapshot withNewSocket(URI target, long startNanos) {
        return new ConnectionSnapshot(state, target, retry, startNanos,
                socketGeneration + 1, credential, lastError, pollingActive, lastTransition);
    }

    /**
     * Advances the generation without creating a socket, retiring the current one.
     */
    public ConnectionSnapshot retireSocket() {
        return new ConnectionSnapshot(state, targetAddress, retry, connectionStartNanos,
                socketGeneration + 1, credential, lastError, pollingActive, lastTransition);
    }

    public ConnectionSnapshot withRetry(RetryState newRetry) {
        return new ConnectionSnapshot(state, targetAddress, newRetry, connectionStartNanos,
                socketGeneration, credential, lastError, pollingActive, lastTransition);
    }

    public ConnectionSnapshot withCredential(Credential newCredential) {
        return new ConnectionSnapshot(state, targetAddress, retry, connectionStartNanos,
                socketGeneration, newCredential, lastError, pollingActive, lastTransition);
    }

    public ConnectionSnapshot withLastError(ConnectivityError error) {
        return new ConnectionSnapshot(state, targetAddress, retry, connectionStartNanos,
                socketGeneration, credential, error, pollingActive, lastTransition);
    }

    public ConnectionSnapshot withPollingActive(boolean active) {
        return new ConnectionSnapshot(state, targetAddress, retry, connectionStartNanos,
                socketGeneration, credential, lastError, active, lastTransition);
    }

    public ConnectionSnapshot withoutTarget() {
        return new ConnectionSnapshot(state, null, retry, connectionStartNanos,
                socketGeneration, credential, lastError, pollingActive, lastTransition);
    }

    @Override
    public String toString() {
        return "ConnectionSnapshot[state=" + state
                + ", gen=" + socketGeneration
                + ", attempts=" + retry.attemptCount()
                + ", polling=" + pollingActive
                + ", target=" + targetAddress + "]";
    }
}
