package com.questrail.possync.realtime.internal.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.possync.api.ConnectionState;
import com.questrail.possync.api.ConnectivityError;
import com.questrail.possync.api.ConnectivityErrorKind;
import com.questrail.possync.realtime.auth.AuthNegotiator;
import com.questrail.possync.realtime.auth.CloseClassifier;
import com.questrail.possync.realtime.auth.FailureKind;
import com.questrail.possync.realtime.config.RealtimeConnectionConfig;
import com.questrail.possync.realtime.internal.events.PollEvent;
import com.questrail.possync.realtime.internal.events.SocketEvent;
import com.questrail.possync.realtime.internal.events.SupervisorCommand;
import com.questrail.possync.realtime.internal.events.SupervisorEvent;
import com.questrail.possync.realtime.internal.events.TimerEvent;
import com.questrail.possync.realtime.internal.exec.ReconnectPolicy;
import com.questrail.possync.realtime.model.Credential;
import com.questrail.possync.realtime.model.MessageEnvelope;
import com.questrail.possync.realtime.model.MessageTypes;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import static com.questrail.possync.realtime.internal.state.SupervisorIntents.Kind.*;

/**
 * SupervisorReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for one realtime connection.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link ConnectionSnapshot} and a single {@link SupervisorEvent},
 * the reducer computes:
 * <ul>
 *   <li>a new {@link ConnectionSnapshot}</li>
 *   <li>the {@link SupervisorIntents} describing what must happen next</li>
 * </ul>
 *
 * It performs no I/O, reads no clock and arms no timer. Monotonic readings
 * arrive inside the events that need them.
 *
 * <h2>Transitions</h2>
 * <pre>
 *   DISCONNECTED/CLOSED --connect--------------------&gt; CONNECTING
 *   CONNECTING --opened------------------------------&gt; AUTHENTICATING
 *   AUTHENTICATING --authenticate sent---------------&gt; CONNECTED
 *   live socket --close 1000-------------------------&gt; DISCONNECTED
 *   live socket --abnormal close, auth---------------&gt; AUTH_FAILED
 *   live socket --abnormal close, transient----------&gt; RECONNECTING | POLLING_FALLBACK
 *   RECONNECTING --reconnect due---------------------&gt; CONNECTING
 *   AUTH_FAILED/RECONNECTING --credential refreshed--&gt; CONNECTING
 *   CONNECTED --credential refreshed-----------------&gt; CONNECTING (socket replaced)
 *   CONNECTED --network lost-------------------------&gt; RECONNECTING | POLLING_FALLBACK
 *   RECONNECTING/POLLING_FALLBACK --network back-----&gt; CONNECTING
 *   any --disconnect---------------------------------&gt; CLOSED
 * </pre>
 *
 * <h2>Stale events</h2>
 * Socket and timer events whose generation does not match the snapshot, or
 * that arrive in a state where they have no meaning, produce no change and no
 * intents.
 */
public final class SupervisorReducer
{
    static final String CLIENT_DISCONNECT_REASON = "Client disconnect";
    static final String CONNECT_TIMEOUT_REASON = "Connection timeout";
    static final String HEARTBEAT_TIMEOUT_REASON = "Heartbeat timeout";
    static final String AUTH_ERROR_REASON = "Authentication failed";
    static final String CREDENTIAL_REFRESHED_REASON = "Credential refreshed";
    static final String NETWORK_LOST_REASON = "Network unavailable";

    /**
     * Result of applying an event to a snapshot.
     *
     * @param newState the updated snapshot
     * @param intents  side effects to be executed by the caller
     */
    public record Result(ConnectionSnapshot newState,
                         SupervisorIntents intents) {}

    private final RealtimeConnectionConfig config;
    private final ReconnectPolicy reconnectPolicy;
    private final AuthNegotiator auth;

    public SupervisorReducer(RealtimeConnectionConfig config, AuthNegotiator auth) {
        this.config = Objects.requireNonNull(config, "config");
        this.reconnectPolicy = config.reconnectPolicy();
        this.auth = Objects.requireNonNull(auth, "auth");
    }

    public Result apply(ConnectionSnapshot state, SupervisorEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof SupervisorCommand.ConnectRequested e) {
            return onConnectRequested(state, e);
        }
        if (event instanceof SupervisorCommand.DisconnectRequested e) {
            return onDisconnectRequested(state, e);
        }
        if (event instanceof SupervisorCommand.CredentialRefreshed e) {
            return onCredentialRefreshed(state, e);
        }
        if (event instanceof SupervisorCommand.NetworkAvailabilityChanged e) {
            return onNetworkAvailabilityChanged(state, e);
        }
        if (event instanceof SocketEvent.SocketOpened e) {
            return onSocketOpened(state, e);
        }
        if (event instanceof SocketEvent.AuthenticationSent e) {
            return onAuthenticationSent(state, e);
        }
        if (event instanceof SocketEvent.SocketClosed e) {
            return onSocketClosed(state, e);
        }
        if (event instanceof SocketEvent.MessageReceived e) {
            return onMessageReceived(state, e);
        }
        if (event instanceof TimerEvent.ConnectTimedOut e) {
            return onConnectTimedOut(state, e);
        }
        if (event instanceof TimerEvent.HeartbeatTimedOut e) {
            return onHeartbeatTimedOut(state, e);
        }
        if (event instanceof TimerEvent.ReconnectDue e) {
            return onReconnectDue(state, e);
        }
        if (event instanceof PollEvent.PollRejected e) {
            return onPollRejected(state, e);
        }

        return unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private Result onConnectRequested(ConnectionSnapshot state, SupervisorCommand.ConnectRequested e) {
        if (state.state().hasLiveSocket()) {
            return unchanged(state);
        }

        ConnectionSnapshot base = state.withCredential(e.credential());
        if (state.state() == ConnectionState.DISCONNECTED || state.state() == ConnectionState.CLOSED) {
            base = base.withRetry(RetryState.none()).withLastError(null);
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder();
        if (state.state() == ConnectionState.RECONNECTING) {
            intents.add(CANCEL_RECONNECT);
        }
        return openSocket(base, e.credential(), e.nowNanos(), e.timestamp(), intents);
    }

    private Result onDisconnectRequested(ConnectionSnapshot state, SupervisorCommand.DisconnectRequested e) {
        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(CANCEL_CONNECT_TIMEOUT)
                .add(CANCEL_RECONNECT)
                .add(STOP_HEARTBEAT)
                .add(STOP_POLLING)
                .add(CLOSE_SOCKET)
                .close(CloseClassifier.NORMAL_CLOSURE, CLIENT_DISCONNECT_REASON);

        if (state.state().hasLiveSocket()) {
            intents.add(EMIT_DISCONNECTED);
        }

        ConnectionSnapshot closed = state
                .retireSocket()
                .withRetry(RetryState.none())
                .withCredential(null)
                .withPollingActive(false)
                .withoutTarget()
                .withState(ConnectionState.CLOSED, e.timestamp());

        return new Result(closed, intents.build());
    }

    private Result onCredentialRefreshed(ConnectionSnapshot state, SupervisorCommand.CredentialRefreshed e) {
        ConnectionState current = state.state();
        if (current == ConnectionState.DISCONNECTED || current == ConnectionState.CLOSED) {
            return unchanged(state);
        }
        if (state.credential().isEmpty()) {
            return unchanged(state);
        }

        boolean retryNow = current == ConnectionState.AUTH_FAILED || current == ConnectionState.RECONNECTING;

        if (e.token().isEmpty()) {
            if (!retryNow) {
                return unchanged(state);
            }
            return missingCredential(state, e.timestamp(),
                    SupervisorIntents.builder().add(CANCEL_RECONNECT));
        }

        Credential held = state.credential().get();
        Credential refreshed = new Credential(e.token().get(), held.identity());
        ConnectionSnapshot updated = state.withCredential(refreshed);

        if (current == ConnectionState.CONNECTED && !refreshed.token().equals(held.token())) {
            return replaceSocket(updated, refreshed, e.nowNanos(), e.timestamp());
        }
        if (!retryNow) {
            return new Result(updated, SupervisorIntents.none());
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder().add(CANCEL_RECONNECT);
        return openSocket(updated, refreshed, e.nowNanos(), e.timestamp(), intents);
    }

    /**
     * The server authenticated the socket with the token it was opened with, so
     * a new token only takes effect on a new socket.
     */
    private Result replaceSocket(ConnectionSnapshot state, Credential credential, long nowNanos, Instant now) {
        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(STOP_HEARTBEAT)
                .add(CLOSE_SOCKET)
                .add(EMIT_DISCONNECTED)
                .close(CloseClassifier.NORMAL_CLOSURE, CREDENTIAL_REFRESHED_REASON);

        ConnectionSnapshot retired = state
                .retireSocket()
                .withRetry(RetryState.none());

        return openSocket(retired, credential, nowNanos, now, intents);
    }

    private Result onNetworkAvailabilityChanged(ConnectionSnapshot state,
                                                SupervisorCommand.NetworkAvailabilityChanged e) {
        ConnectionState current = state.state();

        if (!e.available()) {
            if (current != ConnectionState.CONNECTED) {
                return unchanged(state);
            }
            SupervisorIntents.Builder intents = SupervisorIntents.builder()
                    .add(STOP_HEARTBEAT)
                    .add(CLOSE_SOCKET)
                    .add(EMIT_DISCONNECTED)
                    .close(CloseClassifier.GOING_AWAY, NETWORK_LOST_REASON);
            return transientFailure(state.retireSocket(), NETWORK_LOST_REASON, e.timestamp(), intents);
        }

        if (current != ConnectionState.RECONNECTING && current != ConnectionState.POLLING_FALLBACK) {
            return unchanged(state);
        }
        if (state.credential().isEmpty() || e.token().isEmpty()) {
            // The reconnect timer or the poller still owns recovery.
            return unchanged(state);
        }

        Credential fresh = new Credential(e.token().get(), state.credential().get().identity());
        SupervisorIntents.Builder intents = SupervisorIntents.builder();
        if (current == ConnectionState.RECONNECTING) {
            intents.add(CANCEL_RECONNECT);
        }
        return openSocket(state.withCredential(fresh), fresh, e.nowNanos(), e.timestamp(), intents);
    }

    // ---------------------------------------------------------------------
    // Socket lifecycle
    // ---------------------------------------------------------------------

    private Result onSocketOpened(ConnectionSnapshot state, SocketEvent.SocketOpened e) {
        if (!isCurrent(state, e.generation()) || state.state() != ConnectionState.CONNECTING) {
            return unchanged(state);
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(CANCEL_CONNECT_TIMEOUT)
                .add(SEND_AUTHENTICATE)
                .generation(state.socketGeneration());
        state.credential().ifPresent(intents::credential);

        if (state.pollingActive()) {
            intents.add(STOP_POLLING);
        }

        ConnectionSnapshot next = state
                .withPollingActive(false)
                .withState(ConnectionState.AUTHENTICATING, e.timestamp());

        return new Result(next, intents.build());
    }

    private Result onAuthenticationSent(ConnectionSnapshot state, SocketEvent.AuthenticationSent e) {
        if (!isCurrent(state, e.generation()) || state.state() != ConnectionState.AUTHENTICATING) {
            return unchanged(state);
        }

        ConnectionSnapshot next = state
                .withRetry(RetryState.none())
                .withLastError(null)
                .withState(ConnectionState.CONNECTED, e.timestamp());

        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(START_HEARTBEAT)
                .add(SUBSCRIBE_EVENTS)
                .add(EMIT_CONNECTED)
                .generation(state.socketGeneration());
        state.targetAddress().ifPresent(intents::targetAddress);
        state.credential().ifPresent(intents::credential);

        return new Result(next, intents.build());
    }

    private Result onSocketClosed(ConnectionSnapshot state, SocketEvent.SocketClosed e) {
        if (!isCurrent(state, e.generation()) || !state.state().hasLiveSocket()) {
            return unchanged(state);
        }

        ConnectionSnapshot retired = state.retireSocket();
        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(CANCEL_CONNECT_TIMEOUT)
                .add(STOP_HEARTBEAT)
                .add(EMIT_DISCONNECTED)
                .close(e.code(), e.reason());

        if (e.code() == CloseClassifier.NORMAL_CLOSURE) {
            if (retired.pollingActive()) {
                intents.add(STOP_POLLING);
            }
            ConnectionSnapshot next = retired
                    .withRetry(RetryState.none())
                    .withPollingActive(false)
                    .withState(ConnectionState.DISCONNECTED, e.timestamp());
            return new Result(next, intents.build());
        }

        long elapsedMillis = elapsedMillis(state, e.nowNanos());
        return abnormalClose(retired, e.code(), e.reason(), elapsedMillis, e.timestamp(), intents);
    }

    private Result onMessageReceived(ConnectionSnapshot state, SocketEvent.MessageReceived e) {
        if (!isCurrent(state, e.generation()) || !state.state().hasLiveSocket()) {
            return unchanged(state);
        }

        MessageEnvelope envelope = e.envelope();
        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(DELIVER_MESSAGE)
                .envelope(envelope)
                .generation(state.socketGeneration());

        switch (envelope.type()) {
            case MessageTypes.PONG -> intents.add(NOTE_PONG);
            case MessageTypes.PING -> intents.add(SEND_PONG);
            case MessageTypes.ERROR -> {
                ConnectivityError error = new ConnectivityError(
                        ConnectivityErrorKind.SERVER_REPORTED,
                        describe(envelope.data(), "Server reported an error"),
                        e.timestamp());
                intents.add(EMIT_ERROR).error(error);
                return new Result(state.withLastError(error), intents.build());
            }
            case MessageTypes.AUTH_ERROR -> {
                return inBandAuthRejection(state, envelope, e.timestamp(), intents);
            }
            case MessageTypes.TOKEN_EXPIRED -> intents.add(REQUEST_CREDENTIAL_REFRESH);
            default -> {
                // Business and informational messages are only delivered.
            }
        }

        return new Result(state, intents.build());
    }

    private Result inBandAuthRejection(ConnectionSnapshot state,
                                       MessageEnvelope envelope,
                                       Instant now,
                                       SupervisorIntents.Builder intents) {
        intents.add(CANCEL_CONNECT_TIMEOUT)
                .add(STOP_HEARTBEAT)
                .add(CLOSE_SOCKET)
                .add(EMIT_DISCONNECTED)
                .close(CloseClassifier.POLICY_VIOLATION, AUTH_ERROR_REASON);

        String detail = describe(envelope.data(), AUTH_ERROR_REASON);
        return authFailed(state.retireSocket(), "Server rejected credential: " + detail, now, intents);
    }

    // ---------------------------------------------------------------------
    // Timers
    // ---------------------------------------------------------------------

    private Result onConnectTimedOut(ConnectionSnapshot state, TimerEvent.ConnectTimedOut e) {
        if (!isCurrent(state, e.generation()) || state.state() != ConnectionState.CONNECTING) {
            return unchanged(state);
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(CLOSE_SOCKET)
                .add(EMIT_DISCONNECTED)
                .close(CloseClassifier.ABNORMAL_CLOSURE, CONNECT_TIMEOUT_REASON);

        long elapsedMillis = elapsedMillis(state, e.nowNanos());
        return abnormalClose(state.retireSocket(), CloseClassifier.ABNORMAL_CLOSURE,
                CONNECT_TIMEOUT_REASON, elapsedMillis, e.timestamp(), intents);
    }

    private Result onHeartbeatTimedOut(ConnectionSnapshot state, TimerEvent.HeartbeatTimedOut e) {
        if (!isCurrent(state, e.generation()) || state.state() != ConnectionState.CONNECTED) {
            return unchanged(state);
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder()
                .add(STOP_HEARTBEAT)
                .add(CLOSE_SOCKET)
                .add(EMIT_DISCONNECTED)
                .close(CloseClassifier.GOING_AWAY, HEARTBEAT_TIMEOUT_REASON);

        // Locally detected loss is transient by definition; it never goes
        // through close-code classification.
        return transientFailure(state.retireSocket(),
                "No pong for " + e.missedPongs() + " consecutive pings", e.timestamp(), intents);
    }

    private Result onReconnectDue(ConnectionSnapshot state, TimerEvent.ReconnectDue e) {
        if (state.state() != ConnectionState.RECONNECTING || state.credential().isEmpty()) {
            return unchanged(state);
        }

        if (e.token().isEmpty()) {
            return missingCredential(state, e.timestamp(), SupervisorIntents.builder());
        }

        Credential fresh = new Credential(e.token().get(), state.credential().get().identity());
        return openSocket(state.withCredential(fresh), fresh, e.nowNanos(), e.timestamp(),
                SupervisorIntents.builder());
    }

    // ---------------------------------------------------------------------
    // Polling
    // ---------------------------------------------------------------------

    private Result onPollRejected(ConnectionSnapshot state, PollEvent.PollRejected e) {
        if (!state.pollingActive()) {
            return unchanged(state);
        }

        SupervisorIntents.Builder intents = SupervisorIntents.builder();
        ConnectionSnapshot next = state;

        if (state.state().hasLiveSocket()) {
            // An explicit retry was in flight while polling; it uses the same rejected token.
            intents.add(CANCEL_CONNECT_TIMEOUT)
                    .add(CLOSE_SOCKET)
                    .close(CloseClassifier.NORMAL_CLOSURE, AUTH_ERROR_REASON);
            next = next.retireSocket();
        }

        return authFailed(next, "Polling rejected with HTTP " + e.status(), e.timestamp(), intents);
    }

    // ---------------------------------------------------------------------
    // Shared transitions
    // ---------------------------------------------------------------------

    private Result openSocket(ConnectionSnapshot state,
                              Credential credential,
                              long nowNanos,
                              Instant now,
                              SupervisorIntents.Builder intents) {
        URI target = config.socketUri(credential.identity());
        ConnectionSnapshot next = state
                .withNewSocket(target, nowNanos)
                .withState(ConnectionState.CONNECTING, now);

        intents.add(OPEN_SOCKET)
                .add(ARM_CONNECT_TIMEOUT)
                .generation(next.socketGeneration())
                .targetAddress(target)
                .credential(credential);

        return new Result(next, intents.build());
    }

    private Result abnormalClose(ConnectionSnapshot retired,
                                 int code,
                                 String reason,
                                 long elapsedMillis,
                                 Instant now,
                                 SupervisorIntents.Builder intents) {
        FailureKind kind = auth.classify(code, reason, elapsedMillis);
        String detail = "Socket closed (code " + code + (reason.isBlank() ? "" : ": " + reason) + ")";

        if (kind == FailureKind.AUTH_FAILURE) {
            return authFailed(retired, detail, now, intents);
        }
        return transientFailure(retired, detail, now, intents);
    }

    private Result authFailed(ConnectionSnapshot state,
                              String message,
                              Instant now,
                              SupervisorIntents.Builder intents) {
        ConnectivityError error = new ConnectivityError(ConnectivityErrorKind.AUTHENTICATION, message, now);

        if (state.pollingActive()) {
            intents.add(STOP_POLLING);
        }
        intents.add(EMIT_ERROR).error(error);

        ConnectionSnapshot next = state
                .withPollingActive(false)
                .withLastError(error)
                .withState(ConnectionState.AUTH_FAILED, now);

        return new Result(next, intents.build());
    }

    private Result transientFailure(ConnectionSnapshot state,
                                    String message,
                                    Instant now,
                                    SupervisorIntents.Builder intents) {
        int attempts = state.retry().attemptCount();

        if (reconnectPolicy.isExhausted(attempts)) {
            ConnectionSnapshot next = state;
            if (!state.pollingActive()) {
                ConnectivityError error = new ConnectivityError(
                        ConnectivityErrorKind.MAX_RETRIES_EXCEEDED,
                        "Gave up after " + attempts + " reconnect attempts; polling for updates",
                        now);
                intents.add(START_POLLING).add(EMIT_ERROR).error(error);
                next = next.withLastError(error).withPollingActive(true);
            }
            return new Result(next.withState(ConnectionState.POLLING_FALLBACK, now), intents.build());
        }

        int attempt = attempts + 1;
        Duration delay = reconnectPolicy.delayFor(attempt);
        ConnectivityError error = new ConnectivityError(ConnectivityErrorKind.TRANSIENT_NETWORK, message, now);

        intents.add(ARM_RECONNECT)
                .add(EMIT_RECONNECTING)
                .reconnect(attempt, reconnectPolicy.maxAttempts(), delay);

        ConnectionSnapshot next = state
                .withRetry(state.retry().nextAttempt(delay))
                .withLastError(error)
                .withState(ConnectionState.RECONNECTING, now);

        return new Result(next, intents.build());
    }

    private Result missingCredential(ConnectionSnapshot state, Instant now, SupervisorIntents.Builder intents) {
        ConnectivityError error = new ConnectivityError(
                ConnectivityErrorKind.MISSING_CREDENTIAL,
                "No bearer token available; waiting for credential refresh",
                now);

        intents.add(EMIT_ERROR).error(error);
        ConnectionSnapshot next = state
                .withLastError(error)
                .withState(ConnectionState.AUTH_FAILED, now);

        return new Result(next, intents.build());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Result unchanged(ConnectionSnapshot state) {
        return new Result(state, SupervisorIntents.none());
    }

    private static boolean isCurrent(ConnectionSnapshot state, long generation) {
        return state.socketGeneration() == generation;
    }

    private static long elapsedMillis(ConnectionSnapshot state, long nowNanos) {
        return Math.max(0L, (nowNanos - state.connectionStartNanos()) / 1_000_000L);
    }

    private static String describe(JsonNode data, String fallback) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return fallback;
        }
        if (data.isTextual()) {
            return data.asText();
        }
        JsonNode message = data.get("message");
        if (message != null && message.isTextual()) {
            return message.asText();
        }
        return fallback;
    }
}
