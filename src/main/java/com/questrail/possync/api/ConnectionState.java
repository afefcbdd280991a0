package com.questrail.possync.api;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Lifecycle state of a single realtime connection as seen by its owner.
 *
 * <h2>Purpose</h2>
 * The state is the pull-based half of connectivity observability: UI code may
 * poll it (or the richer {@link ConnectionStatus}) to render a connectivity
 * banner without registering listeners or handling exceptions.
 *
 * <h2>Typical progression</h2>
 * <pre>
 *   DISCONNECTED → CONNECTING → AUTHENTICATING → CONNECTED
 *                                                   ↓
 *                     RECONNECTING | AUTH_FAILED | POLLING_FALLBACK
 *                                                   ↓
 *                                                 CLOSED
 * </pre>
 *
 * Exactly one state is current per connection owner. Transitions are
 * performed only by the connection supervisor.
 */
public enum ConnectionState
{
    /**
     * No connection has been requested yet, or the server closed the socket
     * normally (close code 1000).
     */
    DISCONNECTED,

    /**
     * A socket has been created and its handshake is in flight. A connection
     * timeout is armed.
     */
    CONNECTING,

    /**
     * The socket opened and the in-band authenticate message is being sent.
     * This state is transient; it is not a gate.
     */
    AUTHENTICATING,

    /**
     * The socket is open, the heartbeat is running and business events are
     * subscribed.
     */
    CONNECTED,

    /**
     * A transient failure occurred and a backed-off reconnect attempt is
     * scheduled.
     */
    RECONNECTING,

    /**
     * The backend rejected the credential. No reconnect is scheduled until a
     * credential refresh signal arrives.
     */
    AUTH_FAILED,

    /**
     * Reconnect attempts are exhausted; events are fetched by periodic REST
     * polling instead of the socket.
     */
    POLLING_FALLBACK,

    /**
     * The owner called {@code disconnect()}. All timers are cancelled and no
     * automatic reconnection happens until {@code connect()} is called again.
     */
    CLOSED;

    /**
     * Returns {@code true} while a transport socket is live or being opened.
     */
    public boolean hasLiveSocket()
    {
        return this == CONNECTING || this == AUTHENTICATING || this == CONNECTED;
    }
}
