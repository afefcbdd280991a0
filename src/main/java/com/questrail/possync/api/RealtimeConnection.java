package com.questrail.possync.api;

/**
 * RealtimeConnection
 * -----------------------------------------------------------------------------
 * {@code RealtimeConnection} is the façade through which a point-of-sale
 * application keeps itself synchronized with the order/event backend.
 *
 * <h2>Core Responsibilities</h2>
 * An implementation is responsible for:
 * <ul>
 *   <li>Owning exactly one logical connection and its lifecycle state</li>
 *   <li>Authenticating the connection with the current bearer credential</li>
 *   <li>Recovering from transient failures without a retry storm against an
 *       expired credential</li>
 *   <li>Delivering business events to subscribers regardless of whether the
 *       socket or the polling fallback produced them</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Refreshing credentials (it only consumes a refresh signal)</li>
 *   <li>Queueing outbound business requests while offline</li>
 *   <li>Interpreting business payloads</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * Apart from the precondition failures of {@link #connect(ConnectOptions)}, no
 * connectivity failure is thrown to the caller. Failures are published on the
 * {@link EventChannels#ERROR} channel and reflected in {@link #getStatus()}.
 *
 * <h2>Threading</h2>
 * All methods may be called from any thread. Listener callbacks are delivered
 * serially on the connection's event loop.
 */
public interface RealtimeConnection
{
    /**
     * Starts (or restarts) the socket path.
     *
     * <p>A call while a socket is already live is a no-op. A call while a
     * reconnect is pending, while parked after an authentication failure, or
     * while the polling fallback is active retries the socket path at once.</p>
     *
     * @param options per-call overrides; {@link ConnectOptions#defaults()} for none
     * @throws MissingIdentityException   if no user identity resolves
     * @throws MissingCredentialException if no non-empty bearer token is available
     */
    void connect(ConnectOptions options);

    /**
     * Equivalent to {@code connect(ConnectOptions.defaults())}.
     */
    default void connect()
    {
        connect(ConnectOptions.defaults());
    }

    /**
     * Cancels every timer, closes any socket normally and stops the polling
     * fallback. Automatic reconnection stays disabled until the next
     * {@link #connect(ConnectOptions)}.
     */
    void disconnect();

    /**
     * Signal from the external token manager that a new credential is
     * available. Carries no payload; the new credential is fetched from the
     * credential source.
     *
     * <p>A pending reconnect, or a connection parked after an authentication
     * failure, retries at once. A connected socket is closed normally and
     * replaced by one opened with the new token. While polling, the next poll
     * uses it.</p>
     */
    void credentialRefreshed();

    /**
     * Signal from the platform's reachability monitor.
     *
     * <p>Losing the network while connected closes the socket and enters the
     * reconnect path without waiting for the transport to notice. Regaining
     * it while a reconnect is pending or while polling retries the socket at
     * once. Other states ignore the signal.</p>
     */
    void networkAvailabilityChanged(boolean available);

    /**
     * Sends an application message over the socket.
     *
     * @return {@code true} if the message was handed to the socket; {@code false}
     *         (with a logged warning) when not connected
     */
    boolean send(String type, Object data);

    /**
     * Registers a listener for one channel. Subscriptions survive reconnects.
     */
    Subscription subscribe(String channel, EventListener listener);

    /**
     * Removes a previously registered listener.
     */
    void unsubscribe(String channel, EventListener listener);

    ConnectionState getState();

    ConnectionStatus getStatus();
}
