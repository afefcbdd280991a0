package com.questrail.possync.realtime.transport;

/**
 * TransportSocketListener
 * -----------------------------------------------------------------------------
 * Callback sink for a {@link TransportSocket}.
 *
 * <p>Callbacks for one socket are serialized. {@link #onClose(int, String)} is
 * delivered exactly once per socket, including after a locally requested
 * close and after a failed handshake.</p>
 */
public interface TransportSocketListener
{
    /**
     * The handshake completed and the socket can carry messages.
     */
    void onOpen();

    /**
     * A complete text message arrived.
     */
    void onMessage(String text);

    /**
     * The socket is gone.
     *
     * @param code   close code from the peer's close frame, or 1006 when the
     *               connection dropped without one
     * @param reason close reason; empty when none was given
     */
    void onClose(int code, String reason);

    /**
     * A transport error occurred. Diagnostic only; {@link #onClose(int, String)}
     * follows.
     */
    void onError(Throwable cause);
}
