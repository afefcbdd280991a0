package com.questrail.possync.realtime.transport;

/**
 * TransportSocket
 * -----------------------------------------------------------------------------
 * One physical full-duplex text connection to the backend.
 *
 * <p>A socket is single-use: it is opened once, and after it closes a new
 * instance is created for the next attempt.</p>
 */
public interface TransportSocket
{
    /**
     * Starts the connection and handshake asynchronously. Outcome is reported
     * to the listener via {@link TransportSocketListener#onOpen()} or
     * {@link TransportSocketListener#onClose(int, String)}.
     */
    void open();

    /**
     * Queues a text frame.
     *
     * @return {@code false} if the socket is not open
     */
    boolean send(String text);

    /**
     * Closes the socket. A close frame is sent when the handshake has completed
     * and the code is one that may appear on the wire; otherwise the
     * connection is dropped. Idempotent.
     */
    void close(int code, String reason);

    boolean isOpen();
}
