package com.questrail.possync.api;

/**
 * Names of the lifecycle channels published by a realtime connection.
 *
 * <p>Business channels use the backend's message type names directly
 * (e.g. {@code order.created}).</p>
 */
public final class EventChannels
{
    public static final String CONNECTED = "connected";
    public static final String DISCONNECTED = "disconnected";
    public static final String ERROR = "error";
    public static final String RECONNECTING = "reconnecting";

    /** Every inbound envelope, regardless of type. */
    public static final String MESSAGE = "message";

    private EventChannels() {}
}
