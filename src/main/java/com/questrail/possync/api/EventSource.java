package com.questrail.possync.api;

/**
 * Origin of an event published on the bus.
 *
 * <p>Business consumers normally ignore this; it exists so diagnostics can
 * tell a socket-delivered update from one fetched by the polling fallback.</p>
 */
public enum EventSource
{
    /** Delivered by the realtime socket. */
    SOCKET,

    /** Fetched by the REST polling fallback. */
    POLLING,

    /** Produced locally by the connection supervisor (lifecycle events). */
    SUPERVISOR
}
