package com.questrail.possync.realtime.transport;

import java.net.URI;
import java.util.List;

/**
 * Creates unopened {@link TransportSocket}s.
 */
@FunctionalInterface
public interface TransportSocketFactory
{
    /**
     * @param address      {@code ws://} or {@code wss://} address
     * @param subprotocols handshake subprotocols, in preference order
     * @param listener     receives this socket's callbacks
     */
    TransportSocket create(URI address, List<String> subprotocols, TransportSocketListener listener);
}
