package com.questrail.possync.api;

import java.net.URI;
import java.util.Objects;

/**
 * Payload of the {@link EventChannels#CONNECTED} channel.
 *
 * @param address  socket address that was opened
 * @param tenantId restaurant the connection is scoped to
 */
public record ConnectedNotice(URI address, String tenantId)
{
    public ConnectedNotice {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(tenantId, "tenantId");
    }
}
