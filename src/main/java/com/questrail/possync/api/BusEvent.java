package com.questrail.possync.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A single event delivered to bus listeners.
 *
 * <p>Lifecycle channels carry supervisor-defined payloads
 * ({@link ConnectivityError} on {@code error}, maps on {@code connected},
 * {@code disconnected} and {@code reconnecting}). Business channels carry the
 * inbound message envelope.</p>
 *
 * @param type      channel name the event was emitted on
 * @param payload   channel-specific payload, may be {@code null}
 * @param source    where the event originated
 * @param timestamp wall-clock emit time (observational only)
 */
public record BusEvent(
        String type,
        Object payload,
        EventSource source,
        Instant timestamp
) {
    public BusEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Returns the payload cast to the requested type.
     *
     * @throws ClassCastException if the payload is of a different type
     */
    public <T> T payloadAs(Class<T> type)
    {
        return type.cast(payload);
    }
}
