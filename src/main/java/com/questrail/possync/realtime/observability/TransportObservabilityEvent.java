package com.questrail.possync.realtime.observability;

import java.time.Instant;

/**
 * Record representing socket or polling activity.
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    long generation,
    String detail
) {
    public enum Kind {
        SOCKET_OPENING,
        SOCKET_OPENED,
        SOCKET_CLOSED,
        POLLING_STARTED,
        POLLING_STOPPED,
        POLL_COMPLETED
    }
}
