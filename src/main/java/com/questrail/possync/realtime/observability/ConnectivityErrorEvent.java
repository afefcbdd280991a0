package com.questrail.possync.realtime.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the connectivity stack.
 */
public record ConnectivityErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
