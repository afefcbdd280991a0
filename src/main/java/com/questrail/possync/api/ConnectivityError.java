package com.questrail.possync.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Payload published on the {@code error} channel.
 *
 * @param kind      error classification
 * @param message   human-readable detail, never {@code null}
 * @param timestamp wall-clock time the error was observed (observational only)
 */
public record ConnectivityError(
        ConnectivityErrorKind kind,
        String message,
        Instant timestamp
) {
    public ConnectivityError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        message = message == null ? "" : message;
    }
}
