package com.questrail.possync.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Payload of the {@link EventChannels#RECONNECTING} channel.
 *
 * @param attempt     1-based attempt number
 * @param maxAttempts attempts allowed before polling takes over
 * @param delay       delay until this attempt
 */
public record ReconnectNotice(int attempt, int maxAttempts, Duration delay)
{
    public ReconnectNotice {
        Objects.requireNonNull(delay, "delay");
    }
}
