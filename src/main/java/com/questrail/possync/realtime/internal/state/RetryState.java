package com.questrail.possync.realtime.internal.state;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnect bookkeeping for the current failure episode.
 *
 * <p>{@code attemptCount} only grows within an episode. It returns to zero when
 * a socket reaches CONNECTED and when the owner disconnects.</p>
 *
 * @param attemptCount reconnect attempts scheduled so far
 * @param lastDelay    nominal delay of the most recent attempt
 */
public record RetryState(int attemptCount, Duration lastDelay)
{
    private static final RetryState NONE = new RetryState(0, Duration.ZERO);

    public RetryState {
        Objects.requireNonNull(lastDelay, "lastDelay");
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be >= 0");
        }
    }

    public static RetryState none() {
        return NONE;
    }

    public RetryState nextAttempt(Duration delay) {
        return new RetryState(attemptCount + 1, delay);
    }
}
