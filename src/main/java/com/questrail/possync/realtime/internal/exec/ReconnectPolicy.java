package com.questrail.possync.realtime.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * ReconnectPolicy
 * -----------------------------------------------------------------------------
 * Pure backoff arithmetic for reconnect attempts.
 *
 * <pre>
 *   delayFor(n) = min(baseDelay * 2^(n-1), capDelay)      n &gt;= 1
 * </pre>
 *
 * With the defaults (5s base, 30s cap, 5 attempts) the delays are
 * 5s, 10s, 20s, 30s, 30s. Jitter is not part of this calculation; it is applied
 * by {@link ReconnectScheduler} when a timer is armed.
 */
public record ReconnectPolicy(
        Duration baseDelay,
        Duration capDelay,
        int maxAttempts,
        double jitterFactor
) {
    public ReconnectPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(capDelay, "capDelay");

        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (capDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("capDelay must be >= baseDelay");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (jitterFactor < 0.0 || jitterFactor >= 1.0 || Double.isNaN(jitterFactor)) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
    }

    public static ReconnectPolicy defaults()
    {
        return new ReconnectPolicy(Duration.ofSeconds(5), Duration.ofSeconds(30), 5, 0.0);
    }

    /**
     * Nominal delay before the given attempt.
     *
     * @param attempt 1-based attempt number
     */
    public Duration delayFor(int attempt)
    {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }

        long base = baseDelay.toMillis();
        long cap = capDelay.toMillis();

        // Doubling past 2^62 overflows; anything that large is capped anyway.
        int shift = Math.min(attempt - 1, 62);
        long multiplier = 1L << shift;
        long delay = base > cap / multiplier ? cap : Math.min(base * multiplier, cap);

        return Duration.ofMillis(delay);
    }

    /**
     * {@code true} once {@code attemptCount} attempts have been spent.
     */
    public boolean isExhausted(int attemptCount)
    {
        return attemptCount >= maxAttempts;
    }

    public ReconnectPolicy withJitterFactor(double jitterFactor)
    {
        return new ReconnectPolicy(baseDelay, capDelay, maxAttempts, jitterFactor);
    }
}
