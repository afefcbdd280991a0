package com.questrail.possync.realtime.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * ConnectivityTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the executor layer.
 *
 * <p>This is <em>operational only</em>: it controls timer windows and cadence.
 * Whether to retry, park or fall back is decided by the reducer.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: how long a socket may stay in its handshake
 *       before it is abandoned as an abnormal closure.</li>
 *   <li><b>heartbeatInterval</b>: spacing of outbound {@code ping} messages
 *       while connected.</li>
 *   <li><b>pongTimeout</b>: how long after a ping a {@code pong} must arrive
 *       before the ping counts as missed.</li>
 *   <li><b>maxMissedPongs</b>: consecutive missed pongs that declare the
 *       connection dead. Zero disables pong supervision.</li>
 *   <li><b>pollingInterval</b>: spacing of REST polls while in fallback.</li>
 *   <li><b>quickFailureThreshold</b>: an abnormal closure with no reason
 *       within this window of the open attempt is taken as a silent auth
 *       rejection.</li>
 * </ul>
 */
public record ConnectivityTimingPolicy(
        Duration connectTimeout,
        Duration heartbeatInterval,
        Duration pongTimeout,
        int maxMissedPongs,
        Duration pollingInterval,
        Duration quickFailureThreshold
) {
    public ConnectivityTimingPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(pongTimeout, "pongTimeout");
        Objects.requireNonNull(pollingInterval, "pollingInterval");
        Objects.requireNonNull(quickFailureThreshold, "quickFailureThreshold");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (pongTimeout.isNegative() || pongTimeout.isZero()) {
            throw new IllegalArgumentException("pongTimeout must be positive");
        }
        if (pongTimeout.compareTo(heartbeatInterval) >= 0) {
            throw new IllegalArgumentException("pongTimeout must be shorter than heartbeatInterval");
        }
        if (maxMissedPongs < 0) {
            throw new IllegalArgumentException("maxMissedPongs must be >= 0");
        }
        if (pollingInterval.isNegative() || pollingInterval.isZero()) {
            throw new IllegalArgumentException("pollingInterval must be positive");
        }
        if (quickFailureThreshold.isNegative()) {
            throw new IllegalArgumentException("quickFailureThreshold must be non-negative");
        }
    }

    /**
     * Defaults used by the POS terminal:
     * <ul>
     *   <li>connectTimeout: 10s</li>
     *   <li>heartbeatInterval: 30s</li>
     *   <li>pongTimeout: 5s</li>
     *   <li>maxMissedPongs: 3</li>
     *   <li>pollingInterval: 5s</li>
     *   <li>quickFailureThreshold: 2s</li>
     * </ul>
     */
    public static ConnectivityTimingPolicy defaults()
    {
        return new ConnectivityTimingPolicy(
                Duration.ofSeconds(10),
                Duration.ofSeconds(30),
                Duration.ofSeconds(5),
                3,
                Duration.ofSeconds(5),
                Duration.ofSeconds(2)
        );
    }

    public boolean pongSupervisionEnabled()
    {
        return maxMissedPongs > 0;
    }

    public ConnectivityTimingPolicy withMaxMissedPongs(int maxMissedPongs)
    {
        return new ConnectivityTimingPolicy(connectTimeout, heartbeatInterval, pongTimeout,
                maxMissedPongs, pollingInterval, quickFailureThreshold);
    }

    public ConnectivityTimingPolicy withPollingInterval(Duration pollingInterval)
    {
        return new ConnectivityTimingPolicy(connectTimeout, heartbeatInterval, pongTimeout,
                maxMissedPongs, pollingInterval, quickFailureThreshold);
    }

    public ConnectivityTimingPolicy withConnectTimeout(Duration connectTimeout)
    {
        return new ConnectivityTimingPolicy(connectTimeout, heartbeatInterval, pongTimeout,
                maxMissedPongs, pollingInterval, quickFailureThreshold);
    }
}
