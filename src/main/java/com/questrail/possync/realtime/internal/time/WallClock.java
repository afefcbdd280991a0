package com.questrail.possync.realtime.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for envelope timestamps and event payloads.
 *
 * <p>MUST NOT be used for timeouts, backoff or classification; see
 * {@link MonotonicClock}.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();

    /**
     * Wall clock backed by {@link Instant#now()}.
     */
    WallClock SYSTEM = Instant::now;
}
