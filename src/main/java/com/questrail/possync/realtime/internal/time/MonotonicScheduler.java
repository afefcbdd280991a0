package com.questrail.possync.realtime.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timer surface used by the heartbeat monitor, the reconnect scheduler, the
 * polling fallback and the connection timeout.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in ticks of {@link #clock()}. Tasks run on the
 * connection's event loop, never concurrently with each other or with event
 * processing.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in ticks of {@link #clock()}
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * The clock deadlines are measured against.
     */
    MonotonicClock clock();

    /**
     * Schedule a task to run after a relative delay.
     */
    default Cancellable scheduleAfter(Duration delay, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock().nowNanos() + delay.toNanos(), task);
    }
}
