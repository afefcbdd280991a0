package com.questrail.possync.realtime.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Tests use a manually advanced clock instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock
{
    INSTANCE;

    @Override
    public long nowNanos()
    {
        return System.nanoTime();
    }
}
