package com.questrail.possync.realtime.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision of the connection supervisor:
 * timer deadlines, backoff spacing, and the elapsed time used to classify a
 * closure as a rejection-on-connect.
 *
 * <p>Wall-clock time may jump (NTP, manual changes on a handheld terminal) and
 * is used only for message and event timestamps.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds. Only
     * differences between values are meaningful.
     */
    long nowNanos();
}
