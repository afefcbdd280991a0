package com.questrail.possync.realtime.internal.time;

/**
 * Cancellation handle for a timer armed by the connection supervisor.
 *
 * <p>Every timer the supervisor arms (connection timeout, heartbeat, pong
 * deadline, reconnect delay, polling interval) is held through one of these
 * and cancelled on every exit from the state that armed it.</p>
 */
public interface Cancellable
{
    /**
     * Handle for "nothing armed". Cancelling it is a no-op.
     */
    Cancellable NONE = () -> false;

    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if this call prevented the task from running;
     *         {@code false} if it already ran or was already cancelled
     */
    boolean cancel();
}
