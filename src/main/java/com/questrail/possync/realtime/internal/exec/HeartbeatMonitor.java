package com.questrail.possync.realtime.internal.exec;

import com.questrail.possync.realtime.internal.time.Cancellable;
import com.questrail.possync.realtime.internal.time.MonotonicScheduler;

import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * HeartbeatMonitor
 * =============================================================================
 * Keeps an open connection observably alive.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Sends a ping every {@code heartbeatInterval}, first one an interval
 *       after {@link #start}.</li>
 *   <li>When pong supervision is enabled, each ping arms a
 *       {@code pongTimeout} deadline. A pong received before the deadline
 *       clears the missed count.</li>
 *   <li>After {@code maxMissedPongs} consecutive misses the monitor stops
 *       itself and reports the loss once.</li>
 * </ul>
 *
 * <h2>Staleness</h2>
 * Every {@link #start} and {@link #stop} advances an epoch; timer callbacks
 * from an earlier epoch do nothing. This keeps a late tick from a previous
 * connection from pinging or timing out the current one.
 */
public final class HeartbeatMonitor
{
    private final MonotonicScheduler scheduler;
    private final ConnectivityTimingPolicy timing;

    private long epoch;
    private boolean running;
    private boolean awaitingPong;
    private int missedPongs;
    private Runnable sendPing = () -> {};
    private IntConsumer onTimeout = missed -> {};

    private Cancellable nextPing = Cancellable.NONE;
    private Cancellable pongDeadline = Cancellable.NONE;

    public HeartbeatMonitor(MonotonicScheduler scheduler, ConnectivityTimingPolicy timing)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timing = Objects.requireNonNull(timing, "timing");
    }

    /**
     * Starts (or restarts) the heartbeat.
     *
     * @param sendPing  sends one ping message
     * @param onTimeout receives the missed-pong count when the connection is declared dead
     */
    public synchronized void start(Runnable sendPing, IntConsumer onTimeout)
    {
        Objects.requireNonNull(sendPing, "sendPing");
        Objects.requireNonNull(onTimeout, "onTimeout");

        stop();

        this.sendPing = sendPing;
        this.onTimeout = onTimeout;
        this.running = true;
        scheduleNextPing(epoch);
    }

    public synchronized void stop()
    {
        epoch++;
        running = false;
        awaitingPong = false;
        missedPongs = 0;
        nextPing.cancel();
        pongDeadline.cancel();
        nextPing = Cancellable.NONE;
        pongDeadline = Cancellable.NONE;
    }

    public synchronized void pongReceived()
    {
        if (!running) {
            return;
        }
        awaitingPong = false;
        missedPongs = 0;
        pongDeadline.cancel();
        pongDeadline = Cancellable.NONE;
    }

    public synchronized boolean isRunning()
    {
        return running;
    }

    public synchronized int missedPongs()
    {
        return missedPongs;
    }

    private void scheduleNextPing(long forEpoch)
    {
        nextPing = scheduler.scheduleAfter(timing.heartbeatInterval(), () -> onPingDue(forEpoch));
    }

    private void onPingDue(long forEpoch)
    {
        Runnable ping;
        synchronized (this) {
            if (forEpoch != epoch || !running) {
                return;
            }
            ping = sendPing;
            scheduleNextPing(forEpoch);

            // pongTimeout < heartbeatInterval, so the previous deadline has always resolved here.
            if (timing.pongSupervisionEnabled()) {
                awaitingPong = true;
                pongDeadline = scheduler.scheduleAfter(timing.pongTimeout(), () -> onPongDeadline(forEpoch));
            }
        }
        ping.run();
    }

    private void onPongDeadline(long forEpoch)
    {
        IntConsumer timeout;
        int missed;
        synchronized (this) {
            if (forEpoch != epoch || !running || !awaitingPong) {
                return;
            }
            awaitingPong = false;
            pongDeadline = Cancellable.NONE;
            missedPongs++;
            if (missedPongs < timing.maxMissedPongs()) {
                return;
            }
            missed = missedPongs;
            timeout = onTimeout;
            stop();
        }
        timeout.accept(missed);
    }
}
