package com.questrail.possync.realtime.internal.exec;

import com.questrail.possync.realtime.internal.time.Cancellable;
import com.questrail.possync.realtime.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * ReconnectScheduler
 * -----------------------------------------------------------------------------
 * Single-flight, cancellable reconnect timer.
 *
 * <ul>
 *   <li>At most one timer is armed; arming cancels the previous one.</li>
 *   <li>A firing that raced with {@link #cancel()} or a re-arm is ignored
 *       (sequence guard).</li>
 *   <li>Jitter scales the nominal delay by {@code 1 ± jitterFactor·r} at arm
 *       time, so reconnect storms from many terminals spread out.</li>
 * </ul>
 *
 * Whether to reconnect, and after which nominal delay, is decided by the
 * reducer using {@link ReconnectPolicy}.
 */
public final class ReconnectScheduler
{
    private final MonotonicScheduler scheduler;
    private final double jitterFactor;
    private final DoubleSupplier random;

    private long sequence;
    private volatile long armedSequence = -1;
    private volatile Cancellable armed = Cancellable.NONE;

    /**
     * @param scheduler    timer source
     * @param jitterFactor fraction in [0, 1); 0 disables jitter
     * @param random       uniform source in [0, 1)
     */
    public ReconnectScheduler(MonotonicScheduler scheduler, double jitterFactor, DoubleSupplier random)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.random = Objects.requireNonNull(random, "random");
        if (jitterFactor < 0.0 || jitterFactor >= 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        this.jitterFactor = jitterFactor;
    }

    /**
     * Arms the timer.
     *
     * @return the effective delay after jitter
     */
    public Duration arm(Duration nominalDelay, Runnable onDue)
    {
        Objects.requireNonNull(nominalDelay, "nominalDelay");
        Objects.requireNonNull(onDue, "onDue");

        cancel();

        Duration effective = applyJitter(nominalDelay);
        long seq = ++sequence;
        armedSequence = seq;
        armed = scheduler.scheduleAfter(effective, () -> fire(seq, onDue));
        return effective;
    }

    public void cancel()
    {
        Cancellable prior = armed;
        armed = Cancellable.NONE;
        armedSequence = -1;
        prior.cancel();
    }

    public boolean isArmed()
    {
        return armedSequence != -1;
    }

    private void fire(long seq, Runnable onDue)
    {
        if (seq != armedSequence) {
            return;
        }
        armedSequence = -1;
        armed = Cancellable.NONE;
        onDue.run();
    }

    Duration applyJitter(Duration nominal)
    {
        if (jitterFactor == 0.0) {
            return nominal;
        }
        double spread = (random.getAsDouble() * 2.0 - 1.0) * jitterFactor;
        long millis = Math.round(nominal.toMillis() * (1.0 + spread));
        return Duration.ofMillis(Math.max(0L, millis));
    }
}
