package com.questrail.possync.realtime.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * EventLoopScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} and serial {@link Executor} backed by a
 * single-threaded {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>The same thread runs timer tasks and every submitted event, which gives
 * the supervisor its single logical thread of control: socket callbacks, poll
 * completions and timers are all marshalled here and never interleave.</p>
 *
 * <p>Monotonic deadlines are converted to relative delays at scheduling time
 * using {@link #clock()}; a deadline in the past runs as soon as possible.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> shut down the underlying executor.
 * The composition root that created it is responsible for that.</p>
 *
 * <h2>After shutdown</h2>
 * <p>Transport and HTTP threads may still deliver callbacks once the owner
 * has shut the executor down. Such tasks and timers are dropped with a debug
 * log instead of throwing {@link RejectedExecutionException} into the caller's
 * thread.</p>
 */
public final class EventLoopScheduler implements MonotonicScheduler, Executor
{
    private static final Logger log = LoggerFactory.getLogger(EventLoopScheduler.class);

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    /**
     * @param executor a single-threaded scheduled executor
     * @param clock    clock used for delay conversion
     */
    public EventLoopScheduler(ScheduledExecutorService executor, MonotonicClock clock)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future;
        try {
            future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        }
        catch (RejectedExecutionException e) {
            dropped("timer", e);
            return Cancellable.NONE;
        }

        // mayInterruptIfRunning=false: a task already running completes normally.
        return () -> future.cancel(false);
    }

    @Override
    public MonotonicClock clock()
    {
        return clock;
    }

    @Override
    public void execute(Runnable command)
    {
        Objects.requireNonNull(command, "command");
        try {
            executor.execute(command);
        }
        catch (RejectedExecutionException e) {
            dropped("task", e);
        }
    }

    private void dropped(String what, RejectedExecutionException e)
    {
        if (!executor.isShutdown()) {
            throw e;
        }
        log.debug("Event loop is shut down; dropping {}", what);
    }
}
