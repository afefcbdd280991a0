package com.questrail.possync.realtime.time;

import com.questrail.possync.realtime.internal.time.Cancellable;
import com.questrail.possync.realtime.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} or {@link #advance(Duration)}
 * is called. Tasks with equal deadlines run in scheduling order.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private static final Duration STEP = Duration.ofMillis(100);

    private final ManualMonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    @Override
    public ManualMonotonicClock clock() {
        return clock;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        while (!queue.isEmpty() && queue.peek().deadlineNanos <= clock.nowNanos()) {
            Scheduled next = queue.poll();
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
    }

    /**
     * Advance the clock in 100 ms steps, running due tasks at each step, so
     * tasks fire at (close to) their own deadlines rather than all at the end.
     */
    public void advance(Duration duration) {
        Duration remaining = duration;
        while (remaining.compareTo(Duration.ZERO) > 0) {
            Duration step = remaining.compareTo(STEP) < 0 ? remaining : STEP;
            clock.advance(step);
            runDueTasks();
            remaining = remaining.minus(step);
        }
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * Number of armed, not yet cancelled tasks.
     */
    public int pendingTaskCount() {
        return (int) queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.sequence, o.sequence);
        }
    }
}
