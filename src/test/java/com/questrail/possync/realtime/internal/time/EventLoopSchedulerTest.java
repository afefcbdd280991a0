package com.questrail.possync.realtime.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventLoopSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production event loop.
 *
 * Note: These tests use real time. Tolerances are set generously to avoid
 * false failures on loaded machines.
 */
class EventLoopSchedulerTest {

    private ScheduledExecutorService executor;
    private EventLoopScheduler loop;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        loop = new EventLoopScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = System.nanoTime();

        loop.scheduleAfter(Duration.ofMillis(50), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "Task should execute");
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(45));
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        loop.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(100, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = loop.scheduleAfter(Duration.ofMillis(100), () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        Thread.sleep(150);

        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void submittedTasksRunInOrderOnOneThread() throws InterruptedException {
        List<Integer> order = new CopyOnWriteArrayList<>();
        List<Thread> threads = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);

        for (int i = 1; i <= 3; i++) {
            int n = i;
            loop.execute(() -> {
                order.add(n);
                threads.add(Thread.currentThread());
                latch.countDown();
            });
        }

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        assertEquals(List.of(1, 2, 3), order);
        assertEquals(1, threads.stream().distinct().count());
    }

    @Test
    void timersAndSubmittedTasksShareTheLoopThread() throws InterruptedException {
        List<Thread> threads = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);

        loop.scheduleAfter(Duration.ofMillis(10), () -> {
            threads.add(Thread.currentThread());
            latch.countDown();
        });
        loop.execute(() -> {
            threads.add(Thread.currentThread());
            latch.countDown();
        });

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        assertSame(threads.get(0), threads.get(1));
    }

    @Test
    void workArrivingAfterShutdownIsDropped() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);
        executor.shutdown();

        assertDoesNotThrow(() -> loop.execute(() -> executed.set(true)));
        Cancellable handle = assertDoesNotThrow(() -> loop.scheduleAfter(Duration.ofMillis(10), () -> executed.set(true)));

        assertTrue(executor.awaitTermination(500, TimeUnit.MILLISECONDS));
        assertFalse(handle.cancel());
        assertFalse(executed.get());
    }
}
