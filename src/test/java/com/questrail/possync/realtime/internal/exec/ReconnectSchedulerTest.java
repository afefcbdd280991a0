package com.questrail.possync.realtime.internal.exec;

import com.questrail.possync.realtime.time.DeterministicScheduler;
import com.questrail.possync.realtime.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectSchedulerTest {

    private DeterministicScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new DeterministicScheduler(new ManualMonotonicClock());
    }

    @Test
    void firesOnceAfterDelay() {
        ReconnectScheduler reconnect = new ReconnectScheduler(scheduler, 0.0, () -> 0.5);
        AtomicInteger fired = new AtomicInteger();

        Duration effective = reconnect.arm(Duration.ofSeconds(5), fired::incrementAndGet);

        assertEquals(Duration.ofSeconds(5), effective);
        assertTrue(reconnect.isArmed());

        scheduler.advanceMillis(4_900);
        assertEquals(0, fired.get());

        scheduler.advanceMillis(100);
        assertEquals(1, fired.get());
        assertFalse(reconnect.isArmed());

        scheduler.advanceMillis(60_000);
        assertEquals(1, fired.get());
    }

    @Test
    void armingAgainReplacesPendingTimer() {
        ReconnectScheduler reconnect = new ReconnectScheduler(scheduler, 0.0, () -> 0.5);
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();

        reconnect.arm(Duration.ofSeconds(5), first::incrementAndGet);
        reconnect.arm(Duration.ofSeconds(10), second::incrementAndGet);

        scheduler.advanceMillis(10_000);

        assertEquals(0, first.get());
        assertEquals(1, second.get());
        assertEquals(0, scheduler.pendingTaskCount());
    }

    @Test
    void cancelPreventsFiring() {
        ReconnectScheduler reconnect = new ReconnectScheduler(scheduler, 0.0, () -> 0.5);
        AtomicInteger fired = new AtomicInteger();

        reconnect.arm(Duration.ofSeconds(5), fired::incrementAndGet);
        reconnect.cancel();

        scheduler.advanceMillis(10_000);

        assertEquals(0, fired.get());
        assertFalse(reconnect.isArmed());
        assertEquals(0, scheduler.pendingTaskCount());
    }

    @Test
    void jitterStaysWithinFactor() {
        ReconnectScheduler low = new ReconnectScheduler(scheduler, 0.3, () -> 0.0);
        ReconnectScheduler high = new ReconnectScheduler(scheduler, 0.3, () -> 1.0);
        ReconnectScheduler middle = new ReconnectScheduler(scheduler, 0.3, () -> 0.5);

        assertEquals(Duration.ofMillis(7_000), low.applyJitter(Duration.ofSeconds(10)));
        assertEquals(Duration.ofMillis(13_000), high.applyJitter(Duration.ofSeconds(10)));
        assertEquals(Duration.ofMillis(10_000), middle.applyJitter(Duration.ofSeconds(10)));
    }

    @Test
    void rejectsJitterOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new ReconnectScheduler(scheduler, 1.0, () -> 0.5));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectScheduler(scheduler, -0.1, () -> 0.5));
    }
}
