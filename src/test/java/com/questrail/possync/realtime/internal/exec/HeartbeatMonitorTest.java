package com.questrail.possync.realtime.internal.exec;

import com.questrail.possync.realtime.time.DeterministicScheduler;
import com.questrail.possync.realtime.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HeartbeatMonitorTest
 * -----------------------------------------------------------------------------
 * Timeline with the default policy: pings at 30 s, 60 s, 90 s; each arms a
 * 5 s pong deadline; the third consecutive miss (95 s) reports a timeout.
 */
class HeartbeatMonitorTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private HeartbeatMonitor monitor;

    private List<Long> pingTimesMillis;
    private List<Integer> timeouts;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        monitor = new HeartbeatMonitor(scheduler, ConnectivityTimingPolicy.defaults());
        pingTimesMillis = new ArrayList<>();
        timeouts = new ArrayList<>();
    }

    private void start() {
        monitor.start(() -> pingTimesMillis.add(clock.elapsed().toMillis()), timeouts::add);
    }

    @Test
    void pingsEveryInterval() {
        start();

        scheduler.advanceMillis(29_900);
        assertTrue(pingTimesMillis.isEmpty());

        scheduler.advanceMillis(100);
        assertEquals(List.of(30_000L), pingTimesMillis);

        monitor.pongReceived();
        scheduler.advanceMillis(30_000);
        assertEquals(List.of(30_000L, 60_000L), pingTimesMillis);
    }

    @Test
    void threeMissedPongsReportTimeoutAndStop() {
        start();

        scheduler.advanceMillis(94_900);
        assertTrue(timeouts.isEmpty());
        assertEquals(2, monitor.missedPongs());

        scheduler.advanceMillis(100);
        assertEquals(List.of(3), timeouts);
        assertFalse(monitor.isRunning());
        assertEquals(0, scheduler.pendingTaskCount());
    }

    @Test
    void pongResetsMissedCount() {
        start();

        scheduler.advanceMillis(65_000);
        assertEquals(2, monitor.missedPongs());

        scheduler.advanceMillis(25_000);
        monitor.pongReceived();
        assertEquals(0, monitor.missedPongs());

        scheduler.advanceMillis(60_000);
        assertTrue(timeouts.isEmpty());
        assertTrue(monitor.isRunning());
    }

    @Test
    void disabledSupervisionNeverTimesOut() {
        monitor = new HeartbeatMonitor(scheduler, ConnectivityTimingPolicy.defaults().withMaxMissedPongs(0));
        start();

        scheduler.advanceMillis(600_000);

        assertEquals(20, pingTimesMillis.size());
        assertTrue(timeouts.isEmpty());
    }

    @Test
    void stopCancelsEverything() {
        start();
        scheduler.advanceMillis(31_000);

        monitor.stop();

        assertEquals(0, scheduler.pendingTaskCount());
        scheduler.advanceMillis(300_000);
        assertEquals(1, pingTimesMillis.size());
        assertTrue(timeouts.isEmpty());
    }

    @Test
    void restartDiscardsPreviousRun() {
        AtomicInteger oldPings = new AtomicInteger();
        monitor.start(oldPings::incrementAndGet, timeouts::add);
        scheduler.advanceMillis(10_000);

        start();
        scheduler.advanceMillis(30_000);

        assertEquals(0, oldPings.get());
        assertEquals(List.of(40_000L), pingTimesMillis);
    }
}
