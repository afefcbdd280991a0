package com.questrail.possync.realtime.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectPolicyTest {

    @Test
    void defaultDelaysDoubleUntilCapped() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        List<Long> delays = IntStream.rangeClosed(1, 5)
                .mapToObj(policy::delayFor)
                .map(Duration::toMillis)
                .toList();

        assertEquals(List.of(5_000L, 10_000L, 20_000L, 30_000L, 30_000L), delays);
    }

    @Test
    void veryLargeAttemptStaysAtCap() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertEquals(Duration.ofSeconds(30), policy.delayFor(64));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(Integer.MAX_VALUE));
    }

    @Test
    void exhaustedOnceAttemptsReachCeiling() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertFalse(policy.isExhausted(0));
        assertFalse(policy.isExhausted(4));
        assertTrue(policy.isExhausted(5));
        assertTrue(policy.isExhausted(6));
    }

    @Test
    void attemptNumbersStartAtOne() {
        assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.defaults().delayFor(0));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ZERO, Duration.ofSeconds(1), 5, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), 5, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(5), Duration.ofSeconds(30), 0, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> ReconnectPolicy.defaults().withJitterFactor(1.0));
    }
}
