package com.questrail.possync.realtime.internal.events;

import java.time.Instant;
import java.util.Optional;

/**
 * Firings of timers armed by the executor.
 */
public sealed interface TimerEvent extends SupervisorEvent
        permits TimerEvent.ConnectTimedOut,
                TimerEvent.HeartbeatTimedOut,
                TimerEvent.ReconnectDue
{
    final class ConnectTimedOut extends SupervisorEvent.Base implements TimerEvent {
        private final long generation;
        private final long nowNanos;

        public ConnectTimedOut(Instant timestamp, long generation, long nowNanos) {
            super(timestamp);
            this.generation = generation;
            this.nowNanos = nowNanos;
        }

        public long generation() {
            return generation;
        }

        public long nowNanos() {
            return nowNanos;
        }
    }

    /**
     * Too many consecutive pings went unanswered.
     */
    final class HeartbeatTimedOut extends SupervisorEvent.Base implements TimerEvent {
        private final long generation;
        private final int missedPongs;

        public HeartbeatTimedOut(Instant timestamp, long generation, int missedPongs) {
            super(timestamp);
            this.generation = generation;
            this.missedPongs = missedPongs;
        }

        public long generation() {
            return generation;
        }

        public int missedPongs() {
            return missedPongs;
        }
    }

    /**
     * The backoff delay elapsed. Carries the token read from the credential
     * source when the timer fired.
     */
    final class ReconnectDue extends SupervisorEvent.Base implements TimerEvent {
        private final String token;
        private final long nowNanos;

        public ReconnectDue(Instant timestamp, String token, long nowNanos) {
            super(timestamp);
            this.token = token;
            this.nowNanos = nowNanos;
        }

        public Optional<String> token() {
            return Optional.ofNullable(token).filter(t -> !t.isBlank());
        }

        public long nowNanos() {
            return nowNanos;
        }
    }
}
