package com.questrail.possync.realtime.internal.events;

import java.time.Instant;

/**
 * Outcomes of the polling fallback that affect connection state.
 */
public sealed interface PollEvent extends SupervisorEvent
        permits PollEvent.PollRejected
{
    /**
     * The REST endpoint refused the credential (401/403).
     */
    final class PollRejected extends SupervisorEvent.Base implements PollEvent {
        private final int status;

        public PollRejected(Instant timestamp, int status) {
            super(timestamp);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }
}
