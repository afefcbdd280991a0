package com.questrail.possync.realtime.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SupervisorEvent
 * -----------------------------------------------------------------------------
 * Marker for every input to the connection state machine.
 *
 * <p>Commands from the owner, transport callbacks, timer firings and polling
 * outcomes all arrive as events and are applied one at a time. The timestamp
 * is wall-clock and observational only; events that feed timing decisions
 * carry a separate monotonic reading.</p>
 */
public interface SupervisorEvent
{
    Instant timestamp();

    abstract class Base implements SupervisorEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[" + timestamp + "]";
        }
    }
}
