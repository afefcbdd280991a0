package com.questrail.possync.realtime.observability;

import com.questrail.possync.realtime.internal.events.SupervisorEvent;
import com.questrail.possync.realtime.internal.state.ConnectionSnapshot;
import com.questrail.possync.realtime.internal.state.SupervisorIntents;

import java.time.Instant;

/**
 * Record representing one reducer step of the connection supervisor.
 */
public record StateTransitionEvent(
    Instant timestamp,
    ConnectionSnapshot oldState,
    ConnectionSnapshot newState,
    SupervisorEvent triggeringEvent,
    SupervisorIntents resultingIntents
) {
    /**
     * Checks if the lifecycle state changed during this step.
     */
    public boolean isStateChange() {
        return oldState.state() != newState.state();
    }
}
