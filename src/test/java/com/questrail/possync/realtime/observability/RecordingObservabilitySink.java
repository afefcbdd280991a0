package com.questrail.possync.realtime.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ConnectivityObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(StateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ConnectivityErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<StateTransitionEvent> getStateTransitions() {
        return events.stream()
            .filter(e -> e instanceof StateTransitionEvent)
            .map(e -> (StateTransitionEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized List<TransportObservabilityEvent.Kind> getTransportKinds() {
        return events.stream()
            .filter(e -> e instanceof TransportObservabilityEvent)
            .map(e -> ((TransportObservabilityEvent) e).kind())
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
