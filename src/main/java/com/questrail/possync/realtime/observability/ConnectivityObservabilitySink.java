package com.questrail.possync.realtime.observability;

/**
 * Main interface for receiving connectivity observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ConnectivityObservabilitySink {
    /**
     * Called after every event the supervisor applies, whether or not the
     * state changed.
     * @param event the transition details
     */
    void onStateTransition(StateTransitionEvent event);

    /**
     * Called for socket and polling lifecycle activity.
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when something failed that is not surfaced to listeners
     * (malformed inbound messages, listener-side failures, poll errors).
     * @param event the error event
     */
    void onError(ConnectivityErrorEvent event);
}
