package com.questrail.possync.realtime.observability;

/**
 * No-op implementation of ConnectivityObservabilitySink.
 */
public final class NullObservabilitySink implements ConnectivityObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(StateTransitionEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(ConnectivityErrorEvent event) {}
}
