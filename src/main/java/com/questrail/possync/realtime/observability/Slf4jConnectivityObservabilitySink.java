package com.questrail.possync.realtime.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ConnectivityObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jConnectivityObservabilitySink implements ConnectivityObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jConnectivityObservabilitySink.class);

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        if (event.isStateChange()) {
            log.info("Connection state: {} -> {} ({})",
                event.oldState().state(),
                event.newState().state(),
                event.triggeringEvent().getClass().getSimpleName());
        }
        else if (log.isDebugEnabled() && !event.resultingIntents().isEmpty()) {
            log.debug("Connection event {} in {}: {}",
                event.triggeringEvent().getClass().getSimpleName(),
                event.newState().state(),
                event.resultingIntents());
        }
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.kind() == TransportObservabilityEvent.Kind.POLL_COMPLETED) {
            log.debug("Transport event: {} gen={} {}", event.kind(), event.generation(), event.detail());
        }
        else {
            log.info("Transport event: {} gen={} {}", event.kind(), event.generation(), event.detail());
        }
    }

    @Override
    public void onError(ConnectivityErrorEvent event) {
        if (event.cause() == null) {
            log.warn("Connectivity error: {}", event.message());
        }
        else {
            log.warn("Connectivity error: {}", event.message(), event.cause());
        }
    }
}
