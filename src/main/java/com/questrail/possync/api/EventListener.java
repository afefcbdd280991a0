package com.questrail.possync.api;

/**
 * Callback registered for one event channel.
 *
 * <p>Listeners are invoked on the connection's event loop. They should return
 * quickly; an exception thrown by a listener is logged and contained.</p>
 */
@FunctionalInterface
public interface EventListener
{
    void onEvent(BusEvent event);
}
