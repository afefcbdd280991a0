package com.questrail.possync.realtime.bus;

import com.questrail.possync.api.BusEvent;
import com.questrail.possync.api.EventListener;
import com.questrail.possync.api.Subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * EventBus
 * -----------------------------------------------------------------------------
 * In-process publish/subscribe registry keyed by event type.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Listeners for one type are invoked in registration order.</li>
 *   <li>Registering the same listener twice for one type has no effect.</li>
 *   <li>A listener that throws any {@link Exception}, checked ones included,
 *       is logged and skipped; the remaining listeners still run and the
 *       emitter never sees the exception.</li>
 *   <li>A type's entry is created on first subscribe and removed when its
 *       last listener leaves.</li>
 * </ul>
 *
 * Subscribing and unsubscribing are safe from any thread, including from
 * inside a listener. A listener added during an emit does not receive the
 * event being emitted.
 */
public final class EventBus
{
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArraySet<EventListener>> listeners = new ConcurrentHashMap<>();

    public Subscription subscribe(String type, EventListener listener)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");

        // compute() keeps add and the empty-set removal in unsubscribe atomic per type.
        listeners.compute(type, (t, set) -> {
            CopyOnWriteArraySet<EventListener> target = set == null ? new CopyOnWriteArraySet<>() : set;
            target.add(listener);
            return target;
        });

        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                unsubscribe(type, listener);
            }
        };
    }

    public void unsubscribe(String type, EventListener listener)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");

        listeners.computeIfPresent(type, (t, set) -> {
            set.remove(listener);
            return set.isEmpty() ? null : set;
        });
    }

    /**
     * Delivers an event to every listener registered for its type.
     *
     * @return number of listeners that completed without throwing
     */
    public int emit(BusEvent event)
    {
        Objects.requireNonNull(event, "event");

        Set<EventListener> registered = listeners.get(event.type());
        if (registered == null) {
            return 0;
        }

        int delivered = 0;
        for (EventListener listener : registered) {
            try {
                listener.onEvent(event);
                delivered++;
            }
            catch (Exception e) {
                log.warn("Listener for '{}' threw; continuing with remaining listeners", event.type(), e);
            }
        }
        return delivered;
    }

    public int listenerCount(String type)
    {
        Set<EventListener> registered = listeners.get(type);
        return registered == null ? 0 : registered.size();
    }

    public boolean hasListeners(String type)
    {
        return listenerCount(type) > 0;
    }

    /**
     * Drops every registration.
     */
    public void clear()
    {
        listeners.clear();
    }
}
