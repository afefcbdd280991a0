package com.questrail.possync.realtime.bus;

import com.questrail.possync.api.BusEvent;
import com.questrail.possync.api.EventListener;
import com.questrail.possync.api.EventSource;
import com.questrail.possync.api.Subscription;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private final EventBus bus = new EventBus();

    private static BusEvent event(String type) {
        return new BusEvent(type, "payload", EventSource.SOCKET, Instant.EPOCH);
    }

    @Test
    void throwingListenerDoesNotStopOthers() {
        List<String> seen = new ArrayList<>();
        bus.subscribe("order.created", e -> seen.add("first"));
        bus.subscribe("order.created", e -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe("order.created", e -> seen.add("third"));

        int delivered = assertDoesNotThrow(() -> bus.emit(event("order.created")));

        assertEquals(List.of("first", "third"), seen);
        assertEquals(2, delivered);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }

    @Test
    void checkedExceptionFromListenerIsContained() {
        List<String> seen = new ArrayList<>();
        bus.subscribe("order.created", e -> EventBusTest.<RuntimeException>sneakyThrow(new IOException("disk full")));
        bus.subscribe("order.created", e -> seen.add("second"));

        int delivered = assertDoesNotThrow(() -> bus.emit(event("order.created")));

        assertEquals(List.of("second"), seen);
        assertEquals(1, delivered);
    }

    @Test
    void deliversOnlyToMatchingType() {
        List<String> seen = new ArrayList<>();
        bus.subscribe("order.created", e -> seen.add(e.type()));
        bus.subscribe("menu.updated", e -> seen.add(e.type()));

        bus.emit(event("menu.updated"));

        assertEquals(List.of("menu.updated"), seen);
        assertEquals(0, bus.emit(event("staff.update")));
    }

    @Test
    void sameListenerRegisteredOncePerType() {
        List<BusEvent> seen = new ArrayList<>();
        EventListener listener = seen::add;

        bus.subscribe("connected", listener);
        bus.subscribe("connected", listener);
        bus.emit(event("connected"));

        assertEquals(1, seen.size());
        assertEquals(1, bus.listenerCount("connected"));
    }

    @Test
    void lastUnsubscribeRemovesType() {
        EventListener a = e -> {};
        EventListener b = e -> {};
        bus.subscribe("error", a);
        Subscription sb = bus.subscribe("error", b);

        bus.unsubscribe("error", a);
        assertTrue(bus.hasListeners("error"));

        sb.unsubscribe();
        sb.unsubscribe();
        assertFalse(bus.hasListeners("error"));
        assertEquals(0, bus.listenerCount("error"));
    }

    @Test
    void listenerMayUnsubscribeItselfDuringEmit() {
        List<String> seen = new ArrayList<>();
        Subscription[] holder = new Subscription[1];
        holder[0] = bus.subscribe("message", e -> {
            seen.add("once");
            holder[0].unsubscribe();
        });

        bus.emit(event("message"));
        bus.emit(event("message"));

        assertEquals(List.of("once"), seen);
    }

    @Test
    void clearDropsEverything() {
        bus.subscribe("connected", e -> {});
        bus.subscribe("error", e -> {});

        bus.clear();

        assertFalse(bus.hasListeners("connected"));
        assertFalse(bus.hasListeners("error"));
    }
}
