package com.questrail.possync.realtime.config;

import com.questrail.possync.realtime.model.ConnectionIdentity;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class RealtimeConnectionConfigTest {

    @Test
    void httpsBaseYieldsSecureSocketAddress() {
        RealtimeConnectionConfig config = RealtimeConnectionConfig.builder()
                .withServerBaseUri("https://api.example.com")
                .build();

        URI uri = config.socketUri(new ConnectionIdentity("u-7", "r-42"));

        assertEquals(URI.create("wss://api.example.com/ws/pos/r-42?user_id=u-7"), uri);
        assertTrue(config.secure());
    }

    @Test
    void plainBaseKeepsPort() {
        RealtimeConnectionConfig config = RealtimeConnectionConfig.builder()
                .withServerBaseUri("http://10.0.2.2:8000")
                .build();

        assertEquals(URI.create("ws://10.0.2.2:8000/ws/pos/r-1?user_id=u-1"),
                config.socketUri(new ConnectionIdentity("u-1", "r-1")));
        assertEquals(URI.create("http://10.0.2.2:8000/api/v1/orders/active?restaurant_id=r-1"),
                config.activeOrdersUri("r-1"));
    }

    @Test
    void identifiersAreEncoded() {
        RealtimeConnectionConfig config = RealtimeConnectionConfig.builder()
                .withServerBaseUri("wss://api.example.com")
                .build();

        URI uri = config.socketUri(new ConnectionIdentity("ana maria@pos", "r/42"));

        assertEquals("wss://api.example.com/ws/pos/r%2F42?user_id=ana%20maria%40pos", uri.toString());
        assertEquals("https://api.example.com/api/v1/orders/active?restaurant_id=r%2F42",
                config.activeOrdersUri("r/42").toString());
    }

    @Test
    void defaultsApply() {
        RealtimeConnectionConfig config = RealtimeConnectionConfig.builder()
                .withServerBaseUri("https://api.example.com")
                .build();

        assertEquals("onboarding", config.fallbackTenantId());
        assertEquals(5, config.reconnectPolicy().maxAttempts());
    }

    @Test
    void rejectsUnusableBase() {
        assertThrows(IllegalArgumentException.class,
                () -> RealtimeConnectionConfig.builder().withServerBaseUri("ftp://example.com").build());
        assertThrows(IllegalArgumentException.class,
                () -> RealtimeConnectionConfig.builder().withServerBaseUri("/relative").build());
        assertThrows(NullPointerException.class,
                () -> RealtimeConnectionConfig.builder().build());
    }
}
