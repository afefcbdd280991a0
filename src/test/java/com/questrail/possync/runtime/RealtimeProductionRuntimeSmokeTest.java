package com.questrail.possync.runtime;

import com.questrail.possync.api.ConnectionState;
import com.questrail.possync.api.RealtimeConnection;
import com.questrail.possync.realtime.auth.MutableCredentialSource;
import com.questrail.possync.realtime.config.RealtimeConnectionConfig;
import com.questrail.possync.realtime.observability.Slf4jConnectivityObservabilitySink;
import com.questrail.possync.realtime.poll.FakeActiveStateClient;
import com.questrail.possync.realtime.transport.FakeTransportSocketFactory;
import org.junit.jupiter.api.Test;

import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class RealtimeProductionRuntimeSmokeTest {

    private static void awaitTrue(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + 2_000_000_000L;
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void fullStackLifecycle() throws InterruptedException {
        FakeTransportSocketFactory sockets = new FakeTransportSocketFactory();

        RealtimeProductionRuntime runtime = RealtimeProductionRuntime.builder()
            .withConfig(RealtimeConnectionConfig.builder()
                .withServerBaseUri("http://127.0.0.1:8000")
                .build())
            .withCredentialSource(new MutableCredentialSource("tok-1", "u-1", "r-1"))
            .withObservabilitySink(new Slf4jConnectivityObservabilitySink())
            .withSocketFactory(sockets)
            .withActiveStateClient(new FakeActiveStateClient())
            .build();

        RealtimeConnection connection = runtime.connection();
        assertEquals(ConnectionState.DISCONNECTED, connection.getState());

        connection.connect();
        awaitTrue(() -> sockets.createdCount() == 1, "socket should be created");

        sockets.latest().serverAccepts();
        awaitTrue(() -> connection.getState() == ConnectionState.CONNECTED, "connection should be established");

        runtime.stop();

        assertEquals(ConnectionState.CLOSED, connection.getState());
        assertTrue(sockets.latest().closedByClient());
    }

    @Test
    void transportCallbackAfterStopIsDropped() throws InterruptedException {
        FakeTransportSocketFactory sockets = new FakeTransportSocketFactory();

        RealtimeProductionRuntime runtime = RealtimeProductionRuntime.builder()
            .withConfig(RealtimeConnectionConfig.builder()
                .withServerBaseUri("http://127.0.0.1:8000")
                .build())
            .withCredentialSource(new MutableCredentialSource("tok-1", "u-1", "r-1"))
            .withSocketFactory(sockets)
            .withActiveStateClient(new FakeActiveStateClient())
            .build();

        runtime.connection().connect();
        awaitTrue(() -> sockets.createdCount() == 1, "socket should be created");
        runtime.stop();

        assertDoesNotThrow(() -> sockets.latest().replayOpen());
        assertEquals(ConnectionState.CLOSED, runtime.connection().getState());
    }

    @Test
    void builderRequiresConfigAndCredentials() {
        assertThrows(NullPointerException.class, () -> RealtimeProductionRuntime.builder().build());
        assertThrows(NullPointerException.class, () -> RealtimeProductionRuntime.builder()
            .withConfig(RealtimeConnectionConfig.builder().withServerBaseUri("http://127.0.0.1:8000").build())
            .build());
    }
}
