package com.questrail.possync.realtime.poll;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpActiveStateClientTest {

    private HttpServer server;
    private HttpActiveStateClient client;

    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> tenantHeader = new AtomicReference<>();
    private final AtomicReference<String> query = new AtomicReference<>();

    private volatile int status = 200;
    private volatile String body = "{\"orders\":[]}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/orders/active", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            tenantHeader.set(exchange.getRequestHeaders().getFirst("X-Restaurant-Id"));
            query.set(exchange.getRequestURI().getQuery());

            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();

        int port = server.getAddress().getPort();
        client = HttpActiveStateClient.create(
                tenant -> URI.create("http://127.0.0.1:" + port + "/api/v1/orders/active?restaurant_id=" + tenant),
                Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void sendsBearerTokenAndTenant() throws InterruptedException, ExecutionException, TimeoutException {
        ActiveStateResponse response = client.fetchActiveOrders("r-42", "tok-1").get(5, TimeUnit.SECONDS);

        assertTrue(response.isSuccess());
        assertEquals("{\"orders\":[]}", response.body());
        assertEquals("Bearer tok-1", authorization.get());
        assertEquals("r-42", tenantHeader.get());
        assertEquals("restaurant_id=r-42", query.get());
    }

    @Test
    void rejectionStatusIsReturnedNotThrown() throws InterruptedException, ExecutionException, TimeoutException {
        status = 401;
        body = "";

        ActiveStateResponse response = client.fetchActiveOrders("r-42", "expired").get(5, TimeUnit.SECONDS);

        assertEquals(401, response.status());
        assertTrue(response.isAuthRejection());
        assertFalse(response.isSuccess());
    }

    @Test
    void unreachableServerFailsTheFuture() {
        server.stop(0);
        server = null;

        assertThrows(ExecutionException.class,
                () -> client.fetchActiveOrders("r-42", "tok-1").get(10, TimeUnit.SECONDS));
    }

    @Test
    void invalidEndpointFailsTheFuture() {
        HttpActiveStateClient broken = HttpActiveStateClient.create(
                tenant -> URI.create("ftp://127.0.0.1/orders"), Duration.ofSeconds(1));

        assertTrue(broken.fetchActiveOrders("r-42", "tok-1").isCompletedExceptionally());
    }
}
