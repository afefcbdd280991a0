package com.questrail.possync.realtime.poll;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Answers every request immediately with the configured response, or leaves
 * it pending when {@link #holdResponses()} is set.
 */
public final class FakeActiveStateClient implements ActiveStateClient {

    public record Request(String tenantId, String token) {}

    private final List<Request> requests = new ArrayList<>();
    private final List<CompletableFuture<ActiveStateResponse>> pending = new ArrayList<>();
    private ActiveStateResponse response = new ActiveStateResponse(200, "[]");
    private boolean hold;

    @Override
    public synchronized CompletableFuture<ActiveStateResponse> fetchActiveOrders(String tenantId, String token) {
        requests.add(new Request(tenantId, token));
        if (hold) {
            CompletableFuture<ActiveStateResponse> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        }
        return CompletableFuture.completedFuture(response);
    }

    public synchronized void respondWith(int status, String body) {
        this.response = new ActiveStateResponse(status, body);
    }

    public synchronized void holdResponses() {
        this.hold = true;
    }

    public synchronized List<CompletableFuture<ActiveStateResponse>> pending() {
        return List.copyOf(pending);
    }

    public synchronized List<Request> requests() {
        return List.copyOf(requests);
    }

    public synchronized int requestCount() {
        return requests.size();
    }
}
