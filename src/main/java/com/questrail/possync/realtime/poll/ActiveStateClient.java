package com.questrail.possync.realtime.poll;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the REST endpoint that returns a tenant's active orders.
 *
 * <p>Implementations never throw from this method; transport failures
 * complete the returned future exceptionally.</p>
 */
@FunctionalInterface
public interface ActiveStateClient
{
    CompletableFuture<ActiveStateResponse> fetchActiveOrders(String tenantId, String token);
}
