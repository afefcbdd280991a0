package com.questrail.possync.realtime.poll;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@link ActiveStateClient} backed by the JDK {@link HttpClient}.
 *
 * <p>Sends {@code GET /api/v1/orders/active?restaurant_id=...} with
 * {@code Authorization: Bearer} and {@code X-Restaurant-Id} headers.</p>
 */
public final class HttpActiveStateClient implements ActiveStateClient
{
    static final String TENANT_HEADER = "X-Restaurant-Id";

    private final HttpClient httpClient;
    private final Function<String, URI> endpoint;
    private final Duration requestTimeout;

    /**
     * @param httpClient     shared client
     * @param endpoint       maps a tenant id to the active-orders URI
     * @param requestTimeout per-request timeout
     */
    public HttpActiveStateClient(HttpClient httpClient, Function<String, URI> endpoint, Duration requestTimeout)
    {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public static HttpActiveStateClient create(Function<String, URI> endpoint, Duration timeout)
    {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new HttpActiveStateClient(client, endpoint, timeout);
    }

    @Override
    public CompletableFuture<ActiveStateResponse> fetchActiveOrders(String tenantId, String token)
    {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(endpoint.apply(tenantId))
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .header("Authorization", "Bearer " + token)
                    .header(TENANT_HEADER, tenantId)
                    .GET()
                    .build();
        }
        catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> new ActiveStateResponse(response.statusCode(), response.body()));
    }
}
