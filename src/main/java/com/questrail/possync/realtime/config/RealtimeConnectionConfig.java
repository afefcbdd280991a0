package com.questrail.possync.realtime.config;

import com.questrail.possync.realtime.internal.exec.ConnectivityTimingPolicy;
import com.questrail.possync.realtime.internal.exec.ReconnectPolicy;
import com.questrail.possync.realtime.model.ConnectionIdentity;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Aggregated configuration for one realtime connection.
 *
 * <p>{@code serverBaseUri} is the backend root, e.g. {@code https://api.example.com}.
 * The socket address derives from it by swapping {@code http(s)} for
 * {@code ws(s)}; the polling endpoint keeps the HTTP scheme.</p>
 */
public record RealtimeConnectionConfig(
        URI serverBaseUri,
        String fallbackTenantId,
        ConnectivityTimingPolicy timingPolicy,
        ReconnectPolicy reconnectPolicy
) {
    public static final String DEFAULT_FALLBACK_TENANT = "onboarding";

    static final String SOCKET_PATH = "/ws/pos/";
    static final String ACTIVE_ORDERS_PATH = "/api/v1/orders/active";

    public RealtimeConnectionConfig {
        Objects.requireNonNull(serverBaseUri, "serverBaseUri");
        Objects.requireNonNull(fallbackTenantId, "fallbackTenantId");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");

        if (serverBaseUri.getScheme() == null || serverBaseUri.getHost() == null) {
            throw new IllegalArgumentException("serverBaseUri must be absolute: " + serverBaseUri);
        }
        String scheme = serverBaseUri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https") && !scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("Unsupported scheme: " + scheme);
        }
        if (fallbackTenantId.isBlank()) {
            throw new IllegalArgumentException("fallbackTenantId must not be blank");
        }
    }

    /**
     * {@code {ws|wss}://{host}/ws/pos/{tenantId}?user_id={userId}}
     */
    public URI socketUri(ConnectionIdentity identity)
    {
        Objects.requireNonNull(identity, "identity");
        return URI.create(socketScheme() + "://" + authority()
                + SOCKET_PATH + encode(identity.tenantId())
                + "?user_id=" + encode(identity.userId()));
    }

    /**
     * {@code {http|https}://{host}/api/v1/orders/active?restaurant_id={tenantId}}
     */
    public URI activeOrdersUri(String tenantId)
    {
        Objects.requireNonNull(tenantId, "tenantId");
        return URI.create(httpScheme() + "://" + authority()
                + ACTIVE_ORDERS_PATH + "?restaurant_id=" + encode(tenantId));
    }

    public boolean secure()
    {
        String scheme = serverBaseUri.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("https") || scheme.equals("wss");
    }

    private String socketScheme()
    {
        return secure() ? "wss" : "ws";
    }

    private String httpScheme()
    {
        return secure() ? "https" : "http";
    }

    private String authority()
    {
        return serverBaseUri.getRawAuthority();
    }

    private static String encode(String value)
    {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI serverBaseUri;
        private String fallbackTenantId = DEFAULT_FALLBACK_TENANT;
        private ConnectivityTimingPolicy timingPolicy = ConnectivityTimingPolicy.defaults();
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();

        public Builder withServerBaseUri(URI serverBaseUri) {
            this.serverBaseUri = serverBaseUri;
            return this;
        }

        public Builder withServerBaseUri(String serverBaseUri) {
            return withServerBaseUri(URI.create(serverBaseUri));
        }

        public Builder withFallbackTenantId(String fallbackTenantId) {
            this.fallbackTenantId = fallbackTenantId;
            return this;
        }

        public Builder withTimingPolicy(ConnectivityTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public RealtimeConnectionConfig build() {
            return new RealtimeConnectionConfig(serverBaseUri, fallbackTenantId, timingPolicy, reconnectPolicy);
        }
    }
}
