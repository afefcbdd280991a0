package com.questrail.possync.api;

import java.util.Optional;

/**
 * Per-call overrides for {@code connect()}.
 *
 * <p>Every field is optional. Absent values are resolved from the configured
 * credential source at connect time. A token override is used for this attempt
 * only; subsequent reconnects fetch a fresh copy from the credential source.</p>
 */
public final class ConnectOptions
{
    private static final ConnectOptions DEFAULTS = new ConnectOptions(null, null, null);

    private final String tenantId;
    private final String userId;
    private final String token;

    private ConnectOptions(String tenantId, String userId, String token)
    {
        this.tenantId = tenantId;
        this.userId = userId;
        this.token = token;
    }

    /**
     * Options that resolve everything from the credential source.
     */
    public static ConnectOptions defaults()
    {
        return DEFAULTS;
    }

    public Optional<String> tenantId()
    {
        return Optional.ofNullable(tenantId);
    }

    public Optional<String> userId()
    {
        return Optional.ofNullable(userId);
    }

    public Optional<String> token()
    {
        return Optional.ofNullable(token);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private String tenantId;
        private String userId;
        private String token;

        private Builder() {}

        public Builder withTenantId(String tenantId)
        {
            this.tenantId = tenantId;
            return this;
        }

        public Builder withUserId(String userId)
        {
            this.userId = userId;
            return this;
        }

        public Builder withToken(String token)
        {
            this.token = token;
            return this;
        }

        public ConnectOptions build()
        {
            return new ConnectOptions(tenantId, userId, token);
        }
    }

    @Override
    public String toString()
    {
        return "ConnectOptions[tenantId=" + tenantId
                + ", userId=" + userId
                + ", token=" + (token == null ? "<none>" : "<redacted>") + "]";
    }
}
