package com.questrail.possync.realtime.model;

import java.util.Objects;

/**
 * A fetched copy of the bearer credential and the identity it belongs to.
 *
 * <p>The token manager owns the real credential; the supervisor only holds
 * copies and replaces them wholesale on every refresh signal.</p>
 */
public record Credential(String token, ConnectionIdentity identity)
{
    public Credential {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(identity, "identity");
        if (token.isBlank()) {
            throw new IllegalArgumentException("token must not be blank");
        }
    }

    public String userId()
    {
        return identity.userId();
    }

    public String tenantId()
    {
        return identity.tenantId();
    }

    @Override
    public String toString()
    {
        return "Credential[token=<redacted>, identity=" + identity + "]";
    }
}
