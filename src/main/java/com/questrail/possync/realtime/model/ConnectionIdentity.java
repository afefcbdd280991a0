package com.questrail.possync.realtime.model;

import java.util.Objects;

/**
 * Who a connection is opened for: the signed-in user and the tenant
 * (restaurant) whose events it receives.
 */
public record ConnectionIdentity(String userId, String tenantId)
{
    public ConnectionIdentity {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(tenantId, "tenantId");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
    }
}
