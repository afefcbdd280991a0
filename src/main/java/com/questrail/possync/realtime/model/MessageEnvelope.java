package com.questrail.possync.realtime.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * MessageEnvelope
 * -----------------------------------------------------------------------------
 * The single message shape exchanged with the backend, in both directions.
 *
 * <p>Outbound control messages ({@code ping}, {@code subscribe},
 * {@code authenticate}) and inbound system or business messages all share it.
 * The polling fallback produces the same shape, so consumers never need to
 * know which transport delivered an update.</p>
 *
 * <p>The {@code data} payload is kept as a Jackson tree. Business payload
 * interpretation is left to consumers.</p>
 *
 * @param type         message type, e.g. {@code order.created}
 * @param data         payload tree; {@link NullNode} when absent
 * @param timestamp    sender timestamp
 * @param restaurantId tenant the message is scoped to, may be {@code null}
 */
public record MessageEnvelope(
        String type,
        JsonNode data,
        Instant timestamp,
        String restaurantId
) {
    public MessageEnvelope {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        data = data == null ? NullNode.getInstance() : data;
    }

    public Optional<String> tenantId()
    {
        return Optional.ofNullable(restaurantId);
    }
}
