package com.questrail.possync.realtime.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.possync.realtime.model.MessageEnvelope;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * EnvelopeCodec
 * -----------------------------------------------------------------------------
 * JSON text codec for {@link MessageEnvelope}.
 *
 * <h2>Wire shape</h2>
 * <pre>
 *   { "type": "...", "data": {...}, "timestamp": "ISO-8601", "restaurant_id": "..." }
 * </pre>
 *
 * <ul>
 *   <li>{@code type} is required on decode</li>
 *   <li>{@code data} defaults to JSON null</li>
 *   <li>{@code timestamp} may be ISO-8601 text or epoch milliseconds; when it is
 *       missing or unreadable the supplied receive time is used</li>
 *   <li>{@code restaurant_id} is optional and omitted on encode when absent</li>
 * </ul>
 *
 * Instances are immutable and safe to share.
 */
public final class EnvelopeCodec
{
    static final String FIELD_TYPE = "type";
    static final String FIELD_DATA = "data";
    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_RESTAURANT_ID = "restaurant_id";

    private final ObjectMapper mapper;

    public EnvelopeCodec()
    {
        this(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public EnvelopeCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper()
    {
        return mapper;
    }

    /**
     * Encodes an envelope to its JSON text form.
     */
    public String encode(MessageEnvelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        ObjectNode root = mapper.createObjectNode();
        root.put(FIELD_TYPE, envelope.type());
        root.set(FIELD_DATA, envelope.data());
        root.put(FIELD_TIMESTAMP, envelope.timestamp().toString());
        if (envelope.restaurantId() != null) {
            root.put(FIELD_RESTAURANT_ID, envelope.restaurantId());
        }

        try {
            return mapper.writeValueAsString(root);
        }
        catch (JsonProcessingException e) {
            // A tree built from JsonNodes always serializes.
            throw new IllegalStateException("Failed to encode envelope " + envelope.type(), e);
        }
    }

    /**
     * Decodes JSON text into an envelope.
     *
     * @param text       inbound text frame
     * @param receivedAt timestamp used when the message carries none
     * @throws EnvelopeDecodeException if the text is not a JSON object with a textual type
     */
    public MessageEnvelope decode(String text, Instant receivedAt)
    {
        Objects.requireNonNull(receivedAt, "receivedAt");
        if (text == null || text.isBlank()) {
            throw new EnvelopeDecodeException("Empty message");
        }

        JsonNode root;
        try {
            root = mapper.readTree(text);
        }
        catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("Malformed JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodeException("Message is not a JSON object");
        }

        JsonNode type = root.get(FIELD_TYPE);
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new EnvelopeDecodeException("Message has no type");
        }

        JsonNode data = root.get(FIELD_DATA);
        JsonNode tenant = root.get(FIELD_RESTAURANT_ID);

        return new MessageEnvelope(
                type.asText(),
                data == null ? NullNode.getInstance() : data,
                readTimestamp(root.get(FIELD_TIMESTAMP), receivedAt),
                tenant != null && tenant.isValueNode() && !tenant.isNull() ? tenant.asText() : null
        );
    }

    /**
     * Builds an outbound envelope, converting an arbitrary payload to a tree.
     *
     * @throws IllegalArgumentException if the payload cannot be represented as JSON
     */
    public MessageEnvelope envelope(String type, Object data, Instant timestamp, String restaurantId)
    {
        JsonNode tree = data instanceof JsonNode node ? node : mapper.valueToTree(data);
        return new MessageEnvelope(type, tree, timestamp, restaurantId);
    }

    /**
     * Parses an HTTP body into a tree.
     *
     * @throws EnvelopeDecodeException if the body is not JSON
     */
    public JsonNode readBody(String body)
    {
        try {
            JsonNode node = mapper.readTree(body == null ? "" : body);
            return node == null || node.isMissingNode() ? NullNode.getInstance() : node;
        }
        catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("Malformed JSON body: " + e.getOriginalMessage(), e);
        }
    }

    private static Instant readTimestamp(JsonNode node, Instant fallback)
    {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            }
            catch (DateTimeParseException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
