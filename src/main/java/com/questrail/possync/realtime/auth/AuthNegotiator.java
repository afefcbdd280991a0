package com.questrail.possync.realtime.auth;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.possync.realtime.codec.TokenEncoding;
import com.questrail.possync.realtime.model.Credential;
import com.questrail.possync.realtime.model.MessageEnvelope;
import com.questrail.possync.realtime.model.MessageTypes;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * AuthNegotiator
 * -----------------------------------------------------------------------------
 * Supplies the bearer credential to the backend and interprets closures.
 *
 * <h2>Credential delivery</h2>
 * Query parameters are stripped by some client runtimes, so the token travels
 * twice:
 * <ol>
 *   <li>as handshake subprotocols {@code ["token", base64url(token)]}</li>
 *   <li>as an in-band {@code authenticate} message sent right after open</li>
 * </ol>
 *
 * <h2>Closure classification</h2>
 * Delegated to a {@link CloseClassifier}.
 */
public final class AuthNegotiator
{
    public static final String TOKEN_SUBPROTOCOL = "token";

    private final CloseClassifier classifier;

    public AuthNegotiator(CloseClassifier classifier)
    {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public List<String> subprotocols(Credential credential)
    {
        Objects.requireNonNull(credential, "credential");
        return List.of(TOKEN_SUBPROTOCOL, TokenEncoding.encode(credential.token()));
    }

    public MessageEnvelope authenticateMessage(Credential credential, Instant now)
    {
        Objects.requireNonNull(credential, "credential");
        Objects.requireNonNull(now, "now");

        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("token", credential.token());
        data.put("user_id", credential.userId());
        data.put("restaurant_id", credential.tenantId());
        data.put("timestamp", now.toString());

        return new MessageEnvelope(MessageTypes.AUTHENTICATE, data, now, credential.tenantId());
    }

    public FailureKind classify(int code, String reason, long elapsedMillis)
    {
        return classifier.classify(code, reason, elapsedMillis);
    }
}
