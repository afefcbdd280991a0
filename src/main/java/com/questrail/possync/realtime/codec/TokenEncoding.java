package com.questrail.possync.realtime.codec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * URL-safe, unpadded base64 of a bearer token.
 *
 * <p>The encoded form travels as a WebSocket handshake subprotocol value, so it
 * must not contain {@code +}, {@code /} or {@code =}.</p>
 */
public final class TokenEncoding
{
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private TokenEncoding() {}

    public static String encode(String token)
    {
        Objects.requireNonNull(token, "token");
        return ENCODER.encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Inverse of {@link #encode(String)}. The URL decoder accepts input with or
     * without padding.
     *
     * @throws IllegalArgumentException if the input is not valid base64url
     */
    public static String decode(String encoded)
    {
        Objects.requireNonNull(encoded, "encoded");
        return new String(DECODER.decode(encoded), StandardCharsets.UTF_8);
    }
}
