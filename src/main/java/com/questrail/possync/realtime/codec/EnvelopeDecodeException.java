package com.questrail.possync.realtime.codec;

/**
 * Thrown when inbound text cannot be decoded into a
 * {@link com.questrail.possync.realtime.model.MessageEnvelope}.
 *
 * <p>Decode failures are a protocol concern of a single message. They are
 * caught at the transport boundary and never tear down the connection.</p>
 */
public final class EnvelopeDecodeException extends RuntimeException
{
    public EnvelopeDecodeException(String message)
    {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
