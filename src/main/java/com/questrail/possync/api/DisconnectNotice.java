package com.questrail.possync.api;

/**
 * Payload of the {@link EventChannels#DISCONNECTED} channel.
 *
 * @param code   close code (1000 for a normal close)
 * @param reason close reason; empty when none was given
 */
public record DisconnectNotice(int code, String reason)
{
    public DisconnectNotice {
        reason = reason == null ? "" : reason;
    }

    public boolean isNormal()
    {
        return code == 1000;
    }
}
