package com.questrail.possync.realtime.internal.events;

import com.questrail.possync.realtime.model.MessageEnvelope;

import java.time.Instant;
import java.util.Objects;

/**
 * Transport callbacks, tagged with the generation of the socket that produced
 * them. Events from a retired generation are ignored by the reducer.
 */
public sealed interface SocketEvent extends SupervisorEvent
        permits SocketEvent.SocketOpened,
                SocketEvent.AuthenticationSent,
                SocketEvent.SocketClosed,
                SocketEvent.MessageReceived
{
    long generation();

    final class SocketOpened extends SupervisorEvent.Base implements SocketEvent {
        private final long generation;

        public SocketOpened(Instant timestamp, long generation) {
            super(timestamp);
            this.generation = generation;
        }

        @Override
        public long generation() {
            return generation;
        }
    }

    /**
     * The in-band authenticate message was handed to the socket (or the
     * hand-off failed; the handshake subprotocol still carries the token).
     */
    final class AuthenticationSent extends SupervisorEvent.Base implements SocketEvent {
        private final long generation;
        private final boolean delivered;

        public AuthenticationSent(Instant timestamp, long generation, boolean delivered) {
            super(timestamp);
            this.generation = generation;
            this.delivered = delivered;
        }

        @Override
        public long generation() {
            return generation;
        }

        public boolean delivered() {
            return delivered;
        }
    }

    final class SocketClosed extends SupervisorEvent.Base implements SocketEvent {
        private final long generation;
        private final int code;
        private final String reason;
        private final long nowNanos;

        public SocketClosed(Instant timestamp, long generation, int code, String reason, long nowNanos) {
            super(timestamp);
            this.generation = generation;
            this.code = code;
            this.reason = reason == null ? "" : reason;
            this.nowNanos = nowNanos;
        }

        @Override
        public long generation() {
            return generation;
        }

        public int code() {
            return code;
        }

        public String reason() {
            return reason;
        }

        public long nowNanos() {
            return nowNanos;
        }

        @Override
        public String toString() {
            return "SocketClosed[gen=" + generation + ", code=" + code + ", reason=" + reason + "]";
        }
    }

    final class MessageReceived extends SupervisorEvent.Base implements SocketEvent {
        private final long generation;
        private final MessageEnvelope envelope;

        public MessageReceived(Instant timestamp, long generation, MessageEnvelope envelope) {
            super(timestamp);
            this.generation = generation;
            this.envelope = Objects.requireNonNull(envelope, "envelope");
        }

        @Override
        public long generation() {
            return generation;
        }

        public MessageEnvelope envelope() {
            return envelope;
        }
    }
}
