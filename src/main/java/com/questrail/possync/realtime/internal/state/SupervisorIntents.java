package com.questrail.possync.realtime.internal.state;

import com.questrail.possync.api.ConnectivityError;
import com.questrail.possync.realtime.model.Credential;
import com.questrail.possync.realtime.model.MessageEnvelope;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SupervisorIntents
 * -----------------------------------------------------------------------------
 * Immutable collection of side effects requested by the {@link SupervisorReducer}.
 *
 * <h2>Role in the architecture</h2>
 * The reducer decides <b>what should happen next</b>; the executor decides
 * <b>how</b>. No intent performs I/O itself.
 *
 * <h2>Ordering</h2>
 * {@link Kind} is declared in execution order. Cancellations run before the
 * socket is closed, the socket is closed before a new one is opened, and bus
 * emissions run last so listeners observe the settled state.
 *
 * <h2>Payload</h2>
 * A single optional payload is shared by all kinds in one intent set. The
 * reducer never requests two intents that need conflicting payload values.
 */
public final class SupervisorIntents
{
    public enum Kind {
        /** Cancel the handshake deadline. */
        CANCEL_CONNECT_TIMEOUT,

        /** Cancel a pending reconnect timer. */
        CANCEL_RECONNECT,

        /** Stop pings and pong supervision. */
        STOP_HEARTBEAT,

        /** Stop the REST poller. */
        STOP_POLLING,

        /** Close the held socket with {@code closeCode}/{@code closeReason}. */
        CLOSE_SOCKET,

        /** Create a socket for {@code generation} at {@code targetAddress} using {@code credential}. */
        OPEN_SOCKET,

        /** Arm the handshake deadline for {@code generation}. */
        ARM_CONNECT_TIMEOUT,

        /** Send the in-band authenticate message. */
        SEND_AUTHENTICATE,

        /** Answer a server ping. */
        SEND_PONG,

        /** A pong arrived. */
        NOTE_PONG,

        /** Start pings for {@code generation}. */
        START_HEARTBEAT,

        /** Subscribe to the business event types. */
        SUBSCRIBE_EVENTS,

        /** Arm the reconnect timer for {@code reconnectDelay}. */
        ARM_RECONNECT,

        /** Start the REST poller. */
        START_POLLING,

        /** Publish {@code closeCode}/{@code closeReason} on the disconnected channel. */
        EMIT_DISCONNECTED,

        /** Publish {@code error} on the error channel. */
        EMIT_ERROR,

        /** Publish attempt/max/delay on the reconnecting channel. */
        EMIT_RECONNECTING,

        /** Publish on the connected channel. */
        EMIT_CONNECTED,

        /** Publish an inbound envelope under its type and on the message channel. */
        DELIVER_MESSAGE,

        /** Ask the token manager for a fresh credential ahead of expiry. */
        REQUEST_CREDENTIAL_REFRESH
    }

    private static final SupervisorIntents NONE = builder().build();

    private final Set<Kind> kinds;
    private final long generation;
    private final URI targetAddress;
    private final Credential credential;
    private final int closeCode;
    private final String closeReason;
    private final Duration reconnectDelay;
    private final int attempt;
    private final int maxAttempts;
    private final ConnectivityError error;
    private final MessageEnvelope envelope;

    private SupervisorIntents(Builder b) {
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(b.kinds));
        this.generation = b.generation;
        this.targetAddress = b.targetAddress;
        this.credential = b.credential;
        this.closeCode = b.closeCode;
        this.closeReason = b.closeReason;
        this.reconnectDelay = b.reconnectDelay;
        this.attempt = b.attempt;
        this.maxAttempts = b.maxAttempts;
        this.error = b.error;
        this.envelope = b.envelope;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    public long generation() {
        return generation;
    }

    public Optional<URI> targetAddress() {
        return Optional.ofNullable(targetAddress);
    }

    public Optional<Credential> credential() {
        return Optional.ofNullable(credential);
    }

    public int closeCode() {
        return closeCode;
    }

    public String closeReason() {
        return closeReason;
    }

    public Duration reconnectDelay() {
        return reconnectDelay;
    }

    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Optional<ConnectivityError> error() {
        return Optional.ofNullable(error);
    }

    public Optional<MessageEnvelope> envelope() {
        return Optional.ofNullable(envelope);
    }

    @Override
    public String toString() {
        return "SupervisorIntents" + kinds;
    }

    // ---------------------------------------------------------------------
    // Builder (reducer- and test-friendly)
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static SupervisorIntents none() {
        return NONE;
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private long generation;
        private URI targetAddress;
        private Credential credential;
        private int closeCode;
        private String closeReason = "";
        private Duration reconnectDelay = Duration.ZERO;
        private int attempt;
        private int maxAttempts;
        private ConnectivityError error;
        private MessageEnvelope envelope;

        private Builder() {}

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder generation(long generation) {
            this.generation = generation;
            return this;
        }

        public Builder targetAddress(URI targetAddress) {
            this.targetAddress = targetAddress;
            return this;
        }

        public Builder credential(Credential credential) {
            this.credential = credential;
            return this;
        }

        public Builder close(int code, String reason) {
            this.closeCode = code;
            this.closeReason = reason == null ? "" : reason;
            return this;
        }

        public Builder reconnect(int attempt, int maxAttempts, Duration delay) {
            this.attempt = attempt;
            this.maxAttempts = maxAttempts;
            this.reconnectDelay = Objects.requireNonNull(delay, "delay");
            return this;
        }

        public Builder error(ConnectivityError error) {
            this.error = Objects.requireNonNull(error, "error");
            return this;
        }

        public Builder envelope(MessageEnvelope envelope) {
            this.envelope = Objects.requireNonNull(envelope, "envelope");
            return this;
        }

        public SupervisorIntents build() {
            return new SupervisorIntents(this);
        }
    }
}
