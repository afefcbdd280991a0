package com.questrail.possync.realtime.internal.events;

import com.questrail.possync.realtime.model.Credential;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Requests made by the connection owner or the token manager.
 */
public sealed interface SupervisorCommand extends SupervisorEvent
        permits SupervisorCommand.ConnectRequested,
                SupervisorCommand.DisconnectRequested,
                SupervisorCommand.CredentialRefreshed,
                SupervisorCommand.NetworkAvailabilityChanged
{
    /**
     * Explicit {@code connect()}. The credential has already been resolved and
     * validated on the caller's thread.
     */
    final class ConnectRequested extends SupervisorEvent.Base implements SupervisorCommand {
        private final Credential credential;
        private final long nowNanos;

        public ConnectRequested(Instant timestamp, Credential credential, long nowNanos) {
            super(timestamp);
            this.credential = Objects.requireNonNull(credential, "credential");
            this.nowNanos = nowNanos;
        }

        public Credential credential() {
            return credential;
        }

        public long nowNanos() {
            return nowNanos;
        }
    }

    final class DisconnectRequested extends SupervisorEvent.Base implements SupervisorCommand {
        public DisconnectRequested(Instant timestamp) {
            super(timestamp);
        }
    }

    /**
     * The token manager produced a new credential. Carries the token read from
     * the credential source at signal time; empty if none was available.
     */
    final class CredentialRefreshed extends SupervisorEvent.Base implements SupervisorCommand {
        private final String token;
        private final long nowNanos;

        public CredentialRefreshed(Instant timestamp, String token, long nowNanos) {
            super(timestamp);
            this.token = token;
            this.nowNanos = nowNanos;
        }

        public Optional<String> token() {
            return Optional.ofNullable(token).filter(t -> !t.isBlank());
        }

        public long nowNanos() {
            return nowNanos;
        }
    }

    /**
     * The device's network reachability changed. Carries the token read from
     * the credential source at signal time so a restored network can retry
     * with the newest credential.
     */
    final class NetworkAvailabilityChanged extends SupervisorEvent.Base implements SupervisorCommand {
        private final boolean available;
        private final String token;
        private final long nowNanos;

        public NetworkAvailabilityChanged(Instant timestamp, boolean available, String token, long nowNanos) {
            super(timestamp);
            this.available = available;
            this.token = token;
            this.nowNanos = nowNanos;
        }

        public boolean available() {
            return available;
        }

        public Optional<String> token() {
            return Optional.ofNullable(token).filter(t -> !t.isBlank());
        }

        public long nowNanos() {
            return nowNanos;
        }
    }
}
