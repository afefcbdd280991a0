package com.questrail.possync.realtime.internal.exec;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.possync.api.BusEvent;
import com.questrail.possync.api.ConnectedNotice;
import com.questrail.possync.api.DisconnectNotice;
import com.questrail.possync.api.EventChannels;
import com.questrail.possync.api.EventSource;
import com.questrail.possync.api.ReconnectNotice;
import com.questrail.possync.realtime.auth.AuthNegotiator;
import com.questrail.possync.realtime.auth.CloseClassifier;
import com.questrail.possync.realtime.auth.CredentialSource;
import com.questrail.possync.realtime.bus.EventBus;
import com.questrail.possync.realtime.codec.EnvelopeCodec;
import com.questrail.possync.realtime.codec.EnvelopeDecodeException;
import com.questrail.possync.realtime.internal.events.PollEvent;
import com.questrail.possync.realtime.internal.events.SocketEvent;
import com.questrail.possync.realtime.internal.events.SupervisorEvent;
import com.questrail.possync.realtime.internal.events.TimerEvent;
import com.questrail.possync.realtime.internal.state.ConnectionSnapshot;
import com.questrail.possync.realtime.internal.state.SupervisorIntents;
import com.questrail.possync.realtime.internal.time.Cancellable;
import com.questrail.possync.realtime.internal.time.MonotonicClock;
import com.questrail.possync.realtime.internal.time.MonotonicScheduler;
import com.questrail.possync.realtime.internal.time.WallClock;
import com.questrail.possync.realtime.model.Credential;
import com.questrail.possync.realtime.model.MessageEnvelope;
import com.questrail.possync.realtime.model.MessageTypes;
import com.questrail.possync.realtime.observability.ConnectivityErrorEvent;
import com.questrail.possync.realtime.observability.ConnectivityObservabilitySink;
import com.questrail.possync.realtime.observability.TransportObservabilityEvent;
import com.questrail.possync.realtime.transport.TransportSocket;
import com.questrail.possync.realtime.transport.TransportSocketFactory;
import com.questrail.possync.realtime.transport.TransportSocketListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * DefaultSupervisorIntentExecutor
 * =============================================================================
 * Production executor for {@link SupervisorIntents}.
 *
 * <h2>Outbound wiring flow</h2>
 * <pre>
 *   SupervisorEvent
 *      ↓
 *   SupervisorReducer
 *      ↓ emits
 *   SupervisorIntents
 *      ↓ consumed by
 *   DefaultSupervisorIntentExecutor   (this class)
 *      ↓ delegates to
 *   TransportSocket / HeartbeatMonitor / ReconnectScheduler / PollingFallback / EventBus
 * </pre>
 *
 * <h2>Generations</h2>
 * Each socket is created with a listener bound to the generation the reducer
 * assigned it. Callbacks are re-submitted as events tagged with that
 * generation; the reducer discards those from retired sockets, so a late close
 * from a superseded socket can never disturb its successor.
 *
 * <h2>Threading</h2>
 * {@link #execute} runs on the supervisor's event loop. Socket callbacks may
 * arrive on transport threads; they only construct events and hand them to
 * {@code events}, which marshals them back onto the loop.
 */
public final class DefaultSupervisorIntentExecutor implements SupervisorIntentExecutor
{
    private static final Logger log = LoggerFactory.getLogger(DefaultSupervisorIntentExecutor.class);

    private final TransportSocketFactory socketFactory;
    private final AuthNegotiator auth;
    private final EnvelopeCodec codec;
    private final EventBus bus;
    private final HeartbeatMonitor heartbeat;
    private final ReconnectScheduler reconnect;
    private final PollingFallback polling;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ConnectivityTimingPolicy timing;
    private final Consumer<SupervisorEvent> events;
    private final CredentialSource credentials;
    private final Supplier<ConnectionSnapshot> snapshot;
    private final ConnectivityObservabilitySink sink;

    private volatile TransportSocket currentSocket;
    private Cancellable connectTimeout = Cancellable.NONE;

    public DefaultSupervisorIntentExecutor(TransportSocketFactory socketFactory,
                                           AuthNegotiator auth,
                                           EnvelopeCodec codec,
                                           EventBus bus,
                                           HeartbeatMonitor heartbeat,
                                           ReconnectScheduler reconnect,
                                           PollingFallback polling,
                                           MonotonicScheduler scheduler,
                                           WallClock wallClock,
                                           ConnectivityTimingPolicy timing,
                                           Consumer<SupervisorEvent> events,
                                           CredentialSource credentials,
                                           Supplier<ConnectionSnapshot> snapshot,
                                           ConnectivityObservabilitySink sink)
    {
        this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");
        this.auth = Objects.requireNonNull(auth, "auth");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
        this.reconnect = Objects.requireNonNull(reconnect, "reconnect");
        this.polling = Objects.requireNonNull(polling, "polling");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = scheduler.clock();
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.events = Objects.requireNonNull(events, "events");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void execute(SupervisorIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        if (intents.isEmpty()) {
            return;
        }

        // EnumSet iteration follows declaration order, which is execution order.
        Duration reconnectDelay = intents.reconnectDelay();
        for (SupervisorIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case CANCEL_CONNECT_TIMEOUT -> cancelConnectTimeout();
                case CANCEL_RECONNECT -> reconnect.cancel();
                case STOP_HEARTBEAT -> heartbeat.stop();
                case STOP_POLLING -> polling.stop();
                case CLOSE_SOCKET -> closeSocket(intents.closeCode(), intents.closeReason());
                case OPEN_SOCKET -> openSocket(intents);
                case ARM_CONNECT_TIMEOUT -> armConnectTimeout(intents.generation());
                case SEND_AUTHENTICATE -> sendAuthenticate(intents);
                case SEND_PONG -> sendControl(MessageTypes.PONG);
                case NOTE_PONG -> heartbeat.pongReceived();
                case START_HEARTBEAT -> startHeartbeat(intents.generation());
                case SUBSCRIBE_EVENTS -> subscribeEvents();
                case ARM_RECONNECT -> reconnectDelay = armReconnect(intents.reconnectDelay());
                case START_POLLING -> startPolling();
                case EMIT_DISCONNECTED -> publish(EventChannels.DISCONNECTED,
                        new DisconnectNotice(intents.closeCode(), intents.closeReason()));
                case EMIT_ERROR -> intents.error().ifPresent(error -> publish(EventChannels.ERROR, error));
                case EMIT_RECONNECTING -> publish(EventChannels.RECONNECTING,
                        new ReconnectNotice(intents.attempt(), intents.maxAttempts(), reconnectDelay));
                case EMIT_CONNECTED -> emitConnected(intents);
                case DELIVER_MESSAGE -> intents.envelope().ifPresent(env -> deliver(env, EventSource.SOCKET));
                case REQUEST_CREDENTIAL_REFRESH -> requestCredentialRefresh();
            }
        }
    }

    /**
     * Writes an application message to the current socket.
     *
     * @return {@code false} if no socket is open or the write was refused
     */
    public boolean send(MessageEnvelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        TransportSocket socket = currentSocket;
        if (socket == null || !socket.isOpen()) {
            return false;
        }
        return socket.send(codec.encode(envelope));
    }

    // ---------------------------------------------------------------------
    // Socket lifecycle
    // ---------------------------------------------------------------------

    private void openSocket(SupervisorIntents intents)
    {
        long generation = intents.generation();
        URI target = intents.targetAddress()
                .orElseThrow(() -> new IllegalStateException("OPEN_SOCKET intent requires a target address."));
        Credential credential = intents.credential()
                .orElseThrow(() -> new IllegalStateException("OPEN_SOCKET intent requires a credential."));

        TransportSocket previous = currentSocket;
        if (previous != null) {
            currentSocket = null;
            previous.close(CloseClassifier.NORMAL_CLOSURE, "Superseded");
        }

        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(),
                TransportObservabilityEvent.Kind.SOCKET_OPENING, generation, target.toString()));

        try {
            TransportSocket socket = socketFactory.create(target, auth.subprotocols(credential),
                    new GenerationListener(generation));
            currentSocket = socket;
            socket.open();
        }
        catch (RuntimeException e) {
            log.warn("Unable to open socket to {}: {}", target, e.toString());
            sink.onError(new ConnectivityErrorEvent(wallClock.now(), "Socket open failed", e));
            events.accept(new SocketEvent.SocketClosed(wallClock.now(), generation,
                    CloseClassifier.ABNORMAL_CLOSURE, describe(e), clock.nowNanos()));
        }
    }

    private void closeSocket(int code, String reason)
    {
        TransportSocket socket = currentSocket;
        currentSocket = null;
        if (socket != null) {
            socket.close(code, reason);
        }
    }

    private void armConnectTimeout(long generation)
    {
        cancelConnectTimeout();
        connectTimeout = scheduler.scheduleAfter(timing.connectTimeout(), () ->
                events.accept(new TimerEvent.ConnectTimedOut(wallClock.now(), generation, clock.nowNanos())));
    }

    private void cancelConnectTimeout()
    {
        connectTimeout.cancel();
        connectTimeout = Cancellable.NONE;
    }

    private void sendAuthenticate(SupervisorIntents intents)
    {
        Optional<Credential> credential = intents.credential().or(() -> snapshot.get().credential());
        boolean delivered = false;
        if (credential.isPresent()) {
            delivered = send(auth.authenticateMessage(credential.get(), wallClock.now()));
        }
        if (!delivered) {
            log.debug("Authenticate message not delivered on generation {}", intents.generation());
        }
        events.accept(new SocketEvent.AuthenticationSent(wallClock.now(), intents.generation(), delivered));
    }

    // ---------------------------------------------------------------------
    // Heartbeat and subscriptions
    // ---------------------------------------------------------------------

    private void startHeartbeat(long generation)
    {
        heartbeat.start(
                () -> sendControl(MessageTypes.PING),
                missed -> events.accept(new TimerEvent.HeartbeatTimedOut(wallClock.now(), generation, missed)));
    }

    private void sendControl(String type)
    {
        Instant now = wallClock.now();
        ObjectNode data = codec.mapper().createObjectNode();
        data.put("timestamp", now.toString());
        if (!send(new MessageEnvelope(type, data, now, tenantId()))) {
            log.debug("Dropped {}: socket not open", type);
        }
    }

    private void subscribeEvents()
    {
        Instant now = wallClock.now();
        ObjectNode data = codec.mapper().createObjectNode();
        ArrayNode types = data.putArray("events");
        MessageTypes.BUSINESS_EVENTS.forEach(types::add);

        if (!send(new MessageEnvelope(MessageTypes.SUBSCRIBE, data, now, tenantId()))) {
            log.warn("Subscribe message not delivered; business events may not arrive until reconnect");
        }
    }

    private String tenantId()
    {
        return snapshot.get().credential().map(Credential::tenantId).orElse(null);
    }

    private void requestCredentialRefresh()
    {
        log.info("Server reports the bearer token is expiring; requesting a refresh");
        try {
            credentials.requestRefresh();
        }
        catch (RuntimeException e) {
            log.warn("Token refresh request failed; the connection keeps the current token", e);
            sink.onError(new ConnectivityErrorEvent(wallClock.now(), "Token refresh request failed", e));
        }
    }

    // ---------------------------------------------------------------------
    // Reconnect and polling
    // ---------------------------------------------------------------------

    private Duration armReconnect(Duration nominal)
    {
        // The token is read when the timer fires so a refresh made during the
        // wait is picked up by this attempt.
        return reconnect.arm(nominal, () -> events.accept(new TimerEvent.ReconnectDue(
                wallClock.now(), credentials.currentToken().orElse(null), clock.nowNanos())));
    }

    private void startPolling()
    {
        polling.start(
                this::pollingCredential,
                envelope -> deliver(envelope, EventSource.POLLING),
                status -> events.accept(new PollEvent.PollRejected(wallClock.now(), status)));
    }

    private Optional<Credential> pollingCredential()
    {
        Optional<Credential> held = snapshot.get().credential();
        if (held.isEmpty()) {
            return Optional.empty();
        }
        return credentials.currentToken()
                .filter(token -> !token.isBlank())
                .map(token -> new Credential(token, held.get().identity()))
                .or(() -> held);
    }

    // ---------------------------------------------------------------------
    // Bus
    // ---------------------------------------------------------------------

    private void emitConnected(SupervisorIntents intents)
    {
        URI target = intents.targetAddress()
                .orElseThrow(() -> new IllegalStateException("EMIT_CONNECTED intent requires a target address."));
        Credential credential = intents.credential()
                .orElseThrow(() -> new IllegalStateException("EMIT_CONNECTED intent requires a credential."));

        publish(EventChannels.CONNECTED, new ConnectedNotice(target, credential.tenantId()));
    }

    private void publish(String channel, Object payload)
    {
        bus.emit(new BusEvent(channel, payload, EventSource.SUPERVISOR, wallClock.now()));
    }

    private void deliver(MessageEnvelope envelope, EventSource source)
    {
        Instant now = wallClock.now();
        bus.emit(new BusEvent(envelope.type(), envelope, source, now));
        bus.emit(new BusEvent(EventChannels.MESSAGE, envelope, source, now));
    }

    private static String describe(Throwable t)
    {
        String message = t.getMessage();
        return message == null ? t.getClass().getSimpleName() : message;
    }

    /**
     * Re-submits transport callbacks as events tagged with one generation.
     */
    private final class GenerationListener implements TransportSocketListener
    {
        private final long generation;

        GenerationListener(long generation)
        {
            this.generation = generation;
        }

        @Override
        public void onOpen()
        {
            sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(),
                    TransportObservabilityEvent.Kind.SOCKET_OPENED, generation, ""));
            events.accept(new SocketEvent.SocketOpened(wallClock.now(), generation));
        }

        @Override
        public void onMessage(String text)
        {
            Instant now = wallClock.now();
            MessageEnvelope envelope;
            try {
                envelope = codec.decode(text, now);
            }
            catch (EnvelopeDecodeException e) {
                log.warn("Dropping unreadable message on generation {}: {}", generation, e.getMessage());
                sink.onError(new ConnectivityErrorEvent(now, "Unreadable inbound message", e));
                return;
            }
            events.accept(new SocketEvent.MessageReceived(now, generation, envelope));
        }

        @Override
        public void onClose(int code, String reason)
        {
            long nowNanos = clock.nowNanos();
            sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(),
                    TransportObservabilityEvent.Kind.SOCKET_CLOSED, generation, code + " " + reason));
            events.accept(new SocketEvent.SocketClosed(wallClock.now(), generation, code, reason, nowNanos));
        }

        @Override
        public void onError(Throwable cause)
        {
            sink.onError(new ConnectivityErrorEvent(wallClock.now(),
                    "Socket error on generation " + generation, cause));
        }
    }
}
