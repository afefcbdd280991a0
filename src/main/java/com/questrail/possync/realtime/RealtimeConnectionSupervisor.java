package com.questrail.possync.realtime;

import com.questrail.possync.api.ConnectOptions;
import com.questrail.possync.api.ConnectionState;
import com.questrail.possync.api.ConnectionStatus;
import com.questrail.possync.api.EventListener;
import com.questrail.possync.api.MissingCredentialException;
import com.questrail.possync.api.MissingIdentityException;
import com.questrail.possync.api.RealtimeConnection;
import com.questrail.possync.api.Subscription;
import com.questrail.possync.realtime.auth.AuthNegotiator;
import com.questrail.possync.realtime.auth.CloseClassifier;
import com.questrail.possync.realtime.auth.CredentialSource;
import com.questrail.possync.realtime.bus.EventBus;
import com.questrail.possync.realtime.codec.EnvelopeCodec;
import com.questrail.possync.realtime.config.RealtimeConnectionConfig;
import com.questrail.possync.realtime.internal.events.SupervisorCommand;
import com.questrail.possync.realtime.internal.events.SupervisorEvent;
import com.questrail.possync.realtime.internal.exec.ConnectivityTimingPolicy;
import com.questrail.possync.realtime.internal.exec.DefaultSupervisorIntentExecutor;
import com.questrail.possync.realtime.internal.exec.HeartbeatMonitor;
import com.questrail.possync.realtime.internal.exec.PollingFallback;
import com.questrail.possync.realtime.internal.exec.ReconnectScheduler;
import com.questrail.possync.realtime.internal.state.ConnectionSnapshot;
import com.questrail.possync.realtime.internal.state.SupervisorReducer;
import com.questrail.possync.realtime.internal.time.MonotonicClock;
import com.questrail.possync.realtime.internal.time.MonotonicScheduler;
import com.questrail.possync.realtime.internal.time.WallClock;
import com.questrail.possync.realtime.model.ConnectionIdentity;
import com.questrail.possync.realtime.model.Credential;
import com.questrail.possync.realtime.model.MessageEnvelope;
import com.questrail.possync.realtime.observability.ConnectivityErrorEvent;
import com.questrail.possync.realtime.observability.ConnectivityObservabilitySink;
import com.questrail.possync.realtime.observability.StateTransitionEvent;
import com.questrail.possync.realtime.poll.ActiveStateClient;
import com.questrail.possync.realtime.transport.TransportSocketFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.DoubleSupplier;

/**
 * RealtimeConnectionSupervisor
 * =============================================================================
 * Owner of one realtime connection: composes the reducer, the executor and
 * the connection snapshot behind the {@link RealtimeConnection} facade.
 *
 * <h2>What this class is</h2>
 * <ul>
 *   <li>The single-threaded, actor-style coordinator of the connection</li>
 *   <li>The place where caller-thread preconditions are checked</li>
 * </ul>
 *
 * <h2>What this class is <em>not</em></h2>
 * <ul>
 *   <li>It is <strong>not</strong> a transport adapter</li>
 *   <li>It does <strong>not</strong> decide transitions; the reducer does</li>
 *   <li>It does <strong>not</strong> perform side effects; the executor does</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * <pre>
 *   event → reducer → new snapshot → intents → executor
 * </pre>
 * Every event is handed to {@code loop}. Events submitted while another is
 * being processed (for example by the executor itself) are queued and drained
 * in order, never nested.
 */
public final class RealtimeConnectionSupervisor implements RealtimeConnection
{
    private static final Logger log = LoggerFactory.getLogger(RealtimeConnectionSupervisor.class);

    private final RealtimeConnectionConfig config;
    private final CredentialSource credentials;
    private final Executor loop;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final ConnectivityObservabilitySink sink;
    private final EventBus bus;
    private final EnvelopeCodec codec;
    private final SupervisorReducer reducer;
    private final DefaultSupervisorIntentExecutor executor;

    // Touched only on the loop.
    private final Deque<SupervisorEvent> queue = new ArrayDeque<>();
    private boolean draining;

    private volatile ConnectionSnapshot snapshot;

    public RealtimeConnectionSupervisor(RealtimeConnectionConfig config,
                                        TransportSocketFactory socketFactory,
                                        ActiveStateClient activeStateClient,
                                        CredentialSource credentials,
                                        MonotonicScheduler scheduler,
                                        Executor loop,
                                        WallClock wallClock,
                                        ConnectivityObservabilitySink sink,
                                        EventBus bus,
                                        DoubleSupplier random)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.clock = Objects.requireNonNull(scheduler, "scheduler").clock();
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.codec = new EnvelopeCodec();

        ConnectivityTimingPolicy timing = config.timingPolicy();
        AuthNegotiator auth = new AuthNegotiator(new CloseClassifier(timing.quickFailureThreshold()));

        this.reducer = new SupervisorReducer(config, auth);
        this.snapshot = ConnectionSnapshot.initial(wallClock.now());

        PollingFallback polling = new PollingFallback(
                Objects.requireNonNull(activeStateClient, "activeStateClient"),
                codec,
                scheduler,
                loop,
                timing.pollingInterval(),
                wallClock,
                sink);

        this.executor = new DefaultSupervisorIntentExecutor(
                Objects.requireNonNull(socketFactory, "socketFactory"),
                auth,
                codec,
                bus,
                new HeartbeatMonitor(scheduler, timing),
                new ReconnectScheduler(scheduler, config.reconnectPolicy().jitterFactor(),
                        Objects.requireNonNull(random, "random")),
                polling,
                scheduler,
                wallClock,
                timing,
                this::submit,
                credentials,
                () -> snapshot,
                sink);
    }

    // ---------------------------------------------------------------------
    // RealtimeConnection
    // ---------------------------------------------------------------------

    @Override
    public void connect(ConnectOptions options)
    {
        Objects.requireNonNull(options, "options");

        ConnectionState current = snapshot.state();
        if (current.hasLiveSocket()) {
            log.debug("connect() ignored: connection is already {}", current);
            return;
        }

        Credential credential = resolveCredential(options);
        log.info("Connecting user {} to tenant {}", credential.userId(), credential.tenantId());
        submit(new SupervisorCommand.ConnectRequested(wallClock.now(), credential, clock.nowNanos()));
    }

    @Override
    public void disconnect()
    {
        submit(new SupervisorCommand.DisconnectRequested(wallClock.now()));
    }

    @Override
    public void credentialRefreshed()
    {
        submit(new SupervisorCommand.CredentialRefreshed(
                wallClock.now(), credentials.currentToken().orElse(null), clock.nowNanos()));
    }

    @Override
    public void networkAvailabilityChanged(boolean available)
    {
        log.info("Network {}", available ? "available" : "unavailable");
        submit(new SupervisorCommand.NetworkAvailabilityChanged(
                wallClock.now(), available, credentials.currentToken().orElse(null), clock.nowNanos()));
    }

    @Override
    public boolean send(String type, Object data)
    {
        Objects.requireNonNull(type, "type");

        ConnectionSnapshot current = snapshot;
        if (current.state() != ConnectionState.CONNECTED) {
            log.warn("Dropping '{}' message: connection is {}", type, current.state());
            return false;
        }

        MessageEnvelope envelope;
        try {
            String tenant = current.credential().map(Credential::tenantId).orElse(null);
            envelope = codec.envelope(type, data, wallClock.now(), tenant);
        }
        catch (IllegalArgumentException e) {
            log.warn("Dropping '{}' message: payload is not serializable", type, e);
            return false;
        }

        boolean sent = executor.send(envelope);
        if (!sent) {
            log.warn("Dropping '{}' message: socket is not open", type);
        }
        return sent;
    }

    @Override
    public Subscription subscribe(String channel, EventListener listener)
    {
        return bus.subscribe(channel, listener);
    }

    @Override
    public void unsubscribe(String channel, EventListener listener)
    {
        bus.unsubscribe(channel, listener);
    }

    @Override
    public ConnectionState getState()
    {
        return snapshot.state();
    }

    @Override
    public ConnectionStatus getStatus()
    {
        ConnectionSnapshot current = snapshot;
        return new ConnectionStatus(
                current.state(),
                current.retry().attemptCount(),
                config.reconnectPolicy().maxAttempts(),
                current.pollingActive(),
                current.targetAddress(),
                current.lastError());
    }

    /**
     * Current immutable snapshot, for diagnostics and tests.
     */
    public ConnectionSnapshot snapshot()
    {
        return snapshot;
    }

    // ---------------------------------------------------------------------
    // Event loop
    // ---------------------------------------------------------------------

    void submit(SupervisorEvent event)
    {
        Objects.requireNonNull(event, "event");
        loop.execute(() -> enqueueAndDrain(event));
    }

    private void enqueueAndDrain(SupervisorEvent event)
    {
        queue.addLast(event);
        if (draining) {
            return;
        }

        draining = true;
        try {
            SupervisorEvent next;
            while ((next = queue.pollFirst()) != null) {
                process(next);
            }
        }
        finally {
            draining = false;
        }
    }

    private void process(SupervisorEvent event)
    {
        ConnectionSnapshot oldState = snapshot;
        SupervisorReducer.Result result = reducer.apply(oldState, event);
        snapshot = result.newState();

        sink.onStateTransition(new StateTransitionEvent(
                wallClock.now(),
                oldState,
                result.newState(),
                event,
                result.intents()));

        try {
            executor.execute(result.intents());
        }
        catch (Exception e) {
            // Includes checked exceptions rethrown undeclared by listener code.
            log.error("Failed to execute {} for {}", result.intents(), event, e);
            sink.onError(new ConnectivityErrorEvent(wallClock.now(), "Intent execution error", e));
        }
    }

    // ---------------------------------------------------------------------
    // Credential resolution (caller thread)
    // ---------------------------------------------------------------------

    private Credential resolveCredential(ConnectOptions options)
    {
        String userId = options.userId()
                .or(credentials::currentUserId)
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new MissingIdentityException("No signed-in user; cannot open realtime connection"));

        String tenantId = options.tenantId()
                .or(credentials::currentTenantId)
                .filter(value -> !value.isBlank())
                .orElse(config.fallbackTenantId());

        String token = options.token()
                .or(credentials::currentToken)
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new MissingCredentialException("No bearer token available for user " + userId));

        return new Credential(token, new ConnectionIdentity(userId, tenantId));
    }
}
