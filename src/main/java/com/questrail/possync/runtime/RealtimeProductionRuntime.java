package com.questrail.possync.runtime;

import com.questrail.possync.api.RealtimeConnection;
import com.questrail.possync.realtime.RealtimeConnectionSupervisor;
import com.questrail.possync.realtime.auth.CredentialSource;
import com.questrail.possync.realtime.bus.EventBus;
import com.questrail.possync.realtime.config.RealtimeConnectionConfig;
import com.questrail.possync.realtime.internal.time.EventLoopScheduler;
import com.questrail.possync.realtime.internal.time.SystemMonotonicClock;
import com.questrail.possync.realtime.internal.time.WallClock;
import com.questrail.possync.realtime.observability.ConnectivityObservabilitySink;
import com.questrail.possync.realtime.observability.NullObservabilitySink;
import com.questrail.possync.realtime.poll.ActiveStateClient;
import com.questrail.possync.realtime.poll.HttpActiveStateClient;
import com.questrail.possync.realtime.transport.TransportSocketFactory;
import com.questrail.possync.realtime.transport.netty.NettyWebSocketTransportFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * RealtimeProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production realtime stack.
 *
 * <pre>
 *   RealtimeProductionRuntime runtime = RealtimeProductionRuntime.builder()
 *       .withConfig(config)
 *       .withCredentialSource(session)
 *       .withObservabilitySink(new Slf4jConnectivityObservabilitySink())
 *       .build();
 *
 *   runtime.connection().connect();
 *   ...
 *   runtime.stop();
 * </pre>
 *
 * The runtime owns one single-threaded scheduled executor that is both the
 * supervisor's event loop and its timer scheduler. It also owns the Netty
 * event loop group unless a socket factory was supplied by the caller.
 */
public final class RealtimeProductionRuntime {
    private final RealtimeConnectionSupervisor connection;
    private final ScheduledExecutorService loopExecutor;
    private final NettyWebSocketTransportFactory ownedSocketFactory;

    private RealtimeProductionRuntime(
            RealtimeConnectionSupervisor connection,
            ScheduledExecutorService loopExecutor,
            NettyWebSocketTransportFactory ownedSocketFactory) {
        this.connection = connection;
        this.loopExecutor = loopExecutor;
        this.ownedSocketFactory = ownedSocketFactory;
    }

    public RealtimeConnection connection() {
        return connection;
    }

    /**
     * Disconnects, then releases the event loop and transport threads.
     */
    public void stop() {
        connection.disconnect();

        loopExecutor.shutdown();
        try {
            if (!loopExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                loopExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            loopExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (ownedSocketFactory != null) {
            ownedSocketFactory.shutdown();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RealtimeConnectionConfig config;
        private CredentialSource credentialSource;
        private ConnectivityObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private TransportSocketFactory socketFactory;
        private ActiveStateClient activeStateClient;
        private EventBus eventBus;

        public Builder withConfig(RealtimeConnectionConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCredentialSource(CredentialSource source) {
            this.credentialSource = source;
            return this;
        }

        public Builder withObservabilitySink(ConnectivityObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Overrides the Netty WebSocket transport.
         */
        public Builder withSocketFactory(TransportSocketFactory factory) {
            this.socketFactory = factory;
            return this;
        }

        /**
         * Overrides the {@code java.net.http} polling client.
         */
        public Builder withActiveStateClient(ActiveStateClient client) {
            this.activeStateClient = client;
            return this;
        }

        public Builder withEventBus(EventBus bus) {
            this.eventBus = bus;
            return this;
        }

        public RealtimeProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(credentialSource, "credentialSource");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Event loop (also the timer scheduler)
            ScheduledExecutorService loopExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "pos-realtime-loop");
                t.setDaemon(true);
                return t;
            });
            EventLoopScheduler loop = new EventLoopScheduler(loopExec, SystemMonotonicClock.INSTANCE);

            // 2. Transport
            NettyWebSocketTransportFactory ownedFactory = null;
            TransportSocketFactory sockets = socketFactory;
            if (sockets == null) {
                ownedFactory = new NettyWebSocketTransportFactory();
                sockets = ownedFactory;
            }

            // 3. Polling client
            ActiveStateClient poller = activeStateClient != null
                    ? activeStateClient
                    : HttpActiveStateClient.create(config::activeOrdersUri, config.timingPolicy().connectTimeout());

            // 4. Supervisor
            RealtimeConnectionSupervisor supervisor = new RealtimeConnectionSupervisor(
                config,
                sockets,
                poller,
                credentialSource,
                loop,
                loop,
                WallClock.SYSTEM,
                observabilitySink,
                eventBus != null ? eventBus : new EventBus(),
                () -> ThreadLocalRandom.current().nextDouble()
            );

            return new RealtimeProductionRuntime(supervisor, loopExec, ownedFactory);
        }
    }
}
