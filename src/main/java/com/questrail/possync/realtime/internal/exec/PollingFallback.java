package com.questrail.possync.realtime.internal.exec;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.possync.realtime.codec.EnvelopeCodec;
import com.questrail.possync.realtime.codec.EnvelopeDecodeException;
import com.questrail.possync.realtime.internal.time.Cancellable;
import com.questrail.possync.realtime.internal.time.MonotonicScheduler;
import com.questrail.possync.realtime.internal.time.WallClock;
import com.questrail.possync.realtime.model.Credential;
import com.questrail.possync.realtime.model.MessageEnvelope;
import com.questrail.possync.realtime.model.MessageTypes;
import com.questrail.possync.realtime.observability.ConnectivityErrorEvent;
import com.questrail.possync.realtime.observability.ConnectivityObservabilitySink;
import com.questrail.possync.realtime.observability.TransportObservabilityEvent;
import com.questrail.possync.realtime.poll.ActiveStateClient;
import com.questrail.possync.realtime.poll.ActiveStateResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * PollingFallback
 * =============================================================================
 * Degraded-mode transport: fetches the tenant's active orders over REST while
 * the socket path is unavailable.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Polls immediately on {@link #start}, then every {@code interval}.</li>
 *   <li>Reads the credential on every tick, so a refresh applies to the next
 *       request without restarting.</li>
 *   <li>2xx: the body becomes one {@code order.updated} envelope per order
 *       (top-level array, or an {@code orders}/{@code data} array); any other
 *       JSON becomes a single envelope.</li>
 *   <li>401/403: polling stops and the rejection is reported once.</li>
 *   <li>Other statuses and I/O failures are logged; polling continues.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * HTTP completions are marshalled onto {@code callbackExecutor} (the
 * supervisor's event loop). Responses that arrive after {@link #stop} or after
 * a restart are dropped (epoch guard).
 */
public final class PollingFallback
{
    private static final Logger log = LoggerFactory.getLogger(PollingFallback.class);

    private final ActiveStateClient client;
    private final EnvelopeCodec codec;
    private final MonotonicScheduler scheduler;
    private final Executor callbackExecutor;
    private final Duration interval;
    private final WallClock wallClock;
    private final ConnectivityObservabilitySink sink;

    private long epoch;
    private volatile boolean active;
    private Cancellable nextTick = Cancellable.NONE;
    private Supplier<Optional<Credential>> credential = Optional::empty;
    private Consumer<MessageEnvelope> onEnvelope = e -> {};
    private IntConsumer onRejected = status -> {};

    public PollingFallback(ActiveStateClient client,
                           EnvelopeCodec codec,
                           MonotonicScheduler scheduler,
                           Executor callbackExecutor,
                           Duration interval,
                           WallClock wallClock,
                           ConnectivityObservabilitySink sink)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Starts polling, replacing any previous run.
     *
     * @param credential supplies the credential for each request
     * @param onEnvelope receives each envelope built from a successful response
     * @param onRejected receives the HTTP status when the credential is refused
     */
    public synchronized void start(Supplier<Optional<Credential>> credential,
                                   Consumer<MessageEnvelope> onEnvelope,
                                   IntConsumer onRejected)
    {
        this.credential = Objects.requireNonNull(credential, "credential");
        this.onEnvelope = Objects.requireNonNull(onEnvelope, "onEnvelope");
        this.onRejected = Objects.requireNonNull(onRejected, "onRejected");

        cancelTick();
        long runEpoch = ++epoch;
        active = true;

        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(),
                TransportObservabilityEvent.Kind.POLLING_STARTED, runEpoch, "every " + interval.toMillis() + "ms"));

        tick(runEpoch);
    }

    public synchronized void stop()
    {
        if (!active) {
            return;
        }
        epoch++;
        active = false;
        cancelTick();
        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(),
                TransportObservabilityEvent.Kind.POLLING_STOPPED, epoch, ""));
    }

    public boolean isActive()
    {
        return active;
    }

    private void cancelTick()
    {
        nextTick.cancel();
        nextTick = Cancellable.NONE;
    }

    private void tick(long runEpoch)
    {
        Optional<Credential> current;
        synchronized (this) {
            if (runEpoch != epoch || !active) {
                return;
            }
            nextTick = scheduler.scheduleAfter(interval, () -> tick(runEpoch));
            current = credential.get();
        }

        if (current.isEmpty()) {
            log.warn("Skipping poll: no credential available");
            return;
        }

        Credential cred = current.get();
        CompletableFuture<ActiveStateResponse> request;
        try {
            request = client.fetchActiveOrders(cred.tenantId(), cred.token());
        }
        catch (RuntimeException e) {
            request = CompletableFuture.failedFuture(e);
        }

        request.whenComplete((response, failure) ->
                callbackExecutor.execute(() -> onResponse(runEpoch, cred.tenantId(), response, failure)));
    }

    private void onResponse(long runEpoch, String tenantId, ActiveStateResponse response, Throwable failure)
    {
        IntConsumer rejected;
        Consumer<MessageEnvelope> deliver;
        synchronized (this) {
            if (runEpoch != epoch || !active) {
                return;
            }
            rejected = onRejected;
            deliver = onEnvelope;
        }

        if (failure != null) {
            log.warn("Poll for tenant {} failed: {}", tenantId, failure.toString());
            sink.onError(new ConnectivityErrorEvent(wallClock.now(), "Poll request failed", failure));
            return;
        }

        if (response.isAuthRejection()) {
            log.warn("Poll for tenant {} rejected with HTTP {}; stopping polling", tenantId, response.status());
            stop();
            rejected.accept(response.status());
            return;
        }

        if (!response.isSuccess()) {
            log.warn("Poll for tenant {} returned HTTP {}; will retry", tenantId, response.status());
            return;
        }

        List<MessageEnvelope> envelopes;
        try {
            envelopes = toEnvelopes(response.body(), tenantId, wallClock.now());
        }
        catch (EnvelopeDecodeException e) {
            log.warn("Poll for tenant {} returned an unreadable body", tenantId);
            sink.onError(new ConnectivityErrorEvent(wallClock.now(), "Unreadable poll response", e));
            return;
        }

        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(),
                TransportObservabilityEvent.Kind.POLL_COMPLETED, runEpoch, envelopes.size() + " update(s)"));

        for (MessageEnvelope envelope : envelopes) {
            deliver.accept(envelope);
        }
    }

    List<MessageEnvelope> toEnvelopes(String body, String tenantId, Instant now)
    {
        if (body == null || body.isBlank()) {
            return List.of();
        }

        JsonNode root = codec.readBody(body);
        JsonNode items = root;
        if (root.isObject()) {
            if (root.path("orders").isArray()) {
                items = root.get("orders");
            }
            else if (root.path("data").isArray()) {
                items = root.get("data");
            }
        }

        List<MessageEnvelope> envelopes = new ArrayList<>();
        if (items.isArray()) {
            for (JsonNode item : items) {
                envelopes.add(new MessageEnvelope(MessageTypes.ORDER_UPDATED, item, now, tenantId));
            }
        }
        else if (!items.isNull()) {
            envelopes.add(new MessageEnvelope(MessageTypes.ORDER_UPDATED, items, now, tenantId));
        }
        return envelopes;
    }
}
