package com.qqsuccubus.chatgw.gateway.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.chatgw.core.error.TransientBrokerException;
import com.qqsuccubus.chatgw.core.event.EventWireFormat;
import com.qqsuccubus.chatgw.core.event.FallbackEntry;
import com.qqsuccubus.chatgw.core.event.PlatformEvent;
import com.qqsuccubus.chatgw.core.util.Backoff;
import com.qqsuccubus.chatgw.core.util.JsonUtils;
import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import com.qqsuccubus.chatgw.gateway.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event delivery pipeline: publishes platform events to the broker and falls
 * back to a durable buffer whenever the broker cannot take them.
 * <p>
 * <b>Routing:</b> while the broker is not connected, or while the fallback
 * buffer is being drained, events are appended to the buffer tail so no new
 * event overtakes the backlog.
 * </p>
 * <p>
 * <b>Reconnect:</b> exponential backoff per consecutive attempt, capped, and
 * bounded by an attempt count. {@link #initialize()} resets the count.
 * </p>
 */
public class EventPublisher implements IEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private static final int BUFFER_WRITE_RETRIES = 3;
    private static final Duration BUFFER_WRITE_BACKOFF = Duration.ofMillis(100);

    enum State {
        DISCONNECTED,
        CONNECTING,
        CONNECTED
    }

    private final GatewayConfig config;
    private final IBrokerTransport transport;
    private final IFallbackBuffer fallbackBuffer;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Scheduler timer;

    private final AtomicReference<State> state = new AtomicReference<>(State.DISCONNECTED);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private volatile IBrokerConnection connection;
    private volatile Disposable pendingReconnect;
    private volatile boolean closed;

    // Guards the direct-vs-buffer decision against drain completion
    private final Object routeLock = new Object();
    private IBrokerConnection drainOwner;
    private int pendingAppends;

    public EventPublisher(GatewayConfig config,
                          IBrokerTransport transport,
                          IFallbackBuffer fallbackBuffer,
                          MetricsService metricsService,
                          Clock clock,
                          Scheduler timer) {
        this.config = config;
        this.transport = transport;
        this.fallbackBuffer = fallbackBuffer;
        this.metricsService = metricsService;
        this.clock = clock;
        this.timer = timer;
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            reconnectAttempts.set(0);
            return connect();
        });
    }

    private Mono<Void> connect() {
        if (closed) {
            return Mono.empty();
        }
        if (!state.compareAndSet(State.DISCONNECTED, State.CONNECTING)) {
            log.debug("Broker connection is {}, ignoring connect request", state.get());
            return Mono.empty();
        }

        log.info("Connecting to broker at {}", config.getKafkaBootstrap());
        return transport.connect()
            .doOnNext(this::onConnected)
            .then()
            .doOnCancel(() -> {
                if (state.compareAndSet(State.CONNECTING, State.DISCONNECTED)) {
                    log.warn("Broker connect cancelled");
                }
            })
            .onErrorResume(err -> {
                state.set(State.DISCONNECTED);
                log.warn("Broker connection failed: {}", err.getMessage());
                reconnect();
                return Mono.empty();
            });
    }

    private void onConnected(IBrokerConnection conn) {
        if (closed) {
            conn.close();
            state.set(State.DISCONNECTED);
            return;
        }
        connection = conn;
        reconnectAttempts.set(0);
        synchronized (routeLock) {
            // Claimed before CONNECTED so no publish overtakes the backlog
            drainOwner = conn;
        }
        state.set(State.CONNECTED);
        log.info("Broker connected, draining fallback buffer");

        conn.closeSignal().subscribe(
            ignored -> {
            },
            err -> onConnectionLost(conn, err),
            () -> onConnectionLost(conn, null));

        runDrain(conn);
    }

    private void onConnectionLost(IBrokerConnection conn, @Nullable Throwable error) {
        if (connection != conn) {
            return;
        }
        connection = null;
        state.compareAndSet(State.CONNECTED, State.DISCONNECTED);
        log.warn("Broker connection lost{}", error != null ? ": " + error.getMessage() : "");
        if (!closed) {
            reconnect();
        }
    }

    /**
     * Schedules a reconnect with exponential backoff.
     *
     * @return false when closed, a reconnect is already pending, or attempts are exhausted
     */
    public synchronized boolean reconnect() {
        if (closed) {
            return false;
        }
        Disposable pending = pendingReconnect;
        if (pending != null && !pending.isDisposed()) {
            return false;
        }

        int attempt = reconnectAttempts.incrementAndGet();
        int maxAttempts = config.getBrokerRetryAttempts();
        if (attempt > maxAttempts) {
            if (attempt == maxAttempts + 1) {
                log.error("Broker unreachable after {} reconnect attempts; the next buffered event re-initializes",
                    maxAttempts);
            }
            return false;
        }

        Duration delay = Backoff.exponential(attempt, config.getBrokerRetryBaseDelay(), config.getBrokerRetryMaxDelay());
        metricsService.recordBrokerReconnect();
        log.info("Broker reconnect attempt {}/{} in {}", attempt, maxAttempts, delay);

        pendingReconnect = Mono.delay(delay, timer)
            .then(Mono.defer(() -> {
                pendingReconnect = null;
                return connect();
            }))
            .subscribe(
                ignored -> {
                },
                err -> log.error("Broker reconnect attempt {} failed", attempt, err));
        return true;
    }

    private void ensureReconnecting() {
        if (state.get() != State.DISCONNECTED || reconnect()) {
            return;
        }
        if (claimReinitialize()) {
            log.info("Reconnect attempts exhausted, re-initializing broker connection");
            connect().subscribe(
                ignored -> {
                },
                err -> log.error("Broker re-initialization failed", err));
        }
    }

    /**
     * Resets the attempt counter once the backoff schedule ran out with no reconnect pending.
     */
    private synchronized boolean claimReinitialize() {
        Disposable pending = pendingReconnect;
        if (closed || (pending != null && !pending.isDisposed())
            || reconnectAttempts.get() <= config.getBrokerRetryAttempts()) {
            return false;
        }
        reconnectAttempts.set(0);
        return true;
    }

    @Override
    public Mono<Void> publishEvent(PlatformEvent event) {
        return Mono.defer(() -> {
                String json = EventWireFormat.serialize(event, config.getEventPlatform(), clock.instant());

                IBrokerConnection conn = routeDirect();
                if (conn == null) {
                    log.debug("Buffering {} event for session {} (broker {}, draining={})",
                        event.getType(), event.getSessionId(), state.get(), isDraining());
                    return bufferEvent(json)
                        .then(Mono.fromRunnable(this::ensureReconnecting));
                }

                long startNanos = System.nanoTime();
                return Mono.defer(() -> conn.publish(event.getSessionId(), json))
                    .doOnSuccess(v -> {
                        metricsService.recordBrokerPublishLatency(startNanos);
                        metricsService.recordPublished(false);
                        log.debug("Published {} event for session {}", event.getType(), event.getSessionId());
                    })
                    .onErrorResume(err -> {
                        log.warn("Publish of {} event for session {} failed, buffering: {}",
                            event.getType(), event.getSessionId(), err.getMessage());
                        beginAppend();
                        return bufferEvent(json)
                            .then(Mono.fromRunnable(() -> afterPublishFailure(conn)));
                    });
            })
            .onErrorResume(err -> {
                log.error("Dropping {} event for session {}", event.getType(), event.getSessionId(), err);
                metricsService.recordLost();
                return Mono.empty();
            });
    }

    /**
     * Returns the connection to publish on, or null after registering a pending
     * buffer append.
     */
    @Nullable
    private IBrokerConnection routeDirect() {
        synchronized (routeLock) {
            IBrokerConnection conn = connection;
            if (state.get() == State.CONNECTED && conn != null && drainOwner == null) {
                return conn;
            }
            pendingAppends++;
            return null;
        }
    }

    private void beginAppend() {
        synchronized (routeLock) {
            pendingAppends++;
        }
    }

    private void appendFinished() {
        synchronized (routeLock) {
            pendingAppends--;
        }
    }

    private void afterPublishFailure(IBrokerConnection conn) {
        if (state.get() == State.CONNECTED && connection == conn) {
            // Still connected: push the entry out again through the drain
            triggerDrain(conn);
        } else {
            ensureReconnecting();
        }
    }

    /**
     * Appends to the fallback buffer, retrying briefly. Never errors: a write that
     * keeps failing is logged and counted as lost.
     */
    private Mono<Void> bufferEvent(String json) {
        return Mono.defer(() -> fallbackBuffer.append(FallbackEntry.create(json, clock.instant()).getRaw()))
            .retryWhen(Retry.backoff(BUFFER_WRITE_RETRIES, BUFFER_WRITE_BACKOFF).scheduler(timer))
            .doOnSuccess(v -> metricsService.recordBuffered())
            .onErrorResume(err -> {
                log.error("Event lost: fallback buffer write failed after {} retries", BUFFER_WRITE_RETRIES, err);
                metricsService.recordLost();
                return Mono.empty();
            })
            .doOnTerminate(this::appendFinished)
            .doOnCancel(this::appendFinished);
    }

    private void triggerDrain(IBrokerConnection conn) {
        synchronized (routeLock) {
            if (drainOwner != null) {
                return;
            }
            drainOwner = conn;
        }
        runDrain(conn);
    }

    private void runDrain(IBrokerConnection conn) {
        AtomicLong republished = new AtomicLong();
        drainBatches(conn, republished)
            .subscribe(
                ignored -> {
                },
                err -> onDrainFailed(conn, republished.get(), err),
                () -> log.info("Fallback drain complete, {} events republished", republished.get()));
    }

    private void onDrainFailed(IBrokerConnection conn, long republished, Throwable err) {
        if (closed || connection != conn) {
            releaseDrain(conn);
            log.warn("Fallback drain stopped after {} events, remaining entries stay buffered: {}",
                republished, err.getMessage());
            return;
        }
        // Still connected: keep the drain claim so new events stay behind the backlog
        Duration delay = config.getBrokerRetryBaseDelay();
        log.error("Fallback drain failed after {} events, retrying in {}: {}", republished, delay, err.getMessage());
        Mono.delay(delay, timer).subscribe(ignored -> runDrain(conn));
    }

    /**
     * Republishes the buffer head in batches, oldest first, removing each entry only
     * after the broker acknowledged it.
     */
    private Mono<Void> drainBatches(IBrokerConnection conn, AtomicLong republished) {
        return Mono.defer(() -> {
                if (closed || connection != conn) {
                    return Mono.error(new TransientBrokerException("Broker connection changed during drain"));
                }
                return fallbackBuffer.peekBatch(config.getDrainBatchSize());
            })
            .flatMap(batch -> {
                if (batch.isEmpty()) {
                    if (tryFinishDrain(conn)) {
                        return Mono.<Void>empty();
                    }
                    // Appends still in flight: wait for them to land
                    return Mono.delay(config.getDrainBatchPause(), timer)
                        .then(Mono.defer(() -> drainBatches(conn, republished)));
                }
                log.debug("Draining batch of {} fallback entries", batch.size());
                return Flux.fromIterable(batch)
                    .concatMap(raw -> republish(conn, raw, republished))
                    .then(Mono.delay(config.getDrainBatchPause(), timer))
                    .then(Mono.defer(() -> drainBatches(conn, republished)));
            });
    }

    private Mono<Void> republish(IBrokerConnection conn, String raw, AtomicLong republished) {
        return Mono.defer(() -> {
                FallbackEntry entry = FallbackEntry.parse(raw);
                return conn.publish(keyOf(entry.getEventJson()), entry.getEventJson());
            })
            .then(Mono.defer(fallbackBuffer::removeHead))
            .doOnNext(removed -> {
                if (!removed.equals(raw)) {
                    log.warn("Fallback buffer head changed during drain");
                }
            })
            .doOnSuccess(removed -> {
                metricsService.recordPublished(true);
                republished.incrementAndGet();
            })
            .then();
    }

    private boolean tryFinishDrain(IBrokerConnection conn) {
        synchronized (routeLock) {
            if (drainOwner != conn) {
                return true;
            }
            if (pendingAppends > 0) {
                return false;
            }
            drainOwner = null;
            return true;
        }
    }

    private void releaseDrain(IBrokerConnection conn) {
        synchronized (routeLock) {
            if (drainOwner == conn) {
                drainOwner = null;
            }
        }
    }

    @Nullable
    private static String keyOf(String eventJson) {
        try {
            JsonNode sessionId = JsonUtils.readTree(eventJson).get(EventWireFormat.SESSION_ID);
            return sessionId != null && sessionId.isTextual() ? sessionId.asText() : null;
        } catch (IllegalArgumentException e) {
            log.debug("Republishing fallback entry without key: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isConnected() {
        return state.get() == State.CONNECTED;
    }

    public boolean isDraining() {
        synchronized (routeLock) {
            return drainOwner != null;
        }
    }

    int getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
            closed = true;
            Disposable pending = pendingReconnect;
            if (pending != null) {
                pending.dispose();
            }
            IBrokerConnection conn = connection;
            connection = null;
            state.set(State.DISCONNECTED);
            try {
                if (conn != null) {
                    conn.close();
                }
            } finally {
                fallbackBuffer.close();
            }
            log.info("Event publisher closed");
        });
    }
}
