package com.qqsuccubus.chatgw.gateway.session;

import com.qqsuccubus.chatgw.core.error.ConnectionException;
import com.qqsuccubus.chatgw.core.error.ExpiredException;
import com.qqsuccubus.chatgw.core.error.NotActiveException;
import com.qqsuccubus.chatgw.core.error.NotFoundException;
import com.qqsuccubus.chatgw.core.error.NotReadyException;
import com.qqsuccubus.chatgw.core.model.ClientInfo;
import com.qqsuccubus.chatgw.core.model.QrCode;
import com.qqsuccubus.chatgw.core.model.SessionConfig;
import com.qqsuccubus.chatgw.core.model.SessionInfo;
import com.qqsuccubus.chatgw.core.model.SessionRecord;
import com.qqsuccubus.chatgw.core.model.SessionStatus;
import com.qqsuccubus.chatgw.core.util.Backoff;
import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import com.qqsuccubus.chatgw.gateway.events.IEventPublisher;
import com.qqsuccubus.chatgw.gateway.metrics.MetricsService;
import com.qqsuccubus.chatgw.gateway.protocol.ConnectOptions;
import com.qqsuccubus.chatgw.gateway.protocol.ConnectedUser;
import com.qqsuccubus.chatgw.gateway.protocol.ConnectionEvent;
import com.qqsuccubus.chatgw.gateway.protocol.CredentialStore;
import com.qqsuccubus.chatgw.gateway.protocol.InboundMessage;
import com.qqsuccubus.chatgw.gateway.protocol.ProtocolClient;
import com.qqsuccubus.chatgw.gateway.protocol.ProtocolConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives each session through its connection lifecycle.
 * <p>
 * Responsibilities:
 * - Track live protocol connections (one per session at most)
 * - Hold the current QR credential per session
 * - React to connection events and persist status transitions
 * - Schedule reconnects after transport closes
 * </p>
 * <p>
 * Events of one connection are handled strictly in order. Every status change
 * is written to the store and published as a {@code session_status} event.
 * </p>
 */
public class SessionManager implements ISessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final GatewayConfig config;
    private final ISessionStore sessionStore;
    private final ProtocolClient protocolClient;
    private final IEventPublisher eventPublisher;
    private final IQrCodeRenderer qrRenderer;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Scheduler timer;

    // Live connections: sessionId -> LiveConnection
    private final Map<String, LiveConnection> liveConnections = new ConcurrentHashMap<>();
    private final Map<String, QrCredential> qrCredentials = new ConcurrentHashMap<>();
    private final Map<String, Disposable> pendingReconnects = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();
    private final Set<String> starting = ConcurrentHashMap.newKeySet();
    // In-flight start per session; forgetSession drops the token to void that start
    private final Map<String, Object> startTokens = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    public SessionManager(GatewayConfig config,
                          ISessionStore sessionStore,
                          ProtocolClient protocolClient,
                          IEventPublisher eventPublisher,
                          IQrCodeRenderer qrRenderer,
                          MetricsService metricsService,
                          Clock clock,
                          Scheduler timer) {
        this.config = config;
        this.sessionStore = sessionStore;
        this.protocolClient = protocolClient;
        this.eventPublisher = eventPublisher;
        this.qrRenderer = qrRenderer;
        this.metricsService = metricsService;
        this.clock = clock;
        this.timer = timer;
        metricsService.bindLiveSessions(liveConnections::size);
    }

    @Override
    public Mono<Void> startSession(String sessionId) {
        return Mono.defer(() -> {
            cancelPendingReconnect(sessionId);

            if (!starting.add(sessionId)) {
                log.debug("Session {} is already starting, ignoring start request", sessionId);
                return Mono.empty();
            }
            Object token = new Object();
            startTokens.put(sessionId, token);

            return sessionStore.findById(sessionId)
                .flatMap(record -> {
                    LiveConnection current = liveConnections.get(sessionId);
                    if (current != null && record.getStatus().isLive()) {
                        log.debug("Session {} already has a live connection ({}), ignoring start request",
                            sessionId, record.getStatus());
                        return Mono.<Void>empty();
                    }
                    return openConnection(record, token);
                })
                .doFinally(signal -> {
                    startTokens.remove(sessionId, token);
                    starting.remove(sessionId);
                });
        });
    }

    private Mono<Void> openConnection(SessionRecord record, Object token) {
        String sessionId = record.getId();
        SessionConfig sessionConfig = record.getConfig().withDefaults(config.sessionDefaults());
        ConnectOptions options = ConnectOptions.builder()
            .sessionId(sessionId)
            .qrTimeout(Duration.ofMillis(sessionConfig.getQrTimeoutMs()))
            .build();

        return transition(sessionId, SessionStatus.CONNECTING, null)
            .then(Mono.fromCallable(() -> CredentialStore.open(config.getSessionsDir(), sessionId))
                .subscribeOn(Schedulers.boundedElastic()))
            .flatMap(credentials -> Mono.defer(() -> protocolClient.connect(credentials, options))
                .flatMap(connection -> registerIfCurrent(sessionId, token, connection, credentials, sessionConfig)))
            .doOnNext(live -> log.info("Session {} connecting (generation {})", sessionId, live.getGeneration()))
            .then()
            .onErrorResume(error -> !(error instanceof NotFoundException), error -> {
                ConnectionException failure = error instanceof ConnectionException ce
                    ? ce
                    : new ConnectionException("Failed to start session " + sessionId + ": " + error.getMessage(), error);
                log.error("Failed to start session {}", sessionId, error);
                return transition(sessionId, SessionStatus.ERROR, failure.getMessage())
                    .onErrorResume(statusErr -> {
                        log.warn("Could not record error status for session {}: {}", sessionId, statusErr.getMessage());
                        return Mono.empty();
                    })
                    .then(Mono.error(failure));
            });
    }

    /**
     * Registers the new connection unless the session was forgotten while it was
     * connecting, in which case the connection is closed instead.
     */
    private Mono<LiveConnection> registerIfCurrent(String sessionId, Object token, ProtocolConnection connection,
                                                   CredentialStore credentials, SessionConfig sessionConfig) {
        if (startTokens.get(sessionId) != token) {
            log.info("Session {} was removed while connecting, closing the new connection", sessionId);
            connection.close();
            return Mono.empty();
        }
        LiveConnection live = register(sessionId, connection, credentials, sessionConfig);
        // forgetSession may have run between the check and the registration
        if (startTokens.get(sessionId) != token) {
            log.info("Session {} was removed while connecting, closing the new connection", sessionId);
            liveConnections.remove(sessionId, live);
            live.dispose();
            return Mono.empty();
        }
        return Mono.just(live);
    }

    private LiveConnection register(String sessionId, ProtocolConnection connection,
                                    CredentialStore credentials, SessionConfig sessionConfig) {
        LiveConnection live = new LiveConnection(sessionId, generations.incrementAndGet(),
            connection, credentials, sessionConfig);

        LiveConnection previous = liveConnections.put(sessionId, live);
        if (previous != null) {
            log.warn("Session {}: superseding connection generation {} with {}",
                sessionId, previous.getGeneration(), live.getGeneration());
            previous.dispose();
        }

        live.attach(connection.events()
            .concatMap(event -> handleEvent(live, event)
                .onErrorResume(err -> {
                    log.error("Session {}: failed to handle {} event", sessionId, event.getType(), err);
                    return Mono.empty();
                }))
            .subscribe(
                ignored -> {
                },
                err -> onStreamTerminated(live, err),
                () -> onStreamTerminated(live, null)));
        return live;
    }

    private Mono<Void> handleEvent(LiveConnection live, ConnectionEvent event) {
        if (!isCurrent(live)) {
            log.debug("Session {}: ignoring {} from superseded connection generation {}",
                live.getSessionId(), event.getType(), live.getGeneration());
            return Mono.empty();
        }

        switch (event.getType()) {
            case QR:
                return onQr(live, event.getQr());
            case OPEN:
                return onOpen(live);
            case CLOSE:
                return onClose(live, event.getClose());
            case MESSAGE:
                return onMessage(live, event.getMessage());
            case RECEIPT:
                return eventPublisher.publishEvent(
                    PlatformEventFactory.messageStatus(live.getSessionId(), event.getReceipt(), clock.instant()));
            case PRESENCE:
                return eventPublisher.publishEvent(
                    PlatformEventFactory.presence(live.getSessionId(), event.getPresence(), clock.instant()));
            default:
                return Mono.empty();
        }
    }

    private Mono<Void> onQr(LiveConnection live, String payload) {
        String sessionId = live.getSessionId();
        String rendered;
        try {
            rendered = qrRenderer.render(payload);
        } catch (QrRenderException e) {
            log.error("Session {}: QR rendering failed, restarting in {}", sessionId, config.getQrRetryDelay(), e);
            liveConnections.remove(sessionId, live);
            qrCredentials.remove(sessionId);
            live.closeTransport();
            return transition(sessionId, SessionStatus.ERROR, "qr_render_failed")
                .then(Mono.fromRunnable(() -> scheduleStart(sessionId, config.getQrRetryDelay())));
        }

        Instant expiresAt = clock.instant().plusMillis(live.getSessionConfig().getQrTimeoutMs());
        qrCredentials.put(sessionId, new QrCredential(rendered, expiresAt));
        metricsService.recordQrIssued();
        log.info("Session {}: QR code issued, expires at {}", sessionId, expiresAt);
        return transition(sessionId, SessionStatus.QR_READY, null);
    }

    private Mono<Void> onOpen(LiveConnection live) {
        String sessionId = live.getSessionId();
        qrCredentials.remove(sessionId);
        consecutiveFailures.remove(sessionId);
        live.markOpened(clock.instant());
        return transition(sessionId, SessionStatus.CONNECTED, null);
    }

    private Mono<Void> onClose(LiveConnection live, ConnectionEvent.CloseReason reason) {
        String sessionId = live.getSessionId();
        liveConnections.remove(sessionId, live);
        qrCredentials.remove(sessionId);
        log.info("Session {}: connection closed (reason={}, authFailure={}, loggedOut={})",
            sessionId, reason.getReason(), reason.isAuthFailure(), reason.isLoggedOut());

        // Config is re-read so updates made while connected apply to the reconnect
        return sessionStore.findById(sessionId)
            .flatMap(record -> {
                SessionConfig current = record.getConfig().withDefaults(config.sessionDefaults());
                if (shouldReconnect(reason, current)) {
                    int failures = consecutiveFailures
                        .computeIfAbsent(sessionId, id -> new AtomicInteger())
                        .incrementAndGet();
                    if (current.getMaxRetries() > 0 && failures > current.getMaxRetries()) {
                        log.warn("Session {}: {} consecutive connection failures (configured max {}), still retrying",
                            sessionId, failures, current.getMaxRetries());
                    }
                    return transition(sessionId, SessionStatus.CONNECTING, reason.getReason())
                        .then(Mono.fromRunnable(() -> scheduleStart(sessionId, config.getSessionReconnectDelay())));
                }

                if (reason.isLoggedOut()) {
                    return clearCredentials(live)
                        .then(transition(sessionId, SessionStatus.LOGGED_OUT, reason.getReason()));
                }
                return transition(sessionId, SessionStatus.DISCONNECTED, reason.getReason());
            })
            .onErrorResume(NotFoundException.class, e -> {
                log.info("Session {} no longer exists, not reconnecting", sessionId);
                return Mono.empty();
            });
    }

    private Mono<Void> onMessage(LiveConnection live, InboundMessage message) {
        if (message.isFromMe()) {
            log.debug("Session {}: skipping own message {}", live.getSessionId(), message.getId());
            return Mono.empty();
        }
        return eventPublisher.publishEvent(
            PlatformEventFactory.messageReceived(live.getSessionId(), message, clock.instant()));
    }

    /**
     * A logged-out close never reconnects; an auth-failure close reconnects unless
     * the session disabled {@code restartOnAuthFail}.
     */
    static boolean shouldReconnect(ConnectionEvent.CloseReason reason, SessionConfig sessionConfig) {
        if (reason.isLoggedOut()) {
            return false;
        }
        return !(reason.isAuthFailure() && sessionConfig.isRestartOnAuthFailDisabled());
    }

    private void onStreamTerminated(LiveConnection live, @Nullable Throwable error) {
        if (!isCurrent(live)) {
            return;
        }
        String reason = error != null ? "stream error: " + error.getMessage() : "event stream completed";
        log.warn("Session {}: event stream ended without close ({})", live.getSessionId(), reason);
        onClose(live, new ConnectionEvent.CloseReason(reason, false, false))
            .subscribe(
                ignored -> {
                },
                err -> log.error("Session {}: failed to handle stream termination", live.getSessionId(), err));
    }

    private boolean isCurrent(LiveConnection live) {
        return liveConnections.get(live.getSessionId()) == live;
    }

    private void scheduleStart(String sessionId, Duration delay) {
        metricsService.recordSessionReconnect();
        log.info("Session {}: restart scheduled in {}", sessionId, delay);

        Disposable task = Mono.delay(Backoff.fixed(delay), timer)
            .then(Mono.defer(() -> {
                pendingReconnects.remove(sessionId);
                return startSession(sessionId);
            }))
            .subscribe(
                ignored -> {
                },
                err -> log.warn("Session {}: scheduled restart failed: {}", sessionId, err.getMessage()));

        Disposable previous = pendingReconnects.put(sessionId, task);
        if (previous != null) {
            previous.dispose();
        }
        if (task.isDisposed()) {
            pendingReconnects.remove(sessionId, task);
        }
    }

    private void cancelPendingReconnect(String sessionId) {
        Disposable pending = pendingReconnects.remove(sessionId);
        if (pending != null) {
            pending.dispose();
            log.debug("Session {}: pending reconnect cancelled", sessionId);
        }
    }

    private Mono<Void> clearCredentials(LiveConnection live) {
        return Mono.fromRunnable(() -> live.getCredentials().clear())
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> log.info("Session {}: credentials cleared", live.getSessionId()))
            .onErrorResume(err -> {
                log.error("Session {}: failed to clear credentials", live.getSessionId(), err);
                return Mono.empty();
            })
            .then();
    }

    private Mono<Void> transition(String sessionId, SessionStatus status, @Nullable String reason) {
        return sessionStore.updateStatus(sessionId, status)
            .doOnSuccess(v -> {
                metricsService.recordTransition(status);
                log.info("Session {} -> {}{}", sessionId, status, reason != null ? " (" + reason + ")" : "");
            })
            .then(Mono.defer(() -> eventPublisher.publishEvent(
                PlatformEventFactory.sessionStatus(sessionId, status, reason, clock.instant()))));
    }

    @Override
    public Mono<QrCode> getQrCode(String sessionId) {
        return Mono.defer(() -> {
            QrCredential qr = qrCredentials.get(sessionId);
            if (qr == null) {
                return Mono.error(new NotReadyException(
                    "QR code not available for session " + sessionId + "; start the session first"));
            }
            Instant now = clock.instant();
            if (qr.isExpired(now)) {
                qrCredentials.remove(sessionId, qr);
                return Mono.error(new ExpiredException(
                    "QR code for session " + sessionId + " has expired; restart the session", qr.getExpiresAt()));
            }
            return Mono.just(new QrCode(qr.getCode(), qr.expiresInSeconds(now)));
        });
    }

    @Override
    public Mono<Void> disconnectSession(String sessionId) {
        return Mono.defer(() -> {
            cancelPendingReconnect(sessionId);
            LiveConnection live = liveConnections.remove(sessionId);
            if (live == null) {
                return Mono.error(new NotActiveException(sessionId));
            }
            qrCredentials.remove(sessionId);
            consecutiveFailures.remove(sessionId);

            return live.getConnection().logout()
                .doFinally(signal -> live.dispose())
                .then(clearCredentials(live))
                .then(transition(sessionId, SessionStatus.DISCONNECTED, "disconnect requested"))
                .doOnSuccess(v -> log.info("Session {} disconnected", sessionId))
                .onErrorResume(err -> !(err instanceof NotFoundException), err -> {
                    log.error("Session {}: logout failed", sessionId, err);
                    return transition(sessionId, SessionStatus.DISCONNECTED, "logout failed")
                        .onErrorResume(statusErr -> Mono.empty())
                        .then(Mono.error(new ConnectionException(
                            "Failed to log out session " + sessionId + ": " + err.getMessage(), err)));
                });
        });
    }

    @Override
    public Mono<Void> markDisconnected(String sessionId) {
        return Mono.defer(() -> {
            cancelPendingReconnect(sessionId);
            qrCredentials.remove(sessionId);
            return transition(sessionId, SessionStatus.DISCONNECTED, "no live connection");
        });
    }

    @Override
    public void forgetSession(String sessionId) {
        startTokens.remove(sessionId);
        cancelPendingReconnect(sessionId);
        qrCredentials.remove(sessionId);
        consecutiveFailures.remove(sessionId);
        LiveConnection live = liveConnections.remove(sessionId);
        if (live != null) {
            live.dispose();
        }
        log.debug("Session {} forgotten", sessionId);
    }

    @Override
    public boolean isSessionActive(String sessionId) {
        return liveConnections.containsKey(sessionId);
    }

    @Override
    public Optional<ProtocolConnection> getLiveConnection(String sessionId) {
        return Optional.ofNullable(liveConnections.get(sessionId)).map(LiveConnection::getConnection);
    }

    @Override
    public Mono<SessionInfo> getSessionInfo(String sessionId) {
        return sessionStore.findById(sessionId)
            .map(record -> {
                LiveConnection live = liveConnections.get(sessionId);
                AtomicInteger failures = consecutiveFailures.get(sessionId);
                SessionInfo.SessionInfoBuilder info = SessionInfo.builder()
                    .id(record.getId())
                    .name(record.getName())
                    .status(record.getStatus())
                    .config(record.getConfig().withDefaults(config.sessionDefaults()))
                    .createdAt(record.getCreatedAt())
                    .updatedAt(record.getUpdatedAt())
                    .active(live != null)
                    .consecutiveFailures(failures != null ? failures.get() : 0);
                if (live != null && record.getStatus() == SessionStatus.CONNECTED) {
                    info.clientInfo(clientInfo(live));
                }
                return info.build();
            });
    }

    @Nullable
    private ClientInfo clientInfo(LiveConnection live) {
        ConnectedUser user;
        try {
            user = live.getConnection().getUser();
        } catch (RuntimeException e) {
            log.warn("Session {}: connection metadata unavailable: {}", live.getSessionId(), e.getMessage());
            return null;
        }
        if (user == null) {
            return null;
        }
        return ClientInfo.builder()
            .platform(live.getConnection().getPlatform())
            .phoneNumber(user.phoneNumber())
            .pushName(user.getName())
            .connectedAt(live.getOpenedAt())
            .build();
    }

    @Override
    public Set<String> getActiveSessionIds() {
        return liveConnections.keySet();
    }

    @Override
    public Mono<Void> closeAll() {
        return Mono.fromRunnable(() -> {
            log.info("Closing {} live connections, cancelling {} pending reconnects",
                liveConnections.size(), pendingReconnects.size());
            for (String sessionId : pendingReconnects.keySet()) {
                cancelPendingReconnect(sessionId);
            }
            for (String sessionId : liveConnections.keySet()) {
                LiveConnection live = liveConnections.remove(sessionId);
                if (live != null) {
                    live.dispose();
                }
            }
            qrCredentials.clear();
        });
    }
}
