package com.qqsuccubus.chatgw.gateway.session;

import com.qqsuccubus.chatgw.core.error.ConnectionException;
import com.qqsuccubus.chatgw.core.error.NotActiveException;
import com.qqsuccubus.chatgw.core.error.NotReadyException;
import com.qqsuccubus.chatgw.core.model.CreateSessionRequest;
import com.qqsuccubus.chatgw.core.model.QrCode;
import com.qqsuccubus.chatgw.core.model.SessionInfo;
import com.qqsuccubus.chatgw.core.model.SessionPage;
import com.qqsuccubus.chatgw.core.model.SessionRecord;
import com.qqsuccubus.chatgw.core.model.SessionStatus;
import com.qqsuccubus.chatgw.core.model.SessionStatusResponse;
import com.qqsuccubus.chatgw.core.model.UpdateSessionRequest;
import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import javax.annotation.Nullable;
import java.time.Duration;

/**
 * Session operations offered to callers: CRUD over the Session Store combined
 * with lifecycle actions on the {@link ISessionManager}.
 */
public class SessionService {
    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    static final int DEFAULT_PAGE = 1;
    static final int DEFAULT_LIMIT = 10;
    private static final Duration QR_POLL_INTERVAL = Duration.ofMillis(200);

    private final GatewayConfig config;
    private final ISessionStore sessionStore;
    private final ISessionManager sessionManager;
    private final Scheduler timer;

    public SessionService(GatewayConfig config, ISessionStore sessionStore,
                          ISessionManager sessionManager, Scheduler timer) {
        this.config = config;
        this.sessionStore = sessionStore;
        this.sessionManager = sessionManager;
        this.timer = timer;
    }

    /**
     * Validates and stores a new session, then starts it. A failed start leaves the
     * session in status {@code error} and still returns it.
     */
    public Mono<SessionRecord> createSession(CreateSessionRequest request) {
        return Mono.fromRunnable(() -> SessionRequestValidator.validateCreate(request))
            .then(Mono.defer(() -> sessionStore.create(request)))
            .flatMap(record -> sessionManager.startSession(record.getId())
                .onErrorResume(ConnectionException.class, e -> {
                    log.warn("Session {} created but could not be started: {}", record.getId(), e.getMessage());
                    return Mono.empty();
                })
                .then(Mono.defer(() -> sessionStore.findById(record.getId()))));
    }

    public Mono<SessionRecord> getSessionById(String sessionId) {
        return sessionStore.findById(sessionId);
    }

    public Mono<SessionInfo> getSessionInfo(String sessionId) {
        return sessionManager.getSessionInfo(sessionId);
    }

    public Mono<SessionPage> listSessions(@Nullable SessionStatus status, @Nullable Integer page, @Nullable Integer limit) {
        return sessionStore.findAll(status,
            page != null && page > 0 ? page : DEFAULT_PAGE,
            limit != null && limit > 0 ? limit : DEFAULT_LIMIT);
    }

    /**
     * Partial update. Config changes apply from the next (re)connect of the session.
     */
    public Mono<SessionRecord> updateSession(String sessionId, UpdateSessionRequest request) {
        return Mono.fromRunnable(() -> SessionRequestValidator.validateUpdate(request))
            .then(Mono.defer(() -> sessionStore.update(sessionId, request)));
    }

    /**
     * Returns the current QR code. A {@code disconnected}, {@code error} or
     * {@code logged_out} session is restarted first and its first QR awaited for
     * a short while.
     */
    public Mono<QrCode> getSessionQRCode(String sessionId) {
        return sessionStore.findById(sessionId)
            .flatMap(record -> {
                SessionStatus status = record.getStatus();
                if (status == SessionStatus.CONNECTED) {
                    return Mono.error(new NotReadyException("Session " + sessionId + " is already connected"));
                }
                if (status == SessionStatus.DISCONNECTED || status == SessionStatus.ERROR
                    || status == SessionStatus.LOGGED_OUT) {
                    log.info("Session {} is {}, restarting to obtain a QR code", sessionId, status);
                    return sessionManager.startSession(sessionId).then(awaitQrCode(sessionId));
                }
                return sessionManager.getQrCode(sessionId);
            });
    }

    private Mono<QrCode> awaitQrCode(String sessionId) {
        long attempts = Math.max(1, config.getQrWaitTimeout().toMillis() / QR_POLL_INTERVAL.toMillis());
        return Mono.defer(() -> sessionManager.getQrCode(sessionId))
            .retryWhen(Retry.fixedDelay(attempts, QR_POLL_INTERVAL)
                .filter(NotReadyException.class::isInstance)
                .scheduler(timer)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    public Mono<SessionStatusResponse> disconnectSession(String sessionId) {
        return sessionStore.findById(sessionId)
            .flatMap(record -> {
                if (record.getStatus() == SessionStatus.DISCONNECTED && !sessionManager.isSessionActive(sessionId)) {
                    return Mono.just(new SessionStatusResponse(sessionId, SessionStatus.DISCONNECTED,
                        "Session is already disconnected"));
                }
                return sessionManager.disconnectSession(sessionId)
                    .thenReturn(new SessionStatusResponse(sessionId, SessionStatus.DISCONNECTED,
                        "Session disconnected successfully"))
                    .onErrorResume(NotActiveException.class, e -> {
                        log.info("Session {} has no live connection, marking as disconnected", sessionId);
                        return sessionManager.markDisconnected(sessionId)
                            .thenReturn(new SessionStatusResponse(sessionId, SessionStatus.DISCONNECTED,
                                "Session marked as disconnected"));
                    });
            });
    }

    public Mono<SessionStatusResponse> reconnectSession(String sessionId) {
        return sessionStore.findById(sessionId)
            .flatMap(record -> {
                if (record.getStatus() == SessionStatus.CONNECTED && sessionManager.isSessionActive(sessionId)) {
                    return Mono.just(new SessionStatusResponse(sessionId, SessionStatus.CONNECTED,
                        "Session is already connected"));
                }
                return sessionManager.startSession(sessionId)
                    .then(Mono.defer(() -> sessionStore.findById(sessionId)))
                    .map(updated -> new SessionStatusResponse(sessionId, updated.getStatus(),
                        "Session reconnection started"));
            });
    }

    /**
     * Restarts every session that was live when the previous process stopped.
     *
     * @return Mono of the number of sessions restarted
     */
    public Mono<Long> resumeSessions() {
        return sessionStore.findAll(null, 1, Integer.MAX_VALUE)
            .flatMapMany(page -> Flux.fromIterable(page.getSessions()))
            .filter(record -> record.getStatus().isLive())
            .concatMap(record -> sessionManager.startSession(record.getId())
                .thenReturn(record.getId())
                .onErrorResume(e -> {
                    log.warn("Could not resume session {}: {}", record.getId(), e.getMessage());
                    return Mono.empty();
                }))
            .count()
            .doOnNext(count -> log.info("Resumed {} sessions", count));
    }

    /**
     * Deletes a session. A failing disconnect is logged and does not block the delete.
     */
    public Mono<Void> deleteSession(String sessionId) {
        return sessionStore.findById(sessionId)
            .flatMap(record -> {
                Mono<Void> disconnect = sessionManager.isSessionActive(sessionId)
                    ? sessionManager.disconnectSession(sessionId)
                    .onErrorResume(e -> {
                        log.warn("Failed to disconnect session {} before delete: {}", sessionId, e.getMessage());
                        return Mono.empty();
                    })
                    : Mono.empty();
                return disconnect
                    .then(Mono.fromRunnable(() -> sessionManager.forgetSession(sessionId)))
                    .then(sessionStore.delete(sessionId));
            })
            .doOnSuccess(v -> log.info("Session {} deleted", sessionId));
    }
}
