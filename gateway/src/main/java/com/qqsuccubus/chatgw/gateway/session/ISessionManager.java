package com.qqsuccubus.chatgw.gateway.session;

import com.qqsuccubus.chatgw.core.model.QrCode;
import com.qqsuccubus.chatgw.core.model.SessionInfo;
import com.qqsuccubus.chatgw.gateway.protocol.ProtocolConnection;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.Set;

/**
 * Interface for the session lifecycle manager (Dependency Inversion Principle).
 * <p>
 * Owns live protocol connections, the in-memory QR credentials and reconnect scheduling.
 * </p>
 */
public interface ISessionManager {

    /**
     * Opens a protocol connection for a stored session.
     * <p>
     * Idempotent: returns without side effects while the session is already
     * starting or has a live connection in a live status.
     * </p>
     *
     * @param sessionId Session identifier
     * @return Mono completing once the connection is registered, erroring with
     * {@link com.qqsuccubus.chatgw.core.error.NotFoundException} or
     * {@link com.qqsuccubus.chatgw.core.error.ConnectionException}
     */
    Mono<Void> startSession(String sessionId);

    /**
     * Current pairing challenge of a session.
     *
     * @return Mono erroring with NotReady when none was issued, Expired once past its expiry
     */
    Mono<QrCode> getQrCode(String sessionId);

    /**
     * Logs the session out and tears its connection down.
     *
     * @return Mono erroring with NotActive when no live connection exists
     */
    Mono<Void> disconnectSession(String sessionId);

    /**
     * Records status {@code disconnected} for a session that has no live connection.
     */
    Mono<Void> markDisconnected(String sessionId);

    /**
     * Drops every in-memory trace of a session without logging out: pending
     * reconnect, QR credential, live connection, failure counter. A start still
     * connecting closes its connection instead of registering it.
     */
    void forgetSession(String sessionId);

    boolean isSessionActive(String sessionId);

    Optional<ProtocolConnection> getLiveConnection(String sessionId);

    /**
     * Stored session merged with live connection metadata.
     */
    Mono<SessionInfo> getSessionInfo(String sessionId);

    Set<String> getActiveSessionIds();

    /**
     * Cancels pending reconnects and closes all live connections without logging out.
     */
    Mono<Void> closeAll();
}
