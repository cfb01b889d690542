package com.qqsuccubus.chatgw.gateway.session;

import com.qqsuccubus.chatgw.core.model.CreateSessionRequest;
import com.qqsuccubus.chatgw.core.model.SessionPage;
import com.qqsuccubus.chatgw.core.model.SessionRecord;
import com.qqsuccubus.chatgw.core.model.SessionStatus;
import com.qqsuccubus.chatgw.core.model.UpdateSessionRequest;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;

/**
 * Durable source of truth for session records (Dependency Inversion Principle).
 * <p>
 * Lookups of unknown ids error with {@link com.qqsuccubus.chatgw.core.error.NotFoundException}.
 * </p>
 */
public interface ISessionStore {

    /**
     * Creates a session record with a fresh id and status {@code initializing}.
     */
    Mono<SessionRecord> create(CreateSessionRequest request);

    Mono<SessionRecord> findById(String sessionId);

    /**
     * Lists sessions newest first.
     *
     * @param status Optional status filter
     * @param page   1-based page number
     * @param limit  Page size
     */
    Mono<SessionPage> findAll(@Nullable SessionStatus status, int page, int limit);

    /**
     * Applies a partial update; config fields are merged, not replaced.
     */
    Mono<SessionRecord> update(String sessionId, UpdateSessionRequest request);

    /**
     * Sets the current status. Never recreates a deleted record.
     */
    Mono<Void> updateStatus(String sessionId, SessionStatus status);

    Mono<Void> delete(String sessionId);

    void close();
}
