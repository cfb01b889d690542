package com.qqsuccubus.chatgw.gateway.session;

import com.qqsuccubus.chatgw.core.model.SessionConfig;
import com.qqsuccubus.chatgw.gateway.protocol.CredentialStore;
import com.qqsuccubus.chatgw.gateway.protocol.ProtocolConnection;
import lombok.Getter;
import reactor.core.Disposable;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry entry for one protocol connection of a session.
 * <p>
 * Each start produces a new entry with a higher {@code generation}; events from
 * an entry no longer in the registry are ignored.
 * </p>
 */
@Getter
public class LiveConnection {
    private final String sessionId;
    private final long generation;
    private final ProtocolConnection connection;
    private final CredentialStore credentials;
    private final SessionConfig sessionConfig;
    private volatile Instant openedAt;
    private volatile Disposable subscription;
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    public LiveConnection(String sessionId, long generation, ProtocolConnection connection,
                          CredentialStore credentials, SessionConfig sessionConfig) {
        this.sessionId = sessionId;
        this.generation = generation;
        this.connection = connection;
        this.credentials = credentials;
        this.sessionConfig = sessionConfig;
    }

    void attach(Disposable subscription) {
        this.subscription = subscription;
        if (disposed.get()) {
            subscription.dispose();
        }
    }

    void markOpened(Instant at) {
        this.openedAt = at;
    }

    /**
     * Closes the transport without touching the event subscription. Safe to call
     * from within an event handler.
     */
    void closeTransport() {
        connection.close();
    }

    /**
     * Stops event handling and closes the transport without logging out. Idempotent.
     * Must not be called from within this connection's own event handler.
     */
    void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
        connection.close();
    }

    public boolean isDisposed() {
        return disposed.get();
    }
}
