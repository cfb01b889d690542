package com.qqsuccubus.chatgw.gateway.protocol;

import reactor.core.publisher.Mono;

/**
 * Chat-platform protocol client (pairing, encryption, socket framing).
 * <p>
 * Implementations are provided by an external module and discovered through
 * {@link java.util.ServiceLoader}. Each {@link #connect} call produces an
 * independent connection; the gateway never reuses one across reconnects.
 * </p>
 */
public interface ProtocolClient {

    /**
     * Opens a new connection using the credential material stored at {@code credentials}.
     * <p>
     * The client persists credential updates through the store on its own; the
     * gateway does not interpret the bytes.
     * </p>
     *
     * @param credentials Credential storage location for the session
     * @param options     Connection options for the session
     * @return Mono of the connection, erroring if the client cannot be constructed
     */
    Mono<ProtocolConnection> connect(CredentialStore credentials, ConnectOptions options);
}
