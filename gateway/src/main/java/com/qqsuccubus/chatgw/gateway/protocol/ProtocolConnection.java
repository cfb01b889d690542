package com.qqsuccubus.chatgw.gateway.protocol;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;

/**
 * Handle to one live protocol connection.
 */
public interface ProtocolConnection {

    /**
     * Connection events in the order the transport produced them. Completes after
     * the {@code CLOSE} event.
     */
    Flux<ConnectionEvent> events();

    /**
     * Sends content over the connection.
     *
     * @param content Outbound content
     * @return Mono of the platform receipt
     */
    Mono<MessageReceipt> send(OutboundContent content);

    /**
     * Logs the account out and tears the transport down.
     *
     * @return Mono completing when the platform acknowledged the logout
     */
    Mono<Void> logout();

    /**
     * Tears the transport down without logging out; credentials stay valid.
     */
    void close();

    /**
     * Account behind the connection, once the transport is open.
     */
    @Nullable
    ConnectedUser getUser();

    /**
     * Human-readable platform name, e.g. {@code WhatsApp}.
     */
    String getPlatform();
}
