package com.qqsuccubus.chatgw.gateway.events;

import reactor.core.publisher.Mono;

/**
 * Opens connections to the message broker (Dependency Inversion Principle).
 */
public interface IBrokerTransport {

    /**
     * Connects to the broker and makes sure the destination exists.
     *
     * @return Mono of an open connection, erroring with
     * {@link com.qqsuccubus.chatgw.core.error.TransientBrokerException} when the broker is unreachable
     */
    Mono<IBrokerConnection> connect();
}
