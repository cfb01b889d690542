package com.qqsuccubus.chatgw.gateway.events;

import reactor.core.publisher.Mono;

import javax.annotation.Nullable;

/**
 * One open broker connection.
 */
public interface IBrokerConnection {

    /**
     * Publishes a serialized event to the events destination.
     *
     * @param key     Partitioning key, usually the session id
     * @param payload Serialized event
     * @return Mono completing once the broker acknowledged the event
     */
    Mono<Void> publish(@Nullable String key, String payload);

    /**
     * Terminates when the connection is lost or closed: empty on close,
     * error on transport failure.
     */
    Mono<Void> closeSignal();

    boolean isOpen();

    void close();
}
