package com.qqsuccubus.chatgw.gateway.events;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Durable FIFO of events the broker could not accept (Dependency Inversion Principle).
 * <p>
 * Only the event pipeline writes to it: appends go to the tail, the drain removes from the head.
 * </p>
 */
public interface IFallbackBuffer {

    /**
     * Appends a stored entry to the tail.
     */
    Mono<Void> append(String entry);

    /**
     * Reads up to {@code count} entries from the head without removing them.
     */
    Mono<List<String>> peekBatch(int count);

    /**
     * Removes the head entry.
     *
     * @return Mono of the removed entry, empty when the buffer is empty
     */
    Mono<String> removeHead();

    Mono<Long> size();

    void close();
}
