package com.qqsuccubus.chatgw.gateway.events;

import com.qqsuccubus.chatgw.core.event.PlatformEvent;
import reactor.core.publisher.Mono;

/**
 * Interface for the event pipeline (Dependency Inversion Principle).
 * <p>
 * Abstracts broker publishing, fallback buffering and replay.
 * </p>
 */
public interface IEventPublisher {

    /**
     * Connects to the broker. A failed first attempt is retried in the background.
     *
     * @return Mono completing once the first attempt finished
     */
    Mono<Void> initialize();

    /**
     * Publishes an event, buffering it when the broker is unavailable.
     * <p>
     * The returned Mono never errors: an event is either acknowledged by the
     * broker, written to the fallback buffer, or logged as lost.
     * </p>
     *
     * @param event Event to publish
     * @return Mono completing when the event was acknowledged or buffered
     */
    Mono<Void> publishEvent(PlatformEvent event);

    boolean isConnected();

    /**
     * Stops reconnecting and closes the broker connection. Buffered events stay buffered.
     */
    Mono<Void> close();
}
