package com.qqsuccubus.chatgw.core.event;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One platform occurrence (message received, delivery receipt, presence change,
 * session status change) on its way to downstream consumers.
 * <p>
 * <b>Delivery:</b> once handed to the event pipeline an event is either
 * acknowledged by the broker or written to the fallback buffer.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class PlatformEvent {
    /**
     * Session the event originated from.
     */
    @NonNull
    String sessionId;

    /**
     * Event type, see {@link EventTypes}.
     */
    @NonNull
    String type;

    /**
     * When the occurrence happened.
     */
    @Builder.Default
    Instant occurredAt = Instant.now();

    /**
     * Free-form, JSON-serializable fields merged into the published object.
     */
    @Singular("field")
    Map<String, Object> payload;
}
