package com.qqsuccubus.chatgw.core.event;

/**
 * Values of the {@code type} field of published events.
 */
public final class EventTypes {
    private EventTypes() {
    }

    public static final String MESSAGE_RECEIVED = "message_received";

    /**
     * Outbound message progress: sent, delivered, read.
     */
    public static final String MESSAGE_STATUS = "message_status";

    public static final String PRESENCE_UPDATE = "presence_update";

    /**
     * Session lifecycle transition, carries {@code status} and optional {@code reason}.
     */
    public static final String SESSION_STATUS = "session_status";
}
