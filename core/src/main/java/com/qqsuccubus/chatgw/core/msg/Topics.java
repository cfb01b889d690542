package com.qqsuccubus.chatgw.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Default destination for platform events. Overridden by {@code EVENTS_TOPIC}.
     */
    public static final String PLATFORM_EVENTS = "platform_events";
}
