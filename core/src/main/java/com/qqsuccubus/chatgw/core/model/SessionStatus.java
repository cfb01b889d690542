package com.qqsuccubus.chatgw.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a chat-platform session.
 * <p>
 * Exactly one is current for every stored session. Wire values are the
 * lower-case names used in the Session Store and in published events.
 * </p>
 */
public enum SessionStatus {
    INITIALIZING("initializing"),
    CONNECTING("connecting"),
    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    QR_READY("qr_ready"),
    ERROR("error"),
    LOGGED_OUT("logged_out");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether a live protocol connection is expected to exist in this state.
     */
    public boolean isLive() {
        return this == CONNECTING || this == QR_READY || this == CONNECTED;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        for (SessionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
