package com.qqsuccubus.chatgw.gateway.protocol;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Event emitted by a {@link ProtocolConnection}. Exactly one payload field is set,
 * matching {@link #type}; {@code OPEN} carries none.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConnectionEvent {

    public enum Type {
        QR,
        OPEN,
        CLOSE,
        MESSAGE,
        RECEIPT,
        PRESENCE
    }

    Type type;
    String qr;
    CloseReason close;
    InboundMessage message;
    ReceiptUpdate receipt;
    PresenceUpdate presence;

    public static ConnectionEvent qr(String payload) {
        return new ConnectionEvent(Type.QR, payload, null, null, null, null);
    }

    public static ConnectionEvent open() {
        return new ConnectionEvent(Type.OPEN, null, null, null, null, null);
    }

    public static ConnectionEvent close(String reason, boolean authFailure, boolean loggedOut) {
        return new ConnectionEvent(Type.CLOSE, null, new CloseReason(reason, authFailure, loggedOut),
            null, null, null);
    }

    public static ConnectionEvent message(InboundMessage message) {
        return new ConnectionEvent(Type.MESSAGE, null, null, message, null, null);
    }

    public static ConnectionEvent receipt(ReceiptUpdate receipt) {
        return new ConnectionEvent(Type.RECEIPT, null, null, null, receipt, null);
    }

    public static ConnectionEvent presence(PresenceUpdate presence) {
        return new ConnectionEvent(Type.PRESENCE, null, null, null, null, presence);
    }

    /**
     * Why the transport closed.
     */
    @Value
    public static class CloseReason {
        String reason;
        boolean authFailure;
        boolean loggedOut;
    }
}
