package com.qqsuccubus.chatgw.gateway.protocol;

import lombok.Value;

import java.time.Instant;

/**
 * Delivery or read receipt for a message sent by the session.
 */
@Value
public class ReceiptUpdate {

    public enum Kind {
        DELIVERED,
        READ
    }

    String messageId;
    String chatId;
    Kind kind;
    Instant at;
}
