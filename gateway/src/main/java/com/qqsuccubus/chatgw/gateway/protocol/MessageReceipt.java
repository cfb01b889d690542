package com.qqsuccubus.chatgw.gateway.protocol;

import lombok.Value;

import java.time.Instant;

@Value
public class MessageReceipt {
    String id;
    Instant sentAt;
}
