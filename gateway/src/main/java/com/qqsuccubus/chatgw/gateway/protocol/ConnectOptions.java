package com.qqsuccubus.chatgw.gateway.protocol;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class ConnectOptions {
    String sessionId;
    /**
     * How long one pairing challenge stays valid.
     */
    Duration qrTimeout;
}
