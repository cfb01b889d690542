package com.qqsuccubus.chatgw.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Identity of the account behind a live connection.
 */
@Value
@Builder
public class ClientInfo {
    String platform;
    String phoneNumber;
    String pushName;
    Instant connectedAt;
}
