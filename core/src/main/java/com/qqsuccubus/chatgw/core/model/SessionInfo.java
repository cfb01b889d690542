package com.qqsuccubus.chatgw.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Durable session data merged with live connection metadata.
 * <p>
 * {@code clientInfo} is absent whenever no connected live connection exists.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionInfo {
    String id;
    String name;
    SessionStatus status;
    SessionConfig config;
    Instant createdAt;
    Instant updatedAt;
    ClientInfo clientInfo;
    boolean active;
    int consecutiveFailures;
}
