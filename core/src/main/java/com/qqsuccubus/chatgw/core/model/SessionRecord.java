package com.qqsuccubus.chatgw.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Durable record of one tenant session, as held by the Session Store.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class SessionRecord {
    @NonNull
    String id;
    String name;
    @NonNull
    SessionStatus status;
    @Builder.Default
    SessionConfig config = SessionConfig.empty();
    String webhookUrl;
    Instant createdAt;
    Instant updatedAt;
}
