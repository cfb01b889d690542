package com.qqsuccubus.chatgw.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Partial update; {@code null} fields are left untouched.
 */
@Value
@Builder
@Jacksonized
public class UpdateSessionRequest {
    String name;
    SessionConfig config;
    String webhookUrl;
}
