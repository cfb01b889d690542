package com.qqsuccubus.chatgw.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateSessionRequest {
    String name;
    SessionConfig config;
    String webhookUrl;
}
