package com.qqsuccubus.chatgw.core.model;

import lombok.Value;

@Value
public class SessionStatusResponse {
    String id;
    SessionStatus status;
    String message;
}
