package com.qqsuccubus.chatgw.core.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    NOT_FOUND("NOT_FOUND", 404),
    NOT_ACTIVE("NOT_ACTIVE", 409),
    NOT_READY("NOT_READY", 409),
    EXPIRED("EXPIRED", 410),
    CONNECTION_ERROR("CONNECTION_ERROR", 502),
    BROKER_UNAVAILABLE("BROKER_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
