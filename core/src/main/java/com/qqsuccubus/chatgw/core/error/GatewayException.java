package com.qqsuccubus.chatgw.core.error;

import lombok.Getter;

import java.util.Map;

/**
 * Root of the gateway error taxonomy. Each subtype maps to one {@link ErrorCode}.
 */
@Getter
public abstract class GatewayException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected GatewayException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected GatewayException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected GatewayException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
