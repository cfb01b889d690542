package com.qqsuccubus.chatgw.core.error;

import java.time.Instant;
import java.util.Map;

public class ExpiredException extends GatewayException {

    public ExpiredException(String message, Instant expiredAt) {
        super(ErrorCode.EXPIRED, message, Map.of("expiredAt", expiredAt.toString()));
    }
}
