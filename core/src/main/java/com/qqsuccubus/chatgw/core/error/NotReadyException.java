package com.qqsuccubus.chatgw.core.error;

public class NotReadyException extends GatewayException {

    public NotReadyException(String message) {
        super(ErrorCode.NOT_READY, message);
    }
}
