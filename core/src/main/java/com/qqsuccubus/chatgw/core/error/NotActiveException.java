package com.qqsuccubus.chatgw.core.error;

/**
 * The operation needs a live protocol connection and none is registered.
 */
public class NotActiveException extends GatewayException {

    public NotActiveException(String sessionId) {
        super(ErrorCode.NOT_ACTIVE, "Session " + sessionId + " has no live connection");
    }

    public NotActiveException(String sessionId, String reason) {
        super(ErrorCode.NOT_ACTIVE, "Session " + sessionId + " is not active: " + reason);
    }
}
