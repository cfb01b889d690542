package com.qqsuccubus.chatgw.core.error;

public class NotFoundException extends GatewayException {

    public NotFoundException(String resourceType, String identifier) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found with identifier: %s", resourceType, identifier));
    }

    public static NotFoundException session(String sessionId) {
        return new NotFoundException("Session", sessionId);
    }
}
