package com.qqsuccubus.chatgw.core.error;

/**
 * The protocol client could not be constructed or its handshake failed.
 */
public class ConnectionException extends GatewayException {

    public ConnectionException(String message) {
        super(ErrorCode.CONNECTION_ERROR, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(ErrorCode.CONNECTION_ERROR, message, cause);
    }
}
