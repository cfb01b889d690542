package com.qqsuccubus.chatgw.core.error;

/**
 * Publish or transport failure on the broker side. Recovered inside the event
 * pipeline by buffering; never surfaced to publishers.
 */
public class TransientBrokerException extends GatewayException {

    public TransientBrokerException(String message) {
        super(ErrorCode.BROKER_UNAVAILABLE, message);
    }

    public TransientBrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_UNAVAILABLE, message, cause);
    }
}
