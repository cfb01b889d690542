package com.qqsuccubus.chatgw.gateway.session;

public class QrRenderException extends RuntimeException {

    public QrRenderException(String message) {
        super(message);
    }

    public QrRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
