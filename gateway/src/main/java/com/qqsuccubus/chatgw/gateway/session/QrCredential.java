package com.qqsuccubus.chatgw.gateway.session;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Rendered pairing challenge held in memory until it expires or the session opens.
 */
@Value
public class QrCredential {
    String code;
    Instant expiresAt;

    /**
     * Expired from {@code expiresAt} onwards.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Whole seconds left, never negative.
     */
    public long expiresInSeconds(Instant now) {
        return Math.max(0, Duration.between(now, expiresAt).getSeconds());
    }
}
