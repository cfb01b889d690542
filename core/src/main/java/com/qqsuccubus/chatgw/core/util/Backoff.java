package com.qqsuccubus.chatgw.core.util;

import java.time.Duration;

/**
 * Reconnect delay calculators.
 * <p>
 * <b>Exponential:</b> {@code t = min(max, base * 2^(attempt - 1))} for 1-based attempts,
 * used for infrastructure reconnects (the broker).
 * <br>
 * <b>Fixed:</b> constant delay, used for human-paced pairing reconnects.
 * </p>
 */
public final class Backoff {
    private Backoff() {
    }

    private static final int MAX_EXPONENT = 20;

    /**
     * Computes the exponential delay before the given attempt.
     *
     * @param attempt Attempt number (1-based)
     * @param base    Delay before the first attempt
     * @param max     Maximum delay (cap)
     * @return base * 2^(attempt-1), capped at max
     */
    public static Duration exponential(int attempt, Duration base, Duration max) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        long baseMs = base.toMillis();
        // Cap exponent to avoid overflow
        long expMs = baseMs * (1L << Math.min(attempt - 1, MAX_EXPONENT));
        return Duration.ofMillis(Math.min(expMs, max.toMillis()));
    }

    /**
     * Fixed delay, independent of the attempt number. Negative delays clamp to zero.
     */
    public static Duration fixed(Duration delay) {
        return delay.isNegative() ? Duration.ZERO : delay;
    }
}
