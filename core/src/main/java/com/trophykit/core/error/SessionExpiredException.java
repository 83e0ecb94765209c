package com.trophykit.core.error;

import java.time.Instant;

/** Raised before any network traffic when a stored session is past its expiry. */
public class SessionExpiredException extends RuntimeException {
    private final Instant expiredAt;

    public SessionExpiredException(Instant expiredAt, String message) {
        super(message);
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() { return expiredAt; }
}
