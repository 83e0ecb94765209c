package com.trophykit.core.auth.psn;

import com.trophykit.core.util.StructuredLogger;

import java.time.Instant;
import java.util.Objects;

/**
 * PSN access token. Never refreshed automatically; exchange a new NPSSO once it stops working.
 *
 * @param refreshToken nullable
 * @param expiresInSeconds 0 when the token endpoint did not say
 */
public record BearerCredential(String accessToken, String refreshToken, long expiresInSeconds, Instant issuedAt) {

    public BearerCredential {
        Objects.requireNonNull(accessToken, "accessToken");
        if (accessToken.isBlank()) throw new IllegalArgumentException("accessToken must not be blank");
    }

    public static BearerCredential of(String accessToken) {
        return new BearerCredential(accessToken, null, 0, null);
    }

    public String authorizationHeader() { return "Bearer " + accessToken; }

    @Override public String toString() {
        return "BearerCredential{accessToken=" + StructuredLogger.mask(accessToken)
                + ", refreshToken=" + StructuredLogger.mask(refreshToken)
                + ", expiresInSeconds=" + expiresInSeconds + ", issuedAt=" + issuedAt + '}';
    }
}
