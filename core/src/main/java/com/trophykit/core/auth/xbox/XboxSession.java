package com.trophykit.core.auth.xbox;

import com.trophykit.core.util.StructuredLogger;

import java.time.Instant;
import java.util.Objects;

/** Result of a completed XSTS exchange. Unusable once {@code now >= expiresAt}. */
public record XboxSession(String userHash, String xstsToken, String xuid, Instant expiresAt) {

    public XboxSession {
        Objects.requireNonNull(userHash, "userHash");
        Objects.requireNonNull(xstsToken, "xstsToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    /** {@code XBL3.0 x=<uhs>;<xsts>} */
    public String authorizationHeader() {
        return "XBL3.0 x=" + userHash + ";" + xstsToken;
    }

    @Override public String toString() {
        return "XboxSession{userHash=" + userHash + ", xstsToken=" + StructuredLogger.mask(xstsToken)
                + ", xuid=" + xuid + ", expiresAt=" + expiresAt + '}';
    }
}
