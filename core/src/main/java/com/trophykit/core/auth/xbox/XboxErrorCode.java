package com.trophykit.core.auth.xbox;

import java.util.Optional;

/** Well-known {@code XErr} values returned by the XSTS endpoint. */
public enum XboxErrorCode {
    NO_XBOX_LIVE_ACCOUNT(2148916233L, "Account doesn't have an Xbox Live subscription (no Xbox Live profile exists)"),
    BANNED(2148916235L, "Account is banned from Xbox Live"),
    CHILD_NEEDS_ADULT_VERIFICATION(2148916238L,
            "Adult verification needed: this is a child account and must be added to a family by an adult");

    private final long code;
    private final String message;

    XboxErrorCode(long code, String message) {
        this.code = code;
        this.message = message;
    }

    public long code() { return code; }
    public String message() { return message; }

    public static Optional<XboxErrorCode> of(long xErr) {
        for (XboxErrorCode c : values()) {
            if (c.code == xErr) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** Specific text for known codes, otherwise "Xbox Live error <code>: <raw>". */
    public static String describe(long xErr, String rawMessage) {
        return of(xErr).map(XboxErrorCode::message)
                .orElseGet(() -> "Xbox Live error " + xErr + ": " + (rawMessage == null ? "" : rawMessage));
    }
}
