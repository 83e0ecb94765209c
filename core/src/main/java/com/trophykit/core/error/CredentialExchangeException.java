package com.trophykit.core.error;

import java.util.OptionalLong;

/** A token exchange hop failed. The message is meant to be shown to the user as is. */
public class CredentialExchangeException extends RuntimeException {
    private final String vendor;
    private final String failedState;
    private final Long xErr;

    public CredentialExchangeException(String vendor, String failedState, String message) {
        this(vendor, failedState, null, message, null);
    }

    public CredentialExchangeException(String vendor, String failedState, String message, Throwable cause) {
        this(vendor, failedState, null, message, cause);
    }

    public CredentialExchangeException(String vendor, String failedState, Long xErr, String message, Throwable cause) {
        super(message, cause);
        this.vendor = vendor;
        this.failedState = failedState;
        this.xErr = xErr;
    }

    public String getVendor() { return vendor; }

    /** State the machine was in when the hop failed, e.g. {@code UNAUTHENTICATED}. */
    public String getFailedState() { return failedState; }

    public OptionalLong getXErr() {
        return xErr == null ? OptionalLong.empty() : OptionalLong.of(xErr);
    }
}
