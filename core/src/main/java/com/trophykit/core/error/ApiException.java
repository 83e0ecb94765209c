package com.trophykit.core.error;

import com.trophykit.core.http.QueryParams;

import java.net.URI;

/**
 * A vendor call that did not produce a usable value.
 * {@link #getStatusCode()} is -1 when no HTTP response was received.
 */
public class ApiException extends RuntimeException {

    public enum Kind {
        /** Non-retryable status (4xx other than 429). */
        TERMINAL,
        /** 429/5xx or transport failures kept happening until the retry budget ran out. */
        RETRIES_EXHAUSTED,
        /** Connection-level failure on the last allowed attempt. */
        TRANSPORT,
        /** Body present but could not be mapped onto the requested shape. */
        DECODE,
        /** Body absent where the caller required an object. */
        NO_CONTENT
    }

    private final Kind kind;
    private final int statusCode;
    private final String rawBody;
    private final URI uri;

    public ApiException(Kind kind, int statusCode, String message, String rawBody, URI uri, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.rawBody = rawBody;
        this.uri = uri;
    }

    public static ApiException terminal(int status, String body, URI uri) {
        return new ApiException(Kind.TERMINAL, status,
                "HTTP " + status + " from " + QueryParams.redact(uri), body, uri, null);
    }

    public static ApiException exhausted(int status, String body, URI uri, int attempts) {
        return new ApiException(Kind.RETRIES_EXHAUSTED, status,
                "HTTP " + status + " from " + QueryParams.redact(uri) + " after " + attempts + " attempt(s)", body, uri, null);
    }

    public static ApiException transport(URI uri, int attempts, Throwable cause) {
        return new ApiException(Kind.TRANSPORT, -1,
                "Request to " + QueryParams.redact(uri) + " failed after " + attempts + " attempt(s): " + cause.getMessage(),
                null, uri, cause);
    }

    public static ApiException decode(String parserMessage, String body, Throwable cause) {
        return new ApiException(Kind.DECODE, 200, "Failed to decode response: " + parserMessage, body, null, cause);
    }

    public static ApiException noContent(int status, String what) {
        return new ApiException(Kind.NO_CONTENT, status, "Content expected but absent: " + what, "", null, null);
    }

    public Kind getKind() { return kind; }
    public int getStatusCode() { return statusCode; }
    /** Raw response text as received; null for transport failures. */
    public String getRawBody() { return rawBody; }
    public URI getUri() { return uri; }

    public boolean isTransient() {
        return kind == Kind.RETRIES_EXHAUSTED || kind == Kind.TRANSPORT;
    }
}
