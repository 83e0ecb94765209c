package com.trophykit.core.http;

import java.net.URI;
import java.time.Duration;

/** One send of a logical call. attemptNumber starts at 1; the first attempt has no delay. */
public record RequestAttempt(int attemptNumber, Duration delayBeforeThisAttempt, String method, URI uri) {
    public boolean isRetry() { return attemptNumber > 1; }
}
