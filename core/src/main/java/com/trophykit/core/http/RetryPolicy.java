package com.trophykit.core.http;

import java.time.Duration;

/** Decides which failures are retried and how long to back off between attempts. */
public interface RetryPolicy {
    /** Pseudo status used for connection-level failures (no HTTP response at all). */
    int TRANSPORT_FAILURE = -1;

    /** 429, any 5xx, or {@link #TRANSPORT_FAILURE}. Everything else is terminal. */
    static boolean isRetryableStatus(int statusCode) {
        return statusCode == 429 || statusCode >= 500 || statusCode == TRANSPORT_FAILURE;
    }

    /** {@code retriesSoFar} is 0 for the first send. true means: back off, then send again. */
    default boolean shouldRetry(int statusCode, int retriesSoFar) {
        return isRetryableStatus(statusCode) && retriesSoFar < maxRetries();
    }

    /** Unjittered wait before retry number {@code retry} (1-based). Never above {@link #maxDelay()}. */
    Duration backoff(int retry);

    /** Jittered wait before retry number {@code retry} (1-based). Never above {@link #maxDelay()}. */
    Duration nextDelay(int retry);

    /** Retries after the first send, so a call makes at most {@code maxRetries() + 1} attempts. */
    int maxRetries();

    Duration maxDelay();
}
