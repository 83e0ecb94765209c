package com.trophykit.core.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Doubling backoff with multiplicative jitter, e.g. base 1s: 2s → 4s → 8s ... capped at maxDelay.
 * With the default jitter factor 0.2 each wait is scaled by a random value in [0.8, 1.2).
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public DefaultRetryPolicy() { this(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.2); }

    public DefaultRetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(maxRetries, baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /** {@code random} must return values in [0, 1). */
    public DefaultRetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitterFactor,
                              DoubleSupplier random) {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        if (baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be > 0: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay: " + maxDelay + " < " + baseDelay);
        }
        if (!(jitterFactor >= 0.0 && jitterFactor <= 1.0)) {
            throw new IllegalArgumentException("jitterFactor must be within [0,1]: " + jitterFactor);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
        this.random = Objects.requireNonNull(random, "random");
    }

    public static DefaultRetryPolicy defaults() { return new DefaultRetryPolicy(); }

    /** Single attempt, nothing retried. */
    public static DefaultRetryPolicy none() {
        return new DefaultRetryPolicy(0, Duration.ofMillis(1), Duration.ofMillis(1), 0.0);
    }

    @Override public Duration backoff(int retry) {
        if (retry < 1) throw new IllegalArgumentException("retry is 1-based: " + retry);
        long cap = maxDelay.toMillis();
        long delay = baseDelay.toMillis();
        for (int i = 0; i < retry && delay < cap; i++) {
            delay = Math.min(cap, delay * 2);   // no overflow: stops doubling at the cap
        }
        return Duration.ofMillis(Math.min(cap, delay));
    }

    @Override public Duration nextDelay(int retry) {
        long raw = backoff(retry).toMillis();
        double scale = (1.0 - jitterFactor) + random.getAsDouble() * 2.0 * jitterFactor;
        long jittered = (long) (raw * scale);
        return Duration.ofMillis(Math.max(0, Math.min(maxDelay.toMillis(), jittered)));
    }

    @Override public int maxRetries() { return maxRetries; }
    @Override public Duration maxDelay() { return maxDelay; }
    public Duration baseDelay() { return baseDelay; }
    public double jitterFactor() { return jitterFactor; }

    @Override public String toString() {
        return "DefaultRetryPolicy{maxRetries=" + maxRetries + ", baseDelay=" + baseDelay
                + ", maxDelay=" + maxDelay + ", jitterFactor=" + jitterFactor + '}';
    }
}
