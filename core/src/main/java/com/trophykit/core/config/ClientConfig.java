package com.trophykit.core.config;

import com.trophykit.core.http.DefaultRetryPolicy;
import com.trophykit.core.http.RetryPolicy;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Client tuning shared by all vendor clients (trophykit.yml mapping target).
 * Holds no credentials: API keys, NPSSO and tokens are passed to client constructors.
 */
public final class ClientConfig {
    public static final String BROWSER_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    /** Retry budget: 429, 5xx and connection failures. */
    public static final class Retry {
        private int maxRetries = 3;
        private long baseDelayMs = 1_000;
        private long maxDelayMs = 30_000;
        private double jitterFactor = 0.2;

        public int getMaxRetries() { return maxRetries; }
        public Retry setMaxRetries(int v) { this.maxRetries = v; return this; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public Retry setBaseDelayMs(long v) { this.baseDelayMs = v; return this; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public Retry setMaxDelayMs(long v) { this.maxDelayMs = v; return this; }

        public double getJitterFactor() { return jitterFactor; }
        public Retry setJitterFactor(double v) { this.jitterFactor = v; return this; }
    }

    private Retry retry = new Retry();
    private Duration timeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private String userAgent = BROWSER_USER_AGENT;
    /** dorequest.php rejects requests without a client identifier. */
    private String retroConnectUserAgent = "trophykit/0.3";

    public static ClientConfig defaults() { return new ClientConfig(); }

    public Retry retry() { return retry; }
    public void setRetry(Retry retry) { this.retry = Objects.requireNonNull(retry, "retry"); }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public String getRetroConnectUserAgent() { return retroConnectUserAgent; }
    public void setRetroConnectUserAgent(String ua) { this.retroConnectUserAgent = ua; }

    /** Fails fast on settings that would make the policy or the HTTP client invalid. */
    public void validate() {
        if (retry.maxRetries < 0) throw new IllegalStateException("retry.maxRetries must be >= 0");
        if (retry.baseDelayMs <= 0) throw new IllegalStateException("retry.baseDelayMs must be > 0");
        if (retry.maxDelayMs < retry.baseDelayMs) {
            throw new IllegalStateException("retry.maxDelayMs must be >= retry.baseDelayMs");
        }
        if (!(retry.jitterFactor >= 0.0 && retry.jitterFactor <= 1.0)) {
            throw new IllegalStateException("retry.jitterFactor must be within [0,1]");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalStateException("timeout must be > 0");
        }
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new IllegalStateException("connectTimeout must be > 0");
        }
        if (userAgent == null || userAgent.isBlank()) throw new IllegalStateException("userAgent is required");
        if (retroConnectUserAgent == null || retroConnectUserAgent.isBlank()) {
            throw new IllegalStateException("retroConnectUserAgent is required");
        }
    }

    public RetryPolicy retryPolicy() {
        return new DefaultRetryPolicy(retry.maxRetries, Duration.ofMillis(retry.baseDelayMs),
                Duration.ofMillis(retry.maxDelayMs), retry.jitterFactor);
    }

    /** Redirects are never followed; the PSN authorize hop reads the Location header itself. */
    public HttpClient newHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override public String toString() {
        return "ClientConfig{maxRetries=" + retry.maxRetries + ", baseDelayMs=" + retry.baseDelayMs
                + ", maxDelayMs=" + retry.maxDelayMs + ", jitterFactor=" + retry.jitterFactor
                + ", timeout=" + timeout + ", connectTimeout=" + connectTimeout
                + ", userAgent='" + userAgent + "'}";
    }
}
