package com.trophykit.core.http;

import com.trophykit.core.error.ApiException;
import com.trophykit.core.util.DefaultSleeper;
import com.trophykit.core.util.Sleeper;
import com.trophykit.core.util.StructuredLogger;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Sends a request, retrying 429 / 5xx / connection failures with the configured backoff.
 * <p>
 * The request is rebuilt from the supplier on every attempt. Any other non-2xx status fails
 * immediately. Redirects are returned as-is by {@link #sendOnce(HttpRequest)} and treated as
 * terminal by {@link #execute(Supplier)}.
 * <p>
 * Cancellation is thread interruption: the flag is checked before each attempt and an
 * interrupted backoff wait ends the call with {@link InterruptedException}.
 */
public final class RetryingTransport {
    private static final StructuredLogger log = StructuredLogger.get(RetryingTransport.class);
    private static final int BODY_PREVIEW = 300;

    private final HttpSender sender;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Consumer<RequestAttempt> attemptListener;

    public RetryingTransport(HttpSender sender, RetryPolicy policy) {
        this(sender, policy, new DefaultSleeper(), null);
    }

    public RetryingTransport(HttpSender sender, RetryPolicy policy, Sleeper sleeper,
                             Consumer<RequestAttempt> attemptListener) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.attemptListener = attemptListener;
    }

    public RetryPolicy policy() { return policy; }

    /**
     * @return the first 2xx response
     * @throws ApiException TERMINAL for non-retryable statuses, RETRIES_EXHAUSTED / TRANSPORT once
     *                      {@link RetryPolicy#maxRetries()} retries were spent
     */
    public RawResponse execute(Supplier<HttpRequest> requestBuilder) throws InterruptedException {
        Objects.requireNonNull(requestBuilder, "requestBuilder");
        int retries = 0;
        Duration delay = Duration.ZERO;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("cancelled before attempt " + (retries + 1));
            }
            HttpRequest req = requestBuilder.get();
            if (attemptListener != null) {
                attemptListener.accept(new RequestAttempt(retries + 1, delay, req.method(), req.uri()));
            }

            RawResponse resp = null;
            IOException failure = null;
            int status;
            try {
                resp = sendOnce(req);
                status = resp.getStatusCode();
            } catch (IOException e) {
                failure = e;
                status = RetryPolicy.TRANSPORT_FAILURE;
            }

            if (resp != null && resp.isSuccess()) {
                if (retries > 0) {
                    log.info("http.recovered", "method", req.method(), "uri", QueryParams.redact(req.uri()),
                            "status", status, "retries", retries, "ms", resp.getResponseTimeMs());
                }
                return resp;
            }

            String body = resp == null ? null : resp.getBody();
            if (!RetryPolicy.isRetryableStatus(status)) {
                log.warn("http.terminal", "method", req.method(), "uri", QueryParams.redact(req.uri()), "status", status,
                        "ms", resp == null ? null : resp.getResponseTimeMs(),
                        "body", StructuredLogger.preview(body, BODY_PREVIEW));
                throw ApiException.terminal(status, body, req.uri());
            }
            if (!policy.shouldRetry(status, retries)) {
                log.warn("http.giveup", "method", req.method(), "uri", QueryParams.redact(req.uri()), "status", status,
                        "attempts", retries + 1,
                        "cause", failure == null ? null : failure.getClass().getSimpleName());
                if (failure != null) throw ApiException.transport(req.uri(), retries + 1, failure);
                throw ApiException.exhausted(status, body, req.uri(), retries + 1);
            }

            retries++;
            delay = policy.nextDelay(retries);
            log.info("http.retry", "method", req.method(), "uri", QueryParams.redact(req.uri()), "status", status,
                    "retry", retries, "delayMs", delay.toMillis(),
                    "cause", failure == null ? null : failure.getMessage());
            sleeper.sleep(delay);
        }
    }

    /** One send, no status interpretation. Used for the credential exchange hops. */
    public RawResponse sendOnce(HttpRequest req) throws IOException, InterruptedException {
        long t0 = System.nanoTime();
        HttpResponse<String> r = sender.send(req);
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        return RawResponse.from(req, r, ms);
    }
}
