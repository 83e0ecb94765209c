package com.trophykit.core.client;

import com.trophykit.core.config.ClientConfig;
import com.trophykit.core.error.ApiException;
import com.trophykit.core.http.HttpSender;
import com.trophykit.core.http.QueryParams;
import com.trophykit.core.http.RawResponse;
import com.trophykit.core.http.RetryingTransport;
import com.trophykit.core.json.ResponseDecoder;
import com.trophykit.core.json.ResponseShape;
import com.trophykit.core.util.DefaultSleeper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Shared plumbing for the vendor clients: every GET goes through the retrying transport
 * and the response decoder.
 */
public abstract class VendorClient {
    protected final RetryingTransport transport;
    protected final ResponseDecoder decoder;
    protected final String userAgent;
    protected final Duration timeout;

    protected VendorClient(RetryingTransport transport, ResponseDecoder decoder, String userAgent, Duration timeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    protected VendorClient(ClientConfig cfg) {
        this(defaultTransport(cfg), new ResponseDecoder(), cfg.getUserAgent(), cfg.getTimeout());
    }

    public static RetryingTransport defaultTransport(ClientConfig cfg) {
        cfg.validate();
        return new RetryingTransport(HttpSender.of(cfg.newHttpClient()), cfg.retryPolicy(), new DefaultSleeper(), null);
    }

    /** GET with retries, decoded into {@code shape}. {@code headers} may be null. */
    protected <T> T get(URI uri, ResponseShape<T> shape, Consumer<HttpRequest.Builder> headers)
            throws InterruptedException {
        return decoder.decode(fetch(uri, headers), shape);
    }

    /** GET with retries, undecoded; for bodies read into more than one shape. */
    protected RawResponse fetch(URI uri, Consumer<HttpRequest.Builder> headers) throws InterruptedException {
        return transport.execute(() -> {
            HttpRequest.Builder b = newRequest(uri).GET();
            if (headers != null) headers.accept(b);
            return b.build();
        });
    }

    /**
     * Single send without retries, for calls that must not be repeated (e.g. awarding an
     * achievement). Non-2xx statuses and connection failures raise {@link ApiException}.
     */
    protected <T> T sendOnce(HttpRequest request, ResponseShape<T> shape) throws InterruptedException {
        RawResponse resp;
        try {
            resp = transport.sendOnce(request);
        } catch (IOException e) {
            throw ApiException.transport(request.uri(), 1, e);
        }
        if (!resp.isSuccess()) {
            throw ApiException.terminal(resp.getStatusCode(), resp.getBody(), request.uri());
        }
        return decoder.decode(resp, shape);
    }

    protected <T> T get(URI uri, ResponseShape<T> shape) throws InterruptedException {
        return get(uri, shape, null);
    }

    protected HttpRequest.Builder newRequest(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json");
    }

    /** Percent-encodes one path segment (spaces as %20). */
    protected static String seg(String pathSegment) {
        Objects.requireNonNull(pathSegment, "path segment");
        return QueryParams.enc(pathSegment).replace("+", "%20");
    }

    protected static String trimSlash(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
