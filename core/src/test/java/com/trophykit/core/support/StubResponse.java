package com.trophykit.core.support;

import javax.net.ssl.SSLSession;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Canned {@code HttpResponse<String>} for scripted senders. */
public final class StubResponse implements HttpResponse<String> {
    private final int code;
    private final Map<String, List<String>> headers;
    private final String body;
    private final HttpRequest request;

    public StubResponse(int code, Map<String, List<String>> headers, String body, HttpRequest request) {
        this.code = code;
        this.headers = headers;
        this.body = body;
        this.request = request;
    }

    public static StubResponse of(int code, String body) {
        return new StubResponse(code, Map.of(), body, null);
    }

    @Override public int statusCode() { return code; }
    @Override public HttpRequest request() { return request; }
    @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
    @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
    @Override public String body() { return body; }
    @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
    @Override public URI uri() { return request == null ? null : request.uri(); }
    @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
}
