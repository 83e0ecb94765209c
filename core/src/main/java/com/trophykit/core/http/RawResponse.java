package com.trophykit.core.http;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Status, headers and text body of one vendor response. Body is never null. */
public final class RawResponse {
    private final URI uri;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final long responseTimeMs;

    private RawResponse(Builder b) {
        this.uri = b.uri;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.responseTimeMs = b.responseTimeMs;
    }

    /** Falls back to the request URI when the response does not carry one. */
    public static RawResponse from(HttpRequest req, HttpResponse<String> resp, long elapsedMs) {
        return builder()
                .uri(resp.uri() != null ? resp.uri() : req.uri())
                .statusCode(resp.statusCode())
                .headers(resp.headers().map())
                .body(resp.body())
                .responseTimeMs(elapsedMs)
                .build();
    }

    public URI getUri() { return uri; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public long getResponseTimeMs() { return responseTimeMs; }

    public boolean isSuccess() { return statusCode >= 200 && statusCode < 300; }
    public boolean isRedirect() { return statusCode >= 300 && statusCode < 400; }

    /** 204 or a body with nothing but whitespace. */
    public boolean hasNoContent() { return statusCode == 204 || body.isBlank(); }

    /** First value of a header, case-insensitive. */
    public Optional<String> header(String name) {
        if (name == null) return Optional.empty();
        for (var e : headers.entrySet()) {
            String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? Optional.empty() : Optional.ofNullable(vs.get(0));
            }
        }
        return Optional.empty();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI uri;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private long responseTimeMs;

        public Builder uri(URI uri) { this.uri = uri; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder responseTimeMs(long ms) { this.responseTimeMs = ms; return this; }
        public RawResponse build() { return new RawResponse(this); }
    }

    @Override public String toString() {
        return "RawResponse{" + statusCode + " " + QueryParams.redact(uri) + ", " + body.length() + " chars}";
    }
}
