package com.trophykit.core.auth.psn;

import com.fasterxml.jackson.databind.JsonNode;
import com.trophykit.core.config.ClientConfig;
import com.trophykit.core.error.ApiException;
import com.trophykit.core.error.CredentialExchangeException;
import com.trophykit.core.http.HttpSender;
import com.trophykit.core.http.QueryParams;
import com.trophykit.core.http.RawResponse;
import com.trophykit.core.json.ResponseDecoder;
import com.trophykit.core.util.StructuredLogger;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * NPSSO cookie → authorization code → bearer token.
 * <pre>
 * UNAUTHENTICATED --authorize (302 + code)--> ACCESS_CODE_OBTAINED --token--> TOKEN_OBTAINED --> READY
 *        any failing hop --> EXCHANGE_FAILED
 * </pre>
 * Each hop is a single send. The sender must not follow redirects, since the code is read
 * from the authorize response's {@code Location} header.
 */
public final class PsnCredentialExchange {
    private static final StructuredLogger log = StructuredLogger.get(PsnCredentialExchange.class);

    static final String CLIENT_ID = "09515159-7237-4370-9b40-3806e67c0891";
    static final String REDIRECT_URI = "com.scee.psxandroid.scecompcall://redirect";
    static final String SCOPE = "psn:mobile.v2.core psn:clientapp";
    static final String CLIENT_BASIC_AUTH =
            "Basic MDk1MTUxNTktNzIzNy00MzcwLTliNDAtMzgwNmU2N2MwODkxOnVjUGprYTV0bnRCMktxc1A=";

    private static final String NO_CODE_MESSAGE = "Failed to extract access code from redirect location. "
            + "Is your NPSSO code valid? To get a new NPSSO code, visit " + PsnAuthEndpoints.SSO_COOKIE_URL + ".";

    public enum State { UNAUTHENTICATED, ACCESS_CODE_OBTAINED, TOKEN_OBTAINED, READY, EXCHANGE_FAILED }

    private final HttpSender sender;
    private final PsnAuthEndpoints endpoints;
    private final ResponseDecoder decoder;
    private final String userAgent;
    private final Duration timeout;
    private final Clock clock;

    private volatile State state = State.UNAUTHENTICATED;

    public PsnCredentialExchange(ClientConfig cfg) {
        this(HttpSender.of(cfg.newHttpClient()), PsnAuthEndpoints.defaults(), cfg.getUserAgent(),
                cfg.getTimeout(), Clock.systemUTC());
    }

    public PsnCredentialExchange(HttpSender sender, PsnAuthEndpoints endpoints, String userAgent,
                                 Duration timeout, Clock clock) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.decoder = new ResponseDecoder();
    }

    public State state() { return state; }

    /**
     * Runs both hops. Calling again after success or failure starts over from UNAUTHENTICATED.
     *
     * @throws CredentialExchangeException when a hop fails; the message says what the user should do
     */
    public synchronized BearerCredential exchange(String npsso) throws InterruptedException {
        if (npsso == null || npsso.isBlank()) throw new IllegalArgumentException("npsso must not be blank");
        transition(State.UNAUTHENTICATED);
        String code = requestAccessCode(npsso.trim());
        transition(State.ACCESS_CODE_OBTAINED);
        BearerCredential credential = requestToken(code);
        transition(State.TOKEN_OBTAINED);
        transition(State.READY);
        return credential;
    }

    private String requestAccessCode(String npsso) throws InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(QueryParams.create()
                        .add("access_type", "offline")
                        .add("client_id", CLIENT_ID)
                        .add("redirect_uri", REDIRECT_URI)
                        .add("response_type", "code")
                        .add("scope", SCOPE)
                        .appendTo(endpoints.authorizeUri().toString()))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Cookie", "npsso=" + npsso)
                .GET()
                .build();

        RawResponse resp = send(req);
        String location = resp.header("Location").orElse(null);
        if (location == null || !location.contains("code=")) {
            throw fail("There was a problem retrieving your PSN access code (HTTP " + resp.getStatusCode()
                    + "). Is your NPSSO code valid? To get a new NPSSO code, visit "
                    + PsnAuthEndpoints.SSO_COOKIE_URL + ".", null);
        }
        String code;
        try {
            code = QueryParams.firstValue(location, "code");
        } catch (IllegalArgumentException e) {
            throw fail(NO_CODE_MESSAGE, e);
        }
        if (code == null || code.isBlank()) {
            throw fail(NO_CODE_MESSAGE, null);
        }
        log.debug("psn.exchange.code", "code", StructuredLogger.mask(code));
        return code;
    }

    private BearerCredential requestToken(String code) throws InterruptedException {
        String form = QueryParams.create()
                .add("grant_type", "authorization_code")
                .add("code", code)
                .add("redirect_uri", REDIRECT_URI)
                .add("token_format", "jwt")
                .encode();
        HttpRequest req = HttpRequest.newBuilder(endpoints.tokenUri())
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Authorization", CLIENT_BASIC_AUTH)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();

        RawResponse resp = send(req);
        if (!resp.isSuccess()) {
            throw fail("Token exchange failed with status " + resp.getStatusCode()
                    + ", response: " + StructuredLogger.preview(resp.getBody(), 500), null);
        }
        JsonNode root;
        try {
            root = decoder.tree(resp.getBody());
        } catch (ApiException e) {
            throw fail("Token endpoint returned malformed JSON: " + e.getMessage(), e);
        }
        String accessToken = root.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw fail("Failed to extract access token from response: "
                    + StructuredLogger.preview(resp.getBody(), 500), null);
        }
        String refresh = root.hasNonNull("refresh_token") ? root.get("refresh_token").asText() : null;
        return new BearerCredential(accessToken, refresh, root.path("expires_in").asLong(0), clock.instant());
    }

    private RawResponse send(HttpRequest req) throws InterruptedException {
        long t0 = System.nanoTime();
        try {
            HttpResponse<String> r = sender.send(req);
            return RawResponse.from(req, r, (System.nanoTime() - t0) / 1_000_000L);
        } catch (IOException e) {
            throw fail("Could not reach " + req.uri().getHost() + ": " + e.getMessage(), e);
        }
    }

    private CredentialExchangeException fail(String message, Throwable cause) {
        State failedIn = state;
        transition(State.EXCHANGE_FAILED);
        log.warn("psn.exchange.failed", "state", failedIn, "reason", message);
        return new CredentialExchangeException("psn", failedIn.name(), message, cause);
    }

    private void transition(State next) {
        State prev = state;
        state = next;
        log.info("psn.exchange.state", "from", prev, "to", next);
    }
}
