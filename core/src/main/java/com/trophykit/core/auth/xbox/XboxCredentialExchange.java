package com.trophykit.core.auth.xbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trophykit.core.config.ClientConfig;
import com.trophykit.core.error.ApiException;
import com.trophykit.core.error.CredentialExchangeException;
import com.trophykit.core.http.HttpSender;
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
 * Microsoft account access token → Xbox user token → XSTS token.
 * <pre>
 * UNAUTHENTICATED --user/authenticate--> USER_TOKEN_OBTAINED --xsts/authorize--> XSTS_OBTAINED --> READY
 *        any failing hop --> EXCHANGE_FAILED
 * </pre>
 * The resulting session is valid for {@link #SESSION_LIFETIME}, a little under the
 * tokens' real one-hour lifetime.
 */
public final class XboxCredentialExchange {
    private static final StructuredLogger log = StructuredLogger.get(XboxCredentialExchange.class);

    public static final Duration SESSION_LIFETIME = Duration.ofMinutes(55);

    public enum State { UNAUTHENTICATED, USER_TOKEN_OBTAINED, XSTS_OBTAINED, READY, EXCHANGE_FAILED }

    private final HttpSender sender;
    private final XboxAuthEndpoints endpoints;
    private final Duration timeout;
    private final Clock clock;
    private final ResponseDecoder decoder = new ResponseDecoder();
    private final ObjectMapper mapper = decoder.mapper();

    private volatile State state = State.UNAUTHENTICATED;

    public XboxCredentialExchange(ClientConfig cfg) {
        this(HttpSender.of(cfg.newHttpClient()), XboxAuthEndpoints.defaults(), cfg.getTimeout(), Clock.systemUTC());
    }

    public XboxCredentialExchange(HttpSender sender, XboxAuthEndpoints endpoints, Duration timeout, Clock clock) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public State state() { return state; }

    public Clock clock() { return clock; }

    /** @throws CredentialExchangeException when either hop fails; carries the XErr code when one was sent */
    public synchronized XboxSession exchange(String microsoftAccessToken) throws InterruptedException {
        if (microsoftAccessToken == null || microsoftAccessToken.isBlank()) {
            throw new IllegalArgumentException("microsoftAccessToken must not be blank");
        }
        transition(State.UNAUTHENTICATED);

        ObjectNode userBody = mapper.createObjectNode();
        ObjectNode props = userBody.putObject("Properties");
        props.put("AuthMethod", "RPS");
        props.put("SiteName", "user.auth.xboxlive.com");
        props.put("RpsTicket", "d=" + microsoftAccessToken);
        userBody.put("RelyingParty", "http://auth.xboxlive.com");
        userBody.put("TokenType", "JWT");

        JsonNode user = postJson(endpoints.userAuthenticateUri().toString(), userBody, "Xbox user token");
        String userToken = user.path("Token").asText("");
        String userHash = firstXui(user, "uhs");
        if (userToken.isBlank() || userHash == null) {
            throw fail("Failed to obtain Xbox user token: response has no Token or DisplayClaims.xui[0].uhs", null, null);
        }
        transition(State.USER_TOKEN_OBTAINED);

        ObjectNode xstsBody = mapper.createObjectNode();
        ObjectNode xprops = xstsBody.putObject("Properties");
        xprops.put("SandboxId", "RETAIL");
        xprops.putArray("UserTokens").add(userToken);
        xstsBody.put("RelyingParty", "http://xboxlive.com");
        xstsBody.put("TokenType", "JWT");

        JsonNode xsts = postJson(endpoints.xstsAuthorizeUri().toString(), xstsBody, "XSTS token");
        String xstsToken = xsts.path("Token").asText("");
        String xuid = firstXui(xsts, "xid");
        if (xstsToken.isBlank() || xuid == null) {
            throw fail("Failed to obtain XSTS token: response has no Token or DisplayClaims.xui[0].xid", null, null);
        }
        transition(State.XSTS_OBTAINED);

        XboxSession session = new XboxSession(userHash, xstsToken, xuid, clock.instant().plus(SESSION_LIFETIME));
        transition(State.READY);
        return session;
    }

    private JsonNode postJson(String uri, ObjectNode body, String what) throws InterruptedException {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize " + what + " request", e);
        }
        HttpRequest req = HttpRequest.newBuilder(java.net.URI.create(uri))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("x-xbl-contract-version", "1")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();

        RawResponse resp;
        long t0 = System.nanoTime();
        try {
            HttpResponse<String> r = sender.send(req);
            resp = RawResponse.from(req, r, (System.nanoTime() - t0) / 1_000_000L);
        } catch (IOException e) {
            throw fail("Could not reach " + req.uri().getHost() + ": " + e.getMessage(), null, e);
        }

        JsonNode root = parseQuietly(resp.getBody());
        if (!resp.isSuccess()) {
            if (root.has("XErr")) {
                long xErr = root.get("XErr").asLong();
                String raw = root.path("Message").asText(resp.getBody());
                throw fail(XboxErrorCode.describe(xErr, raw), xErr, null);
            }
            throw fail("Failed to get " + what + ": HTTP " + resp.getStatusCode() + " - "
                    + StructuredLogger.preview(resp.getBody(), 500), null, null);
        }
        if (root.isMissingNode()) {
            throw fail(what + " response was empty or not JSON", null, null);
        }
        return root;
    }

    // error bodies are sometimes empty or plain text
    private JsonNode parseQuietly(String body) {
        try {
            return decoder.tree(body);
        } catch (ApiException e) {
            log.debug("xbox.exchange.unparsable", "reason", e.getMessage());
            return mapper.missingNode();
        }
    }

    private static String firstXui(JsonNode root, String field) {
        JsonNode xui = root.path("DisplayClaims").path("xui");
        if (!xui.isArray() || xui.isEmpty()) return null;
        String v = xui.get(0).path(field).asText("");
        return v.isBlank() ? null : v;
    }

    private CredentialExchangeException fail(String message, Long xErr, Throwable cause) {
        State failedIn = state;
        transition(State.EXCHANGE_FAILED);
        log.warn("xbox.exchange.failed", "state", failedIn, "xErr", xErr, "reason", message);
        return new CredentialExchangeException("xbox", failedIn.name(), xErr, message, cause);
    }

    private void transition(State next) {
        State prev = state;
        state = next;
        log.info("xbox.exchange.state", "from", prev, "to", next);
    }
}
