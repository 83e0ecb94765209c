package com.trophykit.core.client.psn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trophykit.core.auth.psn.BearerCredential;
import com.trophykit.core.auth.psn.PsnCredentialExchange;
import com.trophykit.core.client.VendorClient;
import com.trophykit.core.client.psn.PsnModels.*;
import com.trophykit.core.config.ClientConfig;
import com.trophykit.core.http.QueryParams;
import com.trophykit.core.http.RetryingTransport;
import com.trophykit.core.json.ResponseDecoder;
import com.trophykit.core.json.ResponseShape;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * PlayStation trophy API. Works with a fixed {@link BearerCredential}; once it is rejected
 * (401), obtain a new one from a fresh NPSSO.
 * <p>
 * {@code accountId} may be {@code "me"} for the authenticated user.
 */
public class PsnTrophyClient extends VendorClient {
    public static final String DEFAULT_BASE_URL = "https://m.np.playstation.com/api/trophy/v1";
    public static final String DEFAULT_GRAPHQL_URL = "https://m.np.playstation.com/api/graphql/v1";

    static final String HINT_AVAILABILITY_OP = "metGetHintAvailability";
    static final String HINT_AVAILABILITY_HASH = "71bf26729f2634f4d8cca32ff73aaf42b3b76ad1d2f63b490a809b66483ea5a7";
    static final String TIPS_OP = "metGetTips";
    static final String TIPS_HASH = "93768752a9f4ef69922a543e2209d45020784d8781f57b37a5294e6e206c5630";

    private final BearerCredential credential;
    private final String baseUrl;
    private final String graphQlUrl;

    public PsnTrophyClient(BearerCredential credential, ClientConfig cfg) {
        super(cfg);
        this.credential = Objects.requireNonNull(credential, "credential");
        this.baseUrl = DEFAULT_BASE_URL;
        this.graphQlUrl = DEFAULT_GRAPHQL_URL;
    }

    public PsnTrophyClient(BearerCredential credential, String baseUrl, String graphQlUrl,
                           RetryingTransport transport, ResponseDecoder decoder, String userAgent, Duration timeout) {
        super(transport, decoder, userAgent, timeout);
        this.credential = Objects.requireNonNull(credential, "credential");
        this.baseUrl = trimSlash(baseUrl);
        this.graphQlUrl = trimSlash(graphQlUrl);
    }

    /** Runs the NPSSO exchange, then builds a client around the resulting token. */
    public static PsnTrophyClient fromNpsso(String npsso, ClientConfig cfg) throws InterruptedException {
        BearerCredential c = new PsnCredentialExchange(cfg).exchange(npsso);
        return new PsnTrophyClient(c, cfg);
    }

    /** "trophy2" for PS5 titles, "trophy" for PS3, PS4 and Vita. */
    public static String npServiceName(String platform) {
        if (platform == null) return "trophy";
        for (String p : platform.split(",")) {
            if (p.trim().toUpperCase(Locale.ROOT).equals("PS5")) return "trophy2";
        }
        return "trophy";
    }

    public UserTrophyTitles getUserTrophyTitles(String accountId, int limit, int offset) throws InterruptedException {
        URI uri = QueryParams.create().add("limit", limit).add("offset", offset)
                .appendTo(baseUrl + "/users/" + seg(accountId) + "/trophyTitles");
        return get(uri, ResponseShape.object(UserTrophyTitles.class), auth(null));
    }

    /** @param groupId "all", "default" or "001".. ; @param acceptLanguage nullable, e.g. "de-DE" */
    public TitleTrophies getTitleTrophies(String npCommunicationId, String platform, String groupId,
                                         String acceptLanguage) throws InterruptedException {
        URI uri = QueryParams.create().add("npServiceName", npServiceName(platform))
                .appendTo(baseUrl + "/npCommunicationIds/" + seg(npCommunicationId)
                        + "/trophyGroups/" + seg(group(groupId)) + "/trophies");
        return get(uri, ResponseShape.object(TitleTrophies.class), auth(acceptLanguage));
    }

    public UserEarnedTrophies getUserEarnedTrophies(String npCommunicationId, String platform, String accountId,
                                                   String groupId) throws InterruptedException {
        URI uri = QueryParams.create().add("npServiceName", npServiceName(platform))
                .appendTo(baseUrl + "/users/" + seg(accountId) + "/npCommunicationIds/" + seg(npCommunicationId)
                        + "/trophyGroups/" + seg(group(groupId)) + "/trophies");
        return get(uri, ResponseShape.object(UserEarnedTrophies.class), auth(null));
    }

    public TrophySummary getUserTrophySummary(String accountId) throws InterruptedException {
        URI uri = URI.create(baseUrl + "/users/" + seg(accountId) + "/trophySummary");
        return get(uri, ResponseShape.object(TrophySummary.class), auth(null));
    }

    /** Progress summary of one title for a user, including its rarest trophies. */
    public UserTitlesTrophySummary getUserTitleTrophySummary(String accountId, String npCommunicationId,
                                                            String platform) throws InterruptedException {
        URI uri = QueryParams.create().add("npServiceName", npServiceName(platform))
                .appendTo(baseUrl + "/users/" + seg(accountId) + "/npCommunicationIds/" + seg(npCommunicationId)
                        + "/trophySummary");
        return get(uri, ResponseShape.object(UserTitlesTrophySummary.class), auth(null));
    }

    public TitleTrophyGroups getTitleTrophyGroups(String npCommunicationId, String platform) throws InterruptedException {
        URI uri = QueryParams.create().add("npServiceName", npServiceName(platform))
                .appendTo(baseUrl + "/npCommunicationIds/" + seg(npCommunicationId) + "/trophyGroups");
        return get(uri, ResponseShape.object(TitleTrophyGroups.class), auth(null));
    }

    public UserEarnedTrophyGroups getUserEarnedTrophyGroups(String npCommunicationId, String platform,
                                                           String accountId) throws InterruptedException {
        URI uri = QueryParams.create().add("npServiceName", npServiceName(platform))
                .appendTo(baseUrl + "/users/" + seg(accountId) + "/npCommunicationIds/" + seg(npCommunicationId)
                        + "/trophyGroups");
        return get(uri, ResponseShape.object(UserEarnedTrophyGroups.class), auth(null));
    }

    /** Trophies of a title that have game help. {@code trophyIds} is optional (null or empty = all). */
    public List<HintTrophy> getTrophiesWithGameHelp(String npCommunicationId, Collection<String> trophyIds)
            throws InterruptedException {
        ObjectNode vars = decoder.mapper().createObjectNode();
        vars.put("npCommId", npCommunicationId);
        if (trophyIds != null && !trophyIds.isEmpty()) {
            var arr = vars.putArray("trophyIds");
            trophyIds.forEach(arr::add);
        }
        GameHelpAvailabilityResponse r = get(graphQlUri(HINT_AVAILABILITY_OP, vars, HINT_AVAILABILITY_HASH),
                ResponseShape.object(GameHelpAvailabilityResponse.class), graphQlHeaders());
        return r.trophies();
    }

    /** Empty when the response carries no {@code data}, e.g. the title has no game help. */
    public Optional<Tips> getGameHelpForTrophies(String npCommunicationId, Collection<GameHelpRequestTrophy> trophies)
            throws InterruptedException {
        if (trophies == null || trophies.isEmpty()) {
            throw new IllegalArgumentException("trophies must not be empty");
        }
        ObjectNode vars = decoder.mapper().createObjectNode();
        vars.put("npCommId", npCommunicationId);
        vars.set("trophies", decoder.mapper().valueToTree(trophies));
        GameHelpTipsResponse r = get(graphQlUri(TIPS_OP, vars, TIPS_HASH),
                ResponseShape.object(GameHelpTipsResponse.class), graphQlHeaders());
        return r.data() == null ? Optional.empty() : Optional.ofNullable(r.data().tipsRetrieve());
    }

    URI graphQlUri(String operationName, ObjectNode variables, String sha256Hash) {
        ObjectNode ext = decoder.mapper().createObjectNode();
        ObjectNode pq = ext.putObject("persistedQuery");
        pq.put("version", 1);
        pq.put("sha256Hash", sha256Hash);
        try {
            return QueryParams.create()
                    .add("operationName", operationName)
                    .add("variables", decoder.mapper().writeValueAsString(variables))
                    .add("extensions", decoder.mapper().writeValueAsString(ext))
                    .appendTo(graphQlUrl + "/op");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize GraphQL variables for " + operationName, e);
        }
    }

    private Consumer<HttpRequest.Builder> auth(String acceptLanguage) {
        return b -> {
            b.header("Authorization", credential.authorizationHeader());
            if (acceptLanguage != null && !acceptLanguage.isBlank()) b.header("Accept-Language", acceptLanguage);
        };
    }

    private Consumer<HttpRequest.Builder> graphQlHeaders() {
        return auth(null).andThen(b -> b
                .header("apollographql-client-name", "PlayStationApp-Android")
                .header("Content-Type", "application/json"));
    }

    private static String group(String groupId) {
        return groupId == null || groupId.isBlank() ? "all" : groupId;
    }
}
