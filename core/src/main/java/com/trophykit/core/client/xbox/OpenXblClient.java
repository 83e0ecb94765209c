package com.trophykit.core.client.xbox;

import com.trophykit.core.client.VendorClient;
import com.trophykit.core.client.xbox.XboxModels.*;
import com.trophykit.core.config.ClientConfig;
import com.trophykit.core.http.RetryingTransport;
import com.trophykit.core.json.ResponseDecoder;
import com.trophykit.core.json.ResponseShape;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/** OpenXBL (xbl.io), a third-party relay for Xbox Live authenticated by an API key. */
public class OpenXblClient extends VendorClient {
    public static final String DEFAULT_BASE_URL = "https://xbl.io";

    private final String apiKey;
    private final String baseUrl;

    public OpenXblClient(String apiKey, ClientConfig cfg) {
        super(cfg);
        this.apiKey = requireKey(apiKey);
        this.baseUrl = DEFAULT_BASE_URL;
    }

    public OpenXblClient(String apiKey, String baseUrl, RetryingTransport transport, ResponseDecoder decoder,
                         String userAgent, Duration timeout) {
        super(transport, decoder, userAgent, timeout);
        this.apiKey = requireKey(apiKey);
        this.baseUrl = trimSlash(baseUrl);
    }

    /** Profile of the API key's owner. */
    public ProfileResponse getAccount() throws InterruptedException {
        return call("/api/v2/account", ProfileResponse.class);
    }

    public ProfileResponse getAccount(String xuid) throws InterruptedException {
        return call("/api/v2/account/" + seg(xuid), ProfileResponse.class);
    }

    /** Titles with achievement progress of the API key's owner. */
    public AchievementTitlesResponse getAchievements() throws InterruptedException {
        return call("/api/v2/achievements", AchievementTitlesResponse.class);
    }

    public AchievementTitlesResponse getPlayerAchievements(String xuid) throws InterruptedException {
        return call("/api/v2/achievements/player/" + seg(xuid), AchievementTitlesResponse.class);
    }

    /** One player's achievements for a single title. */
    public AchievementsResponse getTitleAchievements(String xuid, String titleId) throws InterruptedException {
        return call("/api/v2/achievements/player/" + seg(xuid) + "/title/" + seg(titleId), AchievementsResponse.class);
    }

    public List<SearchResult> searchPlayer(String gamertag) throws InterruptedException {
        SearchResponse r = call("/api/v2/search/" + seg(gamertag), SearchResponse.class);
        return r.results() == null ? List.of() : r.results();
    }

    private <T> T call(String path, Class<T> type) throws InterruptedException {
        return get(URI.create(baseUrl + path), ResponseShape.object(type), key());
    }

    private Consumer<HttpRequest.Builder> key() {
        return b -> b.header("x-authorization", apiKey).header("Accept-Language", "en-US");
    }

    private static String requireKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) throw new IllegalArgumentException("OpenXBL apiKey is required");
        return apiKey;
    }
}
