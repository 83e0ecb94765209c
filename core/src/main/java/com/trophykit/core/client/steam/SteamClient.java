package com.trophykit.core.client.steam;

import com.trophykit.core.client.VendorClient;
import com.trophykit.core.client.steam.SteamModels.*;
import com.trophykit.core.config.ClientConfig;
import com.trophykit.core.http.QueryParams;
import com.trophykit.core.http.RetryingTransport;
import com.trophykit.core.json.ResponseDecoder;
import com.trophykit.core.json.ResponseShape;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Steam Web API (api.steampowered.com). The API key is optional; endpoints that need it
 * answer 401/403 without one, which surfaces as a terminal {@code ApiException}.
 */
public class SteamClient extends VendorClient {
    public static final String DEFAULT_BASE_URL = "https://api.steampowered.com";

    private final String baseUrl;
    private final String apiKey;

    public SteamClient(String apiKey) {
        this(apiKey, ClientConfig.defaults());
    }

    public SteamClient(String apiKey, ClientConfig cfg) {
        super(cfg);
        this.baseUrl = DEFAULT_BASE_URL;
        this.apiKey = apiKey;
    }

    public SteamClient(String apiKey, String baseUrl, RetryingTransport transport, ResponseDecoder decoder,
                       String userAgent, Duration timeout) {
        super(transport, decoder, userAgent, timeout);
        this.baseUrl = trimSlash(baseUrl);
        this.apiKey = apiKey;
    }

    /** Up to 100 comma-separated 64-bit ids per call. */
    public List<Player> getPlayerSummaries(Collection<String> steamIds) throws InterruptedException {
        Objects.requireNonNull(steamIds, "steamIds");
        if (steamIds.isEmpty()) return List.of();
        PlayerSummariesResult r = call("ISteamUser/GetPlayerSummaries/v0002/", keyed()
                .add("steamids", String.join(",", steamIds)), PlayerSummariesResult.class);
        return r.response() == null || r.response().players() == null ? List.of() : r.response().players();
    }

    public Optional<Player> getPlayerSummary(String steamId) throws InterruptedException {
        return getPlayerSummaries(List.of(steamId)).stream().findFirst();
    }

    /** @param appIdsFilter nullable; limits the result to these app ids */
    public OwnedGames getOwnedGames(String steamId, boolean includeAppInfo, boolean includePlayedFreeGames,
                                    int[] appIdsFilter) throws InterruptedException {
        QueryParams q = keyed()
                .add("steamid", steamId)
                .add("include_appinfo", includeAppInfo)
                .add("include_played_free_games", includePlayedFreeGames);
        if (appIdsFilter != null) {
            for (int i = 0; i < appIdsFilter.length; i++) {
                q.add("appids_filter[" + i + "]", appIdsFilter[i]);
            }
        }
        OwnedGamesResult r = call("IPlayerService/GetOwnedGames/v0001/", q, OwnedGamesResult.class);
        return r.response() == null ? new OwnedGames(0, List.of()) : r.response();
    }

    /** @param language nullable, e.g. "english" */
    public PlayerStats getPlayerAchievements(String steamId, int appId, String language) throws InterruptedException {
        PlayerAchievementsResult r = call("ISteamUserStats/GetPlayerAchievements/v0001/", keyed()
                .add("steamid", steamId)
                .add("appid", appId)
                .addIf(language != null && !language.isBlank(), "l", language), PlayerAchievementsResult.class);
        return r.playerstats();
    }

    public GameSchema getSchemaForGame(int appId) throws InterruptedException {
        GameSchemaResult r = call("ISteamUserStats/GetSchemaForGame/v2/", keyed().add("appid", appId),
                GameSchemaResult.class);
        return r.game();
    }

    /** Needs no key. */
    public List<GlobalAchievement> getGlobalAchievementPercentages(int gameId) throws InterruptedException {
        GlobalAchievementPercentagesResult r = call("ISteamUserStats/GetGlobalAchievementPercentagesForApp/v0002/",
                QueryParams.create().add("gameid", gameId), GlobalAchievementPercentagesResult.class);
        return r.achievementpercentages() == null || r.achievementpercentages().achievements() == null
                ? List.of() : r.achievementpercentages().achievements();
    }

    /** @param count 0 for all */
    public RecentlyPlayedGames getRecentlyPlayedGames(String steamId, int count) throws InterruptedException {
        RecentlyPlayedGamesResult r = call("IPlayerService/GetRecentlyPlayedGames/v0001/", keyed()
                .add("steamid", steamId)
                .addIf(count > 0, "count", count), RecentlyPlayedGamesResult.class);
        return r.response() == null ? new RecentlyPlayedGames(0, List.of()) : r.response();
    }

    public VanityUrlResult resolveVanityUrl(String vanityUrl) throws InterruptedException {
        VanityUrlResponse r = call("ISteamUser/ResolveVanityURL/v1/", keyed().add("vanityurl", vanityUrl),
                VanityUrlResponse.class);
        return r.response() == null ? new VanityUrlResult(42, null, "No match") : r.response();
    }

    /** @param relationship "friend" or "all" */
    public List<Friend> getFriendList(String steamId, String relationship) throws InterruptedException {
        FriendListResult r = call("ISteamUser/GetFriendList/v0001/", keyed()
                .add("steamid", steamId)
                .add("relationship", relationship == null ? "friend" : relationship), FriendListResult.class);
        return r.friendslist() == null || r.friendslist().friends() == null ? List.of() : r.friendslist().friends();
    }

    private QueryParams keyed() {
        return QueryParams.create().addIf(apiKey != null && !apiKey.isBlank(), "key", apiKey);
    }

    private <T> T call(String path, QueryParams q, Class<T> type) throws InterruptedException {
        q.add("format", "json");
        return get(q.appendTo(baseUrl + "/" + path), ResponseShape.object(type));
    }
}
