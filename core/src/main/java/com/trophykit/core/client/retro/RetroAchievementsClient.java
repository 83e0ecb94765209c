package com.trophykit.core.client.retro;

import com.trophykit.core.client.VendorClient;
import com.trophykit.core.client.retro.RetroAchievementsModels.*;
import com.trophykit.core.config.ClientConfig;
import com.trophykit.core.http.QueryParams;
import com.trophykit.core.http.RawResponse;
import com.trophykit.core.http.RetryingTransport;
import com.trophykit.core.json.ResponseDecoder;
import com.trophykit.core.json.ResponseShape;

import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * RetroAchievements Web API ({@code /API/*.php}, authenticated by {@code y=<web api key>})
 * and Connect API ({@code /dorequest.php}).
 *
 * <p>Connect calls must carry an identifying User-Agent. Login is a retried GET; session,
 * ping and award calls are POSTs sent exactly once, since an award must not be replayed.
 */
public class RetroAchievementsClient extends VendorClient {
    public static final String DEFAULT_WEB_API_URL = "https://retroachievements.org/API";
    public static final String DEFAULT_CONNECT_URL = "https://retroachievements.org/dorequest.php";

    /** Recent-achievements window the server assumes when {@code m} is omitted. */
    static final int DEFAULT_RECENT_MINUTES = 60;

    private static final String FORM = "application/x-www-form-urlencoded";

    private final String webApiKey;
    private final String webApiUrl;
    private final String connectUrl;
    private final String connectUserAgent;

    public RetroAchievementsClient(String webApiKey, ClientConfig cfg) {
        super(cfg);
        this.webApiKey = requireKey(webApiKey);
        this.webApiUrl = DEFAULT_WEB_API_URL;
        this.connectUrl = DEFAULT_CONNECT_URL;
        this.connectUserAgent = cfg.getRetroConnectUserAgent();
    }

    public RetroAchievementsClient(String webApiKey, String webApiUrl, String connectUrl, String connectUserAgent,
                                   RetryingTransport transport, ResponseDecoder decoder,
                                   String userAgent, Duration timeout) {
        super(transport, decoder, userAgent, timeout);
        this.webApiKey = requireKey(webApiKey);
        this.webApiUrl = trimSlash(webApiUrl);
        this.connectUrl = Objects.requireNonNull(connectUrl, "connectUrl");
        this.connectUserAgent = connectUserAgent;
    }

    // ---- Web API ----

    public UserProfile getUserProfile(String user) throws InterruptedException {
        return web("API_GetUserProfile.php", keyed().add("u", user), ResponseShape.object(UserProfile.class));
    }

    /**
     * Profile plus recent activity. The document is read twice, once into the profile record
     * and once into the summary-only fields.
     */
    public UserSummary getUserSummary(String user, int recentGames, int recentAchievements)
            throws InterruptedException {
        RawResponse resp = fetch(keyed()
                .add("u", user)
                .add("g", recentGames)
                .add("a", recentAchievements)
                .appendTo(webApiUrl + "/API_GetUserSummary.php"), null);
        return new UserSummary(
                decoder.decode(resp, ResponseShape.object(UserProfile.class)),
                decoder.decode(resp, ResponseShape.object(UserSummaryDetails.class)));
    }

    public GameInfo getGame(int gameId) throws InterruptedException {
        return web("API_GetGame.php", keyed().add("i", gameId), ResponseShape.object(GameInfo.class));
    }

    /** @param unofficial true for the unofficial achievement set (flag 5), else core (flag 3) */
    public GameInfoExtended getGameExtended(int gameId, boolean unofficial) throws InterruptedException {
        RawResponse resp = fetch(keyed()
                .add("i", gameId)
                .add("f", setFlag(unofficial))
                .appendTo(webApiUrl + "/API_GetGameExtended.php"), null);
        return new GameInfoExtended(
                decoder.decode(resp, ResponseShape.object(GameInfo.class)),
                decoder.decode(resp, ResponseShape.object(GameExtendedDetails.class)));
    }

    public GameInfoExtended getGameExtended(int gameId) throws InterruptedException {
        return getGameExtended(gameId, false);
    }

    public List<ConsoleInfo> getConsoleIds(boolean onlyActive, boolean onlyGameSystems) throws InterruptedException {
        return web("API_GetConsoleIDs.php", keyed()
                .addIf(onlyActive, "a", 1)
                .addIf(onlyGameSystems, "g", 1), ResponseShape.listOf(ConsoleInfo.class));
    }

    /** @param offset 0 for none; @param count 0 for all */
    public List<GameInfoBasic> getGameList(int consoleId, boolean onlyWithAchievements, boolean includeHashes,
                                           int offset, int count) throws InterruptedException {
        return web("API_GetGameList.php", keyed()
                .add("i", consoleId)
                .addIf(onlyWithAchievements, "f", 1)
                .addIf(includeHashes, "h", 1)
                .addIf(offset > 0, "o", offset)
                .addIf(count > 0, "c", count), ResponseShape.listOf(GameInfoBasic.class));
    }

    /** Number of achievements unlocked (key) to number of players with that many unlocks. */
    public Map<String, Integer> getAchievementDistribution(int gameId, boolean hardcoreOnly, boolean unofficial)
            throws InterruptedException {
        return web("API_GetAchievementDistribution.php", keyed()
                .add("i", gameId)
                .addIf(hardcoreOnly, "h", 1)
                .add("f", setFlag(unofficial)), ResponseShape.mapOf(Integer.class));
    }

    /** Keyed by game id. */
    public Map<String, UserGameProgress> getUserProgressForGames(String user, Collection<Integer> gameIds)
            throws InterruptedException {
        Objects.requireNonNull(gameIds, "gameIds");
        if (gameIds.isEmpty()) return Map.of();
        String csv = gameIds.stream().map(String::valueOf).collect(Collectors.joining(","));
        return web("API_GetUserProgress.php", keyed().add("u", user).add("i", csv),
                ResponseShape.mapOf(UserGameProgress.class));
    }

    /** @param minutes look-back window; the server default of 60 is not sent */
    public List<UserRecentAchievement> getUserRecentAchievements(String user, int minutes)
            throws InterruptedException {
        return web("API_GetUserRecentAchievements.php", keyed()
                .add("u", user)
                .addIf(minutes > 0 && minutes != DEFAULT_RECENT_MINUTES, "m", minutes),
                ResponseShape.listOf(UserRecentAchievement.class));
    }

    // ---- Connect API ----

    /** Exchanges an integration account's password for a Connect token. */
    public ConnectLoginResponse login(String user, String password) throws InterruptedException {
        String ua = requireConnectUserAgent();
        URI uri = QueryParams.create()
                .add("r", "login2")
                .add("u", user)
                .add("p", password)
                .appendTo(connectUrl);
        return get(uri, ResponseShape.object(ConnectLoginResponse.class), b -> b.setHeader("User-Agent", ua));
    }

    public StartSessionResponse startSession(String user, String token, int gameId, String player)
            throws InterruptedException {
        QueryParams q = connect("startsession", user, token).add("g", gameId).add("k", player);
        return post(q, QueryParams.create(), StartSessionResponse.class);
    }

    /** @param richPresence nullable; sent in the body as {@code m} */
    public PingResponse ping(String user, String token, int gameId, String player, String richPresence)
            throws InterruptedException {
        QueryParams q = connect("ping", user, token).add("g", gameId).add("k", player);
        return post(q, QueryParams.create().add("m", richPresence), PingResponse.class);
    }

    public AwardAchievementResponse awardAchievement(String user, String token, String player,
                                                     int achievementId, boolean hardcore)
            throws InterruptedException {
        String h = hardcore ? "1" : "0";
        QueryParams q = connect("awardachievement", user, token)
                .add("k", player)
                .add("a", achievementId)
                .add("v", md5Hex(achievementId + player + h + achievementId))
                .add("h", h);
        return post(q, QueryParams.create(), AwardAchievementResponse.class);
    }

    /** Ids, hardcore flag and verification hash travel in the form body. */
    public AwardAchievementsResponse awardAchievements(String user, String token, String player,
                                                       Collection<Integer> achievementIds, boolean hardcore)
            throws InterruptedException {
        Objects.requireNonNull(achievementIds, "achievementIds");
        if (achievementIds.isEmpty()) throw new IllegalArgumentException("achievementIds must not be empty");
        String h = hardcore ? "1" : "0";
        String csv = achievementIds.stream().map(String::valueOf).collect(Collectors.joining(","));
        QueryParams body = QueryParams.create()
                .add("a", csv)
                .add("h", h)
                .add("v", md5Hex(csv + player + h));
        return post(connect("awardachievements", user, token).add("k", player), body,
                AwardAchievementsResponse.class);
    }

    /** Lowercase hex MD5 of the UTF-8 bytes, as the Connect API expects for {@code v}. */
    static String md5Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private <T> T web(String endpoint, QueryParams q, ResponseShape<T> shape) throws InterruptedException {
        return get(q.appendTo(webApiUrl + "/" + endpoint), shape);
    }

    private <T> T post(QueryParams query, QueryParams form, Class<T> type) throws InterruptedException {
        String ua = requireConnectUserAgent();
        HttpRequest req = newRequest(query.appendTo(connectUrl))
                .setHeader("User-Agent", ua)
                .header("Content-Type", FORM)
                .POST(HttpRequest.BodyPublishers.ofString(form.encode(), StandardCharsets.UTF_8))
                .build();
        return sendOnce(req, ResponseShape.object(type));
    }

    private QueryParams keyed() {
        return QueryParams.create().add("y", webApiKey);
    }

    private static QueryParams connect(String request, String user, String token) {
        return QueryParams.create().add("r", request).add("u", user).add("t", token);
    }

    private static int setFlag(boolean unofficial) {
        return unofficial ? 5 : 3;
    }

    private String requireConnectUserAgent() {
        if (connectUserAgent == null || connectUserAgent.isBlank()) {
            throw new IllegalStateException("A RetroAchievements Connect User-Agent must be configured");
        }
        return connectUserAgent;
    }

    private static String requireKey(String key) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("RetroAchievements web API key is required");
        return key;
    }
}
