package com.trophykit.core.client.xbox;

import com.trophykit.core.auth.xbox.XboxSession;
import com.trophykit.core.auth.xbox.XboxSessionManager;
import com.trophykit.core.client.VendorClient;
import com.trophykit.core.client.xbox.XboxModels.*;
import com.trophykit.core.config.ClientConfig;
import com.trophykit.core.error.ApiException;
import com.trophykit.core.http.QueryParams;
import com.trophykit.core.http.RetryingTransport;
import com.trophykit.core.json.ResponseDecoder;
import com.trophykit.core.json.ResponseShape;
import com.trophykit.core.util.StructuredLogger;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Xbox Live services called with an XSTS session. Every call first asks the
 * {@link XboxSessionManager} for a valid session, so an expired session fails (or is renewed)
 * before anything is sent.
 */
public class XboxLiveClient extends VendorClient {
    private static final StructuredLogger log = StructuredLogger.get(XboxLiveClient.class);

    static final String PROFILE_SETTINGS = "Gamertag,Gamerscore,GameDisplayPicRaw,AccountTier,XboxOneRep,"
            + "PreferredColor,RealName,Bio,Location,ModernGamertag,ModernGamertagSuffix,UniqueModernGamertag,"
            + "RealNameOverride,TenureLevel,Watermarks";

    /** Service hosts; only tests replace them. */
    public record Hosts(String profile, String titleHub, String achievements, String userStats) {
        public static Hosts defaults() {
            return new Hosts("https://profile.xboxlive.com", "https://titlehub.xboxlive.com",
                    "https://achievements.xboxlive.com", "https://userstats.xboxlive.com");
        }

        public static Hosts allAt(String baseUrl) {
            return new Hosts(baseUrl, baseUrl, baseUrl, baseUrl);
        }
    }

    private final XboxSessionManager sessions;
    private final Hosts hosts;

    public XboxLiveClient(XboxSessionManager sessions, ClientConfig cfg) {
        super(cfg);
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.hosts = Hosts.defaults();
    }

    public XboxLiveClient(XboxSessionManager sessions, Hosts hosts, RetryingTransport transport,
                          ResponseDecoder decoder, String userAgent, Duration timeout) {
        super(transport, decoder, userAgent, timeout);
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.hosts = Objects.requireNonNull(hosts, "hosts");
    }

    /** Profile settings of the signed-in user. */
    public ProfileResponse getProfile() throws InterruptedException {
        XboxSession s = sessions.currentSession();
        URI uri = QueryParams.create().add("settings", PROFILE_SETTINGS)
                .appendTo(trimSlash(hosts.profile()) + "/users/xuid(" + s.xuid() + ")/profile/settings");
        return get(uri, ResponseShape.object(ProfileResponse.class), xbl(s, "2"));
    }

    /** Played titles with achievement and stats decorations. */
    public TitleHistoryResponse getTitleHistory() throws InterruptedException {
        XboxSession s = sessions.currentSession();
        URI uri = URI.create(trimSlash(hosts.titleHub()) + "/users/xuid(" + s.xuid()
                + ")/titles/titlehistory/decoration/achievement,stats");
        return get(uri, ResponseShape.object(TitleHistoryResponse.class), xbl(s, "2"));
    }

    /**
     * Achievements of one title, locked ones included. Xbox 360 titles are served by contract
     * version 1 and need {@code unlockedOnly=false}; modern titles use contract version 2.
     */
    public AchievementsResponse getAchievements(String titleId, int maxItems) throws InterruptedException {
        Objects.requireNonNull(titleId, "titleId");
        XboxSession s = sessions.currentSession();
        boolean x360 = isXbox360Title(titleId);
        QueryParams q = QueryParams.create().add("titleId", titleId).add("maxItems", maxItems);
        if (x360) {
            q.add("unlockedOnly", "false");
        } else {
            q.add("unearned", "true").add("orderBy", "unlockTime");
        }
        URI uri = q.appendTo(trimSlash(hosts.achievements()) + "/users/xuid(" + s.xuid() + ")/achievements");
        AchievementsResponse r = get(uri, ResponseShape.optional(AchievementsResponse.class), xbl(s, x360 ? "1" : "2"))
                .orElseGet(AchievementsResponse::empty);
        if (log.isDebugEnabled()) {
            log.debug("xbox.achievements", "titleId", titleId, "x360", x360,
                    "count", r.achievements() == null ? 0 : r.achievements().size());
        }
        return r;
    }

    /**
     * Stats for a service config id. Many titles publish none; any HTTP error status yields an
     * empty result instead of an exception.
     */
    public UserStatsResponse getUserStats(String scid) throws InterruptedException {
        XboxSession s = sessions.currentSession();
        URI uri = URI.create(trimSlash(hosts.userStats()) + "/users/xuid(" + s.xuid() + ")/scids/" + seg(scid) + "/stats");
        try {
            return get(uri, ResponseShape.optional(UserStatsResponse.class), xbl(s, "2"))
                    .orElseGet(UserStatsResponse::empty);
        } catch (ApiException e) {
            if (e.getStatusCode() < 0 || e.getKind() == ApiException.Kind.DECODE) throw e;
            log.debug("xbox.stats.unavailable", "scid", scid, "status", e.getStatusCode());
            return UserStatsResponse.empty();
        }
    }

    /** 8 hex digits, or a numeric id below 1000000000. */
    static boolean isXbox360Title(String titleId) {
        if (titleId == null || titleId.isEmpty()) return false;
        if (titleId.length() == 8 && titleId.chars().allMatch(c -> Character.digit(c, 16) >= 0)) return true;
        try {
            return Long.parseLong(titleId) < 1_000_000_000L;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static Consumer<HttpRequest.Builder> xbl(XboxSession s, String contractVersion) {
        return b -> b
                .header("Authorization", s.authorizationHeader())
                .header("x-xbl-contract-version", contractVersion)
                .header("Accept-Language", "en-US");
    }
}
