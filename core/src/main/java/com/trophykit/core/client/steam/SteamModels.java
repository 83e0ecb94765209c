package com.trophykit.core.client.steam;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Steam Web API payloads. Envelope records mirror the wrapper objects Steam puts around results. */
public final class SteamModels {
    private SteamModels() {}

    public record Player(
            String steamid,
            String personaname,
            String profileurl,
            String avatar,
            String avatarmedium,
            String avatarfull,
            int personastate,
            int communityvisibilitystate,
            int profilestate,
            long lastlogoff,
            String realname,
            String primaryclanid,
            long timecreated,
            String gameid,
            String gameextrainfo,
            String loccountrycode) {

        /** 3 = public profile. */
        public boolean isPublic() { return communityvisibilitystate == 3; }
    }

    public record PlayerList(List<Player> players) {}

    public record PlayerSummariesResult(PlayerList response) {}

    public record Friend(String steamid, String relationship, @JsonProperty("friend_since") long friendSince) {}

    public record FriendList(List<Friend> friends) {}

    public record FriendListResult(FriendList friendslist) {}

    public record PlayerAchievement(String apiname, int achieved, long unlocktime, String name, String description) {
        public boolean isAchieved() { return achieved == 1; }
    }

    public record PlayerStats(
            @JsonProperty("steamID") String steamId,
            String gameName,
            boolean success,
            String error,
            List<PlayerAchievement> achievements) {}

    public record PlayerAchievementsResult(PlayerStats playerstats) {}

    public record Game(
            int appid,
            String name,
            @JsonProperty("playtime_forever") int playtimeForever,
            @JsonProperty("playtime_2weeks") int playtime2Weeks,
            @JsonProperty("img_icon_url") String imgIconUrl,
            @JsonProperty("has_community_visible_stats") boolean hasCommunityVisibleStats) {}

    public record OwnedGames(@JsonProperty("game_count") int gameCount, List<Game> games) {}

    public record OwnedGamesResult(OwnedGames response) {}

    public record RecentlyPlayedGames(@JsonProperty("total_count") int totalCount, List<Game> games) {}

    public record RecentlyPlayedGamesResult(RecentlyPlayedGames response) {}

    public record AchievementDefinition(
            String name,
            String displayName,
            String description,
            String icon,
            String icongray,
            int hidden,
            int defaultvalue) {}

    public record AvailableGameStats(List<AchievementDefinition> achievements) {}

    public record GameSchema(String gameName, String gameVersion, AvailableGameStats availableGameStats) {
        public List<AchievementDefinition> achievements() {
            return availableGameStats == null || availableGameStats.achievements() == null
                    ? List.of() : availableGameStats.achievements();
        }
    }

    public record GameSchemaResult(GameSchema game) {}

    /** {@code percent} arrives as a number or a quoted number depending on the endpoint version. */
    public record GlobalAchievement(String name, Float percent) {}

    public record AchievementPercentages(List<GlobalAchievement> achievements) {}

    public record GlobalAchievementPercentagesResult(AchievementPercentages achievementpercentages) {}

    /** success: 1 = resolved, 42 = no match. */
    public record VanityUrlResult(int success, String steamid, String message) {
        public boolean isResolved() { return success == 1 && steamid != null; }
    }

    public record VanityUrlResponse(VanityUrlResult response) {}
}
