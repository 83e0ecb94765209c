package com.trophykit.core.client.retro;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * RetroAchievements payloads. Both APIs use PascalCase keys and "yyyy-MM-dd HH:mm:ss" dates,
 * which the vendor date converter reads into {@link LocalDateTime}.
 */
public final class RetroAchievementsModels {
    private RetroAchievementsModels() {}

    // ---- Web API ----

    public record UserProfile(
            @JsonProperty("User") String user,
            @JsonProperty("ULID") String ulid,
            @JsonProperty("UserPic") String userPic,
            @JsonProperty("MemberSince") LocalDateTime memberSince,
            @JsonProperty("RichPresenceMsg") String richPresenceMsg,
            @JsonProperty("LastGameID") Integer lastGameId,
            @JsonProperty("ContribCount") int contribCount,
            @JsonProperty("ContribYield") int contribYield,
            @JsonProperty("TotalPoints") int totalPoints,
            @JsonProperty("TotalSoftcorePoints") int totalSoftcorePoints,
            @JsonProperty("TotalTruePoints") int totalTruePoints,
            @JsonProperty("Permissions") int permissions,
            @JsonProperty("Untracked") boolean untracked,
            @JsonProperty("ID") long id,
            @JsonProperty("UserWallActive") boolean userWallActive,
            @JsonProperty("Motto") String motto) {}

    public record UserGameProgress(
            @JsonProperty("NumPossibleAchievements") int numPossibleAchievements,
            @JsonProperty("PossibleScore") int possibleScore,
            @JsonProperty("NumAchieved") int numAchieved,
            @JsonProperty("ScoreAchieved") int scoreAchieved,
            @JsonProperty("NumAchievedHardcore") int numAchievedHardcore,
            @JsonProperty("ScoreAchievedHardcore") int scoreAchievedHardcore) {

        public boolean isMastered() {
            return numPossibleAchievements > 0 && numAchievedHardcore == numPossibleAchievements;
        }
    }

    public record RecentlyPlayedGame(
            @JsonProperty("GameID") int gameId,
            @JsonProperty("ConsoleID") int consoleId,
            @JsonProperty("ConsoleName") String consoleName,
            @JsonProperty("Title") String title,
            @JsonProperty("ImageIcon") String imageIcon,
            @JsonProperty("LastPlayed") LocalDateTime lastPlayed,
            @JsonProperty("AchievementsTotal") Integer achievementsTotal) {}

    public record SummaryAchievement(
            @JsonProperty("ID") int id,
            @JsonProperty("GameID") int gameId,
            @JsonProperty("GameTitle") String gameTitle,
            @JsonProperty("Title") String title,
            @JsonProperty("Description") String description,
            @JsonProperty("Points") int points,
            @JsonProperty("Type") String type,
            @JsonProperty("BadgeName") String badgeName,
            @JsonProperty("IsAwarded") String isAwarded,
            @JsonProperty("DateAwarded") LocalDateTime dateAwarded,
            @JsonProperty("HardcoreAchieved") Integer hardcoreAchieved) {}

    /** Summary-only fields; the profile part of the same document is read into {@link UserProfile}. */
    public record UserSummaryDetails(
            @JsonProperty("LastActivity") Map<String, Object> lastActivity,
            @JsonProperty("Rank") Integer rank,
            @JsonProperty("TotalRanked") Integer totalRanked,
            @JsonProperty("Status") String status,
            @JsonProperty("RecentlyPlayedCount") int recentlyPlayedCount,
            @JsonProperty("RecentlyPlayed") List<RecentlyPlayedGame> recentlyPlayed,
            @JsonProperty("Awarded") Map<String, UserGameProgress> awarded,
            @JsonProperty("RecentAchievements") Map<String, Map<String, SummaryAchievement>> recentAchievements,
            @JsonProperty("LastGame") GameInfo lastGame) {}

    public record UserSummary(UserProfile profile, UserSummaryDetails details) {}

    public record ConsoleInfo(
            @JsonProperty("ID") int id,
            @JsonProperty("Name") String name,
            @JsonProperty("IconURL") String iconUrl,
            @JsonProperty("Active") boolean active,
            @JsonProperty("IsGameSystem") boolean gameSystem) {}

    public record GameInfoBasic(
            @JsonProperty("Title") String title,
            @JsonProperty("ID") int id,
            @JsonProperty("ConsoleID") int consoleId,
            @JsonProperty("ConsoleName") String consoleName,
            @JsonProperty("ImageIcon") String imageIcon,
            @JsonProperty("NumAchievements") int numAchievements,
            @JsonProperty("NumLeaderboards") int numLeaderboards,
            @JsonProperty("Points") int points,
            @JsonProperty("DateModified") LocalDateTime dateModified,
            @JsonProperty("ForumTopicID") Integer forumTopicId,
            @JsonProperty("Hashes") List<String> hashes) {}

    public record GameInfo(
            @JsonProperty("ID") Integer id,
            @JsonProperty("Title") String title,
            @JsonProperty("ConsoleID") int consoleId,
            @JsonProperty("ConsoleName") String consoleName,
            @JsonProperty("ForumTopicID") Integer forumTopicId,
            @JsonProperty("Flags") Integer flags,
            @JsonProperty("ImageIcon") String imageIcon,
            @JsonProperty("GameIcon") String gameIcon,
            @JsonProperty("ImageTitle") String imageTitle,
            @JsonProperty("ImageIngame") String imageIngame,
            @JsonProperty("ImageBoxArt") String imageBoxArt,
            @JsonProperty("Publisher") String publisher,
            @JsonProperty("Developer") String developer,
            @JsonProperty("Genre") String genre,
            @JsonProperty("Released") String released) {}

    public record AchievementCoreInfo(
            @JsonProperty("ID") int id,
            @JsonProperty("Title") String title,
            @JsonProperty("Description") String description,
            @JsonProperty("Points") int points,
            @JsonProperty("TrueRatio") int trueRatio,
            @JsonProperty("Type") String type,
            @JsonProperty("Author") String author,
            @JsonProperty("DateCreated") LocalDateTime dateCreated,
            @JsonProperty("DateModified") LocalDateTime dateModified,
            @JsonProperty("BadgeName") String badgeName,
            @JsonProperty("DisplayOrder") int displayOrder,
            @JsonProperty("MemAddr") String memAddr,
            @JsonProperty("NumAwarded") Integer numAwarded,
            @JsonProperty("NumAwardedHardcore") Integer numAwardedHardcore) {}

    /** Extended-only fields; the base game part of the same document is read into {@link GameInfo}. */
    public record GameExtendedDetails(
            @JsonProperty("IsFinal") boolean isFinal,
            @JsonProperty("RichPresencePatch") String richPresencePatch,
            @JsonProperty("GuideURL") String guideUrl,
            @JsonProperty("Updated") LocalDateTime updated,
            @JsonProperty("ParentGameID") Integer parentGameId,
            @JsonProperty("NumDistinctPlayers") int numDistinctPlayers,
            @JsonProperty("NumDistinctPlayersCasual") int numDistinctPlayersCasual,
            @JsonProperty("NumDistinctPlayersHardcore") int numDistinctPlayersHardcore,
            @JsonProperty("NumAchievements") int numAchievements,
            @JsonProperty("Achievements") Map<String, AchievementCoreInfo> achievements) {

        public Map<String, AchievementCoreInfo> achievementsOrEmpty() {
            return achievements == null ? Map.of() : achievements;
        }
    }

    public record GameInfoExtended(GameInfo game, GameExtendedDetails details) {}

    public record UserRecentAchievement(
            @JsonProperty("Date") LocalDateTime date,
            @JsonProperty("HardcoreMode") boolean hardcoreMode,
            @JsonProperty("AchievementID") int achievementId,
            @JsonProperty("Title") String title,
            @JsonProperty("Description") String description,
            @JsonProperty("BadgeName") String badgeName,
            @JsonProperty("Points") int points,
            @JsonProperty("TrueRatio") int trueRatio,
            @JsonProperty("Type") String type,
            @JsonProperty("Author") String author,
            @JsonProperty("GameTitle") String gameTitle,
            @JsonProperty("GameIcon") String gameIcon,
            @JsonProperty("GameID") int gameId,
            @JsonProperty("ConsoleName") String consoleName,
            @JsonProperty("BadgeURL") String badgeUrl,
            @JsonProperty("GameURL") String gameUrl) {}

    // ---- Connect API ----

    public record ConnectLoginResponse(
            @JsonProperty("Success") boolean success,
            @JsonProperty("Error") String error,
            @JsonProperty("User") String user,
            @JsonProperty("Token") String token,
            @JsonProperty("Score") int score,
            @JsonProperty("SoftcoreScore") int softcoreScore,
            @JsonProperty("Messages") int messages,
            @JsonProperty("Permissions") int permissions,
            @JsonProperty("AccountType") String accountType) {}

    public record HardcoreUnlock(@JsonProperty("ID") int id, @JsonProperty("When") long when) {}

    public record StartSessionResponse(
            @JsonProperty("Success") boolean success,
            @JsonProperty("Error") String error,
            @JsonProperty("HardcoreUnlocks") List<HardcoreUnlock> hardcoreUnlocks,
            @JsonProperty("ServerNow") long serverNow) {}

    public record PingResponse(@JsonProperty("Success") boolean success, @JsonProperty("Error") String error) {}

    public record AwardAchievementResponse(
            @JsonProperty("Success") boolean success,
            @JsonProperty("Error") String error,
            @JsonProperty("AchievementsRemaining") Integer achievementsRemaining,
            @JsonProperty("Score") int score,
            @JsonProperty("SoftcoreScore") int softcoreScore,
            @JsonProperty("AchievementID") int achievementId) {}

    public record AwardAchievementsResponse(
            @JsonProperty("Success") boolean success,
            @JsonProperty("Error") String error,
            @JsonProperty("Score") int score,
            @JsonProperty("SoftcoreScore") int softcoreScore,
            @JsonProperty("ExistingIDs") List<Integer> existingIds,
            @JsonProperty("SuccessfulIDs") List<Integer> successfulIds) {}
}
