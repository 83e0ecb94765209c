package com.trophykit.core.client.xbox;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/** Payloads of the *.xboxlive.com services and of OpenXBL, which relays the same shapes. */
public final class XboxModels {
    private XboxModels() {}

    // --- profile ---

    public record ProfileSetting(String id, String value) {}

    public record ProfileUser(String id, String hostId, List<ProfileSetting> settings, boolean isSponsoredUser) {
        /** Value of a setting such as "Gamertag" or "Gamerscore". */
        public Optional<String> setting(String name) {
            if (settings == null) return Optional.empty();
            return settings.stream().filter(s -> name.equals(s.id())).map(ProfileSetting::value).findFirst();
        }
    }

    public record ProfileResponse(List<ProfileUser> profileUsers) {
        public Optional<ProfileUser> first() {
            return profileUsers == null ? Optional.empty() : profileUsers.stream().findFirst();
        }
    }

    // --- title history ---

    public record TitleAchievementSummary(
            int currentAchievements,
            int totalAchievements,
            int currentGamerscore,
            int totalGamerscore,
            double progressPercentage) {}

    public record TitleHistoryInfo(OffsetDateTime lastTimePlayed, boolean visible) {}

    public record TitleStats(String sourceVersion) {}

    public record Title(
            String titleId,
            String pfn,
            String name,
            String type,
            List<String> devices,
            String displayImage,
            String modernTitleId,
            TitleAchievementSummary achievement,
            TitleHistoryInfo titleHistory,
            TitleStats stats) {}

    public record TitleHistoryResponse(String xuid, List<Title> titles) {}

    // --- achievements ---

    public record MediaAsset(String url, int width, int height) {}

    public record Reward(String name, String description, String value, String type) {}

    public record Rarity(String currentCategory, double currentPercentage) {}

    public record Requirement(String id, String current, String target) {}

    public record Progression(List<Requirement> requirements, OffsetDateTime timeUnlocked) {}

    /**
     * Modern (contract 2) achievement. For Xbox 360 titles (contract 1) only the flat fields
     * {@code gamerscore}, {@code unlocked} and {@code timeUnlocked} are filled.
     */
    public record Achievement(
            String id,
            String serviceConfigId,
            String name,
            String description,
            String lockedDescription,
            String unlockedDescription,
            MediaAsset imageUnlocked,
            MediaAsset imageLocked,
            boolean isSecret,
            List<Reward> rewards,
            Rarity rarity,
            String progressState,
            Progression progression,
            Integer gamerscore,
            Boolean unlocked,
            OffsetDateTime timeUnlocked) {

        public boolean isAchieved() {
            if (Boolean.TRUE.equals(unlocked)) return true;
            return "Achieved".equalsIgnoreCase(progressState);
        }
    }

    public record PagingInfo(String continuationToken, int totalRecords) {}

    public record AchievementsResponse(List<Achievement> achievements, PagingInfo pagingInfo) {
        public static AchievementsResponse empty() { return new AchievementsResponse(List.of(), null); }
    }

    // --- user stats ---

    public record Stat(String name, String type, String value) {}

    public record StatCollection(List<Stat> stats) {}

    public record StatGroup(String name, String titleId, List<StatCollection> statlistscollection) {}

    public record UserStatsResponse(List<StatGroup> groups) {
        public static UserStatsResponse empty() { return new UserStatsResponse(List.of()); }
    }

    // --- OpenXBL only ---

    public record SearchResult(String xuid, String gamertag, String displayPicRaw) {}

    public record SearchResponse(List<SearchResult> results) {}

    public record AchievementTitlesResponse(String xuid, List<Title> titles) {}
}
