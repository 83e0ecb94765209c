package com.trophykit.core.client.psn;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

/** PlayStation trophy API payloads (m.np.playstation.com/api/trophy/v1 and the GraphQL game help ops). */
public final class PsnModels {
    private PsnModels() {}

    public record TrophyCounts(int bronze, int silver, int gold, int platinum) {
        public int total() { return bronze + silver + gold + platinum; }
    }

    public record TrophyTitle(
            String npServiceName,
            String npCommunicationId,
            String trophySetVersion,
            String trophyTitleName,
            String trophyTitleDetail,
            String trophyTitleIconUrl,
            String trophyTitlePlatform,
            boolean hasTrophyGroups,
            TrophyCounts definedTrophies,
            int progress,
            TrophyCounts earnedTrophies,
            boolean hiddenFlag,
            OffsetDateTime lastUpdatedDateTime) {}

    public record UserTrophyTitles(
            List<TrophyTitle> trophyTitles,
            int totalItemCount,
            Integer nextOffset,
            Integer previousOffset) {}

    public record Trophy(
            int trophyId,
            boolean trophyHidden,
            String trophyType,
            String trophyName,
            String trophyDetail,
            String trophyIconUrl,
            String trophyGroupId,
            String trophyProgressTargetValue,
            String trophyRewardName,
            String trophyRewardImageUrl) {}

    public record TitleTrophies(
            String trophySetVersion,
            boolean hasTrophyGroups,
            List<Trophy> trophies,
            int totalItemCount,
            Integer nextOffset,
            Integer previousOffset) {}

    public record EarnedTrophy(
            int trophyId,
            boolean trophyHidden,
            boolean earned,
            String progress,
            Integer progressRate,
            OffsetDateTime progressedDateTime,
            OffsetDateTime earnedDateTime,
            String trophyType,
            int trophyRare,
            String trophyEarnedRate) {}

    public record UserEarnedTrophies(
            String trophySetVersion,
            boolean hasTrophyGroups,
            OffsetDateTime lastUpdatedDateTime,
            List<EarnedTrophy> trophies,
            List<EarnedTrophy> rarestTrophies,
            int totalItemCount,
            Integer nextOffset,
            Integer previousOffset) {}

    public record TrophySummary(
            String accountId,
            int trophyLevel,
            int trophyPoint,
            int trophyLevelBasePoint,
            int trophyLevelNextPoint,
            int progress,
            int tier,
            TrophyCounts earnedTrophies) {}

    public record TrophyGroup(
            String trophyGroupId,
            String trophyGroupName,
            String trophyGroupDetail,
            String trophyGroupIconUrl,
            TrophyCounts definedTrophies) {}

    public record TitleTrophyGroups(
            String trophySetVersion,
            String trophyTitleName,
            String trophyTitlePlatform,
            TrophyCounts definedTrophies,
            List<TrophyGroup> trophyGroups) {}

    public record EarnedTrophyGroup(
            String trophyGroupId,
            int progress,
            TrophyCounts earnedTrophies,
            OffsetDateTime lastUpdatedDateTime) {}

    public record UserEarnedTrophyGroups(
            String trophySetVersion,
            boolean hiddenFlag,
            int progress,
            TrophyCounts earnedTrophies,
            OffsetDateTime lastUpdatedDateTime,
            List<EarnedTrophyGroup> trophyGroups) {}

    // --- game help (GraphQL) ---

    public record RarestTrophy(
            int trophyId,
            boolean trophyHidden,
            String trophyType,
            String trophyName,
            String trophyDetail,
            String trophyIconUrl,
            int trophyRare,
            Float trophyEarnedRate,
            boolean earned,
            OffsetDateTime earnedDateTime) {}

    /** Per-title progress; {@code notEarnedTrophyIds} is only present when requested. */
    public record TitleTrophySummary(
            String npServiceName,
            String npCommunicationId,
            String trophyTitleName,
            String trophyTitleDetail,
            String trophyTitleIconUrl,
            boolean hasTrophyGroups,
            List<RarestTrophy> rarestTrophies,
            int progress,
            TrophyCounts earnedTrophies,
            TrophyCounts definedTrophies,
            List<Integer> notEarnedTrophyIds,
            OffsetDateTime lastUpdatedDateTime) {}

    public record TitleSummary(String npTitleId, List<TitleTrophySummary> trophyTitles) {}

    public record UserTitlesTrophySummary(List<TitleSummary> titles) {
        public List<TitleSummary> titlesOrEmpty() { return titles == null ? List.of() : titles; }
    }

    public record HintTrophy(
            @JsonProperty("__typename") String typename,
            String helpType,
            String id,
            String trophyId,
            String udsObjectId) {}

    public record HintAvailability(@JsonProperty("__typename") String typename, List<HintTrophy> trophies) {}

    public record HintAvailabilityData(@JsonProperty("hintAvailabilityRetrieve") HintAvailability hintAvailability) {}

    public record GameHelpAvailabilityResponse(HintAvailabilityData data) {
        public List<HintTrophy> trophies() {
            if (data == null || data.hintAvailability() == null || data.hintAvailability().trophies() == null) {
                return List.of();
            }
            return data.hintAvailability().trophies();
        }
    }

    /** Input of the tips query; take the values from a {@link HintTrophy}. */
    public record GameHelpRequestTrophy(String trophyId, String udsObjectId, String helpType) {
        public static GameHelpRequestTrophy from(HintTrophy t) {
            return new GameHelpRequestTrophy(t.trophyId(), t.udsObjectId(), t.helpType());
        }
    }

    public record TipContent(
            @JsonProperty("__typename") String typename,
            String description,
            String displayName,
            String mediaId,
            String mediaType,
            String mediaUrl,
            String tipId) {}

    public record TipGroup(
            @JsonProperty("__typename") String typename,
            String groupId,
            String groupName,
            List<TipContent> tipContents) {}

    public record TrophyTip(
            @JsonProperty("__typename") String typename,
            List<TipGroup> groups,
            String id,
            int totalGroupCount,
            String trophyId) {}

    public record Tips(@JsonProperty("__typename") String typename, boolean hasAccess, List<TrophyTip> trophies) {}

    public record TipsData(Tips tipsRetrieve) {}

    public record GameHelpTipsResponse(TipsData data) {}
}
