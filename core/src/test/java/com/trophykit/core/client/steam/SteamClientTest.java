package com.trophykit.core.client.steam;

import com.trophykit.core.client.steam.SteamModels.*;
import com.trophykit.core.error.ApiException;
import com.trophykit.core.http.DefaultRetryPolicy;
import com.trophykit.core.http.QueryParams;
import com.trophykit.core.http.RetryingTransport;
import com.trophykit.core.json.ResponseDecoder;
import com.trophykit.core.support.RecordingSleeper;
import com.trophykit.core.support.ScriptedSender;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SteamClientTest {

    private final ScriptedSender sender = new ScriptedSender();

    private SteamClient client(String apiKey) {
        var transport = new RetryingTransport(sender,
                new DefaultRetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(100), 0.0),
                new RecordingSleeper(), null);
        return new SteamClient(apiKey, "https://steam.test/", transport, new ResponseDecoder(),
                "test-agent", Duration.ofSeconds(5));
    }

    private Map<String, List<String>> lastQuery() {
        return QueryParams.parse(sender.lastRequest().uri().getRawQuery());
    }

    @Test
    void player_summaries_join_ids_and_send_key() throws Exception {
        sender.respond(200, "{\"response\":{\"players\":[{\"steamid\":\"7656\",\"personaname\":\"gabe\","
                + "\"communityvisibilitystate\":3,\"lastlogoff\":1700000000}]}}");

        List<Player> players = client("KEY").getPlayerSummaries(List.of("7656", "7657"));

        assertThat(players).hasSize(1);
        assertThat(players.get(0).personaname()).isEqualTo("gabe");
        assertThat(players.get(0).isPublic()).isTrue();
        assertThat(sender.lastRequest().uri().getPath()).isEqualTo("/ISteamUser/GetPlayerSummaries/v0002/");
        assertThat(lastQuery().get("steamids")).containsExactly("7656,7657");
        assertThat(lastQuery().get("key")).containsExactly("KEY");
        assertThat(lastQuery().get("format")).containsExactly("json");
        assertThat(sender.lastRequest().headers().firstValue("User-Agent")).contains("test-agent");
    }

    @Test
    void no_ids_means_no_call() throws Exception {
        assertThat(client("KEY").getPlayerSummaries(List.of())).isEmpty();
        assertThat(sender.calls()).isZero();
    }

    @Test
    void owned_games_with_filter() throws Exception {
        sender.respond(200, "{\"response\":{\"game_count\":1,\"games\":[{\"appid\":440,\"name\":\"TF2\","
                + "\"playtime_forever\":1234,\"img_icon_url\":\"abc\",\"has_community_visible_stats\":true}]}}");

        OwnedGames owned = client("KEY").getOwnedGames("7656", true, false, new int[]{440, 570});

        assertThat(owned.gameCount()).isEqualTo(1);
        assertThat(owned.games().get(0).playtimeForever()).isEqualTo(1234);
        assertThat(owned.games().get(0).hasCommunityVisibleStats()).isTrue();
        assertThat(lastQuery().get("appids_filter[0]")).containsExactly("440");
        assertThat(lastQuery().get("appids_filter[1]")).containsExactly("570");
        assertThat(lastQuery().get("include_appinfo")).containsExactly("true");
        assertThat(lastQuery().get("include_played_free_games")).containsExactly("false");
    }

    @Test
    void empty_owned_games_response_is_tolerated() throws Exception {
        sender.respond(200, "{\"response\":{}}");

        OwnedGames owned = client("KEY").getOwnedGames("7656", false, false, null);

        assertThat(owned.gameCount()).isZero();
        assertThat(owned.games()).isNull();
    }

    @Test
    void global_percentages_accept_quoted_floats_and_need_no_key() throws Exception {
        sender.respond(200, "{\"achievementpercentages\":{\"achievements\":["
                + "{\"name\":\"ACH_WIN\",\"percent\":\"54.3\"},{\"name\":\"ACH_RARE\",\"percent\":0.7}]}}");

        List<GlobalAchievement> list = client("KEY").getGlobalAchievementPercentages(440);

        assertThat(list).extracting(GlobalAchievement::percent).containsExactly(54.3f, 0.7f);
        assertThat(lastQuery()).doesNotContainKey("key");
        assertThat(lastQuery().get("gameid")).containsExactly("440");
    }

    @Test
    void player_achievements_with_language() throws Exception {
        sender.respond(200, "{\"playerstats\":{\"steamID\":\"7656\",\"gameName\":\"TF2\",\"success\":true,"
                + "\"achievements\":[{\"apiname\":\"A\",\"achieved\":1,\"unlocktime\":1600000000},"
                + "{\"apiname\":\"B\",\"achieved\":0,\"unlocktime\":0}]}}");

        PlayerStats stats = client("KEY").getPlayerAchievements("7656", 440, "english");

        assertThat(stats.steamId()).isEqualTo("7656");
        assertThat(stats.achievements()).filteredOn(PlayerAchievement::isAchieved)
                .extracting(PlayerAchievement::apiname).containsExactly("A");
        assertThat(lastQuery().get("l")).containsExactly("english");
    }

    @Test
    void key_is_omitted_when_blank() throws Exception {
        sender.respond(200, "{\"response\":{\"success\":1,\"steamid\":\"7656\"}}");

        VanityUrlResult r = client(" ").resolveVanityUrl("gabelogannewell");

        assertThat(r.isResolved()).isTrue();
        assertThat(r.steamid()).isEqualTo("7656");
        assertThat(lastQuery()).doesNotContainKey("key");
    }

    @Test
    void forbidden_is_terminal_and_not_retried() {
        sender.respond(403, "<html>Forbidden</html>");

        assertThatThrownBy(() -> client("BAD").getFriendList("7656", null))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(403);
                    assertThat(e.getMessage()).doesNotContain("BAD");
                });
        assertThat(sender.calls()).isEqualTo(1);
    }

    @Test
    void server_errors_are_retried_before_success() throws Exception {
        sender.respond(500, "")
                .respond(200, "{\"friendslist\":{\"friends\":[{\"steamid\":\"1\",\"relationship\":\"friend\","
                        + "\"friend_since\":1500000000}]}}");

        List<Friend> friends = client("KEY").getFriendList("7656", "friend");

        assertThat(friends).extracting(Friend::friendSince).containsExactly(1500000000L);
        assertThat(sender.calls()).isEqualTo(2);
    }

    @Test
    void schema_achievements_default_to_empty() throws Exception {
        sender.respond(200, "{\"game\":{\"gameName\":\"Spacewar\",\"gameVersion\":\"1\"}}");

        GameSchema schema = client("KEY").getSchemaForGame(480);

        assertThat(schema.gameName()).isEqualTo("Spacewar");
        assertThat(schema.achievements()).isEmpty();
    }
}
