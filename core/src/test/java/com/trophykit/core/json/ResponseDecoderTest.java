package com.trophykit.core.json;

import com.trophykit.core.error.ApiException;
import com.trophykit.core.http.RawResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseDecoderTest {

    record Item(String name, int count) {}

    private final ResponseDecoder decoder = new ResponseDecoder();

    private static RawResponse resp(int status, String body) {
        return RawResponse.builder().statusCode(status).body(body).build();
    }

    @Test
    @DisplayName("204 / empty / whitespace / null body -> empty list, map and Optional")
    void empty_bodies_yield_empty_collections() {
        for (RawResponse r : List.of(resp(204, ""), resp(200, ""), resp(200, " \n\t"), resp(200, "null"))) {
            assertThat(decoder.decode(r, ResponseShape.listOf(Item.class))).isEmpty();
            assertThat(decoder.decode(r, ResponseShape.mapOf(Item.class))).isEmpty();
            assertThat(decoder.decode(r, ResponseShape.optional(Item.class))).isEqualTo(Optional.empty());
        }
    }

    @Test
    void empty_body_for_required_object_is_no_content() {
        assertThatThrownBy(() -> decoder.decode(resp(204, ""), ResponseShape.object(Item.class)))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ApiException.Kind.NO_CONTENT);
                    assertThat(e.getStatusCode()).isEqualTo(204);
                });
    }

    @Test
    void malformed_json_carries_raw_body_and_parser_message() {
        String body = "{\"name\": \"x\", \"count\": ";
        assertThatThrownBy(() -> decoder.decode(resp(200, body), ResponseShape.object(Item.class)))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ApiException.Kind.DECODE);
                    assertThat(e.getRawBody()).isEqualTo(body);
                    assertThat(e.getMessage()).startsWith("Failed to decode response: ");
                    assertThat(e.getCause()).isNotNull();
                });
    }

    @Test
    void trailing_garbage_after_valid_json_is_a_decode_error() {
        String body = "[1,2] <html>502 Bad Gateway</html>";
        assertThatThrownBy(() -> decoder.decode(resp(200, body), ResponseShape.listOf(Integer.class)))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ApiException.Kind.DECODE);
                    assertThat(e.getRawBody()).isEqualTo(body);
                });
        assertThatThrownBy(() -> decoder.tree("{\"a\":1} {\"b\":2}"))
                .isInstanceOfSatisfying(ApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ApiException.Kind.DECODE));
    }

    @Test
    void shape_mismatch_is_a_decode_error() {
        assertThatThrownBy(() -> decoder.decode(resp(200, "{\"a\":1}"), ResponseShape.listOf(Item.class)))
                .isInstanceOfSatisfying(ApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ApiException.Kind.DECODE));
    }

    @Test
    void decodes_object_list_and_map_roots() {
        Item one = decoder.decode(resp(200, "{\"name\":\"a\",\"count\":2,\"extra\":true}"),
                ResponseShape.object(Item.class));
        assertThat(one).isEqualTo(new Item("a", 2));

        List<Item> list = decoder.decode(resp(200, "[{\"name\":\"a\",\"count\":1},{\"name\":\"b\",\"count\":3}]"),
                ResponseShape.listOf(Item.class));
        assertThat(list).extracting(Item::name).containsExactly("a", "b");

        Map<String, Integer> dist = decoder.decode(resp(200, "{\"1\":500,\"2\":250}"),
                ResponseShape.mapOf(Integer.class));
        assertThat(dist).containsEntry("1", 500).containsEntry("2", 250);

        Optional<Item> opt = decoder.decode(resp(200, "{\"name\":\"z\",\"count\":0}"),
                ResponseShape.optional(Item.class));
        assertThat(opt).contains(new Item("z", 0));
    }

    @Test
    void same_body_decodes_to_equal_values() {
        RawResponse r = resp(200, "[{\"name\":\"a\",\"count\":1},{\"name\":\"b\",\"count\":3}]");

        List<Item> first = decoder.decode(r, ResponseShape.listOf(Item.class));
        List<Item> second = decoder.decode(r, ResponseShape.listOf(Item.class));

        assertThat(second).isEqualTo(first).isNotSameAs(first);
    }

    @Test
    void tree_of_blank_body_is_missing_node() {
        assertThat(decoder.tree("").isMissingNode()).isTrue();
        assertThat(decoder.tree("{\"a\":{\"b\":1}}").path("a").path("b").asInt()).isEqualTo(1);
        assertThatThrownBy(() -> decoder.tree("{oops"))
                .isInstanceOfSatisfying(ApiException.class,
                        e -> assertThat(e.getRawBody()).isEqualTo("{oops"));
    }
}
