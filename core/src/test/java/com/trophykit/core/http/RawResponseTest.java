package com.trophykit.core.http;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RawResponseTest {

    @Test
    void header_lookup_is_case_insensitive() {
        var r = RawResponse.builder()
                .statusCode(302)
                .headers(Map.of("location", List.of("https://x/?code=1")))
                .build();
        assertThat(r.header("Location")).contains("https://x/?code=1");
        assertThat(r.header("missing")).isEmpty();
        assertThat(r.isRedirect()).isTrue();
        assertThat(r.isSuccess()).isFalse();
    }

    @Test
    void no_content_for_204_or_blank_body() {
        assertThat(RawResponse.builder().statusCode(204).body("{}").build().hasNoContent()).isTrue();
        assertThat(RawResponse.builder().statusCode(200).body("  \n").build().hasNoContent()).isTrue();
        assertThat(RawResponse.builder().statusCode(200).build().getBody()).isEmpty();
        assertThat(RawResponse.builder().statusCode(200).body("[]").build().hasNoContent()).isFalse();
    }

    @Test
    void toString_does_not_leak_keys() {
        var r = RawResponse.builder()
                .uri(URI.create("https://api/x?key=SECRET"))
                .statusCode(200)
                .body("{}")
                .build();
        assertThat(r.toString()).doesNotContain("SECRET");
    }
}
