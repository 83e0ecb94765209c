package com.trophykit.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLoggerTest {

    static final class Capture extends Handler {
        final List<LogRecord> records = new ArrayList<>();
        @Override public void publish(LogRecord r) { records.add(r); }
        @Override public void flush() {}
        @Override public void close() {}
    }

    private final Logger jul = Logger.getLogger(StructuredLoggerTest.class.getName());
    private final Capture capture = new Capture();

    @BeforeEach
    void attach() {
        jul.setUseParentHandlers(false);
        jul.setLevel(Level.ALL);
        jul.addHandler(capture);
    }

    @AfterEach
    void detach() {
        jul.removeHandler(capture);
        jul.setUseParentHandlers(true);
        jul.setLevel(null);
    }

    @Test
    void writes_one_json_object_per_event() throws Exception {
        StructuredLogger log = StructuredLogger.get(StructuredLoggerTest.class);

        log.info("http.retry", "status", 503, "uri", "https://x/\"q\"", "retry", 1, "cause", null);

        assertThat(capture.records).hasSize(1);
        JsonNode line = new ObjectMapper().readTree(capture.records.get(0).getMessage());
        assertThat(line.path("event").asText()).isEqualTo("http.retry");
        assertThat(line.path("lvl").asText()).isEqualTo("INFO");
        assertThat(line.path("comp").asText()).isEqualTo("StructuredLoggerTest");
        assertThat(line.path("status").asInt()).isEqualTo(503);
        assertThat(line.path("uri").asText()).isEqualTo("https://x/\"q\"");
        assertThat(line.path("cause").isNull()).isTrue();
        assertThat(line.has("ts")).isTrue();
    }

    @Test
    void odd_key_value_list_is_flagged_and_errors_carry_the_throwable() throws Exception {
        StructuredLogger log = StructuredLogger.get(StructuredLoggerTest.class);

        log.error("decode.failed", new IllegalStateException("boom"), "dangling");

        LogRecord r = capture.records.get(0);
        assertThat(r.getLevel()).isEqualTo(Level.SEVERE);
        assertThat(r.getThrown()).hasMessage("boom");
        JsonNode line = new ObjectMapper().readTree(r.getMessage());
        assertThat(line.path("_kv_mismatch").asBoolean()).isTrue();
        assertThat(line.path("error").asText()).isEqualTo("IllegalStateException");
    }

    @Test
    void debug_respects_level() {
        StructuredLogger log = StructuredLogger.get(StructuredLoggerTest.class);
        jul.setLevel(Level.INFO);

        log.debug("xbox.achievements", "count", 3);

        assertThat(log.isDebugEnabled()).isFalse();
        assertThat(capture.records).isEmpty();
    }

    @Test
    void mask_and_preview() {
        assertThat(StructuredLogger.mask("v3.ABCDEFGH")).isEqualTo("v3.A***(11)");
        assertThat(StructuredLogger.mask("abc")).isEqualTo("***");
        assertThat(StructuredLogger.mask(null)).isNull();
        assertThat(StructuredLogger.preview("0123456789", 4)).isEqualTo("0123...");
        assertThat(StructuredLogger.preview("short", 10)).isEqualTo("short");
    }
}
