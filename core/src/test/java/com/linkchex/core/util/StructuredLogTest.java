package com.linkchex.core.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    @Test
    void line_is_single_json_object_with_escaped_values() {
        StructuredLog slog = StructuredLog.get(StructuredLogTest.class);
        String line = slog.line(Level.INFO, "page-checked", null,
                "url", "https://ex.com/\"q\"", "links", 12, "ok", true);

        assertThat(line).startsWith("{").endsWith("}").doesNotContain("\n");
        assertThat(line).contains("\"lvl\":\"INFO\"");
        assertThat(line).contains("\"comp\":\"StructuredLogTest\"");
        assertThat(line).contains("\"event\":\"page-checked\"");
        assertThat(line).contains("\"url\":\"https://ex.com/\\\"q\\\"\"");
        assertThat(line).contains("\"links\":12");
        assertThat(line).contains("\"ok\":true");
    }

    @Test
    void odd_kv_count_is_flagged_and_error_is_attached() {
        StructuredLog slog = StructuredLog.get(StructuredLogTest.class);
        String line = slog.line(Level.SEVERE, "link-task-failed",
                new IllegalStateException("boom"), "page", "https://ex.com/", "dangling");

        assertThat(line).contains("\"_kv_mismatch\":true");
        assertThat(line).contains("\"error\":\"IllegalStateException\"");
        assertThat(line).contains("\"message\":\"boom\"");
    }

    @Test
    void json_escapes_control_characters() {
        assertThat(Json.str("a\tb\u0001")).isEqualTo("\"a\\tb\\u0001\"");
        assertThat(Json.value(null)).isEqualTo("null");
        assertThat(Json.value(1.5)).isEqualTo("1.5");
    }
}
