package com.locationscout.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final ObjectMapper json = new ObjectMapper();
    private final StructuredLog slog = StructuredLog.get(StructuredLogTest.class);

    @Test
    void line_is_json_with_fixed_keys_and_typed_values() throws Exception {
        JsonNode n = json.readTree(slog.line(Level.INFO, "site-done", null, "pages", 12, "ok", true, "dir", Path.of("out")));

        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("event").asText()).isEqualTo("site-done");
        assertThat(n.get("pages").isInt()).isTrue();
        assertThat(n.get("ok").asBoolean()).isTrue();
        assertThat(n.get("dir").asText()).isEqualTo("out");
        assertThat(n.has("ts")).isTrue();
    }

    @Test
    void bound_fields_go_on_every_event_without_touching_the_parent() throws Exception {
        StructuredLog site = slog.with("site", "Acme \"East\"").with("index", 3);

        JsonNode n = json.readTree(site.line(Level.WARNING, "page-failed", null, "url", "https://acme.com/x"));
        assertThat(n.get("site").asText()).isEqualTo("Acme \"East\"");
        assertThat(n.get("index").asInt()).isEqualTo(3);
        assertThat(n.get("url").asText()).isEqualTo("https://acme.com/x");

        JsonNode parent = json.readTree(slog.line(Level.INFO, "run-start", null));
        assertThat(parent.has("site")).isFalse();
    }

    @Test
    void dangling_key_and_cause_are_kept() throws Exception {
        JsonNode n = json.readTree(slog.line(Level.SEVERE, "site-error", new IllegalStateException("boom"), "site"));

        assertThat(n.has("site")).isTrue();
        assertThat(n.get("site").isNull()).isTrue();
        assertThat(n.get("cause").asText()).isEqualTo("java.lang.IllegalStateException: boom");
    }

    @Test
    void events_go_to_the_prefixed_logger() {
        Logger events = Logger.getLogger(StructuredLog.LOGGER_PREFIX + StructuredLogTest.class.getName());
        List<LogRecord> seen = new ArrayList<>();
        Handler h = new Handler() {
            @Override public void publish(LogRecord r) { seen.add(r); }
            @Override public void flush() {}
            @Override public void close() {}
        };
        events.addHandler(h);
        try {
            slog.warn("checkpoint-failed", "file", "cp.json");
        } finally {
            events.removeHandler(h);
        }

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).getLevel()).isEqualTo(Level.WARNING);
        assertThat(seen.get(0).getMessage()).contains("\"event\":\"checkpoint-failed\"");
    }
}
