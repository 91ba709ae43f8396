package com.locationscout.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 크롤 이벤트 로거. 이벤트 1건 = JSON 한 줄.
 *
 * JUL 로거 이름은 {@value #LOGGER_PREFIX} + 클래스명이라 LogSetup 이 이벤트만 따로(events-*.jsonl) 받을 수 있다.
 * {@link #with(String, Object)} 로 묶은 필드(사이트명, 순번 등)는 이후 모든 이벤트에 붙는다.
 *
 * <pre>
 * StructuredLog slog = SLOG.with("site", "Acme").with("index", 3);
 * slog.info("site-done", "pages", 12, "topScore", 15);
 * // {"ts":"...","lvl":"INFO","comp":"SitePipeline","event":"site-done","site":"Acme","index":3,"pages":12,"topScore":15}
 * </pre>
 */
public final class StructuredLog {
    public static final String LOGGER_PREFIX = "events.";

    private static final ObjectMapper MAPPER = JsonSupport.mapper();

    private final Logger jul;
    private final String comp;
    private final Map<String, Object> bound;

    private StructuredLog(Logger jul, String comp, Map<String, Object> bound) {
        this.jul = jul;
        this.comp = comp;
        this.bound = bound;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(LOGGER_PREFIX + cls.getName()), cls.getSimpleName(), Map.of());
    }

    /** 필드 하나를 더 묶은 새 로거(원본은 그대로) */
    public StructuredLog with(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(bound);
        next.put(key, scalar(value));
        return new StructuredLog(jul, comp, Collections.unmodifiableMap(next));
    }

    public void info(String event, Object... kvs) { log(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        jul.log(lvl, line(lvl, event, t, kvs));
    }

    /** 이벤트 한 줄. 짝이 안 맞는 마지막 키는 null 값으로 남긴다. */
    String line(Level lvl, String event, Throwable t, Object... kvs) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("ts", Instant.now().toString());
        fields.put("lvl", lvl.getName());
        fields.put("comp", comp);
        fields.put("event", event);
        fields.putAll(bound);
        if (kvs != null) {
            for (int i = 0; i < kvs.length; i += 2) {
                Object v = i + 1 < kvs.length ? kvs[i + 1] : null;
                fields.put(String.valueOf(kvs[i]), scalar(v));
            }
        }
        if (t != null) fields.put("cause", t.toString());

        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            // 문자열/숫자/불리언만 담기므로 실제로는 오지 않는 경로
            return "{\"event\":\"" + event + "\",\"lvl\":\"" + lvl.getName() + "\",\"serializeError\":true}";
        }
    }

    /** 숫자/불리언은 그대로, 나머지는 문자열로 */
    private static Object scalar(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean) return v;
        return String.valueOf(v);
    }
}
