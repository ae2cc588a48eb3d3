package com.linkchex.core.util;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거(java.util.logging 위).
 * CLI의 LogSetup이 핸들러를 세팅한 뒤 호출하면 한 줄짜리 JSON으로 찍힌다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = line(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String line(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(128);
        sb.append('{')
          .append(Json.kv("ts", Instant.now().toString())).append(',')
          .append(Json.kv("lvl", lvl.getName())).append(',')
          .append(Json.kv("comp", comp)).append(',')
          .append(Json.kv("thread", Thread.currentThread().getName())).append(',')
          .append(Json.kv("event", event));

        // kvs: "key", value, ...
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                sb.append(',').append(Json.kv(String.valueOf(kvs[i]), kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) sb.append(',').append(Json.kv("_kv_mismatch", true));
        }
        if (t != null) {
            sb.append(',').append(Json.kv("error", t.getClass().getSimpleName()))
              .append(',').append(Json.kv("message", t.getMessage()));
        }
        return sb.append('}').toString();
    }
}
