package com.trophykit.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-line event logger on top of java.util.logging.
 * Every line carries ts/lvl/comp/thread/event followed by the caller's key/value pairs.
 * Secrets (tokens, cookies, API keys) go through {@link #mask(String)} before being passed in.
 */
public final class StructuredLogger {
    private static final ObjectMapper LINES = new ObjectMapper();

    private final Logger jul;
    private final String comp;

    private StructuredLogger(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }
    public static StructuredLogger get(Class<?> cls) { return new StructuredLogger(cls); }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO, event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    public boolean isDebugEnabled() { return jul.isLoggable(Level.FINE); }

    /** Keeps the first four characters of a secret, e.g. {@code v3.A***(41)}. */
    public static String mask(String secret) {
        if (secret == null) return null;
        if (secret.length() <= 4) return "***";
        return secret.substring(0, 4) + "***(" + secret.length() + ")";
    }

    /** Trims long response bodies before they are attached to an event. */
    public static String preview(String body, int max) {
        if (body == null) return null;
        return body.length() <= max ? body : body.substring(0, max) + "...";
    }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        ObjectNode line = LINES.createObjectNode()
                .put("ts", Instant.now().toString())
                .put("lvl", lvl.getName())
                .put("comp", comp)
                .put("thread", Thread.currentThread().getName())
                .put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                field(line, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) line.put("_kv_mismatch", true);
        }
        if (t != null) {
            line.put("error", t.getClass().getSimpleName()).put("message", String.valueOf(t.getMessage()));
        }
        String text;
        try {
            text = LINES.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            text = line.toString();
        }
        if (t == null) jul.log(lvl, text); else jul.log(lvl, text, t);
    }

    // numbers and booleans stay JSON scalars, everything else is written as its toString()
    private static void field(ObjectNode line, String key, Object v) {
        if (v == null) line.putNull(key);
        else if (v instanceof Boolean) line.put(key, (Boolean) v);
        else if (v instanceof Integer || v instanceof Short || v instanceof Byte) line.put(key, ((Number) v).intValue());
        else if (v instanceof Long) line.put(key, (Long) v);
        else if (v instanceof Double || v instanceof Float) line.put(key, ((Number) v).doubleValue());
        else if (v instanceof BigDecimal) line.put(key, (BigDecimal) v);
        else if (v instanceof BigInteger) line.put(key, (BigInteger) v);
        else line.put(key, String.valueOf(v));
    }
}
