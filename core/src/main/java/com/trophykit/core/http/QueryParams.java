package com.trophykit.core.http;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Ordered query/form parameter builder.
 * - null values are skipped, so optional vendor parameters can be passed straight through.
 * - Keys and values are UTF-8 form-encoded.
 * - {@link #parse(String)} keeps every value of repeated keys in input order.
 */
public final class QueryParams {
    private static final Pattern SECRET_PARAMS = Pattern.compile("([?&](?:key|y|p|t|token)=)[^&]*");

    private final Map<String, List<String>> params = new LinkedHashMap<>();

    public static QueryParams create() { return new QueryParams(); }

    public QueryParams add(String key, Object value) {
        if (key == null || key.isEmpty()) throw new IllegalArgumentException("key must not be empty");
        if (value == null) return this;
        params.computeIfAbsent(key, __ -> new ArrayList<>()).add(String.valueOf(value));
        return this;
    }

    /** Adds key=value only when {@code condition} holds. */
    public QueryParams addIf(boolean condition, String key, Object value) {
        return condition ? add(key, value) : this;
    }

    public boolean isEmpty() { return params.isEmpty(); }

    /** {@code a=1&b=x+y}; empty string when no parameters. */
    public String encode() {
        StringBuilder sb = new StringBuilder();
        for (var e : params.entrySet()) {
            for (String v : e.getValue()) {
                if (sb.length() > 0) sb.append('&');
                sb.append(enc(e.getKey())).append('=').append(enc(v));
            }
        }
        return sb.toString();
    }

    /** base + "?" + encoded params; appends with "&" when base already has a query. */
    public URI appendTo(String base) {
        Objects.requireNonNull(base, "base");
        String q = encode();
        if (q.isEmpty()) return URI.create(base);
        return URI.create(base + (base.indexOf('?') >= 0 ? '&' : '?') + q);
    }

    /** Parses {@code a=1&b=2} (no leading '?'). Keys without '=' map to "". */
    public static Map<String, List<String>> parse(String rawQuery) {
        Map<String, List<String>> m = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) return m;
        for (String p : rawQuery.split("&")) {
            if (p.isEmpty()) continue;
            int i = p.indexOf('=');
            String k = dec(i < 0 ? p : p.substring(0, i));
            String v = i < 0 ? "" : dec(p.substring(i + 1));
            m.computeIfAbsent(k, __ -> new ArrayList<>()).add(v);
        }
        return m;
    }

    /** First value of {@code key} in the query part of {@code uriOrQuery} (text after '?'), or null. */
    public static String firstValue(String uriOrQuery, String key) {
        if (uriOrQuery == null) return null;
        int q = uriOrQuery.indexOf('?');
        String raw = q >= 0 ? uriOrQuery.substring(q + 1) : uriOrQuery;
        int hash = raw.indexOf('#');
        if (hash >= 0) raw = raw.substring(0, hash);
        List<String> vals = parse(raw).get(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }

    /** URI text with credential parameters (key, y, p, t, token) replaced by {@code ***}. */
    public static String redact(URI uri) {
        return uri == null ? null : SECRET_PARAMS.matcher(uri.toString()).replaceAll("$1***");
    }

    public static String enc(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }
    static String dec(String s) { return URLDecoder.decode(s, StandardCharsets.UTF_8); }

    @Override public String toString() { return encode(); }
}
