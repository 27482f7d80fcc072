package com.acme.devtools.flowtap.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query string parsing and encoding. When a key repeats, the first value wins.
 */
public final class QueryStrings {
    private QueryStrings() {
    }

    public static Map<String, String> parse(String rawQuery) {
        List<Map.Entry<String, String>> pairs = pairs(rawQuery);
        if (pairs.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : pairs) {
            out.putIfAbsent(pair.getKey(), pair.getValue());
        }
        return Collections.unmodifiableMap(out);
    }

    /**
     * Every decoded key/value pair of {@code rawQuery} in order, repeated keys included. A key
     * without {@code =} has an empty value.
     */
    public static List<Map.Entry<String, String>> pairs(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return List.of();
        }
        List<Map.Entry<String, String>> out = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            out.add(new AbstractMap.SimpleImmutableEntry<>(key, value));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * Decoded query parameters of an absolute or relative URL; empty when the URL does not parse.
     */
    public static Map<String, String> ofUrl(String url) {
        if (url == null || url.isEmpty()) {
            return Map.of();
        }
        try {
            return parse(URI.create(url).getRawQuery());
        } catch (IllegalArgumentException e) {
            int q = url.indexOf('?');
            return q < 0 ? Map.of() : parse(url.substring(q + 1));
        }
    }

    public static String encode(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(encodeComponent(e.getKey()))
                .append('=')
                .append(encodeComponent(e.getValue() == null ? "" : e.getValue()));
        }
        return sb.toString();
    }

    /** RFC 3986 percent-encoding: unreserved characters stay literal, a space becomes {@code %20}. */
    public static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~");
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }
}
