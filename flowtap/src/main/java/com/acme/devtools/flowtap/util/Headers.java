package com.acme.devtools.flowtap.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Header map helpers. Maps keep the captured spelling and insertion order; lookups and
 * overrides compare names case-insensitively.
 */
public final class Headers {
    private Headers() {
    }

    public static Map<String, String> copyOf(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() == null) {
                continue;
            }
            copy.put(e.getKey(), e.getValue() == null ? "" : e.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    public static String lookup(Map<String, String> headers, String name) {
        if (headers == null || name == null) {
            return null;
        }
        String exact = headers.get(name);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    /**
     * Returns {@code original} with every header of {@code overrides} set, replacing an
     * original header of the same name regardless of case.
     */
    public static Map<String, String> merge(Map<String, String> original, Map<String, String> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return copyOf(original);
        }
        Map<String, String> merged = new LinkedHashMap<>();
        Map<String, String> overrideByLowerName = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : overrides.entrySet()) {
            overrideByLowerName.put(e.getKey().toLowerCase(Locale.ROOT), e.getKey());
        }
        if (original != null) {
            for (Map.Entry<String, String> e : original.entrySet()) {
                if (!overrideByLowerName.containsKey(e.getKey().toLowerCase(Locale.ROOT))) {
                    merged.put(e.getKey(), e.getValue());
                }
            }
        }
        for (Map.Entry<String, String> e : overrides.entrySet()) {
            merged.put(e.getKey(), e.getValue() == null ? "" : e.getValue());
        }
        return Collections.unmodifiableMap(merged);
    }
}
