package com.acme.devtools.flowtap.mock;

import java.util.Objects;

public record QueryParam(String key, String value, boolean required, MatchType matchType) {
    public QueryParam {
        Objects.requireNonNull(key, "key");
        value = value == null ? "" : value;
        matchType = matchType == null ? MatchType.EXACT : matchType;
    }

    public static QueryParam exact(String key, String value) {
        return new QueryParam(key, value, true, MatchType.EXACT);
    }

    public static QueryParam wildcard(String key) {
        return new QueryParam(key, "", true, MatchType.WILDCARD);
    }

    public static QueryParam regex(String key, String pattern) {
        return new QueryParam(key, pattern, true, MatchType.REGEX);
    }

    public QueryParam optional() {
        return new QueryParam(key, value, false, matchType);
    }
}
