package com.acme.devtools.flowtap.mock;

import com.acme.devtools.flowtap.util.FlowtapDefaults;
import com.acme.devtools.flowtap.util.QueryStrings;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * URL split into the parts a mock rule matches on. Parsing never throws: input that is not
 * an absolute URL yields {@link #EMPTY}.
 *
 * <p>A parsed URL keeps its query exactly as written in {@code rawQuery}; {@link #toFullUrl()}
 * emits it unchanged while it still describes {@code queryParams}, and percent-encodes the
 * parameters otherwise.
 */
public record StructuredUrl(
    String scheme,
    String host,
    Integer port,
    String path,
    List<QueryParam> queryParams,
    String rawQuery
) {

    public static final StructuredUrl EMPTY = new StructuredUrl("https", "", null, "", List.of());

    public StructuredUrl {
        scheme = scheme == null || scheme.isEmpty() ? "https" : scheme;
        host = host == null ? "" : host;
        path = path == null ? "" : path;
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
        rawQuery = rawQuery == null || rawQuery.isEmpty() ? null : rawQuery;
    }

    public StructuredUrl(String scheme, String host, Integer port, String path, List<QueryParam> queryParams) {
        this(scheme, host, port, path, queryParams, null);
    }

    /** Parses {@code url}; every query parameter becomes an optional wildcard. */
    public static StructuredUrl parse(String url) {
        return parse(url, false);
    }

    /** Parses {@code url}; every query parameter becomes a required exact match. */
    public static StructuredUrl parseExact(String url) {
        return parse(url, true);
    }

    private static StructuredUrl parse(String url, boolean exact) {
        if (url == null || url.isBlank()) {
            return EMPTY;
        }
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return EMPTY;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return EMPTY;
        }
        String rawQuery = uri.getRawQuery();
        List<QueryParam> params = new ArrayList<>();
        for (Map.Entry<String, String> pair : QueryStrings.pairs(rawQuery)) {
            params.add(exact
                ? QueryParam.exact(pair.getKey(), pair.getValue())
                : new QueryParam(pair.getKey(), pair.getValue(), false, MatchType.WILDCARD));
        }
        String path = uri.getRawPath();
        return new StructuredUrl(
            uri.getScheme(),
            uri.getHost(),
            uri.getPort() == -1 ? null : uri.getPort(),
            path == null ? "" : path,
            params,
            rawQuery
        );
    }

    public String toFullUrl() {
        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != null && port != FlowtapDefaults.HTTP_DEFAULT_PORT && port != FlowtapDefaults.HTTPS_DEFAULT_PORT) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (rawQuery != null && describesParams(rawQuery)) {
            return sb.append('?').append(rawQuery).toString();
        }
        for (int i = 0; i < queryParams.size(); i++) {
            QueryParam p = queryParams.get(i);
            sb.append(i == 0 ? '?' : '&')
                .append(QueryStrings.encodeComponent(p.key()))
                .append('=')
                .append(QueryStrings.encodeComponent(p.value()));
        }
        return sb.toString();
    }

    private boolean describesParams(String query) {
        List<Map.Entry<String, String>> pairs = QueryStrings.pairs(query);
        if (pairs.size() != queryParams.size()) {
            return false;
        }
        for (int i = 0; i < pairs.size(); i++) {
            QueryParam p = queryParams.get(i);
            if (!pairs.get(i).getKey().equals(p.key()) || !pairs.get(i).getValue().equals(p.value())) {
                return false;
            }
        }
        return true;
    }
}
