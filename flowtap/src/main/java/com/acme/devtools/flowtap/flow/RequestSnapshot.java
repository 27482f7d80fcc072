package com.acme.devtools.flowtap.flow;

import com.acme.devtools.flowtap.util.Headers;
import com.acme.devtools.flowtap.util.QueryStrings;

import java.util.Map;
import java.util.Objects;

/**
 * Captured request. Header lookups through {@link #header(String)} ignore case.
 */
public record RequestSnapshot(
    String method,
    String url,
    String host,
    String path,
    Map<String, String> headers,
    String body
) {
    public RequestSnapshot {
        method = Objects.requireNonNull(method, "method");
        url = url == null ? "" : url;
        host = host == null ? "" : host;
        path = path == null || path.isEmpty() ? "/" : path;
        headers = Headers.copyOf(headers);
        body = body == null ? "" : body;
    }

    public String header(String name) {
        return Headers.lookup(headers, name);
    }

    /** Decoded query parameters of {@link #url()}, first value per key. */
    public Map<String, String> queryParameters() {
        return QueryStrings.ofUrl(url);
    }

    public String shortUrl() {
        return url.length() > 60 ? url.substring(0, 60) + "..." : url;
    }
}
