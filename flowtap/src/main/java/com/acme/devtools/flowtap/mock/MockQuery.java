package com.acme.devtools.flowtap.mock;

import com.acme.devtools.flowtap.flow.RequestSnapshot;

import java.util.Map;
import java.util.Objects;

/**
 * Request descriptor used for rule lookups: method, host, path without query, and decoded
 * query parameters.
 */
public record MockQuery(String method, String host, String path, Map<String, String> query) {
    public MockQuery {
        Objects.requireNonNull(method, "method");
        host = host == null ? "" : host;
        path = stripQuery(path);
        query = query == null ? Map.of() : Map.copyOf(query);
    }

    public static MockQuery of(RequestSnapshot request) {
        String host = request.host();
        String path = request.path();
        StructuredUrl url = StructuredUrl.parse(request.url());
        if (host.isEmpty()) {
            host = url.host();
        }
        if (!url.path().isEmpty()) {
            path = url.path();
        }
        return new MockQuery(request.method(), host, path, request.queryParameters());
    }

    private static String stripQuery(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        int q = path.indexOf('?');
        return q < 0 ? path : path.substring(0, q);
    }
}
