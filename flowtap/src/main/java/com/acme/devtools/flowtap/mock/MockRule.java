package com.acme.devtools.flowtap.mock;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Stored mock rule. {@code sequence} orders rules by creation and breaks specificity ties.
 * Scheme and port are kept for display only; matching uses method, host, path and query.
 */
public record MockRule(
    String id,
    String name,
    boolean enabled,
    long sequence,
    String method,
    String scheme,
    String host,
    Integer port,
    String path,
    List<QueryParam> queryParams,
    MockResponseSpec response
) {
    public MockRule {
        name = name == null ? "" : name;
        method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
        scheme = scheme == null || scheme.isEmpty() ? "https" : scheme;
        host = Objects.requireNonNull(host, "host");
        path = path == null || path.isEmpty() ? "/" : path;
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
        response = response == null ? MockResponseSpec.ok("") : response;
    }

    /** A rule matching {@code method} on the host, path and query of {@code url}. */
    public static MockRule fromUrl(String name, String method, StructuredUrl url, MockResponseSpec response) {
        return new MockRule(null, name, true, 0L, method, url.scheme(), url.host(), url.port(),
            url.path(), url.queryParams(), response);
    }

    public StructuredUrl displayUrl() {
        return new StructuredUrl(scheme, host, port, path, queryParams);
    }

    public MockRule withIdentity(String newId, long newSequence) {
        return new MockRule(newId, name, enabled, newSequence, method, scheme, host, port, path, queryParams, response);
    }

    public MockRule withEnabled(boolean value) {
        return new MockRule(id, name, value, sequence, method, scheme, host, port, path, queryParams, response);
    }

    public int requiredParamCount() {
        int n = 0;
        for (QueryParam p : queryParams) {
            if (p.required()) {
                n++;
            }
        }
        return n;
    }
}
