package com.acme.devtools.flowtap.transport.http;

import com.acme.devtools.flowtap.util.Headers;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound HTTP request issued through {@link PooledHttpClient}.
 */
public record HttpCall(String method, URI uri, Map<String, String> headers, byte[] body) {
    public HttpCall {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = Headers.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    public static HttpCall get(URI uri) {
        return new HttpCall("GET", uri, Map.of(), null);
    }

    public static HttpCall postJson(URI uri, byte[] json) {
        return new HttpCall("POST", uri, Map.of("Content-Type", "application/json"), json);
    }
}
