package com.acme.devtools.flowtap.flow;

import com.acme.devtools.flowtap.util.Headers;

import java.util.Map;

/**
 * Captured response.
 */
public record ResponseSnapshot(
    int statusCode,
    String reason,
    Map<String, String> headers,
    String body
) {
    public ResponseSnapshot {
        reason = reason == null ? "" : reason;
        headers = Headers.copyOf(headers);
        body = body == null ? "" : body;
    }

    public String header(String name) {
        return Headers.lookup(headers, name);
    }

    public String contentType() {
        return header("Content-Type");
    }

    public String displayStatus() {
        return reason.isEmpty() ? Integer.toString(statusCode) : statusCode + " " + reason;
    }
}
