package com.acme.devtools.flowtap.transport.http;

import com.acme.devtools.flowtap.util.Headers;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Fully read HTTP response.
 */
public record HttpReply(int status, String reason, Map<String, String> headers, byte[] body) {
    public HttpReply {
        reason = reason == null ? "" : reason;
        headers = Headers.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
