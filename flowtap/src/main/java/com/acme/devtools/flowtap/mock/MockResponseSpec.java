package com.acme.devtools.flowtap.mock;

import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.util.Headers;

import java.util.Map;

/**
 * Response a mock rule answers with.
 */
public record MockResponseSpec(int statusCode, Map<String, String> headers, String content) {
    public static final int DEFAULT_STATUS = 200;

    public MockResponseSpec {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode out of range: " + statusCode);
        }
        headers = Headers.copyOf(headers);
        content = content == null ? "" : content;
    }

    public static MockResponseSpec ok(String content) {
        return new MockResponseSpec(DEFAULT_STATUS, Map.of(), content);
    }

    public ResponseSnapshot toSnapshot() {
        return new ResponseSnapshot(statusCode, "", headers, content);
    }

    public ModifiedResponse toModifiedResponse() {
        return new ModifiedResponse(statusCode, headers, content);
    }
}
