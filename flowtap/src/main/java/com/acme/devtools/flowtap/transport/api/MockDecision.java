package com.acme.devtools.flowtap.transport.api;

import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.mock.MockMatch;
import com.acme.devtools.flowtap.util.Headers;

import java.util.Map;

/**
 * Response synthesized from a matching mock rule.
 */
public record MockDecision(String ruleId, String ruleName, int statusCode, Map<String, String> headers, String content) {
    public MockDecision {
        headers = Headers.copyOf(headers);
        content = content == null ? "" : content;
    }

    public static MockDecision of(MockMatch match) {
        return new MockDecision(
            match.rule().id(),
            match.rule().name(),
            match.rule().response().statusCode(),
            match.rule().response().headers(),
            match.rule().response().content()
        );
    }

    public ResponseSnapshot toSnapshot() {
        return new ResponseSnapshot(statusCode, "", headers, content);
    }
}
