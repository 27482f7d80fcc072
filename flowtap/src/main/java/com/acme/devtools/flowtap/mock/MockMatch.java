package com.acme.devtools.flowtap.mock;

import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;

/**
 * Winning rule for a request, with the number of required parameters it matched.
 */
public record MockMatch(MockRule rule, int specificity) {

    public ResponseSnapshot response() {
        return rule.response().toSnapshot();
    }

    public ModifiedResponse modifiedResponse() {
        return rule.response().toModifiedResponse();
    }
}
