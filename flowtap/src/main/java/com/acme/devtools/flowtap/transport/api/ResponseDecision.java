package com.acme.devtools.flowtap.transport.api;

import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;

/**
 * What the capturing side must do with a flow: pass the original response through, or
 * apply {@code modification}. Carries the mock rule that produced it, if any.
 */
public record ResponseDecision(String flowId, ModifiedResponse modification, String mockRuleId, String mockRuleName) {
    public ResponseDecision {
        modification = modification == null ? ModifiedResponse.PASS_THROUGH : modification;
    }

    public static ResponseDecision passThrough(String flowId) {
        return new ResponseDecision(flowId, ModifiedResponse.PASS_THROUGH, null, null);
    }

    public static ResponseDecision modify(String flowId, ModifiedResponse modification) {
        return new ResponseDecision(flowId, modification, null, null);
    }

    public boolean isPassThrough() {
        return modification.isPassThrough();
    }

    public ResponseSnapshot applyTo(ResponseSnapshot original) {
        return modification.applyTo(original);
    }
}
