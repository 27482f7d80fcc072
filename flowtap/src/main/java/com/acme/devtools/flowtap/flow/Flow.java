package com.acme.devtools.flowtap.flow;

import java.util.Optional;

/**
 * Read-only view of a flow taken atomically from the {@link FlowStore}.
 */
public record Flow(
    String id,
    RequestSnapshot request,
    ResponseSnapshot response,
    long capturedAtMillis,
    long durationMillis,
    FlowState state,
    String mockRuleId,
    String mockRuleName,
    boolean modified,
    ModifiedResponse resolution
) {
    public Optional<ResponseSnapshot> responseOpt() {
        return Optional.ofNullable(response);
    }

    public boolean paused() {
        return state == FlowState.PAUSED;
    }

    public boolean mockApplied() {
        return mockRuleId != null;
    }
}
