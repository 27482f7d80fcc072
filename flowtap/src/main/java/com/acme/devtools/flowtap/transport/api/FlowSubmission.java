package com.acme.devtools.flowtap.transport.api;

import com.acme.devtools.flowtap.flow.FlowCapture;
import com.acme.devtools.flowtap.flow.RequestSnapshot;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;

import java.util.Objects;

/**
 * A captured transaction offered to the coordinator.
 *
 * @param flowId       id assigned by the capturing agent, may be {@code null}
 * @param paused       agent-side hint that it is holding the transaction
 * @param mockApplied  the agent already answered from a mock rule
 */
public record FlowSubmission(
    String flowId,
    boolean paused,
    RequestSnapshot request,
    ResponseSnapshot response,
    long timestampMillis,
    long durationMillis,
    boolean mockApplied,
    String mockRuleName,
    String mockRuleId
) {
    public FlowSubmission {
        Objects.requireNonNull(request, "request");
        durationMillis = Math.max(0L, durationMillis);
    }

    public static FlowSubmission of(RequestSnapshot request, ResponseSnapshot response, long durationMillis) {
        return new FlowSubmission(null, false, request, response, System.currentTimeMillis(), durationMillis,
            false, null, null);
    }

    public FlowSubmission withFlowId(String id) {
        return new FlowSubmission(id, paused, request, response, timestampMillis, durationMillis,
            mockApplied, mockRuleName, mockRuleId);
    }

    public FlowSubmission withMock(String ruleId, String ruleName) {
        return new FlowSubmission(flowId, paused, request, response, timestampMillis, durationMillis,
            true, ruleName, ruleId);
    }

    public FlowCapture toCapture() {
        return new FlowCapture(flowId, request, response, timestampMillis, durationMillis);
    }
}
