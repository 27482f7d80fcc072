package com.acme.devtools.flowtap.transport.api;

import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.ResumeResult;
import com.acme.devtools.flowtap.mock.MockQuery;

import java.util.Optional;

/**
 * Request/response contract between a capturing agent and the coordinator. The in-process
 * coordinator and the HTTP client both implement it, so callers cannot tell whether the
 * coordinator runs locally.
 */
public interface ControlChannel {

    /**
     * Offers a captured flow. A {@link SubmitOutcome.Pending} reply means the flow is paused
     * and the caller must hold the transaction until the future completes.
     */
    SubmitOutcome submit(FlowSubmission submission);

    /** Resolves a paused flow; {@code null} modification means unmodified pass-through. */
    ResumeResult resume(String flowId, ModifiedResponse modifiedResponse);

    /** Looks up a mock answer without recording a flow. */
    Optional<MockDecision> queryMock(MockQuery query);

    /** True when the coordinator is reachable and running. */
    boolean ping();
}
