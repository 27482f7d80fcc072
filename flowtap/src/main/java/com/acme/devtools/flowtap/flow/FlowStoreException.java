package com.acme.devtools.flowtap.flow;

/**
 * Thrown when a flow store precondition fails. Carries a {@link FlowError} so transports can
 * map it to a wire-level status.
 */
public final class FlowStoreException extends RuntimeException {
    private final FlowError error;
    private final String flowId;

    public FlowStoreException(FlowError error, String flowId, String message) {
        super(message + ", flowId=" + flowId);
        this.error = error;
        this.flowId = flowId;
    }

    public FlowError error() {
        return error;
    }

    public String flowId() {
        return flowId;
    }
}
