package com.acme.devtools.flowtap.flow;

/**
 * Outcome of a resume request. Only {@link #RESUMED} changes state.
 */
public enum ResumeResult {
    RESUMED,
    UNKNOWN_FLOW,
    ALREADY_RESUMED,
    NOT_PAUSED;

    public boolean isSuccess() {
        return this == RESUMED;
    }
}
