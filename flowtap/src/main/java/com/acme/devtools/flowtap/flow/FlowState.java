package com.acme.devtools.flowtap.flow;

/**
 * Pause-state machine of a flow: {@code PENDING -> PAUSED -> RESUMED -> COMPLETED}, or
 * {@code PENDING -> COMPLETED} when no pause is required. No state is revisited.
 */
public enum FlowState {
    PENDING,
    PAUSED,
    RESUMED,
    COMPLETED;

    public boolean canTransitionTo(FlowState next) {
        return switch (this) {
            case PENDING -> next == PAUSED || next == COMPLETED;
            case PAUSED -> next == RESUMED;
            case RESUMED -> next == COMPLETED;
            case COMPLETED -> false;
        };
    }

    /** True once the flow can no longer be resumed. */
    public boolean isResolved() {
        return this == RESUMED || this == COMPLETED;
    }
}
