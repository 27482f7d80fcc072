package com.acme.devtools.flowtap.flow;

/**
 * Observer of flow store changes, used to publish flows to an external inspector.
 * Callbacks run on the thread that changed the store and must not block.
 */
public interface FlowListener {
    default void onFlowAdded(Flow flow) {
    }

    default void onFlowUpdated(Flow flow) {
    }

    default void onFlowsCleared() {
    }
}
