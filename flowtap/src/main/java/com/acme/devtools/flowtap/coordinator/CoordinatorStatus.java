package com.acme.devtools.flowtap.coordinator;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the coordinator for the status endpoint.
 *
 * @param interceptedFlows ids of the flows currently paused
 */
public record CoordinatorStatus(
    boolean running,
    InterceptMode mode,
    List<String> interceptedFlows,
    int storedFlows,
    int rules,
    Map<String, Long> counters
) {
    public CoordinatorStatus {
        interceptedFlows = List.copyOf(interceptedFlows);
        counters = counters == null ? Map.of() : Map.copyOf(counters);
    }

    public int interceptedCount() {
        return interceptedFlows.size();
    }
}
