package com.acme.devtools.flowtap.flow;

import java.util.Objects;

/**
 * Input to {@link FlowStore#create(FlowCapture)}. {@code proposedId} is the id the capturing
 * agent already assigned; the store keeps it when it is free.
 */
public record FlowCapture(
    String proposedId,
    RequestSnapshot request,
    ResponseSnapshot response,
    long capturedAtMillis,
    long durationMillis
) {
    public FlowCapture {
        Objects.requireNonNull(request, "request");
        durationMillis = Math.max(0L, durationMillis);
    }

    public static FlowCapture of(RequestSnapshot request, ResponseSnapshot response) {
        return new FlowCapture(null, request, response, System.currentTimeMillis(), 0L);
    }
}
