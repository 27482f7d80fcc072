package com.acme.devtools.flowtap.transport.api;

import com.acme.devtools.flowtap.flow.ModifiedResponse;

import java.util.Objects;

/** Operator request to release a paused flow. */
public record ResumeCommand(String flowId, ModifiedResponse modifiedResponse) {
    public ResumeCommand {
        Objects.requireNonNull(flowId, "flowId");
    }
}
