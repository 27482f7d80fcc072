package com.acme.devtools.flowtap.transport.api;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Reply to a flow submission: decided on the spot, or pending an operator.
 */
public sealed interface SubmitOutcome permits SubmitOutcome.Immediate, SubmitOutcome.Pending {
    String flowId();

    /** The decision, already completed for {@link Immediate}. */
    CompletableFuture<ResponseDecision> decision();

    record Immediate(ResponseDecision value) implements SubmitOutcome {
        public Immediate {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String flowId() {
            return value.flowId();
        }

        @Override
        public CompletableFuture<ResponseDecision> decision() {
            return CompletableFuture.completedFuture(value);
        }
    }

    record Pending(String flowId, CompletableFuture<ResponseDecision> decision) implements SubmitOutcome {
        public Pending {
            Objects.requireNonNull(flowId, "flowId");
            Objects.requireNonNull(decision, "decision");
        }
    }
}
