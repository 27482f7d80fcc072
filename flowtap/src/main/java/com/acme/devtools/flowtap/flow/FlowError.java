package com.acme.devtools.flowtap.flow;

public enum FlowError {
    UNKNOWN_FLOW,
    INVALID_STATE
}
