package com.acme.devtools.flowtap.telemetry;

import com.acme.devtools.flowtap.flow.ResumeResult;

public final class NoopFlowMetrics implements FlowMetrics {
    public static final NoopFlowMetrics INSTANCE = new NoopFlowMetrics();

    private NoopFlowMetrics() {
    }

    @Override
    public void incSubmitted() {
    }

    @Override
    public void incPaused() {
    }

    @Override
    public void incResumed() {
    }

    @Override
    public void incResumeRejected(ResumeResult result) {
    }

    @Override
    public void incMocked() {
    }

    @Override
    public void incFailOpen() {
    }

    @Override
    public void incMalformed() {
    }

    @Override
    public void observeHoldNanos(long nanos) {
    }
}
