package com.acme.devtools.flowtap.telemetry;

import com.acme.devtools.flowtap.flow.ResumeResult;

public interface FlowMetrics {
    void incSubmitted();
    void incPaused();
    void incResumed();
    void incResumeRejected(ResumeResult result);
    void incMocked();
    void incFailOpen();
    void incMalformed();
    void observeHoldNanos(long nanos);
}
