package com.acme.devtools.flowtap.telemetry;

import com.acme.devtools.flowtap.flow.ResumeResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicFlowMetrics implements FlowMetrics {
    private final LongAdder submitted = new LongAdder();
    private final LongAdder paused = new LongAdder();
    private final LongAdder resumed = new LongAdder();
    private final LongAdder mocked = new LongAdder();
    private final LongAdder failOpen = new LongAdder();
    private final LongAdder malformed = new LongAdder();
    private final LongAdder holdNanos = new LongAdder();
    private final LongAdder holdSamples = new LongAdder();
    private final ConcurrentHashMap<ResumeResult, LongAdder> resumeRejected = new ConcurrentHashMap<>();

    @Override
    public void incSubmitted() {
        submitted.increment();
    }

    @Override
    public void incPaused() {
        paused.increment();
    }

    @Override
    public void incResumed() {
        resumed.increment();
    }

    @Override
    public void incResumeRejected(ResumeResult result) {
        if (result == null || result.isSuccess()) return;
        resumeRejected.computeIfAbsent(result, ignored -> new LongAdder()).increment();
    }

    @Override
    public void incMocked() {
        mocked.increment();
    }

    @Override
    public void incFailOpen() {
        failOpen.increment();
    }

    @Override
    public void incMalformed() {
        malformed.increment();
    }

    @Override
    public void observeHoldNanos(long nanos) {
        if (nanos < 0) return;
        holdNanos.add(nanos);
        holdSamples.increment();
    }

    public Snapshot snapshot() {
        Map<ResumeResult, Long> rejected = new EnumMap<>(ResumeResult.class);
        resumeRejected.forEach((k, v) -> rejected.put(k, v.sum()));
        return new Snapshot(
            submitted.sum(),
            paused.sum(),
            resumed.sum(),
            mocked.sum(),
            failOpen.sum(),
            malformed.sum(),
            holdNanos.sum(),
            holdSamples.sum(),
            Collections.unmodifiableMap(rejected)
        );
    }

    public record Snapshot(long submitted,
                           long paused,
                           long resumed,
                           long mocked,
                           long failOpen,
                           long malformed,
                           long holdNanosTotal,
                           long holdSamples,
                           Map<ResumeResult, Long> resumeRejected) {

        /** Flat counter view, keyed the way {@code /status} and the stats log print them. */
        public Map<String, Long> asCounters() {
            Map<String, Long> out = new LinkedHashMap<>();
            out.put("submitted", submitted);
            out.put("paused", paused);
            out.put("resumed", resumed);
            out.put("mocked", mocked);
            out.put("fail_open", failOpen);
            out.put("malformed", malformed);
            out.put("hold_nanos_total", holdNanosTotal);
            out.put("hold_samples", holdSamples);
            resumeRejected.forEach((k, v) -> out.put("resume_" + k.name().toLowerCase(Locale.ROOT), v));
            return out;
        }
    }
}
