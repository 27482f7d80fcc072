package com.acme.devtools.flowtap.coordinator;

import com.acme.devtools.flowtap.flow.Flow;
import com.acme.devtools.flowtap.flow.FlowStore;
import com.acme.devtools.flowtap.flow.FlowStoreException;
import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.ResumeResult;
import com.acme.devtools.flowtap.mock.MockMatch;
import com.acme.devtools.flowtap.mock.MockQuery;
import com.acme.devtools.flowtap.mock.MockRuleEngine;
import com.acme.devtools.flowtap.mock.MockRuleRepository;
import com.acme.devtools.flowtap.telemetry.AtomicFlowMetrics;
import com.acme.devtools.flowtap.telemetry.FlowMetrics;
import com.acme.devtools.flowtap.telemetry.NoopFlowMetrics;
import com.acme.devtools.flowtap.transport.api.ControlChannel;
import com.acme.devtools.flowtap.transport.api.FlowSubmission;
import com.acme.devtools.flowtap.transport.api.MockDecision;
import com.acme.devtools.flowtap.transport.api.ResponseDecision;
import com.acme.devtools.flowtap.transport.api.SubmitOutcome;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns flow lifecycle and mode dispatch. Implements {@link ControlChannel} in-process; the
 * HTTP control server delegates to it, so the coordinator never knows which adapter
 * captured a flow.
 *
 * <p>Paused flows are released by {@link #resume}, by the optional debug timeout, or by
 * {@link #stop()}, which resolves every waiter unmodified.
 */
public final class FlowCoordinator implements ControlChannel, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(FlowCoordinator.class.getName());

    private final FlowStore store;
    private final MockRuleRepository rules;
    private final MockRuleEngine engine;
    private final FlowMetrics metrics;
    private final long debugTimeoutMillis;
    private final ScheduledExecutorService timeouts;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Map<String, ModifiedResponse> mockBases = new ConcurrentHashMap<>();
    private final Map<String, Long> pausedAtNanos = new ConcurrentHashMap<>();
    private volatile InterceptMode mode;

    public FlowCoordinator(FlowStore store, MockRuleRepository rules, InterceptMode mode) {
        this(store, rules, mode, NoopFlowMetrics.INSTANCE, 0L);
    }

    public FlowCoordinator(FlowStore store,
                           MockRuleRepository rules,
                           InterceptMode mode,
                           FlowMetrics metrics,
                           long debugTimeoutMillis) {
        this.store = Objects.requireNonNull(store, "store");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.engine = new MockRuleEngine(rules);
        this.mode = Objects.requireNonNull(mode, "mode");
        this.metrics = metrics == null ? NoopFlowMetrics.INSTANCE : metrics;
        this.debugTimeoutMillis = Math.max(0L, debugTimeoutMillis);
        this.timeouts = this.debugTimeoutMillis > 0 ? Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flowtap-debug-timeout");
            t.setDaemon(true);
            return t;
        }) : null;
    }

    FlowCoordinator(FlowStore store,
                    MockRuleRepository rules,
                    InterceptMode mode,
                    FlowMetrics metrics,
                    long debugTimeoutMillis,
                    ScheduledExecutorService timeouts) {
        this.store = Objects.requireNonNull(store, "store");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.engine = new MockRuleEngine(rules);
        this.mode = Objects.requireNonNull(mode, "mode");
        this.metrics = metrics == null ? NoopFlowMetrics.INSTANCE : metrics;
        this.debugTimeoutMillis = Math.max(1L, debugTimeoutMillis);
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
    }

    public FlowStore store() {
        return store;
    }

    public MockRuleRepository rules() {
        return rules;
    }

    public InterceptMode mode() {
        return mode;
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Applies to submissions received from now on; paused flows keep waiting. */
    public void switchMode(InterceptMode next) {
        InterceptMode previous = mode;
        mode = Objects.requireNonNull(next, "mode");
        if (previous != next) {
            LOG.info(() -> "Intercept mode " + previous.wireName() + " -> " + next.wireName());
        }
    }

    @Override
    public SubmitOutcome submit(FlowSubmission submission) {
        metrics.incSubmitted();
        if (!running.get()) {
            return new SubmitOutcome.Immediate(ResponseDecision.passThrough(submission.flowId()));
        }
        if (submission.mockApplied()) {
            String id = store.create(submission.toCapture());
            store.tag(id, submission.mockRuleId(), submission.mockRuleName());
            store.complete(id);
            return new SubmitOutcome.Immediate(
                new ResponseDecision(id, ModifiedResponse.PASS_THROUGH, submission.mockRuleId(), submission.mockRuleName()));
        }
        InterceptMode current = mode;
        return switch (current) {
            case RECORDING -> record(submission);
            case MOCK -> mock(submission);
            case DEBUG -> pause(store.create(submission.toCapture()));
            case MOCK_DEBUG -> mockThenPause(submission);
        };
    }

    private SubmitOutcome record(FlowSubmission submission) {
        String id = store.create(submission.toCapture());
        store.complete(id);
        return new SubmitOutcome.Immediate(ResponseDecision.passThrough(id));
    }

    private SubmitOutcome mock(FlowSubmission submission) {
        Optional<MockMatch> match = engine.match(submission.request());
        if (match.isEmpty()) {
            return record(submission);
        }
        MockMatch m = match.get();
        String id = store.create(submission.toCapture());
        store.tag(id, m.rule().id(), m.rule().name());
        store.replaceResponse(id, m.response());
        ModifiedResponse modification = m.modifiedResponse();
        store.complete(id, modification);
        metrics.incMocked();
        LOG.fine(() -> "Flow " + id + " answered by mock rule " + m.rule().name());
        return new SubmitOutcome.Immediate(new ResponseDecision(id, modification, m.rule().id(), m.rule().name()));
    }

    private SubmitOutcome mockThenPause(FlowSubmission submission) {
        String id = store.create(submission.toCapture());
        engine.match(submission.request()).ifPresent(m -> {
            mockBases.put(id, m.modifiedResponse());
            store.tag(id, m.rule().id(), m.rule().name());
            store.replaceResponse(id, m.response());
            metrics.incMocked();
        });
        return pause(id);
    }

    private SubmitOutcome pause(String id) {
        CompletableFuture<ModifiedResponse> resolution;
        try {
            resolution = store.pause(id);
        } catch (FlowStoreException e) {
            LOG.log(Level.WARNING, "Cannot pause flow " + id + ", passing through", e);
            mockBases.remove(id);
            metrics.incFailOpen();
            return new SubmitOutcome.Immediate(ResponseDecision.passThrough(id));
        }
        metrics.incPaused();
        pausedAtNanos.put(id, System.nanoTime());
        if (!running.get()) {
            // stop() ran between the running check and the pause
            store.cancelAll("coordinator stopped");
        } else if (timeouts != null) {
            scheduleExpiry(id);
        }
        LOG.info(() -> "Flow " + id + " paused for inspection");
        return new SubmitOutcome.Pending(id, decisionFor(id, resolution));
    }

    private CompletableFuture<ResponseDecision> decisionFor(String id, CompletableFuture<ModifiedResponse> resolution) {
        return resolution.thenApply(applied -> {
            mockBases.remove(id);
            Long pausedAt = pausedAtNanos.remove(id);
            if (pausedAt != null) {
                metrics.observeHoldNanos(System.nanoTime() - pausedAt);
            }
            store.complete(id);
            Optional<Flow> flow = store.get(id);
            return new ResponseDecision(id, applied,
                flow.map(Flow::mockRuleId).orElse(null),
                flow.map(Flow::mockRuleName).orElse(null));
        });
    }

    private void scheduleExpiry(String id) {
        try {
            timeouts.schedule(() -> expire(id), debugTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // timer already shut down by stop(); release instead of holding without a deadline
            if (store.resume(id, ModifiedResponse.PASS_THROUGH).isSuccess()) {
                metrics.incFailOpen();
                LOG.warning(() -> "Flow " + id + " passed through, debug timer unavailable");
            }
        }
    }

    private void expire(String id) {
        ResumeResult result = store.resume(id, ModifiedResponse.PASS_THROUGH);
        if (result.isSuccess()) {
            metrics.incFailOpen();
            LOG.warning(() -> "Flow " + id + " not resumed within " + debugTimeoutMillis + " ms, passing through");
        }
    }

    /**
     * The decision of a known flow, completing when the flow is resolved. Empty for unknown ids.
     */
    public Optional<CompletableFuture<ResponseDecision>> awaitDecision(String flowId) {
        return store.resolution(flowId).map(resolution -> decisionFor(flowId, resolution));
    }

    @Override
    public ResumeResult resume(String flowId, ModifiedResponse modifiedResponse) {
        ModifiedResponse effective = modifiedResponse;
        ModifiedResponse base = flowId == null ? null : mockBases.get(flowId);
        if (base != null) {
            effective = base.overriddenBy(modifiedResponse);
        }
        ResumeResult result = store.resume(flowId, effective);
        if (result.isSuccess()) {
            metrics.incResumed();
            ModifiedResponse applied = effective;
            LOG.info(() -> "Flow " + flowId + " resumed" + (applied == null || applied.isPassThrough() ? "" : " with modifications"));
        } else {
            metrics.incResumeRejected(result);
            LOG.fine(() -> "Resume of flow " + flowId + " ignored: " + result);
        }
        return result;
    }

    @Override
    public Optional<MockDecision> queryMock(MockQuery query) {
        if (!running.get()) {
            return Optional.empty();
        }
        Optional<MockDecision> decision = engine.match(query).map(MockDecision::of);
        decision.ifPresent(ignored -> metrics.incMocked());
        return decision;
    }

    @Override
    public boolean ping() {
        return running.get();
    }

    public CoordinatorStatus status() {
        Map<String, Long> counters = metrics instanceof AtomicFlowMetrics atomic
            ? atomic.snapshot().asCounters()
            : Map.of();
        return new CoordinatorStatus(running.get(), mode, store.pausedIds(), store.size(), rules.size(), counters);
    }

    /**
     * Stops accepting new pauses and releases every paused flow unmodified. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        int released = store.cancelAll("coordinator stopped");
        if (timeouts != null) {
            timeouts.shutdownNow();
        }
        LOG.info(() -> "Flow coordinator stopped, released " + released + " paused flow(s)");
    }

    @Override
    public void close() {
        stop();
    }
}
