package com.acme.devtools.flowtap.coordinator;

import com.acme.devtools.flowtap.flow.Flow;
import com.acme.devtools.flowtap.flow.FlowState;
import com.acme.devtools.flowtap.flow.FlowStore;
import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.RequestSnapshot;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.flow.ResumeResult;
import com.acme.devtools.flowtap.mock.MockQuery;
import com.acme.devtools.flowtap.mock.MockRule;
import com.acme.devtools.flowtap.mock.MockRuleRepository;
import com.acme.devtools.flowtap.telemetry.AtomicFlowMetrics;
import com.acme.devtools.flowtap.transport.api.FlowSubmission;
import com.acme.devtools.flowtap.transport.api.ResponseDecision;
import com.acme.devtools.flowtap.transport.api.SubmitOutcome;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowCoordinatorTest {

    private static final ResponseSnapshot LOGIN_OK = new ResponseSnapshot(200, "OK",
        Map.of("Content-Type", "application/json", "X-Trace", "t-1"), "{\"token\":\"abc\"}");

    @Test
    void recordingShouldCompleteAndPassThrough() {
        FlowCoordinator coordinator = coordinator(InterceptMode.RECORDING);

        SubmitOutcome outcome = coordinator.submit(submission("GET", "https://api.example.com/users", LOGIN_OK));

        SubmitOutcome.Immediate immediate = assertInstanceOf(SubmitOutcome.Immediate.class, outcome);
        assertTrue(immediate.value().isPassThrough());
        assertEquals(FlowState.COMPLETED, coordinator.store().get(outcome.flowId()).orElseThrow().state());
        assertEquals(0, coordinator.status().interceptedCount());
    }

    @Test
    void debugShouldPauseUntilResumedWithOverrides() throws Exception {
        FlowCoordinator coordinator = coordinator(InterceptMode.DEBUG);

        SubmitOutcome outcome = coordinator.submit(submission("POST", "https://api.example.com/login", LOGIN_OK));

        SubmitOutcome.Pending pending = assertInstanceOf(SubmitOutcome.Pending.class, outcome);
        assertEquals(FlowState.PAUSED, coordinator.store().get(pending.flowId()).orElseThrow().state());
        assertEquals(1, coordinator.status().interceptedCount());
        assertFalse(pending.decision().isDone());

        ResumeResult result = coordinator.resume(pending.flowId(),
            new ModifiedResponse(404, null, "{\"error\":\"not found\"}"));

        assertEquals(ResumeResult.RESUMED, result);
        ResponseDecision decision = pending.decision().get(2, TimeUnit.SECONDS);
        ResponseSnapshot delivered = decision.applyTo(LOGIN_OK);
        assertEquals(404, delivered.statusCode());
        assertEquals("{\"error\":\"not found\"}", delivered.body());
        assertEquals("application/json", delivered.contentType());
        assertEquals("t-1", delivered.header("X-Trace"));

        Flow flow = coordinator.store().get(pending.flowId()).orElseThrow();
        assertEquals(FlowState.COMPLETED, flow.state());
        assertTrue(flow.modified());
        assertEquals(ResumeResult.ALREADY_RESUMED, coordinator.resume(pending.flowId(), null));
        assertEquals(ResumeResult.UNKNOWN_FLOW, coordinator.resume("missing", null));
    }

    @Test
    void mockModeShouldAnswerFromMatchingRule() {
        FlowCoordinator coordinator = coordinator(InterceptMode.MOCK);
        MockRule rule = coordinator.rules().create("mocked users", "GET", "https://api.example.com/users?limit=10", 200, "[]");

        SubmitOutcome hit = coordinator.submit(submission("GET", "https://api.example.com/users?limit=10", LOGIN_OK));
        SubmitOutcome miss = coordinator.submit(submission("GET", "https://api.example.com/users?limit=20", LOGIN_OK));

        ResponseDecision decision = assertInstanceOf(SubmitOutcome.Immediate.class, hit).value();
        assertFalse(decision.isPassThrough());
        assertEquals(rule.id(), decision.mockRuleId());
        assertEquals("[]", decision.applyTo(LOGIN_OK).body());
        Flow mocked = coordinator.store().get(hit.flowId()).orElseThrow();
        assertEquals(FlowState.COMPLETED, mocked.state());
        assertEquals("mocked users", mocked.mockRuleName());
        assertEquals("[]", mocked.response().body());

        assertTrue(assertInstanceOf(SubmitOutcome.Immediate.class, miss).value().isPassThrough());
    }

    @Test
    void mockDebugShouldLayerOperatorOverridesOnMockResponse() throws Exception {
        FlowCoordinator coordinator = coordinator(InterceptMode.MOCK_DEBUG);
        coordinator.rules().create("mocked login", "POST", "https://api.example.com/login", 201, "{\"mock\":true}");

        SubmitOutcome outcome = coordinator.submit(submission("POST", "https://api.example.com/login", LOGIN_OK));
        SubmitOutcome.Pending pending = assertInstanceOf(SubmitOutcome.Pending.class, outcome);
        assertEquals("mocked login", coordinator.store().get(pending.flowId()).orElseThrow().mockRuleName());

        coordinator.resume(pending.flowId(), new ModifiedResponse(500, null, null));

        ResponseDecision decision = pending.decision().get(2, TimeUnit.SECONDS);
        ResponseSnapshot delivered = decision.applyTo(LOGIN_OK);
        assertEquals(500, delivered.statusCode());
        assertEquals("{\"mock\":true}", delivered.body());
        assertEquals("mocked login", decision.mockRuleName());
    }

    @Test
    void mockDebugTeardownShouldFailOpenToOriginal() throws Exception {
        FlowCoordinator coordinator = coordinator(InterceptMode.MOCK_DEBUG);
        coordinator.rules().create("mocked login", "POST", "https://api.example.com/login", 201, "{\"mock\":true}");
        SubmitOutcome outcome = coordinator.submit(submission("POST", "https://api.example.com/login", LOGIN_OK));

        coordinator.stop();

        assertTrue(outcome.decision().get(2, TimeUnit.SECONDS).isPassThrough());
    }

    @Test
    void stopShouldReleaseEveryPendingFlowUnmodified() throws Exception {
        FlowCoordinator coordinator = coordinator(InterceptMode.DEBUG);
        SubmitOutcome first = coordinator.submit(submission("GET", "https://api.example.com/a", LOGIN_OK));
        SubmitOutcome second = coordinator.submit(submission("GET", "https://api.example.com/b", LOGIN_OK));

        coordinator.stop();

        assertTrue(first.decision().get(2, TimeUnit.SECONDS).isPassThrough());
        assertTrue(second.decision().get(2, TimeUnit.SECONDS).isPassThrough());
        assertFalse(coordinator.isRunning());
        assertFalse(coordinator.ping());
        assertEquals(0, coordinator.status().interceptedCount());

        SubmitOutcome late = coordinator.submit(submission("GET", "https://api.example.com/c", LOGIN_OK));
        assertTrue(assertInstanceOf(SubmitOutcome.Immediate.class, late).value().isPassThrough());
        assertEquals(ResumeResult.ALREADY_RESUMED, coordinator.resume(first.flowId(), new ModifiedResponse(500, null, null)));
    }

    @Test
    void agentSideMockShouldBeRecordedAndTagged() {
        FlowCoordinator coordinator = coordinator(InterceptMode.DEBUG);
        FlowSubmission submission = submission("GET", "https://api.example.com/a", LOGIN_OK).withMock("r-9", "agent mock");

        SubmitOutcome outcome = coordinator.submit(submission);

        ResponseDecision decision = assertInstanceOf(SubmitOutcome.Immediate.class, outcome).value();
        assertTrue(decision.isPassThrough());
        assertEquals("r-9", decision.mockRuleId());
        Flow flow = coordinator.store().get(outcome.flowId()).orElseThrow();
        assertEquals(FlowState.COMPLETED, flow.state());
        assertTrue(flow.mockApplied());
    }

    @Test
    void switchingModeShouldLeavePausedFlowsWaiting() throws Exception {
        FlowCoordinator coordinator = coordinator(InterceptMode.DEBUG);
        SubmitOutcome paused = coordinator.submit(submission("GET", "https://api.example.com/a", LOGIN_OK));

        coordinator.switchMode(InterceptMode.RECORDING);
        SubmitOutcome recorded = coordinator.submit(submission("GET", "https://api.example.com/b", LOGIN_OK));

        assertInstanceOf(SubmitOutcome.Immediate.class, recorded);
        assertFalse(paused.decision().isDone());
        assertEquals(ResumeResult.RESUMED, coordinator.resume(paused.flowId(), null));
        assertTrue(paused.decision().get(2, TimeUnit.SECONDS).isPassThrough());
    }

    @Test
    void debugTimeoutShouldPassThroughAndCountFailOpen() throws Exception {
        AtomicFlowMetrics metrics = new AtomicFlowMetrics();
        FlowCoordinator coordinator = new FlowCoordinator(new FlowStore(), new MockRuleRepository(),
            InterceptMode.DEBUG, metrics, 50L);
        try {
            SubmitOutcome outcome = coordinator.submit(submission("GET", "https://api.example.com/a", LOGIN_OK));

            assertTrue(outcome.decision().get(5, TimeUnit.SECONDS).isPassThrough());
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (metrics.snapshot().failOpen() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1L, metrics.snapshot().failOpen());
            assertEquals(ResumeResult.ALREADY_RESUMED, coordinator.resume(outcome.flowId(), null));
        } finally {
            coordinator.stop();
        }
    }

    @Test
    void pauseShouldFailOpenWhenDebugTimerIsAlreadyShutDown() throws Exception {
        AtomicFlowMetrics metrics = new AtomicFlowMetrics();
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
        timer.shutdownNow();
        FlowCoordinator coordinator = new FlowCoordinator(new FlowStore(), new MockRuleRepository(),
            InterceptMode.DEBUG, metrics, 50L, timer);

        SubmitOutcome outcome = coordinator.submit(submission("GET", "https://api.example.com/a", LOGIN_OK));

        assertTrue(outcome.decision().get(5, TimeUnit.SECONDS).isPassThrough());
        assertEquals(1L, metrics.snapshot().failOpen());
        assertEquals(ResumeResult.ALREADY_RESUMED, coordinator.resume(outcome.flowId(), null));
        coordinator.stop();
    }

    @Test
    void queryMockShouldAnswerWithoutRecordingFlow() {
        FlowCoordinator coordinator = coordinator(InterceptMode.RECORDING);
        coordinator.rules().create("users", "GET", "https://api.example.com/users", 200, "[]");

        assertTrue(coordinator.queryMock(new MockQuery("GET", "api.example.com", "/users", Map.of())).isPresent());
        assertTrue(coordinator.queryMock(new MockQuery("GET", "api.example.com", "/other", Map.of())).isEmpty());
        assertEquals(0, coordinator.store().size());
    }

    @Test
    void statusShouldReportCountersAndPausedIds() {
        AtomicFlowMetrics metrics = new AtomicFlowMetrics();
        FlowCoordinator coordinator = new FlowCoordinator(new FlowStore(), new MockRuleRepository(),
            InterceptMode.DEBUG, metrics, 0L);
        SubmitOutcome outcome = coordinator.submit(submission("GET", "https://api.example.com/a", LOGIN_OK));

        CoordinatorStatus status = coordinator.status();

        assertTrue(status.running());
        assertEquals(InterceptMode.DEBUG, status.mode());
        assertEquals(List.of(outcome.flowId()), status.interceptedFlows());
        assertEquals(1L, status.counters().get("submitted"));
        assertEquals(1L, status.counters().get("paused"));
        coordinator.stop();
    }

    static FlowSubmission submission(String method, String url, ResponseSnapshot response) {
        URI uri = URI.create(url);
        String path = uri.getRawQuery() == null ? uri.getRawPath() : uri.getRawPath() + "?" + uri.getRawQuery();
        RequestSnapshot request = new RequestSnapshot(method, url, uri.getHost(), path,
            Map.of("Accept", "application/json"), "");
        return FlowSubmission.of(request, response, 12L);
    }

    private static FlowCoordinator coordinator(InterceptMode mode) {
        return new FlowCoordinator(new FlowStore(), new MockRuleRepository(), mode);
    }
}
