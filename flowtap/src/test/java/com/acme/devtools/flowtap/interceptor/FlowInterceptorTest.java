package com.acme.devtools.flowtap.interceptor;

import com.acme.devtools.flowtap.coordinator.FlowCoordinator;
import com.acme.devtools.flowtap.coordinator.InterceptMode;
import com.acme.devtools.flowtap.flow.FlowStore;
import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.RequestSnapshot;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.flow.ResumeResult;
import com.acme.devtools.flowtap.mock.MockQuery;
import com.acme.devtools.flowtap.mock.MockRuleRepository;
import com.acme.devtools.flowtap.telemetry.AtomicFlowMetrics;
import com.acme.devtools.flowtap.transport.api.ControlChannel;
import com.acme.devtools.flowtap.transport.api.ControlChannelException;
import com.acme.devtools.flowtap.transport.api.FlowSubmission;
import com.acme.devtools.flowtap.transport.api.MockDecision;
import com.acme.devtools.flowtap.transport.api.ResponseDecision;
import com.acme.devtools.flowtap.transport.api.SubmitOutcome;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowInterceptorTest {

    private static final RequestSnapshot REQUEST = new RequestSnapshot("GET", "https://api.example.com/users?limit=10",
        "api.example.com", "/users?limit=10", Map.of(), "");
    private static final ResponseSnapshot RESPONSE = new ResponseSnapshot(200, "OK",
        Map.of("Content-Type", "application/json"), "[{\"id\":1}]");

    @Test
    void shouldBlockUntilOperatorResumes() throws Exception {
        FlowCoordinator coordinator = new FlowCoordinator(new FlowStore(), new MockRuleRepository(), InterceptMode.DEBUG);
        FlowInterceptor interceptor = new FlowInterceptor(coordinator);
        ExecutorService app = Executors.newSingleThreadExecutor();
        try {
            Future<InterceptedExchange> call = app.submit(() -> interceptor.intercept(REQUEST, RESPONSE, 15L));

            String flowId = awaitPausedFlow(coordinator);
            assertFalse(call.isDone());
            assertEquals(ResumeResult.RESUMED, coordinator.resume(flowId, new ModifiedResponse(null, null, "[]")));

            InterceptedExchange exchange = call.get(5, TimeUnit.SECONDS);
            assertEquals(flowId, exchange.flowId());
            assertTrue(exchange.modified());
            assertEquals("[]", exchange.response().body());
            assertEquals(200, exchange.response().statusCode());
        } finally {
            app.shutdownNow();
            coordinator.stop();
        }
    }

    @Test
    void recordingShouldReturnOriginalResponse() {
        FlowCoordinator coordinator = new FlowCoordinator(new FlowStore(), new MockRuleRepository(), InterceptMode.RECORDING);

        InterceptedExchange exchange = new FlowInterceptor(coordinator).intercept(REQUEST, RESPONSE, 15L);

        assertSame(RESPONSE, exchange.response());
        assertFalse(exchange.modified());
        assertEquals(1, coordinator.store().size());
    }

    @Test
    void channelFailureShouldFailOpen() {
        AtomicFlowMetrics metrics = new AtomicFlowMetrics();
        FakeChannel channel = new FakeChannel(true);
        channel.submitFailure = new ControlChannelException("connection refused", new IllegalStateException());
        FlowInterceptor interceptor = new FlowInterceptor(channel, metrics, 1_000L, 3, () -> 0L);

        InterceptedExchange exchange = interceptor.intercept(REQUEST, RESPONSE, 15L);

        assertSame(RESPONSE, exchange.response());
        assertNull(exchange.flowId());
        assertEquals(1L, metrics.snapshot().failOpen());
    }

    @Test
    void failedDecisionShouldFailOpen() {
        FakeChannel channel = new FakeChannel(true);
        channel.pendingDecision = CompletableFuture.failedFuture(new ControlChannelException("await failed", 502));
        FlowInterceptor interceptor = new FlowInterceptor(channel, null, 1_000L, 3, () -> 0L);

        InterceptedExchange exchange = interceptor.intercept(REQUEST, RESPONSE, 15L);

        assertSame(RESPONSE, exchange.response());
        assertFalse(exchange.modified());
    }

    @Test
    void pingResultShouldBeCachedWithinWindow() {
        AtomicLong now = new AtomicLong(10_000L);
        FakeChannel channel = new FakeChannel(true);
        FlowInterceptor interceptor = new FlowInterceptor(channel, null, 5_000L, 3, now::get);

        interceptor.intercept(REQUEST, RESPONSE, 1L);
        now.addAndGet(4_999L);
        interceptor.intercept(REQUEST, RESPONSE, 1L);
        assertEquals(1, channel.pings.get());

        now.addAndGet(1L);
        interceptor.intercept(REQUEST, RESPONSE, 1L);
        assertEquals(2, channel.pings.get());
        assertEquals(3, channel.submits.get());
    }

    @Test
    void repeatedPingFailuresShouldSuspendUntilReset() {
        AtomicLong now = new AtomicLong();
        FakeChannel channel = new FakeChannel(false);
        FlowInterceptor interceptor = new FlowInterceptor(channel, null, 0L, 3, now::get);

        for (int i = 0; i < 5; i++) {
            interceptor.intercept(REQUEST, RESPONSE, 1L);
            now.addAndGet(10L);
        }
        assertEquals(3, channel.pings.get());
        assertEquals(0, channel.submits.get());

        channel.alive = true;
        interceptor.reset();
        interceptor.intercept(REQUEST, RESPONSE, 1L);

        assertEquals(4, channel.pings.get());
        assertEquals(1, channel.submits.get());
    }

    @Test
    void callersShouldNotWaitBehindSlowPing() throws Exception {
        FakeChannel channel = new FakeChannel(true);
        channel.pingGate = new CountDownLatch(1);
        FlowInterceptor interceptor = new FlowInterceptor(channel, null, 5_000L, 3, () -> 10_000L);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> slow = executor.submit(interceptor::coordinatorAvailable);
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (channel.pings.get() == 0 && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }

            assertFalse(interceptor.coordinatorAvailable());
            assertEquals(1, channel.pings.get());

            channel.pingGate.countDown();
            assertTrue(slow.get(5, TimeUnit.SECONDS));
            assertTrue(interceptor.coordinatorAvailable());
            assertEquals(1, channel.pings.get());
        } finally {
            channel.pingGate.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void disabledInterceptorShouldNotTouchChannel() {
        FakeChannel channel = new FakeChannel(true);
        FlowInterceptor interceptor = new FlowInterceptor(channel, null, 0L, 3, () -> 0L);
        interceptor.setEnabled(false);

        InterceptedExchange exchange = interceptor.intercept(REQUEST, RESPONSE, 1L);

        assertSame(RESPONSE, exchange.response());
        assertEquals(0, channel.pings.get());
        assertEquals(0, channel.submits.get());
        assertFalse(interceptor.isEnabled());
    }

    private static String awaitPausedFlow(FlowCoordinator coordinator) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (!coordinator.store().pausedIds().isEmpty()) {
                return coordinator.store().pausedIds().get(0);
            }
            Thread.sleep(5);
        }
        throw new AssertionError("no flow paused");
    }

    private static final class FakeChannel implements ControlChannel {
        private final AtomicInteger pings = new AtomicInteger();
        private final AtomicInteger submits = new AtomicInteger();
        private volatile boolean alive;
        private volatile CountDownLatch pingGate;
        private RuntimeException submitFailure;
        private CompletableFuture<ResponseDecision> pendingDecision;

        private FakeChannel(boolean alive) {
            this.alive = alive;
        }

        @Override
        public SubmitOutcome submit(FlowSubmission submission) {
            submits.incrementAndGet();
            if (submitFailure != null) {
                throw submitFailure;
            }
            if (pendingDecision != null) {
                return new SubmitOutcome.Pending("f-1", pendingDecision);
            }
            return new SubmitOutcome.Immediate(
                ResponseDecision.passThrough("f-" + submits.get()));
        }

        @Override
        public ResumeResult resume(String flowId, ModifiedResponse modifiedResponse) {
            return ResumeResult.UNKNOWN_FLOW;
        }

        @Override
        public Optional<MockDecision> queryMock(MockQuery query) {
            return Optional.empty();
        }

        @Override
        public boolean ping() {
            pings.incrementAndGet();
            CountDownLatch gate = pingGate;
            if (gate != null) {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return alive;
        }
    }
}
