package com.acme.devtools.flowtap.interceptor;

import com.acme.devtools.flowtap.flow.RequestSnapshot;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.telemetry.FlowMetrics;
import com.acme.devtools.flowtap.telemetry.NoopFlowMetrics;
import com.acme.devtools.flowtap.transport.api.ControlChannel;
import com.acme.devtools.flowtap.transport.api.FlowSubmission;
import com.acme.devtools.flowtap.transport.api.ResponseDecision;
import com.acme.devtools.flowtap.transport.api.SubmitOutcome;
import com.acme.devtools.flowtap.util.FlowtapDefaults;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process adapter for an application's HTTP client: offers every completed exchange to
 * the coordinator and blocks the calling thread while the flow is paused.
 *
 * <p>Never breaks the application. Any channel failure returns the original response. The
 * coordinator's liveness is cached for a few seconds, and after repeated failed pings the
 * interceptor stops calling it until {@link #reset()}.
 */
public final class FlowInterceptor {
    private static final Logger LOG = Logger.getLogger(FlowInterceptor.class.getName());

    private final ControlChannel channel;
    private final FlowMetrics metrics;
    private final long pingCacheMillis;
    private final int maxFailedPings;
    private final LongSupplier clock;

    private volatile boolean enabled = true;

    private final Object livenessLock = new Object();
    private boolean pinged;
    private long lastPingAt;
    private boolean lastPingResult;
    private int failedPings;
    private boolean pingInFlight;

    public FlowInterceptor(ControlChannel channel) {
        this(channel, NoopFlowMetrics.INSTANCE, FlowtapDefaults.PING_CACHE_MS, FlowtapDefaults.MAX_FAILED_PINGS,
            System::currentTimeMillis);
    }

    public FlowInterceptor(ControlChannel channel,
                           FlowMetrics metrics,
                           long pingCacheMillis,
                           int maxFailedPings,
                           LongSupplier clock) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.metrics = metrics == null ? NoopFlowMetrics.INSTANCE : metrics;
        this.pingCacheMillis = Math.max(0L, pingCacheMillis);
        this.maxFailedPings = Math.max(1, maxFailedPings);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        LOG.info(() -> "Flow interceptor " + (enabled ? "enabled" : "disabled"));
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Forgets cached liveness and the failed-ping count. */
    public void reset() {
        synchronized (livenessLock) {
            pinged = false;
            failedPings = 0;
            lastPingResult = false;
        }
    }

    /**
     * Offers the exchange and returns the response the application should see.
     */
    public InterceptedExchange intercept(RequestSnapshot request, ResponseSnapshot response, long durationMillis) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(response, "response");
        if (!enabled || !coordinatorAvailable()) {
            return InterceptedExchange.bypassed(response);
        }
        try {
            SubmitOutcome outcome = channel.submit(FlowSubmission.of(request, response, durationMillis));
            ResponseDecision decision;
            if (outcome instanceof SubmitOutcome.Immediate immediate) {
                decision = immediate.value();
            } else {
                LOG.fine(() -> "Waiting for resume of flow " + outcome.flowId());
                decision = outcome.decision().get();
            }
            ResponseSnapshot applied = decision.applyTo(response);
            return new InterceptedExchange(decision.flowId(), applied, !decision.isPassThrough());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.incFailOpen();
            LOG.warning(() -> "Interrupted while waiting for resume, using original response for " + request.shortUrl());
            return InterceptedExchange.bypassed(response);
        } catch (ExecutionException | RuntimeException e) {
            metrics.incFailOpen();
            LOG.log(Level.WARNING, "Control channel failure, using original response for " + request.shortUrl(), e);
            return InterceptedExchange.bypassed(response);
        }
    }

    /**
     * Cached liveness of the control channel. The ping runs outside the lock; callers arriving
     * while it is in flight get the previous result.
     */
    boolean coordinatorAvailable() {
        long now;
        synchronized (livenessLock) {
            if (failedPings >= maxFailedPings) {
                return false;
            }
            now = clock.getAsLong();
            if (pingInFlight || (pinged && now - lastPingAt < pingCacheMillis)) {
                return lastPingResult;
            }
            pingInFlight = true;
        }
        boolean alive = false;
        try {
            alive = channel.ping();
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "Control ping failed", e);
        } finally {
            publishPing(now, alive);
        }
        return alive;
    }

    private void publishPing(long pingedAt, boolean alive) {
        synchronized (livenessLock) {
            pingInFlight = false;
            if (alive) {
                failedPings = 0;
            } else {
                failedPings++;
                if (failedPings >= maxFailedPings) {
                    LOG.warning(() -> "Coordinator unreachable after " + maxFailedPings + " attempts, interception suspended");
                }
            }
            pinged = true;
            lastPingAt = pingedAt;
            lastPingResult = alive;
        }
    }
}
