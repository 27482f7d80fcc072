package com.acme.devtools.flowtap.telemetry;

import com.acme.devtools.flowtap.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs flow counters as one JSON line per interval.
 */
public final class PeriodicStatsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicStatsReporter.class.getName());

    private final AtomicFlowMetrics metrics;
    private final Supplier<Map<String, Object>> gaugesSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicStatsReporter(AtomicFlowMetrics metrics, long intervalSeconds) {
        this(metrics, intervalSeconds, () -> Map.of());
    }

    public PeriodicStatsReporter(AtomicFlowMetrics metrics,
                                 long intervalSeconds,
                                 Supplier<Map<String, Object>> gaugesSupplier) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.gaugesSupplier = gaugesSupplier == null ? (() -> Map.of()) : gaugesSupplier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "flowtap-stats-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "flowtap");
        payload.put("type", "flow_stats");
        payload.putAll(metrics.snapshot().asCounters());
        Map<String, Object> gauges = gaugesSupplier.get();
        if (gauges != null && !gauges.isEmpty()) {
            payload.put("gauges", gauges);
        }
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            LOG.warning("Stats reporter failure: " + t.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
