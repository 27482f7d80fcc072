package com.acme.devtools.flowtap.transport.proxy;

import com.acme.devtools.flowtap.telemetry.AtomicFlowMetrics;
import com.acme.devtools.flowtap.telemetry.FlowMetrics;
import com.acme.devtools.flowtap.telemetry.NoopFlowMetrics;
import com.acme.devtools.flowtap.telemetry.PeriodicStatsReporter;
import com.acme.devtools.flowtap.transport.http.NettyControlClient;
import com.acme.devtools.flowtap.util.EnvVars;
import com.acme.devtools.flowtap.util.FlowtapDefaults;
import com.acme.devtools.flowtap.util.FlowtapEnvKeys;

import java.net.URI;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Launches the wire-level proxy agent.
 *
 * <p>Usage: {@code ProxyAgentMain [proxyPort] [controlPort]}. The control host and the
 * remaining knobs come from {@code FLOWTAP_*} environment variables.
 */
public final class ProxyAgentMain {
    private static final Logger LOG = Logger.getLogger(ProxyAgentMain.class.getName());

    private ProxyAgentMain() {}

    public static void main(String[] args) throws Exception {
        int proxyPort = args.length > 0
            ? Integer.parseInt(args[0])
            : EnvVars.getIntClamped(FlowtapEnvKeys.FLOWTAP_PROXY_PORT, FlowtapDefaults.DEFAULT_PROXY_PORT, 0, 65535);
        int controlPort = args.length > 1
            ? Integer.parseInt(args[1])
            : EnvVars.getIntClamped(FlowtapEnvKeys.FLOWTAP_CONTROL_PORT, FlowtapDefaults.DEFAULT_CONTROL_PORT, 1, 65535);
        String proxyHost = EnvVars.getOrDefault(FlowtapEnvKeys.FLOWTAP_PROXY_HOST, FlowtapDefaults.DEFAULT_PROXY_HOST);
        String controlHost = EnvVars.getOrDefault(FlowtapEnvKeys.FLOWTAP_CONTROL_HOST, FlowtapDefaults.DEFAULT_CONTROL_HOST);
        boolean mockFirst = EnvVars.getBoolean(FlowtapEnvKeys.FLOWTAP_PROXY_MOCK_FIRST, false);

        int connectTimeoutMs = EnvVars.getIntClamped(FlowtapEnvKeys.FLOWTAP_CLIENT_CONNECT_TIMEOUT_MS,
            FlowtapDefaults.DEFAULT_CONNECT_TIMEOUT_MS, 100, 60_000);
        int responseTimeoutMs = EnvVars.getIntClamped(FlowtapEnvKeys.FLOWTAP_CLIENT_RESPONSE_TIMEOUT_MS,
            FlowtapDefaults.DEFAULT_RESPONSE_TIMEOUT_MS, 100, 300_000);
        int upstreamTimeoutMs = EnvVars.getIntClamped(FlowtapEnvKeys.FLOWTAP_UPSTREAM_TIMEOUT_MS,
            FlowtapDefaults.DEFAULT_UPSTREAM_TIMEOUT_MS, 100, 600_000);

        boolean statsEnabled = EnvVars.getBoolean(FlowtapEnvKeys.FLOWTAP_STATS_ENABLED, true);
        FlowMetrics metrics = statsEnabled ? new AtomicFlowMetrics() : NoopFlowMetrics.INSTANCE;
        PeriodicStatsReporter reporter = null;
        if (metrics instanceof AtomicFlowMetrics atomicMetrics) {
            int intervalSec = EnvVars.getIntClamped(FlowtapEnvKeys.FLOWTAP_STATS_LOG_INTERVAL_SEC,
                FlowtapDefaults.DEFAULT_STATS_LOG_INTERVAL_SEC, 1, 3600);
            reporter = new PeriodicStatsReporter(atomicMetrics, intervalSec);
        }

        URI controlUri = URI.create("http://" + controlHost + ":" + controlPort);
        NettyControlClient client = new NettyControlClient(controlUri,
            responseTimeoutMs,
            FlowtapDefaults.DEFAULT_MOCK_QUERY_TIMEOUT_MS,
            connectTimeoutMs);
        UpstreamHttpClient upstream = new UpstreamHttpClient(upstreamTimeoutMs, connectTimeoutMs, 1);
        InterceptingProxyServer proxy = new InterceptingProxyServer(proxyHost, proxyPort, client, upstream, mockFirst, metrics);

        if (!client.ping()) {
            LOG.warning("Control channel " + controlUri + " is not answering yet; flows pass through until it does");
        }

        AtomicBoolean stopped = new AtomicBoolean(false);
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        PeriodicStatsReporter reporterRef = reporter;
        Runnable stopAndSignal = () -> {
            try {
                stopAll(proxy, upstream, client, reporterRef, stopped);
            } finally {
                shutdownLatch.countDown();
            }
        };
        Thread shutdownHook = new Thread(stopAndSignal, "flowtap-proxy-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            if (reporter != null) {
                reporter.start();
            }
            proxy.start();
            LOG.info(() -> "Proxy agent forwarding flows to " + controlUri);
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ignored) {
                // JVM is shutting down and hook is already in-flight.
            }
            stopAndSignal.run();
        }
    }

    private static void stopAll(InterceptingProxyServer proxy,
                                UpstreamHttpClient upstream,
                                NettyControlClient client,
                                PeriodicStatsReporter reporter,
                                AtomicBoolean stopped) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        try {
            proxy.stop();
        } catch (Exception e) {
            LOG.fine("Shutdown: proxy stop failed: " + e.getClass().getSimpleName());
        }
        try {
            upstream.close();
        } catch (Exception e) {
            LOG.fine("Shutdown: upstream stop failed: " + e.getClass().getSimpleName());
        }
        try {
            client.close();
        } catch (Exception e) {
            LOG.fine("Shutdown: control client stop failed: " + e.getClass().getSimpleName());
        }
        if (reporter != null) {
            try {
                reporter.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: reporter stop failed: " + e.getClass().getSimpleName());
            }
        }
    }
}
