package com.acme.devtools.flowtap.coordinator;

import com.acme.devtools.flowtap.transport.api.ControlTransport;
import com.acme.devtools.flowtap.transport.proxy.InterceptingProxyServer;
import com.acme.devtools.flowtap.transport.proxy.UpstreamHttpClient;
import com.acme.devtools.flowtap.util.EnvVars;
import com.acme.devtools.flowtap.util.FlowtapDefaults;
import com.acme.devtools.flowtap.util.FlowtapEnvKeys;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Launches an inspector session.
 *
 * <p>Usage: {@code FlowtapMain [controlPort] [mode]}. With {@code FLOWTAP_PROXY_ENABLED=true}
 * an in-process proxy agent is started as well and talks to the coordinator directly.
 */
public final class FlowtapMain {
    private static final Logger LOG = Logger.getLogger(FlowtapMain.class.getName());

    private FlowtapMain() {}

    public static void main(String[] args) throws Exception {
        SessionConfig config = SessionConfig.fromEnv(System.getenv());
        if (args.length > 0) {
            config = config.withControlPort(Integer.parseInt(args[0]));
        }
        if (args.length > 1) {
            config = config.withMode(InterceptMode.parse(args[1]));
        }

        InspectorSession session = new InspectorSession(config);

        InterceptingProxyServer proxy = null;
        UpstreamHttpClient upstream = null;
        if (EnvVars.getBoolean(FlowtapEnvKeys.FLOWTAP_PROXY_ENABLED, false)) {
            int upstreamTimeoutMs = EnvVars.getIntClamped(FlowtapEnvKeys.FLOWTAP_UPSTREAM_TIMEOUT_MS,
                FlowtapDefaults.DEFAULT_UPSTREAM_TIMEOUT_MS, 100, 600_000);
            upstream = new UpstreamHttpClient(upstreamTimeoutMs, FlowtapDefaults.DEFAULT_CONNECT_TIMEOUT_MS, 1);
            proxy = new InterceptingProxyServer(
                EnvVars.getOrDefault(FlowtapEnvKeys.FLOWTAP_PROXY_HOST, FlowtapDefaults.DEFAULT_PROXY_HOST),
                config.proxyPort(),
                session.coordinator(),
                upstream,
                EnvVars.getBoolean(FlowtapEnvKeys.FLOWTAP_PROXY_MOCK_FIRST, false),
                session.metrics()
            );
        }

        AtomicBoolean stopped = new AtomicBoolean(false);
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        InterceptingProxyServer proxyRef = proxy;
        UpstreamHttpClient upstreamRef = upstream;
        Runnable stopAndSignal = () -> {
            try {
                stopAll(session, proxyRef, upstreamRef, stopped);
            } finally {
                shutdownLatch.countDown();
            }
        };
        Thread shutdownHook = new Thread(stopAndSignal, "flowtap-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            startWithRollback(session, proxy, stopAndSignal);
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

    /**
     * Starts the session, then the optional proxy. A proxy that fails to bind rolls the
     * session back so no half-started process lingers.
     */
    static void startWithRollback(InspectorSession session,
                                  ControlTransport proxy,
                                  Runnable rollback) throws Exception {
        session.start();
        if (proxy == null) {
            return;
        }
        try {
            proxy.start();
        } catch (Exception proxyStartError) {
            rollback.run();
            throw proxyStartError;
        }
    }

    private static void stopAll(InspectorSession session,
                                InterceptingProxyServer proxy,
                                UpstreamHttpClient upstream,
                                AtomicBoolean stopped) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        // Paused flows must resolve before the proxy drops its client connections.
        try {
            session.coordinator().stop();
        } catch (Exception e) {
            LOG.fine("Shutdown: coordinator stop failed: " + e.getClass().getSimpleName());
        }
        if (proxy != null) {
            try {
                proxy.stop();
            } catch (Exception e) {
                LOG.fine("Shutdown: proxy stop failed: " + e.getClass().getSimpleName());
            }
        }
        if (upstream != null) {
            try {
                upstream.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: upstream stop failed: " + e.getClass().getSimpleName());
            }
        }
        try {
            session.stop();
        } catch (Exception e) {
            LOG.fine("Shutdown: session stop failed: " + e.getClass().getSimpleName());
        }
    }
}
