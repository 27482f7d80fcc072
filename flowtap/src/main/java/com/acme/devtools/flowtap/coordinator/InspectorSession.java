package com.acme.devtools.flowtap.coordinator;

import com.acme.devtools.flowtap.collab.AppInfo;
import com.acme.devtools.flowtap.collab.CertInstallResult;
import com.acme.devtools.flowtap.collab.DeviceAttachment;
import com.acme.devtools.flowtap.collab.DeviceCollaborators;
import com.acme.devtools.flowtap.collab.DeviceInfo;
import com.acme.devtools.flowtap.flow.FlowStore;
import com.acme.devtools.flowtap.mock.MockRuleRepository;
import com.acme.devtools.flowtap.telemetry.AtomicFlowMetrics;
import com.acme.devtools.flowtap.telemetry.PeriodicStatsReporter;
import com.acme.devtools.flowtap.transport.http.ControlHttpServer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One inspection session: flow store, rule set, coordinator and control server, created
 * together and torn down together. Nothing here is global, so tests and embedders can run
 * several sessions side by side.
 *
 * <p>{@link #stop()} detaches devices, releases every paused flow and only then closes the
 * control server, so no agent is left waiting on a channel that went away.
 */
public final class InspectorSession implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(InspectorSession.class.getName());

    private final SessionConfig config;
    private final DeviceCollaborators devices;
    private final FlowStore store;
    private final MockRuleRepository rules;
    private final AtomicFlowMetrics metrics;
    private final FlowCoordinator coordinator;
    private final ControlHttpServer server;
    private final Map<String, DeviceAttachment> attachments = new LinkedHashMap<>();

    private PeriodicStatsReporter reporter;
    private boolean started;
    private boolean stopped;

    public InspectorSession(SessionConfig config) {
        this(config, DeviceCollaborators.NONE);
    }

    public InspectorSession(SessionConfig config, DeviceCollaborators devices) {
        this.config = Objects.requireNonNull(config, "config");
        this.devices = Objects.requireNonNull(devices, "devices");
        this.store = new FlowStore(config.maxFlows());
        this.rules = new MockRuleRepository();
        this.metrics = new AtomicFlowMetrics();
        this.coordinator = new FlowCoordinator(store, rules, config.mode(), metrics, config.debugTimeoutMillis());
        this.server = new ControlHttpServer(config.controlHost(), config.controlPort(), coordinator, metrics);
    }

    public synchronized void start() throws Exception {
        if (stopped) {
            throw new IllegalStateException("session already stopped");
        }
        if (started) {
            return;
        }
        loadRules();
        server.start();
        if (config.statsIntervalSec() > 0) {
            reporter = new PeriodicStatsReporter(metrics, config.statsIntervalSec(), () -> Map.of(
                "paused_flows", store.pausedIds().size(),
                "stored_flows", store.size(),
                "rules", rules.size()
            ));
            reporter.start();
        }
        started = true;
        LOG.info(() -> "Inspector session started in " + coordinator.mode().wireName()
            + " mode, control port " + server.port());
    }

    /**
     * Makes {@code packageName} on {@code deviceId} send its traffic through the proxy agent:
     * installs the CA and enables redirection for the app's uid.
     *
     * @throws IllegalArgumentException when the device is unknown or offline, or the app is not installed
     * @throws IllegalStateException    when redirection could not be enabled
     */
    public synchronized DeviceAttachment attachDevice(String deviceId, String packageName) {
        if (!started || stopped) {
            throw new IllegalStateException("session not running");
        }
        DeviceInfo device = devices.discovery().listDevices().stream()
            .filter(d -> d.id().equals(deviceId))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("unknown device: " + deviceId));
        if (!device.online()) {
            throw new IllegalArgumentException("device offline: " + deviceId);
        }
        AppInfo app = devices.discovery().listApps(deviceId).stream()
            .filter(a -> a.packageName().equals(packageName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("app not installed on " + deviceId + ": " + packageName));

        DeviceAttachment previous = attachments.remove(deviceId);
        if (previous != null) {
            release(previous);
        }

        CertInstallResult certificate = devices.certificates().install(deviceId);
        if (!certificate.isUsable()) {
            LOG.warning("CA not installed on " + device.displayName() + "; HTTPS flows will not be readable");
        } else if (certificate == CertInstallResult.REQUIRES_MANUAL_INSTALL) {
            LOG.info(() -> "CA copied to " + device.displayName() + ", confirm it in the device settings");
        }

        int proxyPort = config.proxyPort();
        if (!devices.redirector().enable(deviceId, app.uid(), proxyPort)) {
            throw new IllegalStateException("traffic redirection failed for " + app.displayName() + " on " + deviceId);
        }
        DeviceAttachment attachment = new DeviceAttachment(device, app, proxyPort, certificate);
        attachments.put(deviceId, attachment);
        LOG.info(() -> "Attached " + app.displayName() + " (uid " + app.uid() + ") on " + device.displayName());
        return attachment;
    }

    public synchronized boolean detachDevice(String deviceId) {
        DeviceAttachment attachment = attachments.remove(deviceId);
        if (attachment == null) {
            return false;
        }
        release(attachment);
        return true;
    }

    public synchronized List<DeviceAttachment> attachments() {
        return List.copyOf(attachments.values());
    }

    public FlowCoordinator coordinator() {
        return coordinator;
    }

    public FlowStore store() {
        return store;
    }

    public MockRuleRepository rules() {
        return rules;
    }

    public AtomicFlowMetrics metrics() {
        return metrics;
    }

    public SessionConfig config() {
        return config;
    }

    public int controlPort() {
        return server.port();
    }

    public synchronized boolean isRunning() {
        return started && !stopped;
    }

    /**
     * Ends the session. Idempotent. Paused flows resolve unmodified before the control
     * server closes.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        for (DeviceAttachment attachment : List.copyOf(attachments.values())) {
            release(attachment);
        }
        attachments.clear();

        coordinator.stop();
        try {
            server.stop();
        } catch (Exception e) {
            LOG.fine("Shutdown: control server stop failed: " + e.getClass().getSimpleName());
        }
        if (reporter != null) {
            reporter.close();
            reporter = null;
        }
        if (started) {
            saveRules();
        }
        LOG.info("Inspector session stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void release(DeviceAttachment attachment) {
        String deviceId = attachment.device().id();
        try {
            if (!devices.redirector().disable(deviceId, attachment.app().uid(), attachment.proxyPort())) {
                LOG.warning("Traffic redirection could not be cleared on " + deviceId);
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Detach failed on " + deviceId, e);
        }
    }

    private void loadRules() throws IOException {
        Path file = config.rulesFile();
        if (file == null || !Files.exists(file)) {
            return;
        }
        rules.loadFrom(file);
    }

    private void saveRules() {
        Path file = config.rulesFile();
        if (file == null) {
            return;
        }
        try {
            rules.saveTo(file);
            LOG.fine(() -> "Saved " + rules.size() + " mock rule(s) to " + file);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not save mock rules to " + file, e);
        }
    }
}
