package com.acme.devtools.flowtap.coordinator;

import com.acme.devtools.flowtap.util.EnvVars;
import com.acme.devtools.flowtap.util.FlowtapDefaults;
import com.acme.devtools.flowtap.util.FlowtapEnvKeys;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for one {@link InspectorSession}.
 *
 * @param controlPort     0 binds an ephemeral port
 * @param rulesFile       loaded on start and written back on stop; {@code null} keeps rules in memory
 * @param statsIntervalSec 0 disables the periodic stats log
 */
public record SessionConfig(String controlHost,
                            int controlPort,
                            InterceptMode mode,
                            int maxFlows,
                            long debugTimeoutMillis,
                            Path rulesFile,
                            int proxyPort,
                            int statsIntervalSec) {

    public static final InterceptMode DEFAULT_MODE = InterceptMode.RECORDING;

    public SessionConfig {
        controlHost = controlHost == null || controlHost.isBlank() ? FlowtapDefaults.DEFAULT_CONTROL_HOST : controlHost;
        Objects.requireNonNull(mode, "mode");
        if (controlPort < 0 || controlPort > 65535) {
            throw new IllegalArgumentException("controlPort out of range: " + controlPort);
        }
        maxFlows = Math.max(1, maxFlows);
        debugTimeoutMillis = Math.max(0L, debugTimeoutMillis);
        statsIntervalSec = Math.max(0, statsIntervalSec);
    }

    public static SessionConfig defaults() {
        return fromEnv(Map.of());
    }

    public static SessionConfig fromEnv(Map<String, String> env) {
        String rules = EnvVars.getOrDefault(env, FlowtapEnvKeys.FLOWTAP_RULES_FILE, "");
        boolean statsEnabled = EnvVars.getBoolean(env, FlowtapEnvKeys.FLOWTAP_STATS_ENABLED, true);
        return new SessionConfig(
            EnvVars.getOrDefault(env, FlowtapEnvKeys.FLOWTAP_CONTROL_HOST, FlowtapDefaults.DEFAULT_CONTROL_HOST),
            EnvVars.getIntClamped(env, FlowtapEnvKeys.FLOWTAP_CONTROL_PORT, FlowtapDefaults.DEFAULT_CONTROL_PORT, 0, 65535),
            EnvVars.getEnum(env, FlowtapEnvKeys.FLOWTAP_MODE, InterceptMode.class, DEFAULT_MODE),
            EnvVars.getIntClamped(env, FlowtapEnvKeys.FLOWTAP_MAX_FLOWS, FlowtapDefaults.DEFAULT_MAX_FLOWS, 1, 1_000_000),
            EnvVars.getLongClamped(env, FlowtapEnvKeys.FLOWTAP_DEBUG_TIMEOUT_MS, FlowtapDefaults.DEFAULT_DEBUG_TIMEOUT_MS, 0L, 86_400_000L),
            rules.isBlank() ? null : Path.of(rules),
            EnvVars.getIntClamped(env, FlowtapEnvKeys.FLOWTAP_PROXY_PORT, FlowtapDefaults.DEFAULT_PROXY_PORT, 0, 65535),
            statsEnabled
                ? EnvVars.getIntClamped(env, FlowtapEnvKeys.FLOWTAP_STATS_LOG_INTERVAL_SEC, FlowtapDefaults.DEFAULT_STATS_LOG_INTERVAL_SEC, 1, 3600)
                : 0
        );
    }

    public SessionConfig withControlPort(int port) {
        return new SessionConfig(controlHost, port, mode, maxFlows, debugTimeoutMillis, rulesFile, proxyPort, statsIntervalSec);
    }

    public SessionConfig withMode(InterceptMode next) {
        return new SessionConfig(controlHost, controlPort, next, maxFlows, debugTimeoutMillis, rulesFile, proxyPort, statsIntervalSec);
    }

    public SessionConfig withRulesFile(Path file) {
        return new SessionConfig(controlHost, controlPort, mode, maxFlows, debugTimeoutMillis, file, proxyPort, statsIntervalSec);
    }
}
