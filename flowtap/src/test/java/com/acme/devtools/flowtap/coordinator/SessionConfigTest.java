package com.acme.devtools.flowtap.coordinator;

import com.acme.devtools.flowtap.util.FlowtapDefaults;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SessionConfigTest {

    @Test
    void shouldUseDefaultsWhenEnvironmentIsEmpty() {
        SessionConfig config = SessionConfig.defaults();

        assertEquals(FlowtapDefaults.DEFAULT_CONTROL_HOST, config.controlHost());
        assertEquals(FlowtapDefaults.DEFAULT_CONTROL_PORT, config.controlPort());
        assertEquals(InterceptMode.RECORDING, config.mode());
        assertEquals(FlowtapDefaults.DEFAULT_MAX_FLOWS, config.maxFlows());
        assertNull(config.rulesFile());
    }

    @Test
    void shouldReadEnvironmentOverrides() {
        SessionConfig config = SessionConfig.fromEnv(Map.of(
            "FLOWTAP_CONTROL_PORT", "9001",
            "FLOWTAP_MODE", "mock_debug",
            "FLOWTAP_MAX_FLOWS", "50",
            "FLOWTAP_DEBUG_TIMEOUT_MS", "30000",
            "FLOWTAP_RULES_FILE", "/tmp/rules.json",
            "FLOWTAP_STATS_ENABLED", "false"
        ));

        assertEquals(9001, config.controlPort());
        assertEquals(InterceptMode.MOCK_DEBUG, config.mode());
        assertEquals(50, config.maxFlows());
        assertEquals(30_000L, config.debugTimeoutMillis());
        assertEquals(Path.of("/tmp/rules.json"), config.rulesFile());
        assertEquals(0, config.statsIntervalSec());
    }

    @Test
    void shouldRejectPortOutOfRange() {
        assertThrows(IllegalArgumentException.class,
            () -> new SessionConfig("127.0.0.1", 70000, InterceptMode.DEBUG, 10, 0L, null, 0, 0));
    }
}
