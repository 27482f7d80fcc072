package com.acme.devtools.flowtap.util;

/**
 * Canonical environment variable names read by the launchers.
 */
public final class FlowtapEnvKeys {
    public static final String FLOWTAP_CONTROL_HOST = "FLOWTAP_CONTROL_HOST";
    public static final String FLOWTAP_CONTROL_PORT = "FLOWTAP_CONTROL_PORT";
    public static final String FLOWTAP_MODE = "FLOWTAP_MODE";
    public static final String FLOWTAP_MAX_FLOWS = "FLOWTAP_MAX_FLOWS";
    public static final String FLOWTAP_DEBUG_TIMEOUT_MS = "FLOWTAP_DEBUG_TIMEOUT_MS";
    public static final String FLOWTAP_RULES_FILE = "FLOWTAP_RULES_FILE";

    public static final String FLOWTAP_PROXY_ENABLED = "FLOWTAP_PROXY_ENABLED";
    public static final String FLOWTAP_PROXY_HOST = "FLOWTAP_PROXY_HOST";
    public static final String FLOWTAP_PROXY_PORT = "FLOWTAP_PROXY_PORT";
    public static final String FLOWTAP_PROXY_MOCK_FIRST = "FLOWTAP_PROXY_MOCK_FIRST";
    public static final String FLOWTAP_UPSTREAM_TIMEOUT_MS = "FLOWTAP_UPSTREAM_TIMEOUT_MS";

    public static final String FLOWTAP_CLIENT_CONNECT_TIMEOUT_MS = "FLOWTAP_CLIENT_CONNECT_TIMEOUT_MS";
    public static final String FLOWTAP_CLIENT_RESPONSE_TIMEOUT_MS = "FLOWTAP_CLIENT_RESPONSE_TIMEOUT_MS";

    public static final String FLOWTAP_STATS_ENABLED = "FLOWTAP_STATS_ENABLED";
    public static final String FLOWTAP_STATS_LOG_INTERVAL_SEC = "FLOWTAP_STATS_LOG_INTERVAL_SEC";

    private FlowtapEnvKeys() {
    }
}
