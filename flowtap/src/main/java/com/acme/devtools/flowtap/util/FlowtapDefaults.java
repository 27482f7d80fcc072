package com.acme.devtools.flowtap.util;

/**
 * Default ports, timeouts and capacities.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class FlowtapDefaults {

    // ---- Ports ----
    public static final int DEFAULT_CONTROL_PORT = 8765;
    public static final int DEFAULT_PROXY_PORT = 8080;
    public static final String DEFAULT_PROXY_HOST = "0.0.0.0";
    public static final String DEFAULT_CONTROL_HOST = "127.0.0.1";

    // ---- Flow store ----
    public static final int DEFAULT_MAX_FLOWS = 1000;

    // ---- Debug mode: 0 waits until an operator resumes or the session stops ----
    public static final long DEFAULT_DEBUG_TIMEOUT_MS = 0L;

    // ---- Control client ----
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_RESPONSE_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_MOCK_QUERY_TIMEOUT_MS = 1_000;
    public static final int DEFAULT_CLIENT_IO_THREADS = 2;
    public static final int DEFAULT_CLIENT_MAX_INFLIGHT = 4096;

    // ---- In-process interceptor liveness cache ----
    public static final long PING_CACHE_MS = 5_000L;
    public static final int MAX_FAILED_PINGS = 3;

    // ---- Proxy agent ----
    public static final int DEFAULT_UPSTREAM_TIMEOUT_MS = 30_000;
    public static final int HTTP_DEFAULT_PORT = 80;
    public static final int HTTPS_DEFAULT_PORT = 443;

    // ---- Netty transport ----
    public static final int DEFAULT_SO_BACKLOG = 1024;
    public static final int MAX_CONTENT_LENGTH = 16 * 1024 * 1024;
    public static final int CLIENT_RESPONSE_LIMIT = 16 * 1024 * 1024;

    // ---- Stats reporter ----
    public static final int DEFAULT_STATS_LOG_INTERVAL_SEC = 60;

    private FlowtapDefaults() {
    }
}
