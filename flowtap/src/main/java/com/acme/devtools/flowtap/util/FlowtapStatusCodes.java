package com.acme.devtools.flowtap.util;

/**
 * HTTP status codes used by the control server, the control client and the proxy agent.
 */
public final class FlowtapStatusCodes {

    // ---- Success ----
    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int NO_CONTENT = 204;

    // ---- Client errors ----
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int CONFLICT = 409;

    // ---- Server errors ----
    public static final int INTERNAL_ERROR = 500;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int GATEWAY_TIMEOUT = 504;

    private FlowtapStatusCodes() {
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }
}
