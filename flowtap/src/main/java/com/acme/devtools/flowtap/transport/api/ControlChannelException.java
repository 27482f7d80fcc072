package com.acme.devtools.flowtap.transport.api;

/**
 * The control channel could not complete a call: coordinator unreachable, timed out, or
 * answered with an unexpected status. Capturing agents treat it as pass-through.
 */
public final class ControlChannelException extends RuntimeException {
    private final int statusCode;

    public ControlChannelException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public ControlChannelException(String message, int statusCode) {
        super(message + ", status=" + statusCode);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed call, 0 when no response arrived. */
    public int statusCode() {
        return statusCode;
    }
}
