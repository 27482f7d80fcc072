package com.acme.devtools.flowtap.transport.wire;

/**
 * Thrown when a control-channel payload cannot be decoded. HTTP endpoints answer it with 400.
 */
public final class WireFormatException extends IllegalArgumentException {
    public WireFormatException(String message) {
        super(message);
    }

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
