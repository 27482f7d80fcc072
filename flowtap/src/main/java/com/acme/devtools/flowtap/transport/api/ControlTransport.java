package com.acme.devtools.flowtap.transport.api;

/**
 * SPI for network endpoints that carry control-channel traffic (the inspector's control
 * server, the proxy agent).
 *
 * <p>{@link #close()} delegates to {@link #stop()}. Implementations must tolerate multiple
 * stop/close calls without error.
 */
public interface ControlTransport extends AutoCloseable {
    /** Short name used in logs. */
    String name();

    /** Starts accepting connections. */
    void start() throws Exception;

    /** Stops accepting connections and releases the event loops. */
    void stop() throws Exception;

    /** Bound port, or the configured port before {@link #start()}. */
    int port();

    @Override
    default void close() throws Exception { stop(); }
}
