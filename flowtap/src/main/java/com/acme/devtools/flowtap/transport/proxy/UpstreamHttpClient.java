package com.acme.devtools.flowtap.transport.proxy;

import com.acme.devtools.flowtap.transport.http.HttpCall;
import com.acme.devtools.flowtap.transport.http.HttpReply;
import com.acme.devtools.flowtap.transport.http.PooledHttpClient;
import com.acme.devtools.flowtap.util.FlowtapDefaults;

import java.net.ConnectException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

/**
 * Forwards proxied requests to their origin server.
 *
 * <p>Hop-by-hop headers are dropped and {@code Accept-Encoding} is removed so the origin
 * answers with an identity body the inspector can read. Idempotent requests are retried
 * when the connection could not be established.
 */
public final class UpstreamHttpClient implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(UpstreamHttpClient.class.getName());

    static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
        "connection",
        "keep-alive",
        "proxy-authenticate",
        "proxy-authorization",
        "proxy-connection",
        "te",
        "trailer",
        "transfer-encoding",
        "upgrade"
    );
    private static final Set<String> IDEMPOTENT_METHODS = Set.of("GET", "HEAD", "OPTIONS", "PUT", "DELETE");

    private final PooledHttpClient http;
    private final long timeoutMillis;
    private final int maxRetries;

    public UpstreamHttpClient() {
        this(FlowtapDefaults.DEFAULT_UPSTREAM_TIMEOUT_MS, FlowtapDefaults.DEFAULT_CONNECT_TIMEOUT_MS, 1);
    }

    public UpstreamHttpClient(long timeoutMillis, int connectTimeoutMillis, int maxRetries) {
        this.timeoutMillis = Math.max(1L, timeoutMillis);
        this.maxRetries = Math.max(0, maxRetries);
        this.http = new PooledHttpClient("flowtap-proxy/1",
            0,
            FlowtapDefaults.DEFAULT_CLIENT_MAX_INFLIGHT,
            connectTimeoutMillis);
    }

    public CompletableFuture<HttpReply> forward(String method, URI target, Map<String, String> headers, byte[] body) {
        HttpCall call = new HttpCall(method, target, forwardableHeaders(headers), body);
        boolean retryable = IDEMPOTENT_METHODS.contains(method.toUpperCase(Locale.ROOT));
        return attempt(call, retryable ? maxRetries : 0);
    }

    private CompletableFuture<HttpReply> attempt(HttpCall call, int retriesLeft) {
        return http.send(call, timeoutMillis)
            .handle((reply, error) -> {
                if (error == null) {
                    return CompletableFuture.completedFuture(reply);
                }
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                if (retriesLeft > 0 && cause instanceof ConnectException) {
                    LOG.fine(() -> "Retrying " + call.method() + " " + call.uri() + " after " + cause.getMessage());
                    return attempt(call, retriesLeft - 1);
                }
                return CompletableFuture.<HttpReply>failedFuture(cause);
            })
            .thenCompose(f -> f);
    }

    static Map<String, String> forwardableHeaders(Map<String, String> headers) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : headers.entrySet()) {
            String lower = e.getKey().toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lower) || "accept-encoding".equals(lower) || "content-length".equals(lower)) {
                continue;
            }
            out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    @Override
    public void close() {
        http.close();
    }
}
