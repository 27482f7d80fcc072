package com.acme.devtools.flowtap.transport.http;

import com.acme.devtools.flowtap.util.FlowtapDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.pool.ChannelPoolHandler;
import io.netty.channel.pool.SimpleChannelPool;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.FutureListener;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Asynchronous HTTP/1.1 client with one channel pool per {@code host:port}. Shared by the
 * control client and the proxy agent's upstream leg.
 */
public final class PooledHttpClient implements AutoCloseable {
    private static final int RESPONSE_LIMIT = FlowtapDefaults.CLIENT_RESPONSE_LIMIT;
    private static final String RESPONSE_HANDLER = "call-response";

    private final EventLoopGroup ioGroup;
    private final Bootstrap bootstrap;
    private final Semaphore inFlight;
    private final String userAgent;
    private final ConcurrentHashMap<String, SimpleChannelPool> pools = new ConcurrentHashMap<>();
    private volatile SslContext sslContext;

    public PooledHttpClient(String userAgent) {
        this(userAgent, FlowtapDefaults.DEFAULT_CLIENT_IO_THREADS, FlowtapDefaults.DEFAULT_CLIENT_MAX_INFLIGHT,
            FlowtapDefaults.DEFAULT_CONNECT_TIMEOUT_MS);
    }

    public PooledHttpClient(String userAgent, int ioThreads, int maxInFlight, int connectTimeoutMillis) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.inFlight = new Semaphore(Math.max(1, maxInFlight));
        int threads = ioThreads > 0 ? ioThreads : Math.max(2, Runtime.getRuntime().availableProcessors());
        this.ioGroup = new NioEventLoopGroup(threads);
        this.bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(1, connectTimeoutMillis));
    }

    /**
     * Sends {@code call}. A non-positive {@code timeoutMillis} waits for the response without
     * limit, which long polls rely on.
     */
    public CompletableFuture<HttpReply> send(HttpCall call, long timeoutMillis) {
        CompletableFuture<HttpReply> result = new CompletableFuture<>();
        if (!inFlight.tryAcquire()) {
            result.completeExceptionally(new IllegalStateException("too many in-flight requests"));
            return result;
        }
        URI target = call.uri();
        String host = target.getHost();
        if (host == null) {
            inFlight.release();
            result.completeExceptionally(new IllegalArgumentException("target host required: " + target));
            return result;
        }
        int port = resolvePort(target);
        boolean https = isHttps(target);
        SimpleChannelPool pool;
        try {
            pool = poolFor(host, port, https);
        } catch (RuntimeException e) {
            inFlight.release();
            result.completeExceptionally(e);
            return result;
        }

        AtomicReference<ScheduledFuture<?>> timeoutFutureRef = new AtomicReference<>();
        result.whenComplete((ignored, error) -> {
            ScheduledFuture<?> timeoutFuture = timeoutFutureRef.getAndSet(null);
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
            inFlight.release();
        });

        pool.acquire().addListener((FutureListener<Channel>) acquireFuture -> {
            if (!acquireFuture.isSuccess()) {
                result.completeExceptionally(acquireFuture.cause());
                return;
            }

            Channel ch = acquireFuture.getNow();
            ch.pipeline().addLast(RESPONSE_HANDLER, new CallResponseHandler(result, pool, ch));

            if (timeoutMillis > 0) {
                ScheduledFuture<?> timeoutFuture = ch.eventLoop().schedule(() -> {
                    if (result.completeExceptionally(new TimeoutException("response timeout after " + timeoutMillis + " ms"))) {
                        ch.close();
                    }
                }, timeoutMillis, TimeUnit.MILLISECONDS);
                timeoutFutureRef.set(timeoutFuture);
                if (result.isDone() && timeoutFutureRef.compareAndSet(timeoutFuture, null)) {
                    timeoutFuture.cancel(false);
                }
            }

            FullHttpRequest req = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.valueOf(call.method()),
                pathAndQuery(target),
                Unpooled.wrappedBuffer(call.body())
            );
            for (Map.Entry<String, String> e : call.headers().entrySet()) {
                req.headers().set(e.getKey(), e.getValue());
            }
            if (!req.headers().contains(HttpHeaderNames.HOST)) {
                req.headers().set(HttpHeaderNames.HOST, hostHeader(target));
            }
            if (!req.headers().contains(HttpHeaderNames.USER_AGENT)) {
                req.headers().set(HttpHeaderNames.USER_AGENT, userAgent);
            }
            req.headers().set(HttpHeaderNames.CONNECTION, "keep-alive");
            req.headers().remove(HttpHeaderNames.TRANSFER_ENCODING);
            req.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, call.body().length);
            ch.writeAndFlush(req).addListener((ChannelFutureListener) writeFuture -> {
                if (!writeFuture.isSuccess()) {
                    ReferenceCountUtil.safeRelease(req);
                    result.completeExceptionally(writeFuture.cause());
                    writeFuture.channel().close();
                }
            });
        });

        return result;
    }

    private SimpleChannelPool poolFor(String host, int port, boolean https) {
        String key = (https ? "https://" : "http://") + host + ":" + port;
        return pools.computeIfAbsent(key, k -> {
            Bootstrap perTarget = bootstrap.clone().remoteAddress(host, port);
            return new SimpleChannelPool(perTarget, new CallChannelPoolHandler(host, port, https));
        });
    }

    private SslContext sslContext() {
        SslContext ctx = sslContext;
        if (ctx == null) {
            synchronized (this) {
                ctx = sslContext;
                if (ctx == null) {
                    try {
                        ctx = SslContextBuilder.forClient().build();
                    } catch (Exception e) {
                        throw new IllegalStateException("Failed to build TLS context", e);
                    }
                    sslContext = ctx;
                }
            }
        }
        return ctx;
    }

    @Override
    public void close() {
        for (SimpleChannelPool pool : pools.values()) {
            pool.close();
        }
        pools.clear();
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private final class CallChannelPoolHandler implements ChannelPoolHandler {
        private final String host;
        private final int port;
        private final boolean https;

        CallChannelPoolHandler(String host, int port, boolean https) {
            this.host = host;
            this.port = port;
            this.https = https;
        }

        @Override
        public void channelCreated(Channel ch) {
            ChannelPipeline p = ch.pipeline();
            if (https) {
                p.addLast(sslContext().newHandler(ch.alloc(), host, port));
            }
            p.addLast(new HttpClientCodec());
            p.addLast(new HttpObjectAggregator(RESPONSE_LIMIT));
        }

        @Override
        public void channelAcquired(Channel ch) {
            // no-op
        }

        @Override
        public void channelReleased(Channel ch) {
            if (ch.pipeline().get(RESPONSE_HANDLER) != null) {
                ch.pipeline().remove(RESPONSE_HANDLER);
            }
        }
    }

    private static final class CallResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<HttpReply> result;
        private final SimpleChannelPool pool;
        private final Channel channel;

        private CallResponseHandler(CompletableFuture<HttpReply> result, SimpleChannelPool pool, Channel channel) {
            this.result = result;
            this.pool = pool;
            this.channel = channel;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            Map<String, String> headers = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : msg.headers()) {
                headers.merge(e.getKey(), e.getValue(), (a, b) -> a + ", " + b);
            }
            HttpReply reply = new HttpReply(
                msg.status().code(),
                msg.status().reasonPhrase(),
                headers,
                ByteBufUtil.getBytes(msg.content())
            );
            if (!HttpUtil.isKeepAlive(msg)) {
                channel.close();
            }
            pool.release(channel);
            result.complete(reply);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!result.isDone()) {
                result.completeExceptionally(new IllegalStateException("connection closed before response"));
            }
            ctx.fireChannelInactive();
        }
    }

    private static boolean isHttps(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    private static int resolvePort(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return isHttps(uri) ? FlowtapDefaults.HTTPS_DEFAULT_PORT : FlowtapDefaults.HTTP_DEFAULT_PORT;
    }

    static String pathAndQuery(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            return path + "?" + uri.getRawQuery();
        }
        return path;
    }

    private static String hostHeader(URI uri) {
        int port = resolvePort(uri);
        if ((isHttps(uri) && port == FlowtapDefaults.HTTPS_DEFAULT_PORT) || (!isHttps(uri) && port == FlowtapDefaults.HTTP_DEFAULT_PORT)) {
            return uri.getHost();
        }
        return uri.getHost() + ":" + port;
    }
}
