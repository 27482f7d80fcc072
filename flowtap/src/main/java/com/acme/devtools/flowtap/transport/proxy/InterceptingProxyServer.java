package com.acme.devtools.flowtap.transport.proxy;

import com.acme.devtools.flowtap.flow.RequestSnapshot;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.mock.MockQuery;
import com.acme.devtools.flowtap.telemetry.FlowMetrics;
import com.acme.devtools.flowtap.telemetry.NoopFlowMetrics;
import com.acme.devtools.flowtap.transport.api.ControlChannel;
import com.acme.devtools.flowtap.transport.api.ControlTransport;
import com.acme.devtools.flowtap.transport.api.FlowSubmission;
import com.acme.devtools.flowtap.transport.api.MockDecision;
import com.acme.devtools.flowtap.transport.api.ResponseDecision;
import com.acme.devtools.flowtap.transport.http.HttpReply;
import com.acme.devtools.flowtap.util.FlowtapDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;

import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wire-level capture agent: an HTTP forward proxy that offers every exchange to a
 * {@link ControlChannel}.
 *
 * <p>While a flow is paused the client connection stops reading (auto-read off) and resumes
 * once the decision arrives. Control-channel calls run on a dedicated executor so the event
 * loop never blocks. Failures fail open: the original upstream response is returned, or
 * {@code 502} when the origin could not be reached. {@code CONNECT} requests are tunnelled
 * opaquely.
 */
public final class InterceptingProxyServer implements ControlTransport {
    private static final Logger LOG = Logger.getLogger(InterceptingProxyServer.class.getName());
    private static final HttpResponseStatus CONNECTION_ESTABLISHED = new HttpResponseStatus(200, "Connection established");
    private static final String CODEC = "codec";
    private static final String AGGREGATOR = "aggregator";
    private static final String HANDLER = "proxy";

    private final String host;
    private final int port;
    private final ControlChannel channel;
    private final UpstreamHttpClient upstream;
    private final boolean mockFirst;
    private final FlowMetrics metrics;

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile ExecutorService controlExecutor;
    private volatile Channel serverChannel;

    public InterceptingProxyServer(int port, ControlChannel channel, UpstreamHttpClient upstream) {
        this(FlowtapDefaults.DEFAULT_PROXY_HOST, port, channel, upstream, false, NoopFlowMetrics.INSTANCE);
    }

    public InterceptingProxyServer(String host,
                                   int port,
                                   ControlChannel channel,
                                   UpstreamHttpClient upstream,
                                   boolean mockFirst,
                                   FlowMetrics metrics) {
        this.host = host == null || host.isBlank() ? FlowtapDefaults.DEFAULT_PROXY_HOST : host;
        this.port = port;
        this.channel = Objects.requireNonNull(channel, "channel");
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.mockFirst = mockFirst;
        this.metrics = metrics == null ? NoopFlowMetrics.INSTANCE : metrics;
    }

    @Override
    public String name() {
        return "intercepting-proxy";
    }

    @Override
    public int port() {
        Channel ch = serverChannel;
        if (ch != null && ch.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return port;
    }

    @Override
    public synchronized void start() throws Exception {
        if (serverChannel != null) {
            return;
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        AtomicInteger threadIds = new AtomicInteger();
        controlExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "flowtap-proxy-control-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, FlowtapDefaults.DEFAULT_SO_BACKLOG)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(CODEC, new HttpServerCodec());
                        ch.pipeline().addLast(AGGREGATOR, new HttpObjectAggregator(FlowtapDefaults.MAX_CONTENT_LENGTH));
                        ch.pipeline().addLast(HANDLER, new ProxyHandler());
                    }
                });

            serverChannel = bootstrap.bind(host, port).sync().channel();
            LOG.info(() -> "Intercepting proxy started on " + host + ":" + port()
                + (mockFirst ? " (mock lookup before upstream)" : ""));
        } catch (Exception e) {
            stop();
            throw e;
        }
    }

    @Override
    public synchronized void stop() throws Exception {
        Exception first = null;

        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            try {
                ch.close().syncUninterruptibly();
            } catch (Exception e) {
                first = e;
            }
        }

        EventLoopGroup workers = workerGroup;
        workerGroup = null;
        if (workers != null) {
            workers.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }

        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }

        ExecutorService executor = controlExecutor;
        controlExecutor = null;
        if (executor != null) {
            executor.shutdownNow();
        }

        LOG.fine("Intercepting proxy stopped");

        if (first != null) {
            throw first;
        }
    }

    private final class ProxyHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
            boolean keepAlive = HttpUtil.isKeepAlive(req);
            if (!req.decoderResult().isSuccess()) {
                writePlain(ctx, false, HttpResponseStatus.BAD_REQUEST, "bad request");
                return;
            }
            if (req.method() == HttpMethod.CONNECT) {
                openTunnel(ctx, req.uri());
                return;
            }
            URI target = resolveTarget(req);
            if (target == null) {
                writePlain(ctx, false, HttpResponseStatus.BAD_REQUEST, "absolute uri or host header required");
                return;
            }
            Map<String, String> headers = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : req.headers()) {
                headers.merge(e.getKey(), e.getValue(), (a, b) -> a + ", " + b);
            }
            byte[] body = ByteBufUtil.getBytes(req.content());
            String method = req.method().name();
            String pathAndQuery = target.getRawQuery() == null
                ? rawPath(target)
                : rawPath(target) + "?" + target.getRawQuery();
            RequestSnapshot request = new RequestSnapshot(
                method,
                target.toString(),
                target.getHost(),
                pathAndQuery,
                headers,
                new String(body, StandardCharsets.UTF_8)
            );

            ctx.channel().config().setAutoRead(false);
            long startedNanos = System.nanoTime();
            handleExchange(request, target, headers, body, startedNanos)
                .whenComplete((reply, error) -> {
                    if (error != null) {
                        LOG.log(Level.WARNING, "Proxy exchange failed for " + request.shortUrl(), error);
                        metrics.incFailOpen();
                        writePlain(ctx, keepAlive, HttpResponseStatus.BAD_GATEWAY, "bad gateway");
                    } else {
                        writeReply(ctx, keepAlive, reply);
                    }
                    ctx.channel().config().setAutoRead(true);
                });
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Proxy pipeline failure", cause);
            ctx.close();
        }
    }

    /**
     * Mock lookup, upstream call and coordinator round trip for one exchange. Completes with
     * the reply to write, or exceptionally when the origin produced no response.
     */
    private CompletableFuture<ProxyReply> handleExchange(RequestSnapshot request,
                                                        URI target,
                                                        Map<String, String> headers,
                                                        byte[] body,
                                                        long startedNanos) {
        return lookupMock(request).thenCompose(mock -> {
            if (mock.isPresent()) {
                MockDecision decision = mock.get();
                LOG.fine(() -> "Mock rule " + decision.ruleName() + " answered " + request.shortUrl());
                ResponseSnapshot mocked = decision.toSnapshot();
                FlowSubmission submission = FlowSubmission.of(request, mocked, elapsedMillis(startedNanos))
                    .withMock(decision.ruleId(), decision.ruleName());
                return offer(submission, ProxyReply.of(mocked));
            }
            return upstream.forward(request.method(), target, headers, body).thenCompose(reply -> {
                ProxyReply original = ProxyReply.of(reply);
                FlowSubmission submission = FlowSubmission.of(request, original.snapshot(), elapsedMillis(startedNanos));
                return offer(submission, original);
            });
        });
    }

    private CompletableFuture<Optional<MockDecision>> lookupMock(RequestSnapshot request) {
        if (!mockFirst) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.supplyAsync(() -> channel.queryMock(MockQuery.of(request)), executor())
            .exceptionally(error -> {
                LOG.fine(() -> "Mock lookup failed, going upstream: " + error.getMessage());
                return Optional.empty();
            });
    }

    /** Submits the flow and applies the decision; any control failure keeps {@code original}. */
    private CompletableFuture<ProxyReply> offer(FlowSubmission submission, ProxyReply original) {
        return CompletableFuture.supplyAsync(() -> channel.submit(submission), executor())
            .thenCompose(outcome -> outcome.decision())
            .handle((decision, error) -> {
                if (error != null) {
                    metrics.incFailOpen();
                    LOG.log(Level.WARNING, "Control channel failure, passing through " + submission.request().shortUrl(), error);
                    return original;
                }
                return original.apply(decision);
            });
    }

    private ExecutorService executor() {
        ExecutorService executor = controlExecutor;
        if (executor == null) {
            throw new IllegalStateException("proxy not running");
        }
        return executor;
    }

    private void openTunnel(ChannelHandlerContext ctx, String authority) {
        int colon = authority.lastIndexOf(':');
        String targetHost = colon > 0 ? authority.substring(0, colon) : authority;
        int targetPort;
        try {
            targetPort = colon > 0 ? Integer.parseInt(authority.substring(colon + 1)) : FlowtapDefaults.HTTPS_DEFAULT_PORT;
        } catch (NumberFormatException e) {
            writePlain(ctx, false, HttpResponseStatus.BAD_REQUEST, "bad connect authority");
            return;
        }
        Channel inbound = ctx.channel();
        inbound.config().setAutoRead(false);
        Bootstrap bootstrap = new Bootstrap()
            .group(inbound.eventLoop())
            .channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, FlowtapDefaults.DEFAULT_CONNECT_TIMEOUT_MS)
            .option(ChannelOption.AUTO_READ, false)
            .handler(new TunnelRelayHandler(inbound));
        ChannelFuture connect = bootstrap.connect(targetHost, targetPort);
        connect.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                LOG.fine(() -> "Tunnel to " + authority + " failed: " + future.cause().getMessage());
                writePlain(ctx, false, HttpResponseStatus.BAD_GATEWAY, "tunnel failed");
                return;
            }
            Channel outbound = future.channel();
            FullHttpResponse established = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, CONNECTION_ESTABLISHED);
            ctx.writeAndFlush(established).addListener((ChannelFutureListener) written -> {
                if (!written.isSuccess()) {
                    outbound.close();
                    return;
                }
                inbound.pipeline().remove(AGGREGATOR);
                inbound.pipeline().remove(CODEC);
                inbound.pipeline().replace(HANDLER, "tunnel", new TunnelRelayHandler(outbound));
                outbound.config().setAutoRead(true);
                inbound.config().setAutoRead(true);
            });
        });
    }

    private static URI resolveTarget(FullHttpRequest req) {
        String uri = req.uri();
        try {
            URI parsed = URI.create(uri);
            if (parsed.getScheme() != null && parsed.getHost() != null) {
                return parsed;
            }
            String hostHeader = req.headers().get(HttpHeaderNames.HOST);
            if (hostHeader == null || hostHeader.isBlank()) {
                return null;
            }
            return URI.create("http://" + hostHeader.trim() + (uri.startsWith("/") ? uri : "/" + uri));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String rawPath(URI uri) {
        String path = uri.getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static void writeReply(ChannelHandlerContext ctx, boolean keepAlive, ProxyReply reply) {
        HttpResponseStatus status = reply.reason().isEmpty()
            ? HttpResponseStatus.valueOf(reply.status())
            : new HttpResponseStatus(reply.status(), reply.reason());
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
            Unpooled.wrappedBuffer(reply.body()));
        for (Map.Entry<String, String> e : reply.headers().entrySet()) {
            String lower = e.getKey().toLowerCase(Locale.ROOT);
            if (UpstreamHttpClient.HOP_BY_HOP_HEADERS.contains(lower) || "content-length".equals(lower)) {
                continue;
            }
            response.headers().set(e.getKey(), e.getValue());
        }
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, reply.body().length);
        write(ctx, keepAlive, response);
    }

    private static void writePlain(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status, String message) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        write(ctx, keepAlive, response);
    }

    private static void write(ChannelHandlerContext ctx, boolean keepAlive, FullHttpResponse response) {
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    /**
     * Response on its way back to the client. Keeps the origin's raw bytes so a pass-through
     * is byte-exact; a content override replaces them.
     */
    record ProxyReply(int status, String reason, Map<String, String> headers, byte[] body) {

        static ProxyReply of(HttpReply reply) {
            return new ProxyReply(reply.status(), reply.reason(), reply.headers(), reply.body());
        }

        static ProxyReply of(ResponseSnapshot snapshot) {
            return new ProxyReply(snapshot.statusCode(), snapshot.reason(), snapshot.headers(),
                snapshot.body().getBytes(StandardCharsets.UTF_8));
        }

        ResponseSnapshot snapshot() {
            return new ResponseSnapshot(status, reason, headers, new String(body, StandardCharsets.UTF_8));
        }

        ProxyReply apply(ResponseDecision decision) {
            if (decision == null || decision.isPassThrough()) {
                return this;
            }
            ResponseSnapshot applied = decision.applyTo(snapshot());
            byte[] newBody = decision.modification().content() == null
                ? body
                : applied.body().getBytes(StandardCharsets.UTF_8);
            return new ProxyReply(applied.statusCode(), applied.reason(), applied.headers(), newBody);
        }
    }
}
