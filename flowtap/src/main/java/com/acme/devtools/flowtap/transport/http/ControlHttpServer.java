package com.acme.devtools.flowtap.transport.http;

import com.acme.devtools.flowtap.coordinator.CoordinatorStatus;
import com.acme.devtools.flowtap.coordinator.FlowCoordinator;
import com.acme.devtools.flowtap.coordinator.InterceptMode;
import com.acme.devtools.flowtap.flow.Flow;
import com.acme.devtools.flowtap.flow.ResumeResult;
import com.acme.devtools.flowtap.mock.MockRule;
import com.acme.devtools.flowtap.telemetry.FlowMetrics;
import com.acme.devtools.flowtap.telemetry.NoopFlowMetrics;
import com.acme.devtools.flowtap.transport.api.ControlTransport;
import com.acme.devtools.flowtap.transport.api.MockDecision;
import com.acme.devtools.flowtap.transport.api.ResponseDecision;
import com.acme.devtools.flowtap.transport.api.ResumeCommand;
import com.acme.devtools.flowtap.transport.api.SubmitOutcome;
import com.acme.devtools.flowtap.transport.wire.FlowWireCodec;
import com.acme.devtools.flowtap.transport.wire.WireFormatException;
import com.acme.devtools.flowtap.util.FlowtapDefaults;
import com.acme.devtools.flowtap.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
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
import io.netty.handler.codec.http.QueryStringDecoder;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Netty HTTP binding of the control channel and the inspector operations.
 *
 * <p>Handlers never block the event loop: a long-poll on {@code /await} registers a
 * completion callback and the reply is written when the flow is resolved.
 */
public final class ControlHttpServer implements ControlTransport {
    private static final Logger LOG = Logger.getLogger(ControlHttpServer.class.getName());
    private static final String JSON = "application/json";
    private static final String RULES_PATH = "/rules";
    private static final String FLOWS_PATH = "/flows";

    private final String host;
    private final int port;
    private final FlowCoordinator coordinator;
    private final FlowMetrics metrics;

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public ControlHttpServer(int port, FlowCoordinator coordinator) {
        this(FlowtapDefaults.DEFAULT_CONTROL_HOST, port, coordinator, NoopFlowMetrics.INSTANCE);
    }

    public ControlHttpServer(String host, int port, FlowCoordinator coordinator, FlowMetrics metrics) {
        this.host = host == null || host.isBlank() ? FlowtapDefaults.DEFAULT_CONTROL_HOST : host;
        this.port = port;
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.metrics = metrics == null ? NoopFlowMetrics.INSTANCE : metrics;
    }

    @Override
    public String name() {
        return "control-http";
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
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(FlowtapDefaults.MAX_CONTENT_LENGTH));
                        ch.pipeline().addLast(new ControlHandler());
                    }
                });

            serverChannel = bootstrap.bind(host, port).sync().channel();
            LOG.info(() -> "Control server started on " + host + ":" + port());
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
            workers.shutdownGracefully().syncUninterruptibly();
        }

        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully().syncUninterruptibly();
        }

        LOG.fine("Control server stopped");

        if (first != null) {
            throw first;
        }
    }

    private final class ControlHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
            boolean keepAlive = HttpUtil.isKeepAlive(req);
            if (!req.decoderResult().isSuccess()) {
                metrics.incMalformed();
                writeJson(ctx, keepAlive, HttpResponseStatus.BAD_REQUEST, error("malformed", "bad request"));
                return;
            }
            QueryStringDecoder uri = new QueryStringDecoder(req.uri());
            String path = uri.path();
            try {
                route(ctx, keepAlive, req, uri, path);
            } catch (WireFormatException e) {
                metrics.incMalformed();
                LOG.warning(() -> "Malformed control request " + req.method() + " " + path + ": " + e.getMessage());
                writeJson(ctx, keepAlive, HttpResponseStatus.BAD_REQUEST, error("malformed", e.getMessage()));
            } catch (Throwable t) {
                LOG.log(Level.WARNING, "Control request failure on " + path, t);
                writeJson(ctx, keepAlive, HttpResponseStatus.INTERNAL_SERVER_ERROR, error("internal_error", "internal error"));
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.WARNING, "Control pipeline failure", cause);
            ctx.close();
        }
    }

    private void route(ChannelHandlerContext ctx,
                       boolean keepAlive,
                       FullHttpRequest req,
                       QueryStringDecoder uri,
                       String path) {
        HttpMethod method = req.method();
        switch (path) {
            case "/intercept" -> {
                if (requireMethod(ctx, keepAlive, method, HttpMethod.POST)) {
                    handleIntercept(ctx, keepAlive, body(req));
                }
            }
            case "/await" -> {
                if (requireMethod(ctx, keepAlive, method, HttpMethod.POST)) {
                    handleAwait(ctx, keepAlive, body(req));
                }
            }
            case "/resume" -> {
                if (requireMethod(ctx, keepAlive, method, HttpMethod.POST)) {
                    handleResume(ctx, keepAlive, body(req));
                }
            }
            case "/mock-match" -> {
                if (requireMethod(ctx, keepAlive, method, HttpMethod.GET)) {
                    handleMockMatch(ctx, keepAlive, uri);
                }
            }
            case "/status" -> {
                if (requireMethod(ctx, keepAlive, method, HttpMethod.GET)) {
                    writeJson(ctx, keepAlive, HttpResponseStatus.OK, encodeStatus(coordinator.status()));
                }
            }
            case "/mode" -> handleMode(ctx, keepAlive, method, req);
            case RULES_PATH -> handleRules(ctx, keepAlive, method, req);
            case FLOWS_PATH -> handleFlows(ctx, keepAlive, method);
            default -> {
                if (path.startsWith(RULES_PATH + "/")) {
                    handleRule(ctx, keepAlive, method, req, path.substring(RULES_PATH.length() + 1));
                } else if (path.startsWith(FLOWS_PATH + "/")) {
                    handleFlow(ctx, keepAlive, method, path.substring(FLOWS_PATH.length() + 1));
                } else {
                    writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, error("not_found", path));
                }
            }
        }
    }

    private void handleIntercept(ChannelHandlerContext ctx, boolean keepAlive, JsonNode body) {
        SubmitOutcome outcome = coordinator.submit(FlowWireCodec.decodeSubmission(body));
        ObjectNode reply;
        if (outcome instanceof SubmitOutcome.Immediate immediate) {
            reply = JsonCodec.objectNode();
            reply.put("status", "decided");
            reply.setAll(FlowWireCodec.encodeDecision(immediate.value()));
        } else {
            reply = JsonCodec.objectNode();
            reply.put("status", "pending");
            reply.put("flow_id", outcome.flowId());
        }
        writeJson(ctx, keepAlive, HttpResponseStatus.OK, reply);
    }

    private void handleAwait(ChannelHandlerContext ctx, boolean keepAlive, JsonNode body) {
        String flowId = requiredFlowId(body);
        Optional<CompletableFuture<ResponseDecision>> decision = coordinator.awaitDecision(flowId);
        if (decision.isEmpty()) {
            writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, error("unknown_flow", flowId));
            return;
        }
        decision.get().whenComplete((value, failure) -> {
            if (failure != null) {
                LOG.log(Level.WARNING, "Decision for flow " + flowId + " failed", failure);
                writeJson(ctx, keepAlive, HttpResponseStatus.INTERNAL_SERVER_ERROR, error("internal_error", flowId));
                return;
            }
            writeJson(ctx, keepAlive, HttpResponseStatus.OK, FlowWireCodec.encodeDecision(value));
        });
    }

    private void handleResume(ChannelHandlerContext ctx, boolean keepAlive, JsonNode body) {
        ResumeCommand command = FlowWireCodec.decodeResumeCommand(body);
        ResumeResult result = coordinator.resume(command.flowId(), command.modifiedResponse());
        switch (result) {
            case RESUMED -> {
                ObjectNode reply = JsonCodec.objectNode();
                reply.put("status", "resumed");
                reply.put("flow_id", command.flowId());
                writeJson(ctx, keepAlive, HttpResponseStatus.OK, reply);
            }
            case UNKNOWN_FLOW -> writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND,
                error("unknown_flow", command.flowId()));
            case ALREADY_RESUMED -> writeJson(ctx, keepAlive, HttpResponseStatus.CONFLICT,
                error("already_resumed", command.flowId()));
            case NOT_PAUSED -> writeJson(ctx, keepAlive, HttpResponseStatus.CONFLICT,
                error("not_paused", command.flowId()));
        }
    }

    private void handleMockMatch(ChannelHandlerContext ctx, boolean keepAlive, QueryStringDecoder uri) {
        Optional<MockDecision> decision = coordinator.queryMock(FlowWireCodec.decodeMockQuery(uri.parameters()));
        if (decision.isPresent()) {
            writeJson(ctx, keepAlive, HttpResponseStatus.OK, FlowWireCodec.encodeMockDecision(decision.get()));
        } else {
            writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, JsonCodec.objectNode());
        }
    }

    private void handleMode(ChannelHandlerContext ctx, boolean keepAlive, HttpMethod method, FullHttpRequest req) {
        if (method == HttpMethod.POST) {
            JsonNode body = body(req);
            JsonNode raw = body.get("mode");
            InterceptMode mode;
            try {
                mode = InterceptMode.parse(raw == null || !raw.isTextual() ? null : raw.asText());
            } catch (IllegalArgumentException e) {
                throw new WireFormatException("unknown mode: " + raw);
            }
            coordinator.switchMode(mode);
        } else if (method != HttpMethod.GET) {
            writeJson(ctx, keepAlive, HttpResponseStatus.METHOD_NOT_ALLOWED, error("method_not_allowed", method.name()));
            return;
        }
        ObjectNode reply = JsonCodec.objectNode();
        reply.put("mode", coordinator.mode().wireName());
        writeJson(ctx, keepAlive, HttpResponseStatus.OK, reply);
    }

    private void handleRules(ChannelHandlerContext ctx, boolean keepAlive, HttpMethod method, FullHttpRequest req) {
        if (method == HttpMethod.GET) {
            writeJson(ctx, keepAlive, HttpResponseStatus.OK, FlowWireCodec.encodeRules(coordinator.rules().list()));
        } else if (method == HttpMethod.POST) {
            MockRule created = coordinator.rules().create(FlowWireCodec.decodeRule(body(req)));
            writeJson(ctx, keepAlive, HttpResponseStatus.CREATED, FlowWireCodec.encodeRule(created));
        } else {
            writeJson(ctx, keepAlive, HttpResponseStatus.METHOD_NOT_ALLOWED, error("method_not_allowed", method.name()));
        }
    }

    private void handleRule(ChannelHandlerContext ctx,
                            boolean keepAlive,
                            HttpMethod method,
                            FullHttpRequest req,
                            String ruleId) {
        if ("from-flow".equals(ruleId)) {
            if (requireMethod(ctx, keepAlive, method, HttpMethod.POST)) {
                JsonNode body = body(req);
                String flowId = requiredFlowId(body);
                Optional<Flow> flow = coordinator.store().get(flowId);
                if (flow.isEmpty()) {
                    writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, error("unknown_flow", flowId));
                    return;
                }
                JsonNode name = body.get("name");
                MockRule created = coordinator.rules().createFromFlow(flow.get(),
                    name == null || name.isNull() ? null : name.asText());
                writeJson(ctx, keepAlive, HttpResponseStatus.CREATED, FlowWireCodec.encodeRule(created));
            }
            return;
        }
        if (method == HttpMethod.GET) {
            Optional<MockRule> rule = coordinator.rules().get(ruleId);
            if (rule.isPresent()) {
                writeJson(ctx, keepAlive, HttpResponseStatus.OK, FlowWireCodec.encodeRule(rule.get()));
            } else {
                writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, error("unknown_rule", ruleId));
            }
        } else if (method == HttpMethod.PUT) {
            Optional<MockRule> updated = coordinator.rules().update(ruleId, FlowWireCodec.decodeRule(body(req)));
            if (updated.isPresent()) {
                writeJson(ctx, keepAlive, HttpResponseStatus.OK, FlowWireCodec.encodeRule(updated.get()));
            } else {
                writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, error("unknown_rule", ruleId));
            }
        } else if (method == HttpMethod.DELETE) {
            if (coordinator.rules().delete(ruleId)) {
                writeEmpty(ctx, keepAlive, HttpResponseStatus.NO_CONTENT);
            } else {
                writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, error("unknown_rule", ruleId));
            }
        } else {
            writeJson(ctx, keepAlive, HttpResponseStatus.METHOD_NOT_ALLOWED, error("method_not_allowed", method.name()));
        }
    }

    private void handleFlows(ChannelHandlerContext ctx, boolean keepAlive, HttpMethod method) {
        if (method == HttpMethod.GET) {
            writeJson(ctx, keepAlive, HttpResponseStatus.OK, FlowWireCodec.encodeFlows(coordinator.store().list()));
        } else if (method == HttpMethod.DELETE) {
            int removed = coordinator.store().clear();
            ObjectNode reply = JsonCodec.objectNode();
            reply.put("cleared", removed);
            writeJson(ctx, keepAlive, HttpResponseStatus.OK, reply);
        } else {
            writeJson(ctx, keepAlive, HttpResponseStatus.METHOD_NOT_ALLOWED, error("method_not_allowed", method.name()));
        }
    }

    private void handleFlow(ChannelHandlerContext ctx, boolean keepAlive, HttpMethod method, String flowId) {
        if (!requireMethod(ctx, keepAlive, method, HttpMethod.GET)) {
            return;
        }
        Optional<Flow> flow = coordinator.store().get(flowId);
        if (flow.isPresent()) {
            writeJson(ctx, keepAlive, HttpResponseStatus.OK, FlowWireCodec.encodeFlow(flow.get()));
        } else {
            writeJson(ctx, keepAlive, HttpResponseStatus.NOT_FOUND, error("unknown_flow", flowId));
        }
    }

    private ObjectNode encodeStatus(CoordinatorStatus status) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("status", status.running() ? "running" : "stopped");
        node.put("mode", status.mode().wireName());
        node.put("intercepted_count", status.interceptedCount());
        ArrayNode ids = node.putArray("intercepted_flows");
        status.interceptedFlows().forEach(ids::add);
        node.put("port", port());
        node.put("stored_flows", status.storedFlows());
        node.put("rules", status.rules());
        ObjectNode counters = node.putObject("counters");
        status.counters().forEach(counters::put);
        return node;
    }

    private static boolean requireMethod(ChannelHandlerContext ctx, boolean keepAlive, HttpMethod actual, HttpMethod expected) {
        if (actual.equals(expected)) {
            return true;
        }
        writeJson(ctx, keepAlive, HttpResponseStatus.METHOD_NOT_ALLOWED, error("method_not_allowed", actual.name()));
        return false;
    }

    private static JsonNode body(FullHttpRequest req) {
        return FlowWireCodec.parse(ByteBufUtil.getBytes(req.content()));
    }

    private static String requiredFlowId(JsonNode body) {
        JsonNode id = body.get("flow_id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            throw new WireFormatException("missing required text field: flow_id");
        }
        return id.asText();
    }

    private static ObjectNode error(String code, String detail) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("error", code);
        node.put("detail", detail);
        return node;
    }

    private static void writeEmpty(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.EMPTY_BUFFER);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, 0);
        write(ctx, keepAlive, response);
    }

    private static void writeJson(ChannelHandlerContext ctx, boolean keepAlive, HttpResponseStatus status, JsonNode body) {
        byte[] bytes = FlowWireCodec.toBytes(body);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, JSON);
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
}
