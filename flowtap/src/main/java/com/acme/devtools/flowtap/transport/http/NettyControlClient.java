package com.acme.devtools.flowtap.transport.http;

import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.ResumeResult;
import com.acme.devtools.flowtap.mock.MockQuery;
import com.acme.devtools.flowtap.transport.api.ControlChannel;
import com.acme.devtools.flowtap.transport.api.ControlChannelException;
import com.acme.devtools.flowtap.transport.api.FlowSubmission;
import com.acme.devtools.flowtap.transport.api.MockDecision;
import com.acme.devtools.flowtap.transport.api.ResponseDecision;
import com.acme.devtools.flowtap.transport.api.ResumeCommand;
import com.acme.devtools.flowtap.transport.api.SubmitOutcome;
import com.acme.devtools.flowtap.transport.wire.FlowWireCodec;
import com.acme.devtools.flowtap.transport.wire.WireFormatException;
import com.acme.devtools.flowtap.util.FlowtapDefaults;
import com.acme.devtools.flowtap.util.FlowtapStatusCodes;
import com.acme.devtools.flowtap.util.JsonCodec;
import com.acme.devtools.flowtap.util.QueryStrings;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.logging.Logger;

/**
 * {@link ControlChannel} spoken over HTTP to a remote {@code ControlHttpServer}.
 *
 * <p>A paused flow is delivered in two steps: {@code /intercept} answers {@code pending}
 * and the returned future is backed by a long poll on {@code /await}. Transport failures
 * surface as {@link ControlChannelException}; a failed long poll completes the pending
 * future exceptionally.
 */
public final class NettyControlClient implements ControlChannel, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(NettyControlClient.class.getName());

    private final URI baseUri;
    private final PooledHttpClient http;
    private final long responseTimeoutMillis;
    private final long mockQueryTimeoutMillis;

    public NettyControlClient(String host, int port) {
        this(URI.create("http://" + host + ":" + port),
            FlowtapDefaults.DEFAULT_RESPONSE_TIMEOUT_MS,
            FlowtapDefaults.DEFAULT_MOCK_QUERY_TIMEOUT_MS,
            FlowtapDefaults.DEFAULT_CONNECT_TIMEOUT_MS);
    }

    public NettyControlClient(URI baseUri, long responseTimeoutMillis, long mockQueryTimeoutMillis, int connectTimeoutMillis) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.responseTimeoutMillis = Math.max(1L, responseTimeoutMillis);
        this.mockQueryTimeoutMillis = Math.max(1L, mockQueryTimeoutMillis);
        this.http = new PooledHttpClient("flowtap-agent/1",
            FlowtapDefaults.DEFAULT_CLIENT_IO_THREADS,
            FlowtapDefaults.DEFAULT_CLIENT_MAX_INFLIGHT,
            connectTimeoutMillis);
    }

    public URI baseUri() {
        return baseUri;
    }

    @Override
    public SubmitOutcome submit(FlowSubmission submission) {
        FlowSubmission withId = submission.flowId() == null || submission.flowId().isBlank()
            ? submission.withFlowId(UUID.randomUUID().toString())
            : submission;
        HttpReply reply = call(HttpCall.postJson(resolve("/intercept"),
            FlowWireCodec.toBytes(FlowWireCodec.encodeSubmission(withId))), responseTimeoutMillis);
        if (reply.status() != FlowtapStatusCodes.OK) {
            throw new ControlChannelException("intercept rejected", reply.status());
        }
        JsonNode body = FlowWireCodec.parse(reply.body());
        String status = body.path("status").asText("");
        if ("decided".equals(status)) {
            return new SubmitOutcome.Immediate(FlowWireCodec.decodeDecision(body));
        }
        if ("pending".equals(status)) {
            String flowId = body.path("flow_id").asText(withId.flowId());
            return new SubmitOutcome.Pending(flowId, awaitDecision(flowId));
        }
        throw new WireFormatException("unknown intercept status: " + status);
    }

    /** Long-polls the decision of a paused flow. The future never times out on its own. */
    public CompletableFuture<ResponseDecision> awaitDecision(String flowId) {
        ObjectNode request = JsonCodec.objectNode();
        request.put("flow_id", flowId);
        return http.send(HttpCall.postJson(resolve("/await"), FlowWireCodec.toBytes(request)), 0L)
            .thenApply(reply -> {
                if (reply.status() != FlowtapStatusCodes.OK) {
                    throw new ControlChannelException("await failed for flow " + flowId, reply.status());
                }
                return FlowWireCodec.decodeDecision(FlowWireCodec.parse(reply.body()));
            });
    }

    @Override
    public ResumeResult resume(String flowId, ModifiedResponse modifiedResponse) {
        byte[] payload = FlowWireCodec.toBytes(FlowWireCodec.encodeResumeCommand(new ResumeCommand(flowId, modifiedResponse)));
        HttpReply reply = call(HttpCall.postJson(resolve("/resume"), payload), responseTimeoutMillis);
        if (reply.status() == FlowtapStatusCodes.OK) {
            return ResumeResult.RESUMED;
        }
        if (reply.status() == FlowtapStatusCodes.NOT_FOUND) {
            return ResumeResult.UNKNOWN_FLOW;
        }
        if (reply.status() == FlowtapStatusCodes.CONFLICT) {
            String error = FlowWireCodec.parse(reply.body()).path("error").asText("");
            return "not_paused".equals(error) ? ResumeResult.NOT_PAUSED : ResumeResult.ALREADY_RESUMED;
        }
        throw new ControlChannelException("resume rejected for flow " + flowId, reply.status());
    }

    @Override
    public Optional<MockDecision> queryMock(MockQuery query) {
        String encoded = QueryStrings.encode(FlowWireCodec.encodeMockQuery(query));
        HttpReply reply = call(HttpCall.get(resolve("/mock-match?" + encoded)), mockQueryTimeoutMillis);
        if (reply.status() == FlowtapStatusCodes.NOT_FOUND) {
            return Optional.empty();
        }
        if (reply.status() != FlowtapStatusCodes.OK) {
            throw new ControlChannelException("mock query rejected", reply.status());
        }
        return FlowWireCodec.decodeMockDecision(FlowWireCodec.parse(reply.body()));
    }

    @Override
    public boolean ping() {
        try {
            HttpReply reply = call(HttpCall.get(resolve("/status")), mockQueryTimeoutMillis);
            if (reply.status() != FlowtapStatusCodes.OK) {
                return false;
            }
            return "running".equals(FlowWireCodec.parse(reply.body()).path("status").asText(""));
        } catch (RuntimeException e) {
            LOG.fine(() -> "Control ping failed: " + e.getMessage());
            return false;
        }
    }

    private HttpReply call(HttpCall call, long timeoutMillis) {
        CompletableFuture<HttpReply> future = http.send(call, timeoutMillis);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ControlChannelException("interrupted while calling " + call.uri(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new ControlChannelException("control call failed: " + call.method() + " " + call.uri(), cause);
        }
    }

    private URI resolve(String pathAndQuery) {
        return baseUri.resolve(pathAndQuery);
    }

    @Override
    public void close() {
        http.close();
    }
}
