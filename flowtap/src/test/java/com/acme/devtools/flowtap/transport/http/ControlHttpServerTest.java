package com.acme.devtools.flowtap.transport.http;

import com.acme.devtools.flowtap.coordinator.FlowCoordinator;
import com.acme.devtools.flowtap.coordinator.InterceptMode;
import com.acme.devtools.flowtap.flow.FlowStore;
import com.acme.devtools.flowtap.mock.MockRuleRepository;
import com.acme.devtools.flowtap.telemetry.AtomicFlowMetrics;
import com.acme.devtools.flowtap.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ControlHttpServerTest {

    private static final String SUBMISSION = """
        {"flow_id": null,
         "request": {"method": "POST", "url": "https://api.example.com/login", "host": "api.example.com",
                     "path": "/login", "headers": {"Content-Type": "application/json"}, "content": "{}"},
         "response": {"status_code": 200, "reason": "OK", "headers": {"X-Trace": "t-1"}, "content": "{\\"token\\":\\"abc\\"}"},
         "timestamp": 1700000000.5, "duration": 0.12}
        """;

    private final HttpClient client = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(Duration.ofSeconds(2))
        .build();

    private AtomicFlowMetrics metrics;
    private FlowCoordinator coordinator;
    private ControlHttpServer server;
    private int port;

    @BeforeEach
    void startServer() throws Exception {
        port = freePort();
        metrics = new AtomicFlowMetrics();
        coordinator = new FlowCoordinator(new FlowStore(), new MockRuleRepository(), InterceptMode.RECORDING, metrics, 0L);
        server = new ControlHttpServer("127.0.0.1", port, coordinator, metrics);
        server.start();
    }

    @AfterEach
    void stopServer() throws Exception {
        coordinator.stop();
        server.stop();
    }

    @Test
    void statusShouldReportModeAndPausedFlows() throws Exception {
        HttpResponse<String> response = send("GET", "/status", null);

        assertEquals(200, response.statusCode());
        JsonNode status = JsonCodec.readTree(response.body());
        assertEquals("running", status.get("status").asText());
        assertEquals("recording", status.get("mode").asText());
        assertEquals(0, status.get("intercepted_count").asInt());
        assertEquals(port, status.get("port").asInt());
    }

    @Test
    void modeShouldSwitchAndRejectUnknownNames() throws Exception {
        HttpResponse<String> switched = send("POST", "/mode", "{\"mode\":\"mock-debug\"}");
        assertEquals(200, switched.statusCode());
        assertEquals("mock_debug", JsonCodec.readTree(switched.body()).get("mode").asText());
        assertEquals(InterceptMode.MOCK_DEBUG, coordinator.mode());

        assertEquals(400, send("POST", "/mode", "{\"mode\":\"replay\"}").statusCode());
        assertEquals(405, send("PUT", "/mode", "{\"mode\":\"debug\"}").statusCode());
        assertEquals("mock_debug", JsonCodec.readTree(send("GET", "/mode", null).body()).get("mode").asText());
    }

    @Test
    void recordingSubmissionShouldBeDecidedImmediately() throws Exception {
        HttpResponse<String> response = send("POST", "/intercept", SUBMISSION);

        assertEquals(200, response.statusCode());
        JsonNode reply = JsonCodec.readTree(response.body());
        assertEquals("decided", reply.get("status").asText());
        assertEquals("pass_through", reply.get("action").asText());
        assertEquals(1, coordinator.store().size());
    }

    @Test
    void debugSubmissionShouldWaitForResume() throws Exception {
        coordinator.switchMode(InterceptMode.DEBUG);

        JsonNode pending = JsonCodec.readTree(send("POST", "/intercept", SUBMISSION).body());
        assertEquals("pending", pending.get("status").asText());
        String flowId = pending.get("flow_id").asText();
        assertEquals(1, JsonCodec.readTree(send("GET", "/status", null).body()).get("intercepted_count").asInt());

        HttpResponse<String> resumed = send("POST", "/resume",
            "{\"flow_id\":\"" + flowId + "\",\"modified_response\":{\"status_code\":404,\"content\":\"{\\\"error\\\":\\\"not found\\\"}\"}}");
        assertEquals(200, resumed.statusCode());
        assertEquals("resumed", JsonCodec.readTree(resumed.body()).get("status").asText());

        HttpResponse<String> decision = send("POST", "/await", "{\"flow_id\":\"" + flowId + "\"}");
        assertEquals(200, decision.statusCode());
        JsonNode body = JsonCodec.readTree(decision.body());
        assertEquals("modify", body.get("action").asText());
        assertEquals(404, body.get("modified_response").get("status_code").asInt());
        assertTrue(body.get("modified_response").get("headers").isNull());

        HttpResponse<String> again = send("POST", "/resume", "{\"flow_id\":\"" + flowId + "\",\"modified_response\":null}");
        assertEquals(409, again.statusCode());
        assertEquals("already_resumed", JsonCodec.readTree(again.body()).get("error").asText());
    }

    @Test
    void unknownFlowsShouldBeNotFound() throws Exception {
        assertEquals(404, send("POST", "/resume", "{\"flow_id\":\"nope\",\"modified_response\":null}").statusCode());
        assertEquals(404, send("POST", "/await", "{\"flow_id\":\"nope\"}").statusCode());
        assertEquals(404, send("GET", "/flows/nope", null).statusCode());
        assertEquals(404, send("GET", "/nowhere", null).statusCode());
    }

    @Test
    void malformedPayloadsShouldBeRejected() throws Exception {
        HttpResponse<String> notJson = send("POST", "/intercept", "not json");
        assertEquals(400, notJson.statusCode());
        assertEquals("malformed", JsonCodec.readTree(notJson.body()).get("error").asText());

        assertEquals(400, send("POST", "/intercept", "{\"request\":{}}").statusCode());
        assertEquals(400, send("POST", "/resume", "{\"modified_response\":null}").statusCode());
        assertEquals(400, send("GET", "/mock-match?host=api.example.com", null).statusCode());
        assertEquals(405, send("GET", "/intercept", null).statusCode());
        assertEquals(4L, metrics.snapshot().malformed());
        assertEquals(0, coordinator.store().size());
    }

    @Test
    void rulesShouldSupportCrudAndMockLookup() throws Exception {
        HttpResponse<String> created = send("POST", "/rules", """
            {"name": "users page", "method": "GET", "host": "api.example.com", "path": "/users",
             "query_params": [{"key": "limit", "value": "10", "required": true, "match_type": "EXACT"}],
             "status_code": 200, "headers": {"Content-Type": "application/json"}, "content": "[]"}
            """);
        assertEquals(201, created.statusCode());
        String ruleId = JsonCodec.readTree(created.body()).get("id").asText();
        assertFalse(ruleId.isBlank());
        assertEquals(1, JsonCodec.readTree(send("GET", "/rules", null).body()).size());

        HttpResponse<String> hit = send("GET", "/mock-match?method=GET&host=api.example.com&path=/users&query_limit=10", null);
        assertEquals(200, hit.statusCode());
        JsonNode match = JsonCodec.readTree(hit.body());
        assertEquals(ruleId, match.get("rule_id").asText());
        assertEquals("[]", match.get("content").asText());

        HttpResponse<String> miss = send("GET", "/mock-match?method=GET&host=api.example.com&path=/users&query_limit=20", null);
        assertEquals(404, miss.statusCode());
        assertEquals("{}", miss.body());

        HttpResponse<String> updated = send("PUT", "/rules/" + ruleId, """
            {"name": "users page", "method": "GET", "host": "api.example.com", "path": "/users",
             "status_code": 503, "content": "down"}
            """);
        assertEquals(200, updated.statusCode());
        assertEquals(503, JsonCodec.readTree(send("GET", "/rules/" + ruleId, null).body()).get("status_code").asInt());

        assertEquals(204, send("DELETE", "/rules/" + ruleId, null).statusCode());
        assertEquals(404, send("DELETE", "/rules/" + ruleId, null).statusCode());
        assertEquals(0, coordinator.rules().size());
    }

    @Test
    void flowsShouldBeListedAndTurnedIntoRules() throws Exception {
        JsonNode decided = JsonCodec.readTree(send("POST", "/intercept", SUBMISSION).body());
        String flowId = decided.get("flow_id").asText();

        JsonNode flows = JsonCodec.readTree(send("GET", "/flows", null).body());
        assertEquals(1, flows.size());
        assertEquals("completed", flows.get(0).get("state").asText());

        JsonNode flow = JsonCodec.readTree(send("GET", "/flows/" + flowId, null).body());
        assertEquals("/login", flow.get("request").get("path").asText());

        HttpResponse<String> fromFlow = send("POST", "/rules/from-flow", "{\"flow_id\":\"" + flowId + "\",\"name\":\"login\"}");
        assertEquals(201, fromFlow.statusCode());
        JsonNode rule = JsonCodec.readTree(fromFlow.body());
        assertEquals("login", rule.get("name").asText());
        assertEquals("POST", rule.get("method").asText());
        assertEquals("{\"token\":\"abc\"}", rule.get("content").asText());

        HttpResponse<String> cleared = send("DELETE", "/flows", null);
        assertEquals(1, JsonCodec.readTree(cleared.body()).get("cleared").asInt());
        assertEquals(0, coordinator.store().size());
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create("http://127.0.0.1:" + port + path))
            .timeout(Duration.ofSeconds(5));
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static int freePort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
