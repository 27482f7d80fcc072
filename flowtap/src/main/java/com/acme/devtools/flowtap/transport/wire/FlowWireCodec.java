package com.acme.devtools.flowtap.transport.wire;

import com.acme.devtools.flowtap.flow.Flow;
import com.acme.devtools.flowtap.flow.ModifiedResponse;
import com.acme.devtools.flowtap.flow.RequestSnapshot;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.mock.MatchType;
import com.acme.devtools.flowtap.mock.MockQuery;
import com.acme.devtools.flowtap.mock.MockResponseSpec;
import com.acme.devtools.flowtap.mock.MockRule;
import com.acme.devtools.flowtap.mock.QueryParam;
import com.acme.devtools.flowtap.transport.api.FlowSubmission;
import com.acme.devtools.flowtap.transport.api.MockDecision;
import com.acme.devtools.flowtap.transport.api.ResponseDecision;
import com.acme.devtools.flowtap.transport.api.ResumeCommand;
import com.acme.devtools.flowtap.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * JSON shapes of the control channel. Field names are snake_case; timestamps and durations
 * travel as fractional seconds.
 */
public final class FlowWireCodec {
    public static final String QUERY_PARAM_PREFIX = "query_";

    private FlowWireCodec() {
    }

    public static JsonNode parse(byte[] body) {
        if (body == null || body.length == 0) {
            throw new WireFormatException("empty body");
        }
        try {
            JsonNode root = JsonCodec.readTree(body);
            if (root == null || root.isMissingNode()) {
                throw new WireFormatException("empty body");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new WireFormatException("malformed json: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new WireFormatException("unreadable body", e);
        }
    }

    public static byte[] toBytes(JsonNode node) {
        try {
            return JsonCodec.writeBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize json", e);
        }
    }

    // --- snapshots ---

    public static ObjectNode encodeRequest(RequestSnapshot request) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("method", request.method());
        node.put("url", request.url());
        node.put("host", request.host());
        node.put("path", request.path());
        node.set("headers", encodeHeaders(request.headers()));
        node.put("content", request.body());
        return node;
    }

    public static RequestSnapshot decodeRequest(JsonNode node) {
        requireObject(node, "request");
        return new RequestSnapshot(
            requiredText(node, "method"),
            optionalText(node, "url"),
            optionalText(node, "host"),
            optionalText(node, "path"),
            decodeHeaders(node.get("headers")),
            optionalText(node, "content")
        );
    }

    public static ObjectNode encodeResponse(ResponseSnapshot response) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("status_code", response.statusCode());
        node.put("reason", response.reason());
        node.set("headers", encodeHeaders(response.headers()));
        node.put("content", response.body());
        return node;
    }

    public static ResponseSnapshot decodeResponse(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        requireObject(node, "response");
        return new ResponseSnapshot(
            requiredStatus(node, "status_code"),
            optionalText(node, "reason"),
            decodeHeaders(node.get("headers")),
            optionalText(node, "content")
        );
    }

    // --- submission ---

    public static ObjectNode encodeSubmission(FlowSubmission submission) {
        ObjectNode node = JsonCodec.objectNode();
        putNullable(node, "flow_id", submission.flowId());
        node.put("paused", submission.paused());
        node.set("request", encodeRequest(submission.request()));
        if (submission.response() == null) {
            node.putNull("response");
        } else {
            node.set("response", encodeResponse(submission.response()));
        }
        node.put("timestamp", submission.timestampMillis() / 1000.0d);
        node.put("duration", submission.durationMillis() / 1000.0d);
        node.put("mock_applied", submission.mockApplied());
        putNullable(node, "mock_rule_name", submission.mockRuleName());
        putNullable(node, "mock_rule_id", submission.mockRuleId());
        return node;
    }

    public static FlowSubmission decodeSubmission(JsonNode node) {
        requireObject(node, "submission");
        JsonNode timestamp = node.get("timestamp");
        long timestampMillis = timestamp != null && timestamp.isNumber()
            ? Math.round(timestamp.asDouble() * 1000.0d)
            : System.currentTimeMillis();
        JsonNode duration = node.get("duration");
        long durationMillis = duration != null && duration.isNumber()
            ? Math.round(duration.asDouble() * 1000.0d)
            : 0L;
        return new FlowSubmission(
            nullableText(node, "flow_id"),
            node.path("paused").asBoolean(false),
            decodeRequest(node.get("request")),
            decodeResponse(node.get("response")),
            timestampMillis,
            durationMillis,
            node.path("mock_applied").asBoolean(false),
            nullableText(node, "mock_rule_name"),
            nullableText(node, "mock_rule_id")
        );
    }

    // --- resume ---

    public static ObjectNode encodeModified(ModifiedResponse modified) {
        ObjectNode node = JsonCodec.objectNode();
        if (modified.statusCode() == null) {
            node.putNull("status_code");
        } else {
            node.put("status_code", modified.statusCode());
        }
        if (modified.headers() == null) {
            node.putNull("headers");
        } else {
            node.set("headers", encodeHeaders(modified.headers()));
        }
        putNullable(node, "content", modified.content());
        return node;
    }

    /** Decodes a modification; an absent or {@code null} node means pass-through. */
    public static ModifiedResponse decodeModified(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        requireObject(node, "modified_response");
        JsonNode status = node.get("status_code");
        Integer statusCode = isAbsent(status) ? null : requiredStatus(node, "status_code");
        JsonNode headers = node.get("headers");
        return new ModifiedResponse(
            statusCode,
            isAbsent(headers) ? null : decodeHeaders(headers),
            nullableText(node, "content")
        );
    }

    public static ObjectNode encodeResumeCommand(ResumeCommand command) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("flow_id", command.flowId());
        if (command.modifiedResponse() == null) {
            node.putNull("modified_response");
        } else {
            node.set("modified_response", encodeModified(command.modifiedResponse()));
        }
        return node;
    }

    public static ResumeCommand decodeResumeCommand(JsonNode node) {
        requireObject(node, "resume command");
        return new ResumeCommand(requiredText(node, "flow_id"), decodeModified(node.get("modified_response")));
    }

    // --- decision ---

    public static ObjectNode encodeDecision(ResponseDecision decision) {
        ObjectNode node = JsonCodec.objectNode();
        putNullable(node, "flow_id", decision.flowId());
        node.put("action", decision.isPassThrough() ? "pass_through" : "modify");
        if (decision.isPassThrough()) {
            node.putNull("modified_response");
        } else {
            node.set("modified_response", encodeModified(decision.modification()));
        }
        putNullable(node, "mock_rule_id", decision.mockRuleId());
        putNullable(node, "mock_rule_name", decision.mockRuleName());
        return node;
    }

    public static ResponseDecision decodeDecision(JsonNode node) {
        requireObject(node, "decision");
        String action = requiredText(node, "action");
        ModifiedResponse modified;
        switch (action) {
            case "pass_through" -> modified = ModifiedResponse.PASS_THROUGH;
            case "modify" -> {
                modified = decodeModified(node.get("modified_response"));
                if (modified == null) {
                    modified = ModifiedResponse.PASS_THROUGH;
                }
            }
            default -> throw new WireFormatException("unknown action: " + action);
        }
        return new ResponseDecision(
            nullableText(node, "flow_id"),
            modified,
            nullableText(node, "mock_rule_id"),
            nullableText(node, "mock_rule_name")
        );
    }

    // --- mock query ---

    /** Query-string parameters of a mock lookup: {@code method, host, path, query_<key>}. */
    public static Map<String, String> encodeMockQuery(MockQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("method", query.method());
        params.put("host", query.host());
        params.put("path", query.path());
        for (Map.Entry<String, String> e : query.query().entrySet()) {
            params.put(QUERY_PARAM_PREFIX + e.getKey(), e.getValue());
        }
        return params;
    }

    public static MockQuery decodeMockQuery(Map<String, List<String>> params) {
        String method = first(params, "method");
        if (method == null || method.isBlank()) {
            throw new WireFormatException("missing required parameter: method");
        }
        Map<String, String> query = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : params.entrySet()) {
            if (e.getKey().startsWith(QUERY_PARAM_PREFIX) && !e.getValue().isEmpty()) {
                query.put(e.getKey().substring(QUERY_PARAM_PREFIX.length()), e.getValue().get(0));
            }
        }
        String host = first(params, "host");
        String path = first(params, "path");
        return new MockQuery(method, host == null ? "" : host, path == null ? "/" : path, query);
    }

    public static ObjectNode encodeMockDecision(MockDecision decision) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("rule_name", decision.ruleName());
        node.put("rule_id", decision.ruleId());
        node.put("status_code", decision.statusCode());
        node.set("headers", encodeHeaders(decision.headers()));
        node.put("content", decision.content());
        return node;
    }

    /** Decodes a mock lookup reply; {@code {}} means no rule matched. */
    public static Optional<MockDecision> decodeMockDecision(JsonNode node) {
        if (isAbsent(node) || (node.isObject() && node.isEmpty())) {
            return Optional.empty();
        }
        requireObject(node, "mock decision");
        return Optional.of(new MockDecision(
            optionalText(node, "rule_id"),
            optionalText(node, "rule_name"),
            requiredStatus(node, "status_code"),
            decodeHeaders(node.get("headers")),
            optionalText(node, "content")
        ));
    }

    // --- rules ---

    public static ObjectNode encodeRule(MockRule rule) {
        ObjectNode node = JsonCodec.objectNode();
        putNullable(node, "id", rule.id());
        node.put("name", rule.name());
        node.put("enabled", rule.enabled());
        node.put("method", rule.method());
        node.put("scheme", rule.scheme());
        node.put("host", rule.host());
        if (rule.port() == null) {
            node.putNull("port");
        } else {
            node.put("port", rule.port());
        }
        node.put("path", rule.path());
        ArrayNode params = node.putArray("query_params");
        for (QueryParam p : rule.queryParams()) {
            ObjectNode param = params.addObject();
            param.put("key", p.key());
            param.put("value", p.value());
            param.put("required", p.required());
            param.put("match_type", p.matchType().name());
        }
        node.put("status_code", rule.response().statusCode());
        node.set("headers", encodeHeaders(rule.response().headers()));
        node.put("content", rule.response().content());
        return node;
    }

    /** Decodes a rule; id and sequence are left to the repository. */
    public static MockRule decodeRule(JsonNode node) {
        requireObject(node, "rule");
        List<QueryParam> params = new ArrayList<>();
        JsonNode paramsNode = node.get("query_params");
        if (!isAbsent(paramsNode)) {
            if (!paramsNode.isArray()) {
                throw new WireFormatException("query_params must be an array");
            }
            for (JsonNode p : paramsNode) {
                requireObject(p, "query param");
                params.add(new QueryParam(
                    requiredText(p, "key"),
                    optionalText(p, "value"),
                    p.path("required").asBoolean(true),
                    decodeMatchType(p.get("match_type"))
                ));
            }
        }
        JsonNode port = node.get("port");
        JsonNode status = node.get("status_code");
        MockResponseSpec response;
        try {
            response = new MockResponseSpec(
                isAbsent(status) ? MockResponseSpec.DEFAULT_STATUS : requiredStatus(node, "status_code"),
                decodeHeaders(node.get("headers")),
                optionalText(node, "content")
            );
        } catch (IllegalArgumentException e) {
            throw new WireFormatException(e.getMessage(), e);
        }
        return new MockRule(
            nullableText(node, "id"),
            optionalText(node, "name"),
            node.path("enabled").asBoolean(true),
            0L,
            requiredText(node, "method"),
            optionalText(node, "scheme"),
            requiredText(node, "host"),
            port != null && port.canConvertToInt() && !port.isNull() ? port.asInt() : null,
            optionalText(node, "path"),
            params,
            response
        );
    }

    public static ArrayNode encodeRules(List<MockRule> rules) {
        ArrayNode array = JsonCodec.arrayNode();
        for (MockRule rule : rules) {
            array.add(encodeRule(rule));
        }
        return array;
    }

    public static List<MockRule> decodeRules(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new WireFormatException("rule list must be a json array");
        }
        List<MockRule> out = new ArrayList<>(node.size());
        for (JsonNode rule : node) {
            out.add(decodeRule(rule));
        }
        return out;
    }

    // --- flows ---

    public static ObjectNode encodeFlow(Flow flow) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("flow_id", flow.id());
        node.put("state", flow.state().name().toLowerCase(Locale.ROOT));
        node.put("paused", flow.paused());
        node.set("request", encodeRequest(flow.request()));
        if (flow.response() == null) {
            node.putNull("response");
        } else {
            node.set("response", encodeResponse(flow.response()));
        }
        node.put("timestamp", flow.capturedAtMillis() / 1000.0d);
        node.put("duration", flow.durationMillis() / 1000.0d);
        node.put("mock_applied", flow.mockApplied());
        putNullable(node, "mock_rule_name", flow.mockRuleName());
        putNullable(node, "mock_rule_id", flow.mockRuleId());
        node.put("modified", flow.modified());
        return node;
    }

    public static ArrayNode encodeFlows(List<Flow> flows) {
        ArrayNode array = JsonCodec.arrayNode();
        for (Flow flow : flows) {
            array.add(encodeFlow(flow));
        }
        return array;
    }

    // --- helpers ---

    private static ObjectNode encodeHeaders(Map<String, String> headers) {
        ObjectNode node = JsonCodec.objectNode();
        for (Map.Entry<String, String> e : headers.entrySet()) {
            node.put(e.getKey(), e.getValue());
        }
        return node;
    }

    private static Map<String, String> decodeHeaders(JsonNode node) {
        if (isAbsent(node)) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new WireFormatException("headers must be a json object");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            JsonNode value = e.getValue();
            if (value.isContainerNode()) {
                throw new WireFormatException("header value must be scalar: " + e.getKey());
            }
            headers.put(e.getKey(), value.isNull() ? "" : value.asText());
        }
        return headers;
    }

    private static MatchType decodeMatchType(JsonNode node) {
        if (isAbsent(node)) {
            return MatchType.EXACT;
        }
        try {
            return MatchType.valueOf(node.asText().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new WireFormatException("unknown match_type: " + node.asText(), e);
        }
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new WireFormatException(what + " must be a json object");
        }
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new WireFormatException("missing required text field: " + field);
        }
        return node.asText().trim();
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (isAbsent(node)) {
            return "";
        }
        if (node.isContainerNode()) {
            throw new WireFormatException("field must be scalar: " + field);
        }
        return node.asText();
    }

    private static String nullableText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (isAbsent(node)) {
            return null;
        }
        if (node.isContainerNode()) {
            throw new WireFormatException("field must be scalar: " + field);
        }
        return node.asText();
    }

    private static int requiredStatus(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.canConvertToInt()) {
            throw new WireFormatException("missing required integer field: " + field);
        }
        int value = node.asInt();
        if (value < 100 || value > 599) {
            throw new WireFormatException(field + " out of range: " + value);
        }
        return value;
    }

    private static void putNullable(ObjectNode node, String field, String value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value);
        }
    }

    private static String first(Map<String, List<String>> params, String key) {
        List<String> values = params.get(key);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
