package com.acme.devtools.flowtap.mock;

import com.acme.devtools.flowtap.flow.Flow;
import com.acme.devtools.flowtap.flow.ResponseSnapshot;
import com.acme.devtools.flowtap.transport.wire.FlowWireCodec;
import com.acme.devtools.flowtap.util.JsonCodec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Rule collection with read-copy-update semantics. Writers swap in a new immutable list;
 * readers take {@link #snapshot()} and never see a partially applied change.
 */
public final class MockRuleRepository {
    private static final Logger LOG = Logger.getLogger(MockRuleRepository.class.getName());

    private final AtomicReference<List<MockRule>> rules = new AtomicReference<>(List.of());
    private final AtomicLong sequence = new AtomicLong();

    public List<MockRule> snapshot() {
        return rules.get();
    }

    public List<MockRule> list() {
        return snapshot();
    }

    public int size() {
        return snapshot().size();
    }

    public Optional<MockRule> get(String id) {
        for (MockRule rule : snapshot()) {
            if (rule.id().equals(id)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Stores {@code draft} as a new rule. A blank or already used id is replaced with a fresh one.
     */
    public MockRule create(MockRule draft) {
        long seq = sequence.incrementAndGet();
        MockRule[] created = new MockRule[1];
        update(current -> {
            String id = draft.id();
            if (id == null || id.isBlank() || containsId(current, id)) {
                id = UUID.randomUUID().toString();
            }
            created[0] = draft.withIdentity(id, seq);
            List<MockRule> next = new ArrayList<>(current);
            next.add(created[0]);
            return next;
        });
        MockRule rule = created[0];
        LOG.info(() -> "Mock rule added: " + rule.name() + " " + rule.method() + " " + rule.host() + rule.path());
        return rule;
    }

    /** Replaces the rule with {@code id}, keeping its id and creation order. */
    public Optional<MockRule> update(String id, MockRule replacement) {
        MockRule[] updated = new MockRule[1];
        update(current -> {
            updated[0] = null;
            List<MockRule> next = new ArrayList<>(current.size());
            for (MockRule rule : current) {
                if (rule.id().equals(id)) {
                    updated[0] = replacement.withIdentity(id, rule.sequence());
                    next.add(updated[0]);
                } else {
                    next.add(rule);
                }
            }
            return updated[0] == null ? current : next;
        });
        return Optional.ofNullable(updated[0]);
    }

    public boolean delete(String id) {
        boolean[] removed = new boolean[1];
        update(current -> {
            List<MockRule> next = new ArrayList<>(current);
            removed[0] = next.removeIf(rule -> rule.id().equals(id));
            return removed[0] ? next : current;
        });
        if (removed[0]) {
            LOG.info(() -> "Mock rule removed: " + id);
        }
        return removed[0];
    }

    public Optional<MockRule> setEnabled(String id, boolean enabled) {
        MockRule[] updated = new MockRule[1];
        update(current -> {
            updated[0] = null;
            List<MockRule> next = new ArrayList<>(current.size());
            for (MockRule rule : current) {
                if (rule.id().equals(id)) {
                    updated[0] = rule.withEnabled(enabled);
                    next.add(updated[0]);
                } else {
                    next.add(rule);
                }
            }
            return updated[0] == null ? current : next;
        });
        return Optional.ofNullable(updated[0]);
    }

    public void clear() {
        rules.set(List.of());
    }

    /**
     * Builds and stores a rule answering like {@code flow} did: same method, host and path,
     * every captured query parameter required with its exact value. A repeated key keeps its
     * first value, the one a lookup sees.
     */
    public MockRule createFromFlow(Flow flow, String name) {
        StructuredUrl url = StructuredUrl.parseExact(flow.request().url());
        String host = flow.request().host().isEmpty() ? url.host() : flow.request().host();
        String path = url.path().isEmpty() ? MockQuery.of(flow.request()).path() : url.path();
        ResponseSnapshot response = flow.response();
        MockResponseSpec spec = response == null
            ? MockResponseSpec.ok("")
            : new MockResponseSpec(response.statusCode(), response.headers(), response.body());
        String ruleName = name == null || name.isBlank()
            ? flow.request().method() + " " + path
            : name;
        return create(new MockRule(null, ruleName, true, 0L, flow.request().method(), url.scheme(), host,
            url.port(), path, firstValuePerKey(url.queryParams()), spec));
    }

    private static List<QueryParam> firstValuePerKey(List<QueryParam> params) {
        Map<String, QueryParam> byKey = new LinkedHashMap<>();
        for (QueryParam param : params) {
            byKey.putIfAbsent(param.key(), param);
        }
        return List.copyOf(byKey.values());
    }

    /** Replaces the rule set with the rules stored in {@code file}. Returns the number loaded. */
    public int loadFrom(Path file) throws IOException {
        List<MockRule> decoded = FlowWireCodec.decodeRules(JsonCodec.readTree(file));
        List<MockRule> loaded = new ArrayList<>(decoded.size());
        List<String> ids = new ArrayList<>();
        for (MockRule rule : decoded) {
            String id = rule.id();
            if (id == null || id.isBlank() || ids.contains(id)) {
                id = UUID.randomUUID().toString();
            }
            ids.add(id);
            loaded.add(rule.withIdentity(id, sequence.incrementAndGet()));
        }
        rules.set(List.copyOf(loaded));
        LOG.info(() -> "Loaded " + loaded.size() + " mock rule(s) from " + file);
        return loaded.size();
    }

    public void saveTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JsonCodec.writeFile(file, FlowWireCodec.encodeRules(snapshot()));
    }

    /** Convenience factory for a rule answering {@code method host+path} with a fixed body. */
    public MockRule create(String name, String method, String url, int statusCode, String content) {
        StructuredUrl parsed = StructuredUrl.parseExact(url);
        return create(MockRule.fromUrl(name, method, parsed,
            new MockResponseSpec(statusCode, Map.of(), content)));
    }

    private void update(UnaryOperator<List<MockRule>> change) {
        while (true) {
            List<MockRule> current = rules.get();
            List<MockRule> next = change.apply(current);
            if (next == current) {
                return;
            }
            if (rules.compareAndSet(current, List.copyOf(next))) {
                return;
            }
        }
    }

    private static boolean containsId(List<MockRule> rules, String id) {
        for (MockRule rule : rules) {
            if (rule.id().equals(id)) {
                return true;
            }
        }
        return false;
    }
}
