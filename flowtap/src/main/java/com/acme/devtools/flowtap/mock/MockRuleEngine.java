package com.acme.devtools.flowtap.mock;

import com.acme.devtools.flowtap.flow.RequestSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Selects the mock rule that answers a request.
 *
 * <p>A rule is a candidate when it is enabled and its method (ignoring case), host and path
 * equal the request's. Each required query parameter must then be present and satisfy its
 * {@link MatchType}; optional parameters and extra request parameters are ignored. Among the
 * survivors the rule with the most required parameters wins, then the earliest created.
 *
 * <p>A rule whose regex does not compile is skipped and logged; the scan goes on.
 */
public final class MockRuleEngine {
    private static final Logger LOG = Logger.getLogger(MockRuleEngine.class.getName());
    private static final int MAX_CACHED_PATTERNS = 256;

    private final MockRuleRepository repository;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public MockRuleEngine(MockRuleRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    public Optional<MockMatch> match(RequestSnapshot request) {
        return match(MockQuery.of(request));
    }

    public Optional<MockMatch> match(MockQuery query) {
        List<MockRule> rules = repository.snapshot();
        MockRule best = null;
        int bestScore = -1;
        for (MockRule rule : rules) {
            int score;
            try {
                score = score(rule, query);
            } catch (PatternSyntaxException e) {
                LOG.log(Level.WARNING, "Skipping mock rule with invalid pattern: " + rule.id() + " " + rule.name(), e);
                continue;
            }
            if (score < 0) {
                continue;
            }
            if (best == null || score > bestScore || (score == bestScore && rule.sequence() < best.sequence())) {
                best = rule;
                bestScore = score;
            }
        }
        if (best == null) {
            LOG.fine(() -> "No mock rule for " + query.method() + " " + query.host() + query.path());
            return Optional.empty();
        }
        MockRule winner = best;
        LOG.fine(() -> "Mock rule matched: " + winner.name() + " for " + query.method() + " " + query.host() + query.path());
        return Optional.of(new MockMatch(best, bestScore));
    }

    /** Number of required parameters matched, or -1 when the rule does not apply. */
    private int score(MockRule rule, MockQuery query) {
        if (!rule.enabled()
            || !rule.method().equalsIgnoreCase(query.method())
            || !rule.host().equals(query.host())
            || !rule.path().equals(query.path())) {
            return -1;
        }
        int matched = 0;
        for (QueryParam param : rule.queryParams()) {
            if (!param.required()) {
                continue;
            }
            String actual = query.query().get(param.key());
            if (actual == null) {
                return -1;
            }
            switch (param.matchType()) {
                case EXACT -> {
                    if (!param.value().equals(actual)) {
                        return -1;
                    }
                }
                case REGEX -> {
                    if (!pattern(param.value()).matcher(actual).matches()) {
                        return -1;
                    }
                }
                case WILDCARD -> {
                }
            }
            matched++;
        }
        return matched;
    }

    private Pattern pattern(String regex) {
        Pattern cached = patterns.get(regex);
        if (cached != null) {
            return cached;
        }
        Pattern compiled = Pattern.compile(regex);
        if (patterns.size() < MAX_CACHED_PATTERNS) {
            patterns.put(regex, compiled);
        }
        return compiled;
    }
}
