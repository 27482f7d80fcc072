package com.acme.devtools.flowtap.coordinator;

import java.util.Locale;

/**
 * How the coordinator treats new submissions.
 */
public enum InterceptMode {
    /** Record and pass through. */
    RECORDING,
    /** Pause every flow until an operator resumes it. */
    DEBUG,
    /** Answer from a matching mock rule, otherwise pass through. */
    MOCK,
    /** Apply a matching mock rule, then pause for the operator. */
    MOCK_DEBUG;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses a mode name, ignoring case and accepting {@code -} for {@code _}. */
    public static InterceptMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("mode is required");
        }
        return valueOf(raw.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
