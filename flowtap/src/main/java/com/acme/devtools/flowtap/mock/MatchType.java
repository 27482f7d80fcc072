package com.acme.devtools.flowtap.mock;

/**
 * How a required query parameter is compared with the request value.
 */
public enum MatchType {
    /** Value must be equal. */
    EXACT,
    /** Key must be present, any value. */
    WILDCARD,
    /** Value must fully match the rule value as a regular expression. */
    REGEX
}
