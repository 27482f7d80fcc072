package com.acme.devtools.flowtap.mock;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuredUrlTest {

    @Test
    void shouldRoundTripUrlsWithQueryParameters() {
        for (String url : List.of(
            "https://api.example.com/users?limit=10&sort=name",
            "http://localhost:8080/v1/items?q=red+shoes",
            "https://api.example.com/health",
            "https://api.example.com/search?q=a%20b",
            "https://api.example.com/search?v=a~b",
            "https://api.example.com/items?id=1&id=2&flag"
        )) {
            assertEquals(url, StructuredUrl.parseExact(url).toFullUrl());
        }
    }

    @Test
    void shouldPercentEncodeParametersBuiltInCode() {
        StructuredUrl url = new StructuredUrl("https", "api.example.com", 8443, "/search",
            List.of(QueryParam.exact("q", "a b"), QueryParam.exact("v", "a~b&c")));

        assertEquals("https://api.example.com:8443/search?q=a%20b&v=a~b%26c", url.toFullUrl());
    }

    @Test
    void shouldReencodeWhenParametersNoLongerMatchRawQuery() {
        StructuredUrl parsed = StructuredUrl.parseExact("https://api.example.com/search?q=a+b");
        StructuredUrl edited = new StructuredUrl(parsed.scheme(), parsed.host(), parsed.port(), parsed.path(),
            List.of(QueryParam.exact("q", "c d")), parsed.rawQuery());

        assertEquals("https://api.example.com/search?q=c%20d", edited.toFullUrl());
    }

    @Test
    void shouldOmitDefaultPorts() {
        assertEquals("https://api.example.com/a", StructuredUrl.parse("https://api.example.com:443/a").toFullUrl());
        assertEquals("http://api.example.com/a", StructuredUrl.parse("http://api.example.com:80/a").toFullUrl());
    }

    @Test
    void exactParseShouldRequireEveryParameter() {
        StructuredUrl url = StructuredUrl.parseExact("https://api.example.com/users?limit=10&q=a%20b");

        assertEquals("https", url.scheme());
        assertEquals("api.example.com", url.host());
        assertNull(url.port());
        assertEquals("/users", url.path());
        assertEquals(List.of(QueryParam.exact("limit", "10"), QueryParam.exact("q", "a b")), url.queryParams());
    }

    @Test
    void lenientParseShouldMakeParametersOptionalWildcards() {
        StructuredUrl url = StructuredUrl.parse("https://api.example.com/users?limit=10");

        QueryParam limit = url.queryParams().get(0);
        assertFalse(limit.required());
        assertEquals(MatchType.WILDCARD, limit.matchType());
        assertEquals("10", limit.value());
    }

    @Test
    void shouldReturnEmptyForInputThatIsNotAnAbsoluteUrl() {
        assertSame(StructuredUrl.EMPTY, StructuredUrl.parse(null));
        assertSame(StructuredUrl.EMPTY, StructuredUrl.parse("   "));
        assertSame(StructuredUrl.EMPTY, StructuredUrl.parse("/relative/path"));
        assertSame(StructuredUrl.EMPTY, StructuredUrl.parse("http://bad host/x"));
        assertTrue(StructuredUrl.EMPTY.queryParams().isEmpty());
    }
}
