package com.routemq.exchange;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Headers Matcher Tests")
class HeadersMatcherTest {

    private static Map<String, Object> args(Object... keyValues) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @Nested
    @DisplayName("x-match all")
    class MatchAllTests {

        @Test
        @DisplayName("All criteria must hold")
        void testAll() {
            HeadersMatcher matcher = HeadersMatcher.fromArguments(args("x-match", "all", "format", "pdf", "type", "report"));

            assertThat(matcher.matches(args("format", "pdf", "type", "report", "extra", 1))).isTrue();
            assertThat(matcher.matches(args("format", "pdf"))).isFalse();
            assertThat(matcher.matches(args("format", "pdf", "type", "log"))).isFalse();
        }

        @Test
        @DisplayName("all is the default mode")
        void testDefaultIsAll() {
            HeadersMatcher matcher = HeadersMatcher.fromArguments(args("format", "pdf", "type", "report"));

            assertThat(matcher.isMatchAny()).isFalse();
            assertThat(matcher.matches(args("format", "pdf"))).isFalse();
        }
    }

    @Nested
    @DisplayName("x-match any")
    class MatchAnyTests {

        @Test
        @DisplayName("One holding criterion is enough")
        void testAny() {
            HeadersMatcher matcher = HeadersMatcher.fromArguments(args("x-match", "any", "format", "pdf", "type", "report"));

            assertThat(matcher.matches(args("type", "report"))).isTrue();
            assertThat(matcher.matches(args("format", "zip", "type", "log"))).isFalse();
            assertThat(matcher.matches(null)).isFalse();
        }
    }

    @Test
    @DisplayName("No criteria matches every message")
    void testNoCriteria() {
        assertThat(HeadersMatcher.fromArguments(null).matches(args("a", 1))).isTrue();
        assertThat(HeadersMatcher.fromArguments(args("x-match", "any")).matches(Map.of())).isTrue();
    }

    @Test
    @DisplayName("A null criterion only requires the header to be present")
    void testPresenceOnly() {
        HeadersMatcher matcher = HeadersMatcher.fromArguments(args("trace-id", null));

        assertThat(matcher.matches(args("trace-id", "abc"))).isTrue();
        assertThat(matcher.matches(args("other", "abc"))).isFalse();
    }

    @Test
    @DisplayName("x- keys are ignored unless the mode says with-x")
    void testXKeys() {
        HeadersMatcher plain = HeadersMatcher.fromArguments(args("x-match", "all", "x-priority", 5));
        HeadersMatcher withX = HeadersMatcher.fromArguments(args("x-match", "all-with-x", "x-priority", 5));

        assertThat(plain.getCriteria()).isEmpty();
        assertThat(plain.matches(Map.of())).isTrue();
        assertThat(withX.getCriteria()).containsOnlyKeys("x-priority");
        assertThat(withX.matches(args("x-priority", 5))).isTrue();
        assertThat(withX.matches(Map.of())).isFalse();
    }

    @Test
    @DisplayName("Numbers compare by value across widths")
    void testNumericEquality() {
        HeadersMatcher matcher = HeadersMatcher.fromArguments(args("count", 5));

        assertThat(matcher.matches(args("count", 5L))).isTrue();
        assertThat(matcher.matches(args("count", (short) 5))).isTrue();
        assertThat(matcher.matches(args("count", 6))).isFalse();
        assertThat(HeadersMatcher.valuesEqual(1.5d, 1.5f)).isTrue();
        assertThat(HeadersMatcher.valuesEqual(new byte[] {1, 2}, new byte[] {1, 2})).isTrue();
        assertThat(HeadersMatcher.valuesEqual("5", 5)).isFalse();
    }
}
