package com.routemq.exchange;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Topic Matcher Tests")
class TopicMatcherTest {

    @Nested
    @DisplayName("Splitting")
    class SplitTests {

        @Test
        @DisplayName("Empty key has no words")
        void testEmptyKey() {
            assertThat(TopicMatcher.split("")).isEmpty();
            assertThat(TopicMatcher.split(null)).isEmpty();
        }

        @Test
        @DisplayName("Empty words between dots are kept")
        void testEmptyWords() {
            assertThat(TopicMatcher.split("a..b")).containsExactly("a", "", "b");
            assertThat(TopicMatcher.split(".")).containsExactly("", "");
        }
    }

    @Nested
    @DisplayName("Single word wildcard")
    class StarTests {

        @Test
        @DisplayName("* matches exactly one word")
        void testStar() {
            assertThat(TopicMatcher.matches("*.orange.*", "quick.orange.rabbit")).isTrue();
            assertThat(TopicMatcher.matches("*.orange.*", "orange.rabbit")).isFalse();
            assertThat(TopicMatcher.matches("*.orange.*", "quick.orange.male.rabbit")).isFalse();
            assertThat(TopicMatcher.matches("*", "")).isFalse();
        }

        @Test
        @DisplayName("* never matches inside a word")
        void testNoPartialWord() {
            assertThat(TopicMatcher.matches("stock.*", "stock.usd.nyse")).isFalse();
            assertThat(TopicMatcher.matches("sto*", "stock")).isFalse();
        }
    }

    @Nested
    @DisplayName("Multi word wildcard")
    class HashTests {

        @Test
        @DisplayName("Trailing # matches zero or more words")
        void testTrailingHash() {
            assertThat(TopicMatcher.matches("lazy.#", "lazy")).isTrue();
            assertThat(TopicMatcher.matches("lazy.#", "lazy.pink.rabbit")).isTrue();
            assertThat(TopicMatcher.matches("lazy.#", "lazy.pink.rabbit.fox")).isTrue();
            assertThat(TopicMatcher.matches("lazy.#", "quick.lazy")).isFalse();
        }

        @Test
        @DisplayName("Leading # matches zero or more words")
        void testLeadingHash() {
            assertThat(TopicMatcher.matches("#.rabbit", "quick.orange.rabbit")).isTrue();
            assertThat(TopicMatcher.matches("#.rabbit", "rabbit")).isTrue();
            assertThat(TopicMatcher.matches("#.rabbit", "rabbit.fox")).isFalse();
        }

        @Test
        @DisplayName("Lone # matches everything, the empty key included")
        void testLoneHash() {
            assertThat(TopicMatcher.matches("#", "")).isTrue();
            assertThat(TopicMatcher.matches("#", "a.b.c")).isTrue();
        }

        @ParameterizedTest(name = "a.#.b.#.c vs {0} -> {1}")
        @CsvSource({
            "a.b.c, true",
            "a.x.b.y.c, true",
            "a.b.b.c, true",
            "a.x.y.b.c.c, true",
            "a.c.b, false",
            "a.b, false",
            "a.x.c, false"
        })
        @DisplayName("Several # in one pattern backtrack")
        void testMultipleHashes(String key, boolean expected) {
            assertThat(TopicMatcher.matches("a.#.b.#.c", key)).isEqualTo(expected);
        }

        @Test
        @DisplayName("# followed by * needs at least one word")
        void testHashThenStar() {
            assertThat(TopicMatcher.matches("#.*", "")).isFalse();
            assertThat(TopicMatcher.matches("#.*", "a")).isTrue();
            assertThat(TopicMatcher.matches("#.*", "a.b.c")).isTrue();
        }
    }

    @Test
    @DisplayName("Literal pattern matches only the identical key")
    void testLiteral() {
        assertThat(TopicMatcher.matches("a.b", "a.b")).isTrue();
        assertThat(TopicMatcher.matches("a.b", "a.b.c")).isFalse();
        assertThat(TopicMatcher.matches("", "")).isTrue();
        assertThat(TopicMatcher.matches("", "a")).isFalse();
    }
}
