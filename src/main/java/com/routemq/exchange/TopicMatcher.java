package com.routemq.exchange;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Topic exchange pattern matching over dot-separated words.
 * <p>
 * {@code *} matches exactly one word and {@code #} matches zero or more words.
 * Wildcards only ever stand for whole words.
 */
public final class TopicMatcher {

    public static final String WORD_DELIMITER = "\\.";
    public static final String SINGLE_WORD = "*";
    public static final String ZERO_OR_MORE_WORDS = "#";

    private TopicMatcher() {
    }

    /**
     * Split a routing key or binding pattern into words. The empty string has no
     * words; empty words between adjacent dots are kept.
     */
    public static List<String> split(String key) {
        if (key == null || key.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(Arrays.asList(key.split(WORD_DELIMITER, -1)));
    }

    public static boolean matches(String pattern, String routingKey) {
        return matches(split(pattern), split(routingKey));
    }

    /**
     * matched[p][k] holds whether pattern words from p on match key words from k on.
     */
    public static boolean matches(List<String> patternWords, List<String> keyWords) {
        int patternLength = patternWords.size();
        int keyLength = keyWords.size();

        boolean[][] matched = new boolean[patternLength + 1][keyLength + 1];
        matched[patternLength][keyLength] = true;

        for (int p = patternLength - 1; p >= 0; p--) {
            String word = patternWords.get(p);
            for (int k = keyLength; k >= 0; k--) {
                if (ZERO_OR_MORE_WORDS.equals(word)) {
                    // '#' either stops here or swallows one more key word
                    matched[p][k] = matched[p + 1][k] || (k < keyLength && matched[p][k + 1]);
                } else if (k < keyLength && (SINGLE_WORD.equals(word) || word.equals(keyWords.get(k)))) {
                    matched[p][k] = matched[p + 1][k + 1];
                }
            }
        }
        return matched[0][0];
    }
}
