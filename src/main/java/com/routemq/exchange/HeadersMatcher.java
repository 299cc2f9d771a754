package com.routemq.exchange;

import com.routemq.amqp.AmqpConstants;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Header predicate of one headers-exchange binding, parsed from its arguments.
 * <p>
 * {@code x-match} selects {@code all} (the default) or {@code any}. Other keys starting
 * with {@code x-} are ignored unless the mode is {@code all-with-x} or {@code any-with-x}.
 * A criterion with a null value matches on presence of the header alone.
 */
public final class HeadersMatcher {

    private static final String X_PREFIX = "x-";

    private final boolean matchAny;
    private final Map<String, Object> criteria;

    private HeadersMatcher(boolean matchAny, Map<String, Object> criteria) {
        this.matchAny = matchAny;
        this.criteria = criteria;
    }

    public static HeadersMatcher fromArguments(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return new HeadersMatcher(false, Collections.emptyMap());
        }

        Object xMatch = arguments.get(AmqpConstants.HEADERS_MATCH_ARGUMENT);
        String mode = xMatch != null ? xMatch.toString() : "all";
        boolean matchAny = mode.startsWith("any");
        boolean includeX = mode.endsWith("-with-x");

        Map<String, Object> criteria = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            String key = entry.getKey();
            if (AmqpConstants.HEADERS_MATCH_ARGUMENT.equals(key)) {
                continue;
            }
            if (!includeX && key.startsWith(X_PREFIX)) {
                continue;
            }
            criteria.put(key, entry.getValue());
        }
        return new HeadersMatcher(matchAny, Collections.unmodifiableMap(criteria));
    }

    public boolean isMatchAny() {
        return matchAny;
    }

    public Map<String, Object> getCriteria() {
        return criteria;
    }

    public boolean matches(Map<String, Object> headers) {
        if (criteria.isEmpty()) {
            return true;
        }
        Map<String, Object> actual = headers != null ? headers : Collections.emptyMap();

        for (Map.Entry<String, Object> entry : criteria.entrySet()) {
            boolean holds = actual.containsKey(entry.getKey())
                && (entry.getValue() == null || valuesEqual(entry.getValue(), actual.get(entry.getKey())));
            if (matchAny && holds) {
                return true;
            }
            if (!matchAny && !holds) {
                return false;
            }
        }
        return !matchAny;
    }

    static boolean valuesEqual(Object expected, Object actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        if (expected instanceof Number && actual instanceof Number) {
            Number a = (Number) expected;
            Number b = (Number) actual;
            if (isIntegral(a) && isIntegral(b)) {
                return a.longValue() == b.longValue();
            }
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        if (expected instanceof byte[] && actual instanceof byte[]) {
            return Arrays.equals((byte[]) expected, (byte[]) actual);
        }
        return expected.equals(actual);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Byte || n instanceof Short || n instanceof Integer || n instanceof Long;
    }

    @Override
    public String toString() {
        return String.format("HeadersMatcher{mode=%s, criteria=%s}", matchAny ? "any" : "all", criteria);
    }
}
