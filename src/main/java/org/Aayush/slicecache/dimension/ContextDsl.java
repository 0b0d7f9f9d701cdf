package org.Aayush.slicecache.dimension;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;

/**
 * Parser and formatter for chained {@code context(key:value)} clauses.
 *
 * <p>Only the context clause family is understood. Clauses are separated by {@code .} and may
 * appear in any order; formatting always emits keys alphabetically.</p>
 */
public final class ContextDsl {
    private static final String CLAUSE_PREFIX = "context(";

    private ContextDsl() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses a context DSL chain into a canonical assignment.
     *
     * @param dsl chain such as {@code context(device:mobile).context(channel:google)}; null or
     *            blank yields the empty assignment.
     * @return canonical assignment.
     * @throws IllegalArgumentException on malformed clauses or a key bound twice.
     */
    public static DimensionAssignment parse(String dsl) {
        if (dsl == null || dsl.isBlank()) {
            return DimensionAssignment.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        String remaining = dsl.trim();
        while (!remaining.isEmpty()) {
            if (!remaining.startsWith(CLAUSE_PREFIX)) {
                throw new IllegalArgumentException("expected context(...) clause at: " + remaining);
            }
            int close = remaining.indexOf(')');
            if (close < 0) {
                throw new IllegalArgumentException("unterminated context clause: " + remaining);
            }
            String body = remaining.substring(CLAUSE_PREFIX.length(), close);
            int colon = body.indexOf(':');
            if (colon <= 0 || colon == body.length() - 1) {
                throw new IllegalArgumentException("context clause must be key:value, got: " + body);
            }
            String key = DimensionAssignment.normalizeKey(body.substring(0, colon));
            String value = body.substring(colon + 1).trim();
            String previous = values.put(key, value);
            if (previous != null) {
                throw new IllegalArgumentException("dimension " + key + " bound twice: " + previous + ", " + value);
            }
            remaining = remaining.substring(close + 1).trim();
            if (remaining.startsWith(".")) {
                remaining = remaining.substring(1).trim();
                if (remaining.isEmpty()) {
                    throw new IllegalArgumentException("dangling separator in: " + dsl);
                }
            } else if (!remaining.isEmpty()) {
                throw new IllegalArgumentException("expected '.' between clauses at: " + remaining);
            }
        }
        return DimensionAssignment.of(values);
    }

    /**
     * Formats sorted key/value pairs as a context chain.
     */
    static String format(SortedMap<String, String> valuesByKey) {
        if (valuesByKey.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<String, String> entry : valuesByKey.entrySet()) {
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(CLAUSE_PREFIX).append(entry.getKey()).append(':').append(entry.getValue()).append(')');
        }
        return builder.toString();
    }
}
