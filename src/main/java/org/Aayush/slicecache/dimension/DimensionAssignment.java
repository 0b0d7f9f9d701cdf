package org.Aayush.slicecache.dimension;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable canonical mapping from dimension key to one concrete value.
 *
 * <p>Keys are trimmed and lower-cased, values are trimmed, and entries are kept sorted by key
 * so two assignments built from differently ordered inputs compare equal and share one
 * canonical DSL form. The empty assignment means "no constraint on any dimension".</p>
 */
public final class DimensionAssignment implements Comparable<DimensionAssignment> {
    private static final DimensionAssignment EMPTY = new DimensionAssignment(new TreeMap<>());

    private final TreeMap<String, String> valuesByKey;
    private final String canonical;

    private DimensionAssignment(TreeMap<String, String> valuesByKey) {
        this.valuesByKey = valuesByKey;
        this.canonical = ContextDsl.format(valuesByKey);
    }

    /**
     * Returns the shared empty assignment.
     */
    public static DimensionAssignment empty() {
        return EMPTY;
    }

    /**
     * Creates an assignment from raw key/value pairs.
     *
     * @param values raw mapping; keys are normalised, blank keys or values are rejected.
     * @return canonical assignment.
     * @throws IllegalArgumentException when two raw keys normalise to the same key.
     */
    public static DimensionAssignment of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> normalized = new TreeMap<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String key = normalizeKey(entry.getKey());
            String value = normalizeValue(entry.getValue(), key);
            if (normalized.put(key, value) != null) {
                throw new IllegalArgumentException("duplicate dimension key after normalisation: " + key);
            }
        }
        return new DimensionAssignment(normalized);
    }

    /**
     * Convenience factory for a single-key assignment.
     */
    public static DimensionAssignment of(String key, String value) {
        return of(Map.of(key, value));
    }

    /**
     * Convenience factory for a two-key assignment.
     */
    public static DimensionAssignment of(String key1, String value1, String key2, String value2) {
        return of(Map.of(key1, value1, key2, value2));
    }

    /**
     * Parses the canonical context DSL form, for example {@code context(channel:google)}.
     */
    public static DimensionAssignment parse(String dsl) {
        return ContextDsl.parse(dsl);
    }

    /**
     * Normalises one dimension key.
     */
    public static String normalizeKey(String key) {
        String normalized = Objects.requireNonNull(key, "dimension key").trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("dimension key must be non-blank");
        }
        return normalized;
    }

    private static String normalizeValue(String value, String key) {
        String normalized = Objects.requireNonNull(value, "value for " + key).trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("value for dimension " + key + " must be non-blank");
        }
        return normalized;
    }

    /**
     * Returns the value bound to {@code key}, or {@code null} when the key is absent.
     */
    public String value(String key) {
        if (key == null) {
            return null;
        }
        return valuesByKey.get(key.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Returns whether this assignment constrains {@code key}.
     */
    public boolean hasKey(String key) {
        return value(key) != null;
    }

    /**
     * Returns sorted keys.
     */
    public Set<String> keys() {
        return Collections.unmodifiableSet(valuesByKey.keySet());
    }

    /**
     * Returns the sorted key/value view.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(valuesByKey);
    }

    public int size() {
        return valuesByKey.size();
    }

    public boolean isEmpty() {
        return valuesByKey.isEmpty();
    }

    /**
     * Returns whether every key of {@code other} is bound here to the same value.
     */
    public boolean covers(DimensionAssignment other) {
        for (Map.Entry<String, String> entry : other.valuesByKey.entrySet()) {
            if (!entry.getValue().equals(valuesByKey.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns keys bound here but absent from {@code other}, sorted.
     */
    public Set<String> keysNotIn(DimensionAssignment other) {
        TreeSet<String> extra = new TreeSet<>();
        for (String key : valuesByKey.keySet()) {
            if (!other.valuesByKey.containsKey(key)) {
                extra.add(key);
            }
        }
        return Collections.unmodifiableSet(extra);
    }

    /**
     * Returns a copy restricted to {@code keys}.
     */
    public DimensionAssignment project(Set<String> keys) {
        TreeMap<String, String> projected = new TreeMap<>();
        for (Map.Entry<String, String> entry : valuesByKey.entrySet()) {
            if (keys.contains(entry.getKey())) {
                projected.put(entry.getKey(), entry.getValue());
            }
        }
        return projected.isEmpty() ? EMPTY : new DimensionAssignment(projected);
    }

    /**
     * Returns a copy with {@code key} bound to {@code value}, replacing any existing binding.
     */
    public DimensionAssignment with(String key, String value) {
        TreeMap<String, String> extended = new TreeMap<>(valuesByKey);
        String normalizedKey = normalizeKey(key);
        extended.put(normalizedKey, normalizeValue(value, normalizedKey));
        return new DimensionAssignment(extended);
    }

    /**
     * Returns the canonical context DSL, empty for the empty assignment.
     */
    public String toDsl() {
        return canonical;
    }

    @Override
    public int compareTo(DimensionAssignment other) {
        return canonical.compareTo(other.canonical);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DimensionAssignment)) {
            return false;
        }
        return canonical.equals(((DimensionAssignment) o).canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical.isEmpty() ? "(dimensionless)" : canonical;
    }
}
