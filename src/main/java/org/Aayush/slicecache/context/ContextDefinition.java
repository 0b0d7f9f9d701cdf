package org.Aayush.slicecache.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only definition of one context dimension as published by the definitions collaborator.
 */
@Value
@Builder(toBuilder = true)
public class ContextDefinition {
    public static final String DEFAULT_CATCH_ALL_ID = "other";

    /** Dimension key, for example {@code channel}. */
    String key;
    /** Enumerated value ids in declaration order. May include the catch-all id. */
    @Singular
    List<String> values;
    /** Aggregation policy; {@code null} is treated as {@link OtherPolicy#OPEN}. */
    OtherPolicy otherPolicy;
    /** Catch-all value id; {@code null} means {@link #DEFAULT_CATCH_ALL_ID}. */
    String catchAllValueId;
    /** Alias to canonical value id, for raw values reported under a legacy name. */
    @Singular
    Map<String, String> aliases;

    /**
     * Returns the effective policy.
     */
    public OtherPolicy policy() {
        return otherPolicy == null ? OtherPolicy.OPEN : otherPolicy;
    }

    /**
     * Returns the effective catch-all id.
     */
    public String catchAll() {
        return catchAllValueId == null || catchAllValueId.isBlank() ? DEFAULT_CATCH_ALL_ID : catchAllValueId.trim();
    }

    /**
     * Returns whether the catch-all id is listed among the enumerated values.
     */
    public boolean listsCatchAll() {
        return values.contains(catchAll());
    }

    /**
     * Returns the value set a complete partition must contain under this policy.
     */
    public Set<String> expectedValues() {
        TreeSet<String> expected = new TreeSet<>();
        String catchAll = catchAll();
        for (String value : values) {
            if (!value.equals(catchAll)) {
                expected.add(value);
            }
        }
        if (policy().includesCatchAll()) {
            expected.add(catchAll);
        }
        return Collections.unmodifiableSet(expected);
    }

    /**
     * Resolves a raw value to its canonical id through the alias table.
     */
    public String canonicalValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        String aliased = aliases.get(trimmed);
        return aliased == null ? trimmed : aliased;
    }
}
