package org.Aayush.slicecache.plan;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Correctness disclosure attached to a satisfied result.
 *
 * @param kind disclosure kind.
 * @param dimensions dimensions summed away, sorted; empty for {@link Kind#EXACT} and {@link Kind#PRORATED}.
 * @param missingValues for {@link Kind#PARTIAL_AGGREGATION}, expected values absent per dimension.
 */
public record Disclosure(Kind kind, List<String> dimensions, Map<String, List<String>> missingValues) {
    private static final Disclosure EXACT = new Disclosure(Kind.EXACT, List.of(), Map.of());
    private static final Disclosure PRORATED = new Disclosure(Kind.PRORATED, List.of(), Map.of());

    /**
     * Disclosure kinds.
     */
    public enum Kind {
        /** Answered by slices for exactly the requested assignment. */
        EXACT,
        /** Summed across complete partitions. */
        MECE_COMPLETE,
        /** Summed across partitions that are not guaranteed complete. */
        PARTIAL_AGGREGATION,
        /** Scaled from a coarser cached window. */
        PRORATED
    }

    public Disclosure {
        dimensions = List.copyOf(dimensions);
        missingValues = Map.copyOf(new TreeMap<>(missingValues));
    }

    public static Disclosure exact() {
        return EXACT;
    }

    public static Disclosure prorated() {
        return PRORATED;
    }

    public static Disclosure meceComplete(List<String> dimensions) {
        return new Disclosure(Kind.MECE_COMPLETE, dimensions, Map.of());
    }

    public static Disclosure partialAggregation(List<String> dimensions, Map<String, List<String>> missingValues) {
        return new Disclosure(Kind.PARTIAL_AGGREGATION, dimensions, missingValues);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case EXACT, PRORATED -> kind.name();
            case MECE_COMPLETE -> kind.name() + dimensions;
            case PARTIAL_AGGREGATION -> kind.name() + dimensions + " missing=" + missingValues;
        };
    }
}
