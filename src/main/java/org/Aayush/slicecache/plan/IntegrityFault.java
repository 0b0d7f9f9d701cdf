package org.Aayush.slicecache.plan;

import org.Aayush.slicecache.dimension.DimensionAssignment;

import java.util.List;

/**
 * Data-integrity problem found while planning. Never resolved silently.
 *
 * @param code fault code such as {@code AMBIGUOUS_SLICE}.
 * @param detail human-readable detail.
 * @param assignments assignments involved.
 */
public record IntegrityFault(String code, String detail, List<DimensionAssignment> assignments) {
    public static final String AMBIGUOUS_SLICE = "AMBIGUOUS_SLICE";
    public static final String INCONSISTENT_DIMENSIONS = "INCONSISTENT_DIMENSIONS";
    public static final String AGGREGATION_FAILED = "AGGREGATION_FAILED";

    public IntegrityFault {
        assignments = List.copyOf(assignments);
    }
}
