package org.Aayush.slicecache.slice;

import java.util.List;
import java.util.Set;

/**
 * Output of {@link SliceIsolator#isolate(java.util.Collection, org.Aayush.slicecache.dimension.DimensionAssignment)}.
 *
 * @param matched slices matching every specified dimension.
 * @param unspecifiedDims keys carried by the matches beyond the query; for
 *                        {@link Status#INCONSISTENT_DIMENSIONS} the union over all matches.
 * @param status isolation status.
 */
public record IsolationResult(List<Slice> matched, Set<String> unspecifiedDims, Status status) {

    /**
     * Isolation status.
     */
    public enum Status {
        /** No slice matched. */
        EMPTY,
        /** Matches carry exactly the query's keys. */
        EXACT,
        /** Matches carry the same extra keys. */
        SUPERSET,
        /** Matches disagree on their extra keys; a data-integrity fault. */
        INCONSISTENT_DIMENSIONS
    }

    public IsolationResult {
        matched = List.copyOf(matched);
        unspecifiedDims = Set.copyOf(unspecifiedDims);
    }
}
