package org.Aayush.slicecache.plan;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.SliceMode;

/**
 * One unit of missing work: an assignment and a contiguous day range to fetch.
 */
@Value
@Builder(toBuilder = true)
public class FetchPlanItem implements Comparable<FetchPlanItem> {

    /**
     * Item lifecycle. Items are retired once merged, so there is no success state.
     */
    public enum Status {
        NEEDED,
        IN_FLIGHT,
        FAILED
    }

    /**
     * Why the item is needed.
     */
    public enum Reason {
        /** Cached slice exists but lacks days in the window. */
        MISSING_DAYS,
        /** An expected dimension value has no cached slice. */
        MISSING_VALUE,
        /** A grid cell has no cached slice although its values are known. */
        MISSING_COMBINATION,
        /** Nothing is cached for the metric. */
        NO_CACHED_SLICE,
        /** Cached slices answer a different question. */
        SIGNATURE_INCOMPATIBLE,
        /** Cached slices cannot be summed into the requested total. */
        NOT_REDUCIBLE,
        /** Cached slices disagree with each other. */
        INTEGRITY_FAULT
    }

    @NonNull
    String metricId;
    @NonNull
    DimensionAssignment assignment;
    @NonNull
    DateRange range;
    @NonNull
    @Builder.Default
    SliceMode mode = SliceMode.WINDOW;
    @NonNull
    @Builder.Default
    Status status = Status.NEEDED;
    @NonNull
    Reason reason;

    /**
     * Returns the canonical key {@code metricId|assignmentDsl|start|end}.
     */
    public String itemKey() {
        return metricId + "|" + assignment.toDsl() + "|" + range.start() + "|" + range.end();
    }

    public int dayCount() {
        return range.dayCount();
    }

    public FetchPlanItem withStatus(Status next) {
        return toBuilder().status(next).build();
    }

    @Override
    public int compareTo(FetchPlanItem other) {
        int byAssignment = assignment.compareTo(other.assignment);
        if (byAssignment != 0) {
            return byAssignment;
        }
        int byRange = range.compareTo(other.range);
        return byRange != 0 ? byRange : mode.compareTo(other.mode);
    }
}
