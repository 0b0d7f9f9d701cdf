package org.Aayush.slicecache.plan;

import lombok.Builder;
import lombok.Value;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.signature.CacheSignature;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.SliceMode;

/**
 * One planning request.
 */
@Value
@Builder(toBuilder = true)
public class PlanRequest {
    /** Metric whose slice arena is consulted. */
    String metricId;
    /** Requested constraints; {@code null} means dimensionless. */
    DimensionAssignment assignment;
    /** Inclusive requested window. */
    DateRange window;
    /** Fingerprint of the question being asked now. */
    CacheSignature signature;
    /** Source resolution; {@code null} means {@link SourceGranularity#DAILY}. */
    SourceGranularity granularity;
    /** Window or cohort semantics; {@code null} means {@link SliceMode#WINDOW}. */
    SliceMode mode;

    public DimensionAssignment effectiveAssignment() {
        return assignment == null ? DimensionAssignment.empty() : assignment;
    }

    public SliceMode effectiveMode() {
        return mode == null ? SliceMode.WINDOW : mode;
    }

    public SourceGranularity effectiveGranularity() {
        return granularity == null ? SourceGranularity.DAILY : granularity;
    }
}
