package org.Aayush.slicecache.reduction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.slicecache.context.MeceCheck;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.slice.TimeSeries;

import java.util.List;
import java.util.Map;

/**
 * Result of summing matched slices across their unspecified dimensions.
 */
@Value
@Builder
public class ReductionOutcome {

    /**
     * Outcome kind.
     */
    public enum Kind {
        /** The slices were summed. */
        REDUCED,
        /** The dimensions may not be summed away; a fetch is required. */
        NOT_REDUCIBLE,
        /** The slices should have aligned but did not; a data-integrity fault. */
        AGGREGATION_FAILED
    }

    Kind kind;
    /** Reason code for non-reduced outcomes, {@code null} when reduced. */
    String reasonCode;
    /** Human-readable detail for non-reduced outcomes. */
    String detail;
    /** Per reduced dimension MECE evaluation, keyed by dimension. */
    @Singular("check")
    Map<String, MeceCheck> checks;
    /** Grid cells absent from the cache, first ones only. */
    @Singular("missingCombination")
    List<DimensionAssignment> missingCombinations;
    /** Assignments that failed alignment or de-duplication. */
    @Singular("offendingAssignment")
    List<DimensionAssignment> offendingAssignments;
    /** Assignment restricted to the specified dimensions. */
    DimensionAssignment assignment;
    /** Day-by-day sum. */
    TimeSeries series;
    long n;
    long k;

    public boolean isReduced() {
        return kind == Kind.REDUCED;
    }

    /**
     * Returns whether every reduced dimension was a complete partition.
     */
    public boolean isComplete() {
        for (MeceCheck check : checks.values()) {
            if (!check.isComplete()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code k / n}, or {@code 0.0} when {@code n} is zero.
     */
    public double mean() {
        return n == 0L ? 0.0d : (double) k / (double) n;
    }
}
