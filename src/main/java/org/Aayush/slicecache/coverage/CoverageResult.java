package org.Aayush.slicecache.coverage;

import org.Aayush.slicecache.slice.DateRange;

import java.util.List;

/**
 * Day-granular coverage of one requested range.
 *
 * @param status coverage status.
 * @param gaps maximal missing sub-ranges in ascending order; empty when fully covered.
 */
public record CoverageResult(Status status, List<DateRange> gaps) {
    private static final CoverageResult FULLY_COVERED = new CoverageResult(Status.FULLY_COVERED, List.of());

    /**
     * Coverage status.
     */
    public enum Status {
        FULLY_COVERED,
        GAPS
    }

    public CoverageResult {
        gaps = List.copyOf(gaps);
        if ((status == Status.FULLY_COVERED) != gaps.isEmpty()) {
            throw new IllegalArgumentException("status " + status + " inconsistent with " + gaps.size() + " gaps");
        }
    }

    public static CoverageResult fullyCovered() {
        return FULLY_COVERED;
    }

    /**
     * Returns {@link #fullyCovered()} for an empty list, otherwise a gaps result.
     */
    public static CoverageResult ofGaps(List<DateRange> gaps) {
        return gaps.isEmpty() ? FULLY_COVERED : new CoverageResult(Status.GAPS, gaps);
    }

    public boolean isFullyCovered() {
        return status == Status.FULLY_COVERED;
    }

    public int missingDayCount() {
        int days = 0;
        for (DateRange gap : gaps) {
            days += gap.dayCount();
        }
        return days;
    }
}
