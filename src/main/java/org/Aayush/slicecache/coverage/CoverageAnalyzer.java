package org.Aayush.slicecache.coverage;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.slicecache.slice.AggregateTotal;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.Slice;
import org.Aayush.slicecache.slice.TimeSeries;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Day-granular coverage and gap analysis.
 *
 * <p>Gaps are always the maximal contiguous sub-ranges of {@code requested \ dates}, so one
 * fetch request is emitted per contiguous hole rather than per missing day.</p>
 */
public final class CoverageAnalyzer {

    /**
     * Returns coverage of {@code requested} by the dates of {@code series}.
     */
    public CoverageResult coverage(TimeSeries series, DateRange requested) {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(requested, "requested");
        return jointCoverage(List.of(series), requested).joint();
    }

    /**
     * Returns coverage of {@code requested} by a slice: its points plus its fetched ranges.
     */
    public CoverageResult coverage(Slice slice, DateRange requested) {
        Objects.requireNonNull(slice, "slice");
        Objects.requireNonNull(requested, "requested");
        return coverage(slice.seriesWithin(requested), requested);
    }

    /**
     * Returns the maximal runs of consecutive days present in {@code series}.
     */
    public List<DateRange> coveredRanges(TimeSeries series) {
        return GapCoalescer.coalesce(series.epochDays());
    }

    /**
     * Returns intersection coverage: a day is covered only when every series has it.
     *
     * <p>An empty series list covers nothing.</p>
     */
    public JointCoverage jointCoverage(List<TimeSeries> seriesList, DateRange requested) {
        Objects.requireNonNull(seriesList, "seriesList");
        Objects.requireNonNull(requested, "requested");
        int start = requested.startEpochDay();
        int end = requested.endEpochDay();
        int dayCount = end - start + 1;

        int[] presentCount = new int[dayCount];
        List<CoverageResult> members = new ArrayList<>(seriesList.size());
        for (TimeSeries series : seriesList) {
            boolean[] present = new boolean[dayCount];
            int[] days = series.epochDays();
            int from = lowerBound(days, start);
            for (int i = from; i < days.length && days[i] <= end; i++) {
                present[days[i] - start] = true;
                presentCount[days[i] - start]++;
            }
            members.add(CoverageResult.ofGaps(GapCoalescer.coalesce(missingDays(present, start))));
        }

        IntArrayList jointMissing = new IntArrayList();
        for (int offset = 0; offset < dayCount; offset++) {
            if (presentCount[offset] < seriesList.size() || seriesList.isEmpty()) {
                jointMissing.add(start + offset);
            }
        }
        return new JointCoverage(CoverageResult.ofGaps(GapCoalescer.coalesce(jointMissing)), members);
    }

    /**
     * Evaluates a cached window total against a requested window.
     *
     * <p>Equal windows are exact. A cached window that strictly contains the request is
     * pro-rated linearly by day count, rounding half-up. Anything else is not covered.</p>
     */
    public AggregateCoverage aggregateCoverage(AggregateTotal total, DateRange requested) {
        Objects.requireNonNull(requested, "requested");
        if (total == null) {
            return AggregateCoverage.notCovered();
        }
        DateRange cached = total.window();
        if (cached.equals(requested)) {
            return new AggregateCoverage(AggregateCoverage.Status.EXACT, total.n(), total.k());
        }
        if (!cached.contains(requested)) {
            return AggregateCoverage.notCovered();
        }
        BigDecimal share = BigDecimal.valueOf(requested.dayCount());
        BigDecimal whole = BigDecimal.valueOf(cached.dayCount());
        return new AggregateCoverage(
                AggregateCoverage.Status.PRORATED,
                prorate(total.n(), share, whole),
                prorate(total.k(), share, whole)
        );
    }

    private static long prorate(long value, BigDecimal share, BigDecimal whole) {
        return BigDecimal.valueOf(value)
                .multiply(share)
                .divide(whole, 0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    private static IntArrayList missingDays(boolean[] present, int start) {
        IntArrayList missing = new IntArrayList();
        for (int offset = 0; offset < present.length; offset++) {
            if (!present[offset]) {
                missing.add(start + offset);
            }
        }
        return missing;
    }

    private static int lowerBound(int[] days, int day) {
        int index = Arrays.binarySearch(days, day);
        return index >= 0 ? index : -index - 1;
    }
}
