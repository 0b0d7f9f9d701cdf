package org.Aayush.slicecache.slice;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.signature.CacheSignature;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Immutable unit of cached data for one dimension assignment.
 *
 * <p>A day is covered when the series has a point for it or when it lies inside a fetched
 * range. Sources omit days without events, so a fetched day without a point counts as zero.</p>
 */
@Value
@Builder(toBuilder = true)
public class Slice {
    /** Coordinates; empty means dimensionless. */
    @NonNull
    @Builder.Default
    DimensionAssignment assignment = DimensionAssignment.empty();
    /** Window or cohort date semantics. */
    @NonNull
    @Builder.Default
    SliceMode mode = SliceMode.WINDOW;
    /** Daily counts, possibly empty for aggregate-only sources. */
    @NonNull
    @Builder.Default
    TimeSeries series = TimeSeries.empty();
    /** Ranges the source has answered for this slice, in ascending order. */
    @NonNull
    @Builder.Default
    List<DateRange> fetchedRanges = List.of();
    /** Fingerprint of the question the slice answers. */
    @NonNull
    @Builder.Default
    CacheSignature signature = CacheSignature.unparseable();
    /** Window totals for aggregate-only sources, otherwise {@code null}. */
    AggregateTotal aggregateTotal;
    /** When the data was retrieved, if known. */
    Instant retrievedAt;

    /**
     * Returns whether both slices carry identical data, ignoring retrieval time.
     */
    public boolean hasSameContent(Slice other) {
        return series.equals(other.series)
                && fetchedRanges.equals(other.fetchedRanges)
                && Objects.equals(aggregateTotal, other.aggregateTotal);
    }

    /**
     * Returns whether the slice carries window totals but no daily points.
     */
    public boolean isAggregateOnly() {
        return aggregateTotal != null && series.isEmpty();
    }

    /**
     * Returns whether {@code day} lies inside a fetched range.
     */
    public boolean wasFetched(LocalDate day) {
        for (DateRange range : fetchedRanges) {
            if (range.contains(day)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the series restricted to {@code window}, with a zero point on every fetched day
     * that has no point of its own.
     */
    public TimeSeries seriesWithin(DateRange window) {
        TimeSeries restricted = series.restrictTo(window);
        if (fetchedRanges.isEmpty()) {
            return restricted;
        }
        TimeSeries.Builder builder = TimeSeries.builder();
        boolean filled = false;
        for (LocalDate day = window.start(); !day.isAfter(window.end()); day = day.plusDays(1)) {
            int index = restricted.indexOf(day);
            if (index >= 0) {
                builder.add(day, restricted.n(index), restricted.k(index));
            } else if (wasFetched(day)) {
                builder.add(day, 0L, 0L);
                filled = true;
            }
        }
        return filled ? builder.build() : restricted;
    }
}
