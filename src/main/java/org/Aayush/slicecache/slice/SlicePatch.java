package org.Aayush.slicecache.slice;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.signature.CacheSignature;

import java.time.Instant;

/**
 * Freshly fetched data to merge into the slice with the same assignment, mode and signature.
 */
@Value
@Builder
public class SlicePatch {
    @NonNull
    DimensionAssignment assignment;
    @NonNull
    @Builder.Default
    SliceMode mode = SliceMode.WINDOW;
    @NonNull
    CacheSignature signature;
    @NonNull
    @Builder.Default
    TimeSeries series = TimeSeries.empty();
    /** Range the source was asked for, or {@code null} when unknown. */
    DateRange fetchedRange;
    AggregateTotal aggregateTotal;
    Instant retrievedAt;
}
