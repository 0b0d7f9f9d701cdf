package org.Aayush.slicecache.fetch;

import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.SliceMode;
import org.Aayush.slicecache.slice.TimeSeries;

/**
 * External source collaborator. Owns all I/O.
 */
@FunctionalInterface
public interface FetchAdapter {

    /**
     * Fetches daily counts for one assignment over one contiguous range.
     *
     * <p>Days the source has no events for may be omitted; every day of {@code range} is
     * recorded as fetched once the result merges.</p>
     *
     * @param metricId metric being fetched.
     * @param assignment dimension constraints.
     * @param range inclusive day range.
     * @param mode window or cohort date semantics.
     * @return fetched series; days outside {@code range} make the whole result unusable.
     * @throws AdapterException on network, auth or source failure.
     */
    TimeSeries fetch(String metricId, DimensionAssignment assignment, DateRange range, SliceMode mode)
            throws AdapterException;
}
