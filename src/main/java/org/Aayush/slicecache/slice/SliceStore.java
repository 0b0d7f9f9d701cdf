package org.Aayush.slicecache.slice;

import java.util.List;

/**
 * Persisted slice store collaborator.
 */
public interface SliceStore {

    /**
     * Returns an immutable snapshot of every slice held for {@code metricId}.
     */
    List<Slice> loadSlices(String metricId);

    /**
     * Merges a patch and returns the resulting slice. Dates already present are never
     * overwritten, so replaying the same patch is a no-op.
     */
    Slice merge(String metricId, SlicePatch patch);
}
