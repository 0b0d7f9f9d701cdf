package org.Aayush.slicecache.slice;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Matching slices that share one unspecified-dimension key set.
 *
 * @param unspecifiedDims keys the slices carry beyond the query, sorted.
 * @param members slices in canonical assignment order.
 */
public record SliceFamily(Set<String> unspecifiedDims, List<Slice> members) {

    public SliceFamily {
        unspecifiedDims = Set.copyOf(unspecifiedDims);
        members = List.copyOf(members);
    }

    /**
     * Returns whether the family answers the query without reduction.
     */
    public boolean isExact() {
        return unspecifiedDims.isEmpty();
    }

    /**
     * Returns the sorted key list joined by {@code ','}, used for deterministic ordering.
     */
    public String dimensionLabel() {
        return String.join(",", new TreeSet<>(unspecifiedDims));
    }
}
