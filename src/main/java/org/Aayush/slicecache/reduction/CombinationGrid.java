package org.Aayush.slicecache.reduction;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.Aayush.slicecache.dimension.DimensionAssignment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Cross-product grid over a fixed set of dimensions.
 *
 * <p>Cells are assignments restricted to the grid's dimensions. Cells are enumerated in
 * canonical order: keys alphabetically, values in sorted order, last key varying fastest.</p>
 */
public final class CombinationGrid {
    private final SortedMap<String, SortedSet<String>> valuesByKey;

    private CombinationGrid(SortedMap<String, SortedSet<String>> valuesByKey) {
        this.valuesByKey = valuesByKey;
    }

    /**
     * Creates a grid from per-dimension value sets.
     */
    public static CombinationGrid of(Map<String, ? extends Collection<String>> valuesByKey) {
        Objects.requireNonNull(valuesByKey, "valuesByKey");
        TreeMap<String, SortedSet<String>> sorted = new TreeMap<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : valuesByKey.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new IllegalArgumentException("grid dimension " + entry.getKey() + " has no values");
            }
            sorted.put(entry.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(entry.getValue())));
        }
        return new CombinationGrid(Collections.unmodifiableSortedMap(sorted));
    }

    public SortedMap<String, SortedSet<String>> valuesByKey() {
        return valuesByKey;
    }

    /**
     * Returns the number of cells, saturating at {@link Integer#MAX_VALUE}.
     */
    public int cellCount() {
        long count = 1L;
        for (SortedSet<String> values : valuesByKey.values()) {
            count = Math.min(Integer.MAX_VALUE, count * values.size());
        }
        return (int) count;
    }

    /**
     * Enumerates every cell in canonical order.
     */
    public List<DimensionAssignment> cells() {
        List<String> keys = new ArrayList<>(valuesByKey.keySet());
        List<DimensionAssignment> cells = new ArrayList<>();
        enumerate(keys, 0, new TreeMap<>(), cells);
        return cells;
    }

    /**
     * Counts observed cells and reports missing and repeated ones.
     *
     * @param observed projected cell per contributing slice.
     */
    public Occupancy occupancy(Collection<DimensionAssignment> observed) {
        Object2IntOpenHashMap<DimensionAssignment> counts = new Object2IntOpenHashMap<>();
        counts.defaultReturnValue(0);
        for (DimensionAssignment cell : observed) {
            counts.addTo(cell, 1);
        }
        List<DimensionAssignment> missing = new ArrayList<>();
        for (DimensionAssignment cell : cells()) {
            if (counts.getInt(cell) == 0) {
                missing.add(cell);
            }
        }
        TreeSet<DimensionAssignment> duplicated = new TreeSet<>();
        for (Object2IntMap.Entry<DimensionAssignment> entry : counts.object2IntEntrySet()) {
            if (entry.getIntValue() > 1) {
                duplicated.add(entry.getKey());
            }
        }
        return new Occupancy(missing, new ArrayList<>(duplicated));
    }

    private void enumerate(
            List<String> keys,
            int depth,
            TreeMap<String, String> prefix,
            List<DimensionAssignment> sink
    ) {
        if (depth == keys.size()) {
            sink.add(DimensionAssignment.of(prefix));
            return;
        }
        String key = keys.get(depth);
        for (String value : valuesByKey.get(key)) {
            prefix.put(key, value);
            enumerate(keys, depth + 1, prefix, sink);
        }
        prefix.remove(key);
    }

    /**
     * Grid occupancy.
     *
     * @param missing cells with no contributing slice, canonical order.
     * @param duplicated cells with more than one contributing slice, canonical order.
     */
    public record Occupancy(List<DimensionAssignment> missing, List<DimensionAssignment> duplicated) {

        public Occupancy {
            missing = List.copyOf(missing);
            duplicated = List.copyOf(duplicated);
        }

        public boolean isComplete() {
            return missing.isEmpty() && duplicated.isEmpty();
        }
    }
}
