package org.Aayush.slicecache.reduction;

import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.Slice;
import org.Aayush.slicecache.slice.SliceMode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Collapses slices that repeat the same assignment in the same mode.
 *
 * <p>Window and cohort slices never collapse into each other. Repeats that agree on every
 * shared day collapse into one slice carrying the union of their days and fetched ranges. Repeats that report different counts for the same day, or different window
 * totals, are ambiguous and are reported rather than resolved by picking one.</p>
 */
public final class SliceDeduplicator {

    private SliceDeduplicator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * De-duplicates {@code slices}, keeping first-seen order.
     */
    public static Result deduplicate(Collection<Slice> slices) {
        LinkedHashMap<Key, Slice> unique = new LinkedHashMap<>();
        LinkedHashMap<Key, DimensionAssignment> ambiguousKeys = new LinkedHashMap<>();
        for (Slice slice : slices) {
            Key key = new Key(slice.getMode(), slice.getAssignment());
            Slice previous = unique.get(key);
            if (previous == null) {
                unique.put(key, slice);
            } else if (conflicts(previous, slice)) {
                ambiguousKeys.put(key, slice.getAssignment());
            } else if (!previous.hasSameContent(slice)) {
                List<DateRange> fetched = new ArrayList<>(previous.getFetchedRanges());
                fetched.addAll(slice.getFetchedRanges());
                unique.put(key, previous.toBuilder()
                        .series(previous.getSeries().merge(slice.getSeries()))
                        .fetchedRanges(DateRange.union(fetched))
                        .aggregateTotal(previous.getAggregateTotal() != null
                                ? previous.getAggregateTotal()
                                : slice.getAggregateTotal())
                        .build());
            }
        }
        for (Key key : ambiguousKeys.keySet()) {
            unique.remove(key);
        }
        TreeSet<DimensionAssignment> ambiguous = new TreeSet<>(ambiguousKeys.values());
        return new Result(new ArrayList<>(unique.values()), new ArrayList<>(ambiguous));
    }

    private static boolean conflicts(Slice first, Slice second) {
        if (first.getAggregateTotal() != null
                && second.getAggregateTotal() != null
                && !Objects.equals(first.getAggregateTotal(), second.getAggregateTotal())) {
            return true;
        }
        return !first.getSeries().agreesOnSharedDays(second.getSeries());
    }

    private record Key(SliceMode mode, DimensionAssignment assignment) {
    }

    /**
     * De-duplication result.
     *
     * @param unique one slice per unambiguous assignment.
     * @param ambiguous assignments seen with conflicting content, sorted.
     */
    public record Result(List<Slice> unique, List<DimensionAssignment> ambiguous) {

        public Result {
            unique = List.copyOf(unique);
            ambiguous = List.copyOf(ambiguous);
        }

        public boolean isAmbiguous() {
            return !ambiguous.isEmpty();
        }
    }
}
