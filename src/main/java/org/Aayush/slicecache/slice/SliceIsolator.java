package org.Aayush.slicecache.slice;

import org.Aayush.slicecache.dimension.DimensionAssignment;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds cached slices whose assignment agrees with a query on every specified dimension.
 *
 * <p>Matching is exact on specified keys, restricted to one {@link SliceMode}, and does no date
 * reasoning.</p>
 */
public final class SliceIsolator {
    private static final Comparator<SliceFamily> FAMILY_ORDER = Comparator
            .comparingInt((SliceFamily family) -> family.unspecifiedDims().size())
            .thenComparing(SliceFamily::dimensionLabel);

    /**
     * Isolates matching window slices and their unspecified dimensions.
     *
     * <p>For the empty query every dimensioned slice is a candidate; dimensionless slices are
     * matched only when no dimensioned slice exists. Unspecified keys are read off the first
     * match and must be identical across all matches.</p>
     */
    public IsolationResult isolate(Collection<Slice> slices, DimensionAssignment query) {
        return isolate(slices, query, SliceMode.WINDOW);
    }

    /**
     * Isolates matching slices of one mode.
     */
    public IsolationResult isolate(Collection<Slice> slices, DimensionAssignment query, SliceMode mode) {
        Objects.requireNonNull(slices, "slices");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(mode, "mode");
        List<Slice> matched = new ArrayList<>();
        for (Slice slice : slices) {
            if (slice.getMode() == mode && slice.getAssignment().covers(query)) {
                matched.add(slice);
            }
        }
        if (query.isEmpty() && matched.stream().anyMatch(slice -> !slice.getAssignment().isEmpty())) {
            matched.removeIf(slice -> slice.getAssignment().isEmpty());
        }
        if (matched.isEmpty()) {
            return new IsolationResult(List.of(), Set.of(), IsolationResult.Status.EMPTY);
        }

        Set<String> first = matched.get(0).getAssignment().keysNotIn(query);
        TreeSet<String> union = new TreeSet<>(first);
        boolean consistent = true;
        for (Slice slice : matched) {
            Set<String> extra = slice.getAssignment().keysNotIn(query);
            if (!extra.equals(first)) {
                consistent = false;
                union.addAll(extra);
            }
        }
        if (!consistent) {
            return new IsolationResult(matched, union, IsolationResult.Status.INCONSISTENT_DIMENSIONS);
        }
        IsolationResult.Status status = first.isEmpty()
                ? IsolationResult.Status.EXACT
                : IsolationResult.Status.SUPERSET;
        return new IsolationResult(matched, first, status);
    }

    /**
     * Groups matching window slices into consistent families by their unspecified key set.
     *
     * <p>Families are ordered by number of unspecified keys, then key names, so the exact
     * family (if any) is first. Members are in canonical assignment order.</p>
     */
    public List<SliceFamily> families(Collection<Slice> slices, DimensionAssignment query) {
        return families(slices, query, SliceMode.WINDOW);
    }

    /**
     * Groups matching slices of one mode into families.
     */
    public List<SliceFamily> families(Collection<Slice> slices, DimensionAssignment query, SliceMode mode) {
        Objects.requireNonNull(slices, "slices");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(mode, "mode");
        Map<String, List<Slice>> byLabel = new TreeMap<>();
        Map<String, Set<String>> keysByLabel = new TreeMap<>();
        for (Slice slice : slices) {
            if (slice.getMode() != mode || !slice.getAssignment().covers(query)) {
                continue;
            }
            Set<String> extra = slice.getAssignment().keysNotIn(query);
            String label = String.join(",", extra);
            byLabel.computeIfAbsent(label, ignored -> new ArrayList<>()).add(slice);
            keysByLabel.putIfAbsent(label, extra);
        }
        List<SliceFamily> families = new ArrayList<>(byLabel.size());
        for (Map.Entry<String, List<Slice>> entry : byLabel.entrySet()) {
            List<Slice> members = entry.getValue();
            members.sort(Comparator.comparing(Slice::getAssignment));
            families.add(new SliceFamily(keysByLabel.get(entry.getKey()), members));
        }
        families.sort(FAMILY_ORDER);
        return families;
    }
}
