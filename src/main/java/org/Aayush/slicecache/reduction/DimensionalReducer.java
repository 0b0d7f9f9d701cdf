package org.Aayush.slicecache.reduction;

import org.Aayush.slicecache.context.ContextDefinition;
import org.Aayush.slicecache.context.ContextRegistry;
import org.Aayush.slicecache.context.MeceCheck;
import org.Aayush.slicecache.context.MecePolicy;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.slice.Slice;
import org.Aayush.slicecache.slice.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Sums matched slices across their unspecified dimensions when that is a valid total.
 *
 * <p>Order of checks:</p>
 * <ol>
 * <li>too many unspecified dimensions;</li>
 * <li>de-duplication (conflicting repeats are ambiguous);</li>
 * <li>per-dimension MECE evaluation;</li>
 * <li>joint grid occupancy over the canonical observed values;</li>
 * <li>identical date arrays;</li>
 * <li>day-by-day sum.</li>
 * </ol>
 */
public final class DimensionalReducer {
    public static final int DEFAULT_MAX_JOINT_DIMENSIONS = 4;
    public static final int MAX_REPORTED_COMBINATIONS = 10;

    public static final String REASON_TOO_MANY_DIMENSIONS = "REDUCE_TOO_MANY_DIMENSIONS";
    public static final String REASON_NOT_MECE = "REDUCE_NOT_MECE";
    public static final String REASON_INCOMPLETE_COMBINATIONS = "REDUCE_INCOMPLETE_COMBINATIONS";
    public static final String REASON_DUPLICATE_COMBINATION = "REDUCE_DUPLICATE_COMBINATION";
    public static final String REASON_AMBIGUOUS_SLICE = "REDUCE_AMBIGUOUS_SLICE";
    public static final String REASON_DATE_ARRAYS_MISALIGNED = "REDUCE_DATE_ARRAYS_MISALIGNED";
    public static final String REASON_NO_SLICES = "REDUCE_NO_SLICES";

    private static final Logger log = LoggerFactory.getLogger(DimensionalReducer.class);

    private final ContextRegistry registry;
    private final MecePolicy mecePolicy;
    private final int maxJointDimensions;

    public DimensionalReducer(ContextRegistry registry) {
        this(registry, MecePolicy.defaults(), DEFAULT_MAX_JOINT_DIMENSIONS);
    }

    public DimensionalReducer(ContextRegistry registry, MecePolicy mecePolicy, int maxJointDimensions) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.mecePolicy = Objects.requireNonNull(mecePolicy, "mecePolicy");
        if (maxJointDimensions <= 0) {
            throw new IllegalArgumentException("maxJointDimensions must be > 0");
        }
        this.maxJointDimensions = maxJointDimensions;
    }

    /**
     * Evaluates each unspecified dimension without summing.
     *
     * @return checks keyed by dimension, in key order.
     */
    public Map<String, MeceCheck> evaluate(Collection<Slice> matched, Set<String> unspecifiedDims) {
        TreeMap<String, MeceCheck> checks = new TreeMap<>();
        for (String key : new TreeSet<>(unspecifiedDims)) {
            TreeSet<String> values = new TreeSet<>();
            for (Slice slice : matched) {
                String value = slice.getAssignment().value(key);
                if (value != null) {
                    values.add(value);
                }
            }
            checks.put(key, mecePolicy.evaluate(key, registry.definition(key), values));
        }
        return checks;
    }

    /**
     * Reduces {@code matched} across {@code unspecifiedDims}.
     *
     * @param matched slices that share one unspecified key set, already restricted to the window.
     * @param unspecifiedDims keys to sum away; empty means the slices must collapse to one.
     */
    public ReductionOutcome reduce(Collection<Slice> matched, Set<String> unspecifiedDims) {
        Objects.requireNonNull(matched, "matched");
        Objects.requireNonNull(unspecifiedDims, "unspecifiedDims");
        if (matched.isEmpty()) {
            return notReducible(REASON_NO_SLICES, "no slices to reduce").build();
        }
        if (unspecifiedDims.size() > maxJointDimensions) {
            return notReducible(
                    REASON_TOO_MANY_DIMENSIONS,
                    unspecifiedDims.size() + " unspecified dimensions exceed limit " + maxJointDimensions
            ).build();
        }

        SliceDeduplicator.Result dedup = SliceDeduplicator.deduplicate(matched);
        if (dedup.isAmbiguous()) {
            log.warn("Ambiguous slices with conflicting content: {}", dedup.ambiguous());
            return ReductionOutcome.builder()
                    .kind(ReductionOutcome.Kind.AGGREGATION_FAILED)
                    .reasonCode(REASON_AMBIGUOUS_SLICE)
                    .detail("conflicting slices for " + dedup.ambiguous())
                    .offendingAssignments(dedup.ambiguous())
                    .build();
        }
        List<Slice> slices = dedup.unique();

        Map<String, MeceCheck> checks = evaluate(slices, unspecifiedDims);
        List<String> failures = new ArrayList<>();
        for (MeceCheck check : checks.values()) {
            if (!check.isAggregable()) {
                failures.add(check.getKey() + "=" + check.getReasonCode());
            }
        }
        if (!failures.isEmpty()) {
            return notReducible(REASON_NOT_MECE, "dimensions not aggregable: " + failures)
                    .checks(checks)
                    .build();
        }

        if (!unspecifiedDims.isEmpty()) {
            ReductionOutcome gridFailure = checkGrid(slices, checks);
            if (gridFailure != null) {
                return gridFailure;
            }
        } else if (slices.size() > 1) {
            return notReducible(REASON_DUPLICATE_COMBINATION, "exact query matched " + slices.size() + " slices")
                    .build();
        }

        TimeSeries reference = slices.get(0).getSeries();
        List<DimensionAssignment> misaligned = new ArrayList<>();
        for (Slice slice : slices) {
            if (!slice.getSeries().hasSameDates(reference)) {
                misaligned.add(slice.getAssignment());
            }
        }
        if (!misaligned.isEmpty()) {
            log.warn("Date arrays misaligned against {}: {}", slices.get(0).getAssignment(), misaligned);
            return ReductionOutcome.builder()
                    .kind(ReductionOutcome.Kind.AGGREGATION_FAILED)
                    .reasonCode(REASON_DATE_ARRAYS_MISALIGNED)
                    .detail("date arrays differ from " + slices.get(0).getAssignment())
                    .checks(checks)
                    .offendingAssignments(misaligned)
                    .build();
        }

        TimeSeries sum = reference;
        for (int i = 1; i < slices.size(); i++) {
            sum = sum.plus(slices.get(i).getSeries());
        }
        Set<String> specified = new TreeSet<>(slices.get(0).getAssignment().keys());
        specified.removeAll(unspecifiedDims);
        return ReductionOutcome.builder()
                .kind(ReductionOutcome.Kind.REDUCED)
                .checks(checks)
                .assignment(slices.get(0).getAssignment().project(specified))
                .series(sum)
                .n(sum.totalN())
                .k(sum.totalK())
                .build();
    }

    /**
     * Returns the grid of cells a complete cache would hold for these dimensions: the expected
     * values where a definition asserts completeness, the observed values otherwise.
     */
    public CombinationGrid targetGrid(Map<String, MeceCheck> checks) {
        LinkedHashMap<String, List<String>> values = new LinkedHashMap<>();
        for (MeceCheck check : checks.values()) {
            TreeSet<String> cellValues = new TreeSet<>(check.getPresentValues());
            ContextDefinition definition = registry.definition(check.getKey());
            if (definition != null && definition.policy().canBeComplete()) {
                cellValues.addAll(check.getMissingValues());
            }
            values.put(check.getKey(), new ArrayList<>(cellValues));
        }
        return CombinationGrid.of(values);
    }

    /**
     * Projects a slice onto the grid dimensions using canonical value ids.
     */
    public DimensionAssignment canonicalCell(Slice slice, Set<String> dims) {
        TreeMap<String, String> cell = new TreeMap<>();
        for (String key : dims) {
            String raw = slice.getAssignment().value(key);
            ContextDefinition definition = registry.definition(key);
            cell.put(key, definition == null ? raw : definition.canonicalValue(raw));
        }
        return DimensionAssignment.of(cell);
    }

    private ReductionOutcome checkGrid(List<Slice> slices, Map<String, MeceCheck> checks) {
        LinkedHashMap<String, List<String>> observed = new LinkedHashMap<>();
        for (MeceCheck check : checks.values()) {
            observed.put(check.getKey(), check.getPresentValues());
        }
        CombinationGrid grid = CombinationGrid.of(observed);
        List<DimensionAssignment> cells = new ArrayList<>(slices.size());
        for (Slice slice : slices) {
            cells.add(canonicalCell(slice, checks.keySet()));
        }
        CombinationGrid.Occupancy occupancy = grid.occupancy(cells);
        if (!occupancy.duplicated().isEmpty()) {
            return notReducible(REASON_DUPLICATE_COMBINATION, "cells present more than once: " + occupancy.duplicated())
                    .checks(checks)
                    .offendingAssignments(occupancy.duplicated())
                    .build();
        }
        if (!occupancy.missing().isEmpty()) {
            List<DimensionAssignment> missing = occupancy.missing();
            return notReducible(
                    REASON_INCOMPLETE_COMBINATIONS,
                    missing.size() + " of " + grid.cellCount() + " combinations missing"
            )
                    .checks(checks)
                    .missingCombinations(missing.subList(0, Math.min(MAX_REPORTED_COMBINATIONS, missing.size())))
                    .build();
        }
        return null;
    }

    private static ReductionOutcome.ReductionOutcomeBuilder notReducible(String reasonCode, String detail) {
        return ReductionOutcome.builder()
                .kind(ReductionOutcome.Kind.NOT_REDUCIBLE)
                .reasonCode(reasonCode)
                .detail(detail);
    }
}
