package org.Aayush.slicecache.plan;

import lombok.Builder;
import org.Aayush.slicecache.context.ContextRegistry;
import org.Aayush.slicecache.context.MeceCheck;
import org.Aayush.slicecache.context.MecePolicy;
import org.Aayush.slicecache.coverage.AggregateCoverage;
import org.Aayush.slicecache.coverage.CoverageAnalyzer;
import org.Aayush.slicecache.coverage.CoverageResult;
import org.Aayush.slicecache.coverage.JointCoverage;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.reduction.CombinationGrid;
import org.Aayush.slicecache.reduction.DimensionalReducer;
import org.Aayush.slicecache.reduction.ReductionOutcome;
import org.Aayush.slicecache.reduction.SliceDeduplicator;
import org.Aayush.slicecache.signature.SignatureMatch;
import org.Aayush.slicecache.signature.SignatureMatcher;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.IsolationResult;
import org.Aayush.slicecache.slice.Slice;
import org.Aayush.slicecache.slice.SliceFamily;
import org.Aayush.slicecache.slice.SliceIsolator;
import org.Aayush.slicecache.slice.SliceMode;
import org.Aayush.slicecache.slice.SliceStore;
import org.Aayush.slicecache.slice.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Planning orchestrator.
 *
 * <p>Stages per request, each recorded in the {@link PlanTrace}:</p>
 * <ul>
 * <li>{@code SIGNATURE_FILTER}: drop slices whose signature cannot answer the query.</li>
 * <li>{@code ISOLATE}: group matching slices of the request's mode into families by their
 * unspecified keys.</li>
 * <li>{@code EXACT_OR_REDUCE}: use the exact family, or sum a family whose partitions allow it.</li>
 * <li>{@code COVERAGE_CHECK}: the window must be covered by every contributing slice, where a
 * day counts as covered when it has a point or was inside a fetched range.</li>
 * </ul>
 * <p>A satisfied answer comes from the exact family first, then from the lexicographically
 * smallest complete reduction, then from a reduction across open partitions with a partial
 * disclosure. Otherwise the fetch plan is built from the best candidate.</p>
 */
public final class FetchPlanBuilder implements PlannerService {
    public static final String REASON_REQUEST_REQUIRED = "PLAN_REQUEST_REQUIRED";
    public static final String REASON_METRIC_ID_REQUIRED = "PLAN_METRIC_ID_REQUIRED";
    public static final String REASON_WINDOW_REQUIRED = "PLAN_WINDOW_REQUIRED";
    public static final String REASON_SIGNATURE_REQUIRED = "PLAN_SIGNATURE_REQUIRED";

    public static final String TRACE_NO_CACHED_SLICE = "PLAN_NO_CACHED_SLICE";
    public static final String TRACE_SIGNATURE_REJECTED = "PLAN_SIGNATURE_REJECTED";
    public static final String TRACE_SIGNATURE_COMPATIBLE = "PLAN_SIGNATURE_COMPATIBLE";
    public static final String TRACE_SIGNATURE_NONE_COMPATIBLE = "PLAN_SIGNATURE_NONE_COMPATIBLE";
    public static final String TRACE_ISOLATE_EMPTY = "PLAN_ISOLATE_EMPTY";
    public static final String TRACE_ISOLATE_EXACT = "PLAN_ISOLATE_EXACT";
    public static final String TRACE_ISOLATE_SUPERSET = "PLAN_ISOLATE_SUPERSET";
    public static final String TRACE_ISOLATE_INCONSISTENT = "PLAN_ISOLATE_INCONSISTENT_DIMENSIONS";
    public static final String TRACE_AMBIGUOUS_SLICE = "PLAN_AMBIGUOUS_SLICE";
    public static final String TRACE_NOT_MECE = "PLAN_REDUCE_NOT_MECE";
    public static final String TRACE_TOO_MANY_DIMENSIONS = "PLAN_REDUCE_TOO_MANY_DIMENSIONS";
    public static final String TRACE_MISSING_VALUES = "PLAN_REDUCE_MISSING_VALUES";
    public static final String TRACE_INCOMPLETE_GRID = "PLAN_REDUCE_INCOMPLETE_GRID";
    public static final String TRACE_AGGREGATION_FAILED = "PLAN_REDUCE_AGGREGATION_FAILED";
    public static final String TRACE_REDUCED_COMPLETE = "PLAN_REDUCED_COMPLETE";
    public static final String TRACE_REDUCED_PARTIAL = "PLAN_REDUCED_PARTIAL";
    public static final String TRACE_COVERAGE_FULL = "PLAN_COVERAGE_FULL";
    public static final String TRACE_COVERAGE_GAPS = "PLAN_COVERAGE_GAPS";
    public static final String TRACE_AGGREGATE_EXACT = "PLAN_AGGREGATE_EXACT";
    public static final String TRACE_AGGREGATE_PRORATED = "PLAN_AGGREGATE_PRORATED";
    public static final String TRACE_AGGREGATE_NOT_COVERED = "PLAN_AGGREGATE_NOT_COVERED";
    public static final String TRACE_NOT_REDUCIBLE = "PLAN_NOT_REDUCIBLE";

    private static final Logger log = LoggerFactory.getLogger(FetchPlanBuilder.class);

    private final SliceStore sliceStore;
    private final SignatureMatcher signatureMatcher;
    private final SliceIsolator sliceIsolator;
    private final DimensionalReducer reducer;
    private final CoverageAnalyzer coverageAnalyzer;
    private final int maxJointDimensions;

    /**
     * Creates the planner.
     *
     * @param sliceStore slice arena collaborator.
     * @param contextRegistry context definitions collaborator.
     * @param config optional tuning; {@link PlannerConfig#defaults()} when {@code null}.
     */
    @Builder
    public FetchPlanBuilder(SliceStore sliceStore, ContextRegistry contextRegistry, PlannerConfig config) {
        this.sliceStore = Objects.requireNonNull(sliceStore, "sliceStore");
        PlannerConfig effective = config == null ? PlannerConfig.defaults() : config;
        this.maxJointDimensions = effective.effectiveMaxJointDimensions();
        this.signatureMatcher = new SignatureMatcher();
        this.sliceIsolator = new SliceIsolator();
        this.reducer = new DimensionalReducer(
                Objects.requireNonNull(contextRegistry, "contextRegistry"),
                MecePolicy.defaults(),
                maxJointDimensions
        );
        this.coverageAnalyzer = new CoverageAnalyzer();
    }

    /**
     * Plans one request.
     *
     * @throws SliceCacheException when the request violates its contract.
     */
    @Override
    public PlanResult plan(PlanRequest request) {
        validate(request);
        Planning planning = new Planning(request);
        PlanResult result = planning.run();
        if (!result.getFaults().isEmpty()) {
            log.warn("Plan for {} {} over {} reported integrity faults: {}",
                    request.getMetricId(), planning.query, request.getWindow(), result.getFaults());
        }
        log.debug("Plan for {} {} over {}: {} trace={}",
                request.getMetricId(), planning.query, request.getWindow(), result.getOutcome(), result.getTrace());
        return result;
    }

    private static void validate(PlanRequest request) {
        if (request == null) {
            throw new SliceCacheException(REASON_REQUEST_REQUIRED, "plan request must be provided");
        }
        if (request.getMetricId() == null || request.getMetricId().isBlank()) {
            throw new SliceCacheException(REASON_METRIC_ID_REQUIRED, "metricId must be non-blank");
        }
        if (request.getWindow() == null) {
            throw new SliceCacheException(REASON_WINDOW_REQUIRED, "window must be provided");
        }
        if (request.getSignature() == null) {
            throw new SliceCacheException(REASON_SIGNATURE_REQUIRED, "query signature must be provided");
        }
    }

    /**
     * State for one planning pass.
     */
    private final class Planning {
        private final PlanRequest request;
        private final String metricId;
        private final DimensionAssignment query;
        private final DateRange window;
        private final SliceMode mode;
        private final PlanTrace trace = new PlanTrace();
        private final List<IntegrityFault> faults = new ArrayList<>();

        private Planning(PlanRequest request) {
            this.request = request;
            this.metricId = request.getMetricId().trim();
            this.query = request.effectiveAssignment();
            this.window = request.getWindow();
            this.mode = request.effectiveMode();
        }

        private PlanResult run() {
            List<Slice> cached = sliceStore.loadSlices(metricId);
            if (cached.isEmpty()) {
                trace.record(PlanTrace.Stage.SIGNATURE_FILTER, TRACE_NO_CACHED_SLICE, metricId);
                return needsFetch(List.of(item(query, window, FetchPlanItem.Reason.NO_CACHED_SLICE)));
            }

            List<Slice> compatible = filterBySignature(cached);
            if (compatible.isEmpty()) {
                trace.record(PlanTrace.Stage.SIGNATURE_FILTER, TRACE_SIGNATURE_NONE_COMPATIBLE,
                        cached.size() + " cached slices");
                return needsFetch(List.of(item(query, window, FetchPlanItem.Reason.SIGNATURE_INCOMPATIBLE)));
            }

            List<SliceFamily> families = isolate(compatible);
            if (families.isEmpty()) {
                return needsFetch(List.of(item(query, window, FetchPlanItem.Reason.NO_CACHED_SLICE)));
            }

            if (request.effectiveGranularity() == SourceGranularity.AGGREGATE) {
                return planAggregate(families);
            }
            return planDaily(families);
        }

        private List<Slice> filterBySignature(List<Slice> cached) {
            List<Slice> compatible = new ArrayList<>(cached.size());
            TreeMap<String, Integer> rejected = new TreeMap<>();
            for (Slice slice : cached) {
                SignatureMatch match = signatureMatcher.canSatisfy(slice.getSignature(), request.getSignature());
                if (match.isCompatible()) {
                    compatible.add(slice);
                } else {
                    rejected.merge(match.describe(), 1, Integer::sum);
                }
            }
            if (!rejected.isEmpty()) {
                trace.record(PlanTrace.Stage.SIGNATURE_FILTER, TRACE_SIGNATURE_REJECTED, rejected.toString());
            }
            if (!compatible.isEmpty()) {
                trace.record(PlanTrace.Stage.SIGNATURE_FILTER, TRACE_SIGNATURE_COMPATIBLE,
                        compatible.size() + " of " + cached.size());
            }
            return compatible;
        }

        private List<SliceFamily> isolate(List<Slice> compatible) {
            IsolationResult isolation = sliceIsolator.isolate(compatible, query, mode);
            switch (isolation.status()) {
                case EMPTY -> trace.record(PlanTrace.Stage.ISOLATE, TRACE_ISOLATE_EMPTY, query.toString());
                case EXACT -> trace.record(PlanTrace.Stage.ISOLATE, TRACE_ISOLATE_EXACT,
                        isolation.matched().size() + " slices");
                case SUPERSET -> trace.record(PlanTrace.Stage.ISOLATE, TRACE_ISOLATE_SUPERSET,
                        "unspecified " + new TreeSet<>(isolation.unspecifiedDims()));
                case INCONSISTENT_DIMENSIONS -> {
                    trace.record(PlanTrace.Stage.ISOLATE, TRACE_ISOLATE_INCONSISTENT,
                            "unspecified keys differ across matches: " + new TreeSet<>(isolation.unspecifiedDims()));
                    List<DimensionAssignment> involved = new ArrayList<>();
                    for (Slice slice : isolation.matched()) {
                        involved.add(slice.getAssignment());
                    }
                    faults.add(new IntegrityFault(
                            IntegrityFault.INCONSISTENT_DIMENSIONS,
                            "matches for " + query + " carry different unspecified keys",
                            involved.stream().distinct().sorted().toList()
                    ));
                }
            }
            if (isolation.status() == IsolationResult.Status.EMPTY) {
                return List.of();
            }
            return sliceIsolator.families(compatible, query, mode);
        }

        private PlanResult planAggregate(List<SliceFamily> families) {
            SliceFamily exact = families.get(0).isExact() ? families.get(0) : null;
            if (exact == null) {
                trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_NOT_REDUCIBLE,
                        "aggregate sources are answered by the exact assignment only");
                return needsFetch(List.of(item(query, window, FetchPlanItem.Reason.NOT_REDUCIBLE)));
            }
            Slice slice = exactSlice(exact);
            if (slice == null) {
                return needsFetch(List.of(item(query, window, FetchPlanItem.Reason.INTEGRITY_FAULT)));
            }
            AggregateCoverage coverage = coverageAnalyzer.aggregateCoverage(slice.getAggregateTotal(), window);
            switch (coverage.status()) {
                case EXACT -> {
                    trace.record(PlanTrace.Stage.COVERAGE_CHECK, TRACE_AGGREGATE_EXACT, window.toString());
                    return satisfied(coverage.n(), coverage.k(), TimeSeries.empty(), List.of(Disclosure.exact()), List.of());
                }
                case PRORATED -> {
                    trace.record(PlanTrace.Stage.COVERAGE_CHECK, TRACE_AGGREGATE_PRORATED,
                            slice.getAggregateTotal().window() + " -> " + window);
                    return satisfied(coverage.n(), coverage.k(), TimeSeries.empty(),
                            List.of(Disclosure.prorated()), List.of());
                }
                case NOT_COVERED -> {
                    trace.record(PlanTrace.Stage.COVERAGE_CHECK, TRACE_AGGREGATE_NOT_COVERED,
                            slice.getAggregateTotal() == null ? "no window total" : slice.getAggregateTotal().window().toString());
                    return needsFetch(List.of(item(query, window, FetchPlanItem.Reason.MISSING_DAYS)));
                }
            }
            throw new IllegalStateException("unhandled aggregate coverage " + coverage.status());
        }

        private PlanResult planDaily(List<SliceFamily> families) {
            List<FetchPlanItem> exactFallback = null;
            List<Candidate> complete = new ArrayList<>();
            Candidate partial = null;
            List<FetchPlanItem> reductionFallback = null;

            for (SliceFamily family : families) {
                if (family.isExact()) {
                    Slice slice = exactSlice(family);
                    if (slice == null) {
                        continue;
                    }
                    CoverageResult coverage = coverageAnalyzer.coverage(slice, window);
                    if (coverage.isFullyCovered()) {
                        trace.record(PlanTrace.Stage.COVERAGE_CHECK, TRACE_COVERAGE_FULL, "exact " + query);
                        TimeSeries series = slice.seriesWithin(window);
                        return satisfied(series.totalN(), series.totalK(), series, List.of(Disclosure.exact()), List.of());
                    }
                    trace.record(PlanTrace.Stage.COVERAGE_CHECK, TRACE_COVERAGE_GAPS,
                            "exact " + query + " gaps " + coverage.gaps());
                    exactFallback = gapItems(slice.getAssignment(), coverage);
                    continue;
                }

                FamilyEvaluation evaluation = evaluate(family);
                if (evaluation == null) {
                    continue;
                }
                if (evaluation.candidate != null) {
                    if (evaluation.candidate.complete) {
                        complete.add(evaluation.candidate);
                    } else if (partial == null) {
                        partial = evaluation.candidate;
                    }
                } else if (reductionFallback == null && evaluation.completable && !evaluation.fallback.isEmpty()) {
                    reductionFallback = evaluation.fallback;
                }
            }

            if (!complete.isEmpty()) {
                complete.sort(Comparator.comparing(candidate -> candidate.family.dimensionLabel()));
                Candidate chosen = complete.get(0);
                List<List<String>> alternatives = new ArrayList<>();
                for (int i = 1; i < complete.size(); i++) {
                    alternatives.add(sortedDims(complete.get(i).family));
                }
                return satisfied(chosen.outcome.getN(), chosen.outcome.getK(), chosen.outcome.getSeries(),
                        List.of(Disclosure.meceComplete(sortedDims(chosen.family))), alternatives);
            }
            if (partial != null) {
                return satisfied(partial.outcome.getN(), partial.outcome.getK(), partial.outcome.getSeries(),
                        List.of(Disclosure.partialAggregation(sortedDims(partial.family), missingValues(partial.outcome))),
                        List.of());
            }
            if (exactFallback != null) {
                return needsFetch(exactFallback);
            }
            if (reductionFallback != null) {
                return needsFetch(reductionFallback);
            }
            trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_NOT_REDUCIBLE,
                    "no family can produce " + query);
            return needsFetch(List.of(item(query, window, FetchPlanItem.Reason.NOT_REDUCIBLE)));
        }

        /**
         * Evaluates one reduction family, or returns {@code null} when it cannot help at all.
         */
        private FamilyEvaluation evaluate(SliceFamily family) {
            Set<String> dims = family.unspecifiedDims();
            String label = "[" + family.dimensionLabel() + "]";
            if (dims.size() > maxJointDimensions) {
                trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_TOO_MANY_DIMENSIONS,
                        label + " exceeds " + maxJointDimensions);
                return null;
            }
            SliceDeduplicator.Result dedup = SliceDeduplicator.deduplicate(family.members());
            if (dedup.isAmbiguous()) {
                recordAmbiguity(dedup);
                return null;
            }
            List<Slice> members = dedup.unique();
            Map<String, MeceCheck> checks = reducer.evaluate(members, dims);
            List<String> notMece = new ArrayList<>();
            boolean completable = true;
            boolean missingRequired = false;
            for (MeceCheck check : checks.values()) {
                if (!check.isAggregable()) {
                    notMece.add(check.getKey() + "=" + check.getReasonCode());
                    continue;
                }
                boolean closedFamily = check.getPolicy().canBeComplete();
                completable &= closedFamily;
                missingRequired |= closedFamily && !check.getMissingValues().isEmpty();
            }
            if (!notMece.isEmpty()) {
                trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_NOT_MECE, label + " " + notMece);
                return null;
            }

            Map<DimensionAssignment, Slice> byCell = new HashMap<>();
            for (Slice member : members) {
                Slice previous = byCell.putIfAbsent(reducer.canonicalCell(member, dims), member);
                if (previous != null) {
                    trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_AGGREGATION_FAILED,
                            label + " cell " + reducer.canonicalCell(member, dims) + " reported twice");
                    faults.add(new IntegrityFault(IntegrityFault.AMBIGUOUS_SLICE,
                            "two slices resolve to one cell " + reducer.canonicalCell(member, dims),
                            List.of(previous.getAssignment(), member.getAssignment())));
                    return null;
                }
            }

            List<TimeSeries> seriesList = new ArrayList<>(members.size());
            for (Slice member : members) {
                seriesList.add(member.seriesWithin(window));
            }
            JointCoverage coverage = coverageAnalyzer.jointCoverage(seriesList, window);
            List<DimensionAssignment> observedMissing = CombinationGrid.of(presentValues(checks))
                    .occupancy(byCell.keySet())
                    .missing();

            FamilyEvaluation evaluation = new FamilyEvaluation(completable);
            if (missingRequired) {
                trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_MISSING_VALUES, label + " " + missingValuesOf(checks));
            } else if (!observedMissing.isEmpty()) {
                trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_INCOMPLETE_GRID,
                        label + " missing " + firstCombinations(observedMissing));
            } else if (!coverage.isFullyCovered()) {
                trace.record(PlanTrace.Stage.COVERAGE_CHECK, TRACE_COVERAGE_GAPS,
                        label + " joint gaps " + coverage.joint().gaps());
            } else {
                trace.record(PlanTrace.Stage.COVERAGE_CHECK, TRACE_COVERAGE_FULL, label);
                List<Slice> restricted = new ArrayList<>(members.size());
                for (Slice member : members) {
                    restricted.add(member.toBuilder().series(member.seriesWithin(window)).build());
                }
                ReductionOutcome outcome = reducer.reduce(restricted, dims);
                switch (outcome.getKind()) {
                    case REDUCED -> {
                        boolean isComplete = outcome.isComplete();
                        trace.record(PlanTrace.Stage.EXACT_OR_REDUCE,
                                isComplete ? TRACE_REDUCED_COMPLETE : TRACE_REDUCED_PARTIAL, label);
                        evaluation.candidate = new Candidate(family, outcome, isComplete);
                        return evaluation;
                    }
                    case AGGREGATION_FAILED -> {
                        trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_AGGREGATION_FAILED,
                                label + " " + outcome.getReasonCode());
                        faults.add(new IntegrityFault(IntegrityFault.AGGREGATION_FAILED,
                                outcome.getDetail(), outcome.getOffendingAssignments()));
                        return null;
                    }
                    case NOT_REDUCIBLE -> trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_NOT_REDUCIBLE,
                            label + " " + outcome.getReasonCode());
                }
            }
            evaluation.fallback = reductionItems(members, dims, checks, byCell);
            return evaluation;
        }

        /**
         * Fetch items that would complete a reduction family: member gaps, then absent cells.
         */
        private List<FetchPlanItem> reductionItems(
                List<Slice> members,
                Set<String> dims,
                Map<String, MeceCheck> checks,
                Map<DimensionAssignment, Slice> byCell
        ) {
            List<FetchPlanItem> items = new ArrayList<>();
            for (DimensionAssignment cell : reducer.targetGrid(checks).cells()) {
                Slice member = byCell.get(cell);
                if (member != null) {
                    items.addAll(gapItems(member.getAssignment(), coverageAnalyzer.coverage(member, window)));
                    continue;
                }
                DimensionAssignment target = query;
                boolean unseenValue = false;
                for (Map.Entry<String, String> entry : cell.asMap().entrySet()) {
                    target = target.with(entry.getKey(), entry.getValue());
                    unseenValue |= !checks.get(entry.getKey()).getPresentValues().contains(entry.getValue());
                }
                items.add(item(target, window, unseenValue
                        ? FetchPlanItem.Reason.MISSING_VALUE
                        : FetchPlanItem.Reason.MISSING_COMBINATION));
            }
            return items;
        }

        private Slice exactSlice(SliceFamily exact) {
            SliceDeduplicator.Result dedup = SliceDeduplicator.deduplicate(exact.members());
            if (dedup.isAmbiguous()) {
                recordAmbiguity(dedup);
                return null;
            }
            return dedup.unique().get(0);
        }

        private void recordAmbiguity(SliceDeduplicator.Result dedup) {
            trace.record(PlanTrace.Stage.EXACT_OR_REDUCE, TRACE_AMBIGUOUS_SLICE, dedup.ambiguous().toString());
            faults.add(new IntegrityFault(IntegrityFault.AMBIGUOUS_SLICE,
                    "slices with the same assignment disagree on content", dedup.ambiguous()));
        }

        private List<FetchPlanItem> gapItems(DimensionAssignment assignment, CoverageResult coverage) {
            List<FetchPlanItem> items = new ArrayList<>(coverage.gaps().size());
            for (DateRange gap : coverage.gaps()) {
                items.add(item(assignment, gap, FetchPlanItem.Reason.MISSING_DAYS));
            }
            return items;
        }

        private FetchPlanItem item(DimensionAssignment assignment, DateRange range, FetchPlanItem.Reason reason) {
            return FetchPlanItem.builder()
                    .metricId(metricId)
                    .assignment(assignment)
                    .range(range)
                    .mode(mode)
                    .reason(reason)
                    .build();
        }

        private PlanResult satisfied(
                long n,
                long k,
                TimeSeries series,
                List<Disclosure> disclosures,
                List<List<String>> alternatives
        ) {
            return base(PlanResult.Outcome.SATISFIED)
                    .n(n)
                    .k(k)
                    .series(series)
                    .disclosures(disclosures)
                    .alternativeReductions(alternatives)
                    .build();
        }

        private PlanResult needsFetch(List<FetchPlanItem> items) {
            LinkedHashMap<String, FetchPlanItem> unique = new LinkedHashMap<>();
            for (FetchPlanItem item : items) {
                unique.putIfAbsent(item.itemKey(), item);
            }
            List<FetchPlanItem> sorted = new ArrayList<>(unique.values());
            sorted.sort(Comparator.naturalOrder());
            return base(PlanResult.Outcome.NEEDS_FETCH)
                    .series(TimeSeries.empty())
                    .items(sorted)
                    .build();
        }

        private PlanResult.PlanResultBuilder base(PlanResult.Outcome outcome) {
            return PlanResult.builder()
                    .outcome(outcome)
                    .metricId(metricId)
                    .assignment(query)
                    .window(window)
                    .faults(faults)
                    .trace(trace);
        }
    }

    private static List<String> sortedDims(SliceFamily family) {
        return new ArrayList<>(new TreeSet<>(family.unspecifiedDims()));
    }

    private static Map<String, List<String>> presentValues(Map<String, MeceCheck> checks) {
        LinkedHashMap<String, List<String>> values = new LinkedHashMap<>();
        for (MeceCheck check : checks.values()) {
            values.put(check.getKey(), check.getPresentValues());
        }
        return values;
    }

    private static Map<String, List<String>> missingValuesOf(Map<String, MeceCheck> checks) {
        TreeMap<String, List<String>> missing = new TreeMap<>();
        for (MeceCheck check : checks.values()) {
            if (!check.getMissingValues().isEmpty()) {
                missing.put(check.getKey(), check.getMissingValues());
            }
        }
        return missing;
    }

    private static Map<String, List<String>> missingValues(ReductionOutcome outcome) {
        return missingValuesOf(outcome.getChecks());
    }

    private static List<DimensionAssignment> firstCombinations(List<DimensionAssignment> missing) {
        return missing.subList(0, Math.min(DimensionalReducer.MAX_REPORTED_COMBINATIONS, missing.size()));
    }

    /**
     * A family that can produce the requested value.
     */
    private static final class Candidate {
        private final SliceFamily family;
        private final ReductionOutcome outcome;
        private final boolean complete;

        private Candidate(SliceFamily family, ReductionOutcome outcome, boolean complete) {
            this.family = family;
            this.outcome = outcome;
            this.complete = complete;
        }
    }

    /**
     * Evaluation of one reduction family: a candidate, or the items that would complete it.
     */
    private static final class FamilyEvaluation {
        private final boolean completable;
        private Candidate candidate;
        private List<FetchPlanItem> fallback = List.of();

        private FamilyEvaluation(boolean completable) {
            this.completable = completable;
        }
    }
}
