package org.Aayush.slicecache.fetch;

import org.Aayush.slicecache.context.ContextDefinition;
import org.Aayush.slicecache.context.DefinitionHasher;
import org.Aayush.slicecache.context.InMemoryContextRegistry;
import org.Aayush.slicecache.context.OtherPolicy;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.plan.Disclosure;
import org.Aayush.slicecache.plan.FetchPlanBuilder;
import org.Aayush.slicecache.plan.FetchPlanItem;
import org.Aayush.slicecache.plan.PlanRequest;
import org.Aayush.slicecache.plan.PlanResult;
import org.Aayush.slicecache.plan.PlannerService;
import org.Aayush.slicecache.signature.CacheSignature;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.InMemorySliceStore;
import org.Aayush.slicecache.slice.Slice;
import org.Aayush.slicecache.slice.SliceMode;
import org.Aayush.slicecache.slice.TimeSeries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.Aayush.slicecache.testutil.SliceFixtures.CORE;
import static org.Aayush.slicecache.testutil.SliceFixtures.METRIC;
import static org.Aayush.slicecache.testutil.SliceFixtures.channel;
import static org.Aayush.slicecache.testutil.SliceFixtures.constant;
import static org.Aayush.slicecache.testutil.SliceFixtures.day;
import static org.Aayush.slicecache.testutil.SliceFixtures.days;
import static org.Aayush.slicecache.testutil.SliceFixtures.registry;
import static org.Aayush.slicecache.testutil.SliceFixtures.series;
import static org.Aayush.slicecache.testutil.SliceFixtures.signature;
import static org.Aayush.slicecache.testutil.SliceFixtures.slice;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FetchDispatcher Tests")
class FetchDispatcherTest {

    private static final DimensionAssignment GOOGLE = DimensionAssignment.of("channel", "google");
    private static final DimensionAssignment META = DimensionAssignment.of("channel", "meta");
    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-11-20T00:00:00Z"), ZoneOffset.UTC);
    private static final ContextDefinition CHANNEL = channel(OtherPolicy.COMPUTED_OTHER);
    private static final InMemoryContextRegistry REGISTRY = registry(CHANNEL);

    private InMemorySliceStore store;
    private final List<FetchDispatcher> dispatchers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemorySliceStore();
    }

    @AfterEach
    void tearDown() {
        dispatchers.forEach(FetchDispatcher::close);
    }

    private FetchDispatcher dispatcher(FetchAdapter adapter, DispatchConfig config) {
        FetchDispatcher dispatcher = new FetchDispatcher(adapter, store, REGISTRY, config, FIXED);
        dispatchers.add(dispatcher);
        return dispatcher;
    }

    private static FetchPlanItem item(DimensionAssignment assignment, DateRange range) {
        return FetchPlanItem.builder()
                .metricId(METRIC)
                .assignment(assignment)
                .range(range)
                .reason(FetchPlanItem.Reason.MISSING_DAYS)
                .build();
    }

    /**
     * Adapter answering every day of the requested range with fixed counts.
     */
    private static TimeSeries fill(DateRange range, long n, long k) {
        TimeSeries.Builder builder = TimeSeries.builder();
        for (LocalDate d = range.start(); !d.isAfter(range.end()); d = d.plusDays(1)) {
            builder.add(d, n, k);
        }
        return builder.build();
    }

    @Test
    @DisplayName("Successful fetches merge into the store with the dispatch signature")
    void testMergesFetchedSeries() {
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> fill(range, 10, 1),
                DispatchConfig.builder().maxConcurrentFetches(2).build());

        DispatchReport report = dispatcher.dispatchAndAwait(
                List.of(item(GOOGLE, days(1, 3)), item(META, days(1, 3))), signature("channel"));

        assertTrue(report.isComplete());
        assertEquals(2, report.count(ItemOutcome.Status.MERGED));
        assertTrue(report.outstanding().isEmpty());
        assertEquals(2, store.loadSlices(METRIC).size());
        assertTrue(store.loadSlices(METRIC).stream()
                .allMatch(slice -> slice.getSignature().equals(signature("channel"))
                        && slice.getRetrievedAt().equals(FIXED.instant())
                        && slice.getSeries().size() == 3));
    }

    @Test
    @DisplayName("Items beyond the request budget are not dispatched and stay NEEDED")
    void testRequestBudget() {
        AtomicInteger calls = new AtomicInteger();
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            calls.incrementAndGet();
            return fill(range, 10, 1);
        }, DispatchConfig.builder().requestBudget(2).build());

        DispatchReport report = dispatcher.dispatchAndAwait(List.of(
                item(GOOGLE, days(1, 1)),
                item(GOOGLE, days(3, 3)),
                item(META, days(1, 1))
        ), signature("channel"));

        assertEquals(2, calls.get());
        assertEquals(1, report.count(ItemOutcome.Status.NOT_DISPATCHED));
        FetchPlanItem withheld = report.outstanding().get(0);
        assertEquals(META, withheld.getAssignment());
        assertEquals(FetchPlanItem.Status.NEEDED, withheld.getStatus());
        assertFalse(report.isComplete());
    }

    @Test
    @DisplayName("Items not in NEEDED status are withheld")
    void testNonNeededWithheld() {
        AtomicInteger calls = new AtomicInteger();
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            calls.incrementAndGet();
            return fill(range, 10, 1);
        }, DispatchConfig.builder().build());

        DispatchReport report = dispatcher.dispatchAndAwait(
                List.of(item(GOOGLE, days(1, 1)).withStatus(FetchPlanItem.Status.IN_FLIGHT)), signature("channel"));

        assertEquals(0, calls.get());
        assertEquals(1, report.count(ItemOutcome.Status.NOT_DISPATCHED));
    }

    @Test
    @DisplayName("Adapter failures are classified and never merged or retried")
    void testFailureClassification() {
        AtomicInteger calls = new AtomicInteger();
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            calls.incrementAndGet();
            if (assignment.equals(GOOGLE)) {
                throw new AdapterException("rate limited", true);
            }
            throw new AdapterException("unknown metric", false);
        }, DispatchConfig.builder().build());

        DispatchReport report = dispatcher.dispatchAndAwait(
                List.of(item(GOOGLE, days(1, 3)), item(META, days(1, 3))), signature("channel"));

        assertEquals(2, calls.get());
        assertEquals(ItemOutcome.Status.FAILED_RETRYABLE, report.outcomes().get(0).status());
        assertEquals("rate limited", report.outcomes().get(0).detail());
        assertEquals(ItemOutcome.Status.FAILED_TERMINAL, report.outcomes().get(1).status());
        assertEquals(FetchPlanItem.Status.FAILED, report.outcomes().get(1).item().getStatus());
        assertTrue(store.loadSlices(METRIC).isEmpty());
    }

    @Test
    @DisplayName("A result with days outside the item range merges nothing")
    void testOutOfRangeRejected() {
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> constant(1, 5, 10, 1),
                DispatchConfig.builder().build());

        DispatchReport report = dispatcher.dispatchAndAwait(List.of(item(GOOGLE, days(2, 4))), signature("channel"));

        assertEquals(ItemOutcome.Status.FAILED_TERMINAL, report.outcomes().get(0).status());
        assertTrue(store.loadSlices(METRIC).isEmpty());
    }

    @Test
    @DisplayName("Cancelled items never merge, even when the adapter later returns")
    void testCancellation() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return fill(range, 10, 1);
        }, DispatchConfig.builder().maxConcurrentFetches(1).build());

        DispatchHandle handle = dispatcher.dispatch(
                List.of(item(GOOGLE, days(1, 3)), item(META, days(1, 3))), signature("channel"));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(2, handle.cancel());
        release.countDown();
        DispatchReport report = handle.await();

        assertEquals(2, report.count(ItemOutcome.Status.CANCELLED));
        assertEquals(FetchPlanItem.Status.NEEDED, report.outcomes().get(0).item().getStatus());
        assertEquals(0, handle.cancel());
        assertTrue(store.loadSlices(METRIC).isEmpty());
    }

    @Test
    @DisplayName("Fetches exceeding the timeout are cancelled and reported retryable")
    void testTimeout() {
        CountDownLatch never = new CountDownLatch(1);
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            try {
                never.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return fill(range, 10, 1);
        }, DispatchConfig.builder().fetchTimeout(Duration.ofMillis(50)).build());

        DispatchReport report = dispatcher.dispatchAndAwait(List.of(item(GOOGLE, days(1, 3))), signature("channel"));

        assertEquals(ItemOutcome.Status.FAILED_RETRYABLE, report.outcomes().get(0).status());
        assertTrue(report.outcomes().get(0).detail().startsWith("timed out"));
        assertTrue(store.loadSlices(METRIC).isEmpty());
    }

    @Test
    @DisplayName("No more than maxConcurrentFetches adapter calls run at once")
    void testConcurrencyBound() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
            return fill(range, 10, 1);
        }, DispatchConfig.builder().maxConcurrentFetches(2).build());

        List<FetchPlanItem> items = new ArrayList<>();
        for (int d = 1; d <= 8; d++) {
            items.add(item(DimensionAssignment.of("channel", "c" + d), DateRange.singleDay(day(d))));
        }
        DispatchReport report = dispatcher.dispatchAndAwait(items, signature("channel"));

        assertTrue(report.isComplete());
        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
    }

    @Test
    @DisplayName("The unparseable signature cannot be used to store fetched data")
    void testRejectsUnparseableSignature() {
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> fill(range, 1, 0),
                DispatchConfig.builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> dispatcher.dispatch(List.of(item(GOOGLE, days(1, 1))), CacheSignature.unparseable()));
    }

    @Test
    @DisplayName("Executing a plan and re-planning yields a satisfied answer")
    void testPlanDispatchReplan() {
        store.put(METRIC, List.of(
                slice(GOOGLE, constant(1, 7, 100, 10)),
                slice(META, constant(1, 7, 50, 5))
        ));
        PlannerService planner = FetchPlanBuilder.builder()
                .sliceStore(store)
                .contextRegistry(registry(channel(OtherPolicy.COMPUTED_OTHER)))
                .build();
        PlanRequest request = PlanRequest.builder()
                .metricId(METRIC)
                .window(days(1, 7))
                .signature(signature())
                .build();

        PlanResult first = planner.plan(request);
        assertEquals(PlanResult.Outcome.NEEDS_FETCH, first.getOutcome());

        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> fill(range, 25, 1),
                DispatchConfig.builder().build());
        DispatchReport report = dispatcher.dispatchAndAwait(first.getItems(), request.getSignature());
        assertTrue(report.isComplete());

        PlanResult second = planner.plan(request);
        assertTrue(second.isSatisfied());
        assertTrue(second.hasDisclosure(Disclosure.Kind.MECE_COMPLETE));
        assertEquals(7 * (100 + 50 + 25), second.getN());

        DispatchReport replay = dispatcher.dispatchAndAwait(first.getItems(), request.getSignature());
        assertTrue(replay.isComplete());
        assertEquals(3, store.loadSlices(METRIC).size());
        assertEquals(second.getN(), planner.plan(request).getN());
    }

    @Test
    @DisplayName("A fetched catch-all slice is signed with its channel definition and answers channel queries")
    void testFetchedSliceCarriesDefinitionHash() {
        store.put(METRIC, List.of(
                slice(GOOGLE, constant(1, 7, 100, 10)),
                slice(META, constant(1, 7, 50, 5))
        ));
        PlannerService planner = FetchPlanBuilder.builder()
                .sliceStore(store)
                .contextRegistry(REGISTRY)
                .build();
        PlanRequest total = PlanRequest.builder()
                .metricId(METRIC)
                .window(days(1, 7))
                .signature(signature())
                .build();
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> fill(range, 25, 1),
                DispatchConfig.builder().build());

        assertTrue(dispatcher.dispatchAndAwait(planner.plan(total).getItems(), total.getSignature()).isComplete());

        String channelHash = new DefinitionHasher().hash(CHANNEL);
        Slice other = store.loadSlices(METRIC).stream()
                .filter(slice -> slice.getAssignment().equals(DimensionAssignment.of("channel", "other")))
                .findFirst()
                .orElseThrow();
        assertEquals(CacheSignature.of(CORE, Map.of("channel", channelHash)), other.getSignature());

        PlanResult otherOnly = planner.plan(total.toBuilder()
                .assignment(DimensionAssignment.of("channel", "other"))
                .signature(CacheSignature.of(CORE, Map.of("channel", channelHash)))
                .build());
        assertTrue(otherOnly.isSatisfied());
        assertTrue(otherOnly.hasDisclosure(Disclosure.Kind.EXACT));
        assertEquals(7 * 25, otherOnly.getN());
    }

    @Test
    @DisplayName("An item whose dimension has no definition fails terminally without calling the adapter")
    void testUnknownDimensionNotSigned() {
        AtomicInteger calls = new AtomicInteger();
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            calls.incrementAndGet();
            return fill(range, 10, 1);
        }, DispatchConfig.builder().build());

        DispatchReport report = dispatcher.dispatchAndAwait(
                List.of(item(DimensionAssignment.of("device", "mobile"), days(1, 3))), signature("channel"));

        assertEquals(0, calls.get());
        assertEquals(ItemOutcome.Status.FAILED_TERMINAL, report.outcomes().get(0).status());
        assertTrue(report.outcomes().get(0).detail().contains("device"));
        assertTrue(store.loadSlices(METRIC).isEmpty());
    }

    @Test
    @DisplayName("Days the source returns no rows for are covered once fetched")
    void testSparseFetchCoversRange() {
        AtomicInteger calls = new AtomicInteger();
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            calls.incrementAndGet();
            return series(20, 1, 7);
        }, DispatchConfig.builder().build());
        PlannerService planner = FetchPlanBuilder.builder()
                .sliceStore(store)
                .contextRegistry(REGISTRY)
                .build();
        PlanRequest request = PlanRequest.builder()
                .metricId(METRIC)
                .assignment(GOOGLE)
                .window(days(1, 7))
                .signature(signature("channel"))
                .build();

        PlanResult first = planner.plan(request);
        assertTrue(dispatcher.dispatchAndAwait(first.getItems(), request.getSignature()).isComplete());
        assertEquals(List.of(days(1, 7)), store.loadSlices(METRIC).get(0).getFetchedRanges());

        PlanResult second = planner.plan(request);
        assertTrue(second.isSatisfied());
        assertTrue(second.getItems().isEmpty());
        assertEquals(7, second.getSeries().size());
        assertEquals(21 + 27, second.getN());
        assertEquals(0L, second.getSeries().n(3));

        dispatcher.dispatchAndAwait(second.getItems(), request.getSignature());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Cohort items reach the adapter as cohort fetches and merge as cohort slices")
    void testCohortModeCarried() {
        AtomicReference<SliceMode> seen = new AtomicReference<>();
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            seen.set(mode);
            return fill(range, 10, 1);
        }, DispatchConfig.builder().build());

        FetchPlanItem cohortItem = item(GOOGLE, days(1, 3)).toBuilder().mode(SliceMode.COHORT).build();
        assertTrue(dispatcher.dispatchAndAwait(List.of(cohortItem), signature("channel")).isComplete());

        assertEquals(SliceMode.COHORT, seen.get());
        assertEquals(1, store.loadSlices(METRIC).size());
        assertEquals(SliceMode.COHORT, store.loadSlices(METRIC).get(0).getMode());
    }

    @Test
    @DisplayName("Fetch timeout counts from when the fetch starts, not while it waits for a worker")
    void testTimeoutExcludesQueueTime() {
        FetchDispatcher dispatcher = dispatcher((metric, assignment, range, mode) -> {
            if (assignment.equals(GOOGLE)) {
                long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(350);
                while (System.nanoTime() < end) {
                    Thread.onSpinWait();
                }
            } else {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new AdapterException("interrupted", true);
                }
            }
            return fill(range, 10, 1);
        }, DispatchConfig.builder().maxConcurrentFetches(1).fetchTimeout(Duration.ofMillis(200)).build());

        DispatchReport report = dispatcher.dispatchAndAwait(
                List.of(item(GOOGLE, days(1, 3)), item(META, days(1, 3))), signature("channel"));

        assertEquals(ItemOutcome.Status.FAILED_RETRYABLE, report.outcomes().get(0).status());
        assertTrue(report.outcomes().get(0).detail().startsWith("timed out"));
        assertEquals(ItemOutcome.Status.MERGED, report.outcomes().get(1).status());
        assertEquals(1, store.loadSlices(METRIC).size());
        assertEquals(META, store.loadSlices(METRIC).get(0).getAssignment());
    }
}
