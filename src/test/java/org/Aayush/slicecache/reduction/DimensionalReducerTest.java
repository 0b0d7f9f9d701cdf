package org.Aayush.slicecache.reduction;

import org.Aayush.slicecache.context.ContextDefinition;
import org.Aayush.slicecache.context.InMemoryContextRegistry;
import org.Aayush.slicecache.context.MeceCheck;
import org.Aayush.slicecache.context.MecePolicy;
import org.Aayush.slicecache.context.OtherPolicy;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.slice.Slice;
import org.Aayush.slicecache.slice.SliceMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.Aayush.slicecache.testutil.SliceFixtures.channel;
import static org.Aayush.slicecache.testutil.SliceFixtures.constant;
import static org.Aayush.slicecache.testutil.SliceFixtures.days;
import static org.Aayush.slicecache.testutil.SliceFixtures.device;
import static org.Aayush.slicecache.testutil.SliceFixtures.registry;
import static org.Aayush.slicecache.testutil.SliceFixtures.series;
import static org.Aayush.slicecache.testutil.SliceFixtures.slice;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DimensionalReducer Tests")
class DimensionalReducerTest {

    private static final Set<String> CHANNEL = Set.of("channel");
    private static final Set<String> CHANNEL_DEVICE = Set.of("channel", "device");

    private static Slice cell(String channel, String device, long n, long k) {
        return slice(DimensionAssignment.of("channel", channel, "device", device), constant(1, 3, n, k));
    }

    private static Slice channelSlice(String value, long n, long k) {
        return slice(DimensionAssignment.of("channel", value), constant(1, 3, n, k));
    }

    @Test
    @DisplayName("Complete CLOSED 2x2 grid sums every cell day by day")
    void testCompleteGridReduces() {
        DimensionalReducer reducer = new DimensionalReducer(
                registry(channel(OtherPolicy.CLOSED), device(OtherPolicy.CLOSED)));

        ReductionOutcome outcome = reducer.reduce(List.of(
                cell("google", "mobile", 10, 1),
                cell("google", "desktop", 20, 2),
                cell("meta", "mobile", 30, 3),
                cell("meta", "desktop", 40, 4)
        ), CHANNEL_DEVICE);

        assertTrue(outcome.isReduced());
        assertTrue(outcome.isComplete());
        assertEquals(DimensionAssignment.empty(), outcome.getAssignment());
        assertEquals(300, outcome.getN());
        assertEquals(30, outcome.getK());
        assertEquals(100, outcome.getSeries().n(0));
        assertEquals(0.1d, outcome.mean(), 1e-9);
    }

    @Test
    @DisplayName("Missing grid cell is reported as an incomplete combination")
    void testIncompleteGrid() {
        DimensionalReducer reducer = new DimensionalReducer(
                registry(channel(OtherPolicy.CLOSED), device(OtherPolicy.CLOSED)));

        ReductionOutcome outcome = reducer.reduce(List.of(
                cell("google", "mobile", 10, 1),
                cell("google", "desktop", 20, 2),
                cell("meta", "mobile", 30, 3)
        ), CHANNEL_DEVICE);

        assertEquals(ReductionOutcome.Kind.NOT_REDUCIBLE, outcome.getKind());
        assertEquals(DimensionalReducer.REASON_INCOMPLETE_COMBINATIONS, outcome.getReasonCode());
        assertEquals(List.of(DimensionAssignment.of("channel", "meta", "device", "desktop")),
                outcome.getMissingCombinations());
    }

    @Test
    @DisplayName("Unknown dimension definition is not MECE")
    void testUnknownDefinitionNotMece() {
        DimensionalReducer reducer = new DimensionalReducer(new InMemoryContextRegistry());

        ReductionOutcome outcome = reducer.reduce(
                List.of(channelSlice("google", 10, 1), channelSlice("meta", 10, 1)), CHANNEL);

        assertEquals(DimensionalReducer.REASON_NOT_MECE, outcome.getReasonCode());
        assertEquals(MecePolicy.REASON_UNKNOWN_CONTEXT, outcome.getChecks().get("channel").getReasonCode());
    }

    @Test
    @DisplayName("Dimension count above the configured limit is refused")
    void testTooManyDimensions() {
        DimensionalReducer reducer = new DimensionalReducer(
                registry(channel(OtherPolicy.CLOSED), device(OtherPolicy.CLOSED)), MecePolicy.defaults(), 1);

        ReductionOutcome outcome = reducer.reduce(List.of(cell("google", "mobile", 1, 0)), CHANNEL_DEVICE);
        assertEquals(DimensionalReducer.REASON_TOO_MANY_DIMENSIONS, outcome.getReasonCode());
    }

    @Test
    @DisplayName("Members with different date arrays fail aggregation")
    void testMisalignedDates() {
        DimensionalReducer reducer = new DimensionalReducer(registry(channel(OtherPolicy.CLOSED)));

        ReductionOutcome outcome = reducer.reduce(List.of(
                slice(DimensionAssignment.of("channel", "google"), series(10, 1, 2, 3)),
                slice(DimensionAssignment.of("channel", "meta"), series(10, 1, 3))
        ), CHANNEL);

        assertEquals(ReductionOutcome.Kind.AGGREGATION_FAILED, outcome.getKind());
        assertEquals(DimensionalReducer.REASON_DATE_ARRAYS_MISALIGNED, outcome.getReasonCode());
        assertEquals(List.of(DimensionAssignment.of("channel", "meta")), outcome.getOffendingAssignments());
    }

    @Test
    @DisplayName("Conflicting repeats of one assignment are ambiguous")
    void testAmbiguousRepeat() {
        DimensionalReducer reducer = new DimensionalReducer(registry(channel(OtherPolicy.CLOSED)));

        ReductionOutcome outcome = reducer.reduce(List.of(
                channelSlice("google", 10, 1),
                channelSlice("google", 11, 1),
                channelSlice("meta", 10, 1)
        ), CHANNEL);

        assertEquals(ReductionOutcome.Kind.AGGREGATION_FAILED, outcome.getKind());
        assertEquals(DimensionalReducer.REASON_AMBIGUOUS_SLICE, outcome.getReasonCode());
        assertEquals(List.of(DimensionAssignment.of("channel", "google")), outcome.getOffendingAssignments());
    }

    @Test
    @DisplayName("Window and cohort slices of one assignment never collapse or conflict")
    void testDeduplicationKeepsModesApart() {
        Slice window = channelSlice("google", 10, 1);
        Slice cohort = channelSlice("google", 99, 9).toBuilder().mode(SliceMode.COHORT).build();

        SliceDeduplicator.Result result = SliceDeduplicator.deduplicate(List.of(window, cohort));

        assertFalse(result.isAmbiguous());
        assertEquals(List.of(window, cohort), result.unique());
    }

    @Test
    @DisplayName("Agreeing repeats also merge their fetched ranges")
    void testAgreeingRepeatsMergeFetchedRanges() {
        DimensionAssignment google = DimensionAssignment.of("channel", "google");
        Slice early = slice(google, series(10, 1)).toBuilder().fetchedRanges(List.of(days(1, 2))).build();
        Slice late = slice(google, series(10, 4)).toBuilder().fetchedRanges(List.of(days(3, 5))).build();

        SliceDeduplicator.Result result = SliceDeduplicator.deduplicate(List.of(early, late));

        assertEquals(1, result.unique().size());
        assertEquals(List.of(days(1, 5)), result.unique().get(0).getFetchedRanges());
    }

    @Test
    @DisplayName("Agreeing repeats collapse into their union before summing")
    void testAgreeingRepeatsCollapse() {
        DimensionalReducer reducer = new DimensionalReducer(registry(channel(OtherPolicy.CLOSED)));
        DimensionAssignment google = DimensionAssignment.of("channel", "google");

        ReductionOutcome outcome = reducer.reduce(List.of(
                slice(google, series(10, 1, 2)),
                slice(google, series(10, 2, 3)),
                slice(DimensionAssignment.of("channel", "meta"), series(20, 1, 2, 3))
        ), CHANNEL);

        assertTrue(outcome.isReduced());
        assertEquals(3, outcome.getSeries().size());
        assertEquals((11 + 12 + 13) + (21 + 22 + 23), outcome.getN());
    }

    @Test
    @DisplayName("Aliases mapping two raw values onto one cell are duplicate combinations")
    void testAliasDuplicateCell() {
        ContextDefinition aliased = channel(OtherPolicy.CLOSED).toBuilder().alias("fb", "meta").build();
        DimensionalReducer reducer = new DimensionalReducer(registry(aliased));

        ReductionOutcome outcome = reducer.reduce(List.of(
                channelSlice("google", 10, 1),
                channelSlice("meta", 10, 1),
                channelSlice("fb", 10, 1)
        ), CHANNEL);

        assertEquals(DimensionalReducer.REASON_DUPLICATE_COMBINATION, outcome.getReasonCode());
        assertEquals(List.of(DimensionAssignment.of("channel", "meta")), outcome.getOffendingAssignments());
    }

    @Test
    @DisplayName("OPEN dimension sums but is never reported complete")
    void testOpenReducesPartially() {
        DimensionalReducer reducer = new DimensionalReducer(registry(channel(OtherPolicy.OPEN)));

        ReductionOutcome outcome = reducer.reduce(
                List.of(channelSlice("google", 10, 1), channelSlice("meta", 20, 2)), CHANNEL);

        assertTrue(outcome.isReduced());
        assertFalse(outcome.isComplete());
        assertEquals(90, outcome.getN());
    }

    @Test
    @DisplayName("Target grid adds expected values only where completeness is possible")
    void testTargetGrid() {
        DimensionalReducer reducer = new DimensionalReducer(
                registry(channel(OtherPolicy.COMPUTED_OTHER), device(OtherPolicy.OPEN)));
        List<Slice> slices = List.of(cell("google", "mobile", 1, 0), cell("meta", "mobile", 1, 0));

        Map<String, MeceCheck> checks = reducer.evaluate(slices, CHANNEL_DEVICE);
        CombinationGrid grid = reducer.targetGrid(checks);

        assertEquals(Set.of("google", "meta", "other"), grid.valuesByKey().get("channel"));
        assertEquals(Set.of("mobile"), grid.valuesByKey().get("device"));
        assertEquals(3, grid.cellCount());
        assertEquals(DimensionAssignment.of("channel", "google", "device", "mobile"), grid.cells().get(0));
    }

    @Test
    @DisplayName("Exact family with a single slice passes through unchanged")
    void testExactPassThrough() {
        DimensionalReducer reducer = new DimensionalReducer(new InMemoryContextRegistry());
        Slice only = channelSlice("google", 10, 1);

        ReductionOutcome outcome = reducer.reduce(List.of(only), Set.of());

        assertTrue(outcome.isReduced());
        assertEquals(only.getSeries(), outcome.getSeries());
        assertEquals(only.getAssignment(), outcome.getAssignment());
    }
}
