package org.Aayush.slicecache.slice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Slice arena keyed by metric id.
 *
 * <p>A patch merges into the slice with the same assignment, mode and signature; its fetched
 * range joins the slice's fetched ranges.</p>
 *
 * <p>Readers see immutable snapshots without locking; writers to one metric are serialized
 * and publish a fresh snapshot atomically.</p>
 */
public final class InMemorySliceStore implements SliceStore {
    private static final Logger log = LoggerFactory.getLogger(InMemorySliceStore.class);

    private final ConcurrentHashMap<String, MetricArena> arenas = new ConcurrentHashMap<>();

    @Override
    public List<Slice> loadSlices(String metricId) {
        MetricArena arena = arenas.get(requireMetricId(metricId));
        return arena == null ? List.of() : arena.snapshot;
    }

    @Override
    public Slice merge(String metricId, SlicePatch patch) {
        Objects.requireNonNull(patch, "patch");
        MetricArena arena = arenas.computeIfAbsent(requireMetricId(metricId), ignored -> new MetricArena());
        arena.writeLock.lock();
        try {
            List<Slice> current = arena.snapshot;
            ArrayList<Slice> next = new ArrayList<>(current.size() + 1);
            Slice merged = null;
            for (Slice slice : current) {
                if (merged == null
                        && slice.getAssignment().equals(patch.getAssignment())
                        && slice.getMode() == patch.getMode()
                        && slice.getSignature().equals(patch.getSignature())) {
                    merged = mergeInto(slice, patch);
                    next.add(merged);
                } else {
                    next.add(slice);
                }
            }
            if (merged == null) {
                merged = Slice.builder()
                        .assignment(patch.getAssignment())
                        .mode(patch.getMode())
                        .signature(patch.getSignature())
                        .series(patch.getSeries())
                        .fetchedRanges(fetchedRanges(List.of(), patch))
                        .aggregateTotal(patch.getAggregateTotal())
                        .retrievedAt(patch.getRetrievedAt())
                        .build();
                next.add(merged);
                log.debug("Created slice {} for metric {}", merged.getAssignment(), metricId);
            }
            arena.snapshot = List.copyOf(next);
            return merged;
        } finally {
            arena.writeLock.unlock();
        }
    }

    /**
     * Adds slices verbatim, without merging, for example when loading an existing cache.
     */
    public void put(String metricId, Collection<Slice> slices) {
        Objects.requireNonNull(slices, "slices");
        MetricArena arena = arenas.computeIfAbsent(requireMetricId(metricId), ignored -> new MetricArena());
        arena.writeLock.lock();
        try {
            ArrayList<Slice> next = new ArrayList<>(arena.snapshot);
            for (Slice slice : slices) {
                next.add(Objects.requireNonNull(slice, "slice"));
            }
            arena.snapshot = List.copyOf(next);
        } finally {
            arena.writeLock.unlock();
        }
    }

    /**
     * Drops every slice held for {@code metricId}.
     */
    public void clear(String metricId) {
        arenas.remove(requireMetricId(metricId));
    }

    private static Slice mergeInto(Slice existing, SlicePatch patch) {
        TimeSeries series = existing.getSeries().merge(patch.getSeries());
        AggregateTotal total = existing.getAggregateTotal() != null
                ? existing.getAggregateTotal()
                : patch.getAggregateTotal();
        List<DateRange> fetched = fetchedRanges(existing.getFetchedRanges(), patch);
        if (series == existing.getSeries()
                && total == existing.getAggregateTotal()
                && fetched.equals(existing.getFetchedRanges())) {
            return existing;
        }
        return existing.toBuilder()
                .series(series)
                .fetchedRanges(fetched)
                .aggregateTotal(total)
                .retrievedAt(patch.getRetrievedAt() != null ? patch.getRetrievedAt() : existing.getRetrievedAt())
                .build();
    }

    private static List<DateRange> fetchedRanges(List<DateRange> existing, SlicePatch patch) {
        if (patch.getFetchedRange() == null) {
            return existing;
        }
        List<DateRange> ranges = new ArrayList<>(existing);
        ranges.add(patch.getFetchedRange());
        return DateRange.union(ranges);
    }

    private static String requireMetricId(String metricId) {
        String id = Objects.requireNonNull(metricId, "metricId").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("metricId must be non-blank");
        }
        return id;
    }

    private static final class MetricArena {
        private final ReentrantLock writeLock = new ReentrantLock();
        private volatile List<Slice> snapshot = List.of();
    }
}
