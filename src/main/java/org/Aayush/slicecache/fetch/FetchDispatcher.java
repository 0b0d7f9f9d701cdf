package org.Aayush.slicecache.fetch;

import org.Aayush.slicecache.context.ContextRegistry;
import org.Aayush.slicecache.context.DefinitionHasher;
import org.Aayush.slicecache.plan.FetchPlanItem;
import org.Aayush.slicecache.signature.CacheSignature;
import org.Aayush.slicecache.slice.SlicePatch;
import org.Aayush.slicecache.slice.SliceStore;
import org.Aayush.slicecache.slice.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes fetch plan items on a bounded pool and merges results into the slice store.
 *
 * <p>Contracts:</p>
 * <ul>
 * <li>At most {@code maxConcurrentFetches} adapter calls run at once.</li>
 * <li>At most {@code requestBudget} items are dispatched per call; the rest are reported
 * {@code NOT_DISPATCHED} and stay {@code NEEDED}.</li>
 * <li>Merges for one (metric, assignment, mode) are serialized on a striped lock.</li>
 * <li>Each merged slice is signed with the query's core hash plus a definition hash for every
 * dimension it carries, and records the item range as fetched.</li>
 * <li>A merge is all-or-nothing: a result with days outside the item range merges nothing.</li>
 * <li>A cancelled item never merges; cancellation is checked under the key lock.</li>
 * <li>Failures are classified, never retried.</li>
 * </ul>
 */
public final class FetchDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchDispatcher.class);
    private static final int MERGE_LOCK_STRIPES = 64;

    private final FetchAdapter adapter;
    private final SliceStore sliceStore;
    private final ContextRegistry contextRegistry;
    private final DefinitionHasher definitionHasher = new DefinitionHasher();
    private final DispatchConfig config;
    private final Clock clock;
    private final ExecutorService workers;
    private final ReentrantLock[] mergeLocks = new ReentrantLock[MERGE_LOCK_STRIPES];

    public FetchDispatcher(
            FetchAdapter adapter,
            SliceStore sliceStore,
            ContextRegistry contextRegistry,
            DispatchConfig config
    ) {
        this(adapter, sliceStore, contextRegistry, config, Clock.systemUTC());
    }

    public FetchDispatcher(
            FetchAdapter adapter,
            SliceStore sliceStore,
            ContextRegistry contextRegistry,
            DispatchConfig config,
            Clock clock
    ) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.sliceStore = Objects.requireNonNull(sliceStore, "sliceStore");
        this.contextRegistry = Objects.requireNonNull(contextRegistry, "contextRegistry");
        this.config = config == null ? DispatchConfig.defaults() : config;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = Executors.newFixedThreadPool(this.config.effectiveMaxConcurrentFetches(), new WorkerThreadFactory());
        for (int i = 0; i < mergeLocks.length; i++) {
            mergeLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Dispatches {@code items} and returns immediately.
     *
     * @param items plan items in priority order.
     * @param signature signature of the question the items were planned for.
     * @return handle for awaiting or cancelling this dispatch.
     */
    public DispatchHandle dispatch(List<FetchPlanItem> items, CacheSignature signature) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(signature, "signature");
        if (signature.isUnparseable()) {
            throw new IllegalArgumentException("cannot sign fetched data from the unparseable signature");
        }
        int budget = config.effectiveRequestBudget();
        List<DispatchHandle.Tracked> tracked = new ArrayList<>(items.size());
        for (FetchPlanItem item : items) {
            if (item.getStatus() != FetchPlanItem.Status.NEEDED || tracked.size() >= budget) {
                tracked.add(DispatchHandle.Tracked.withheld(item));
                continue;
            }
            DispatchHandle.Tracked entry = DispatchHandle.Tracked.inFlight(item.withStatus(FetchPlanItem.Status.IN_FLIGHT));
            entry.future(submit(entry, signature));
            tracked.add(entry);
        }
        log.info("Dispatched {} of {} fetch items (budget {})",
                tracked.stream().filter(DispatchHandle.Tracked::isDispatched).count(), items.size(),
                budget == DispatchConfig.UNBOUNDED ? "unbounded" : String.valueOf(budget));
        return new DispatchHandle(tracked, config.effectiveFetchTimeout());
    }

    /**
     * Dispatches and waits for every item.
     */
    public DispatchReport dispatchAndAwait(List<FetchPlanItem> items, CacheSignature signature) {
        return dispatch(items, signature).await();
    }

    private Future<ItemOutcome> submit(DispatchHandle.Tracked entry, CacheSignature signature) {
        return workers.submit(() -> execute(entry, signature));
    }

    private ItemOutcome execute(DispatchHandle.Tracked entry, CacheSignature signature) {
        FetchPlanItem item = entry.item();
        if (!entry.start()) {
            return entry.cancelledOutcome();
        }
        CacheSignature sliceSignature;
        try {
            sliceSignature = definitionHasher.signatureFor(signature, contextRegistry, item.getAssignment().keys());
        } catch (IllegalArgumentException ex) {
            log.warn("Cannot sign fetch result for {}: {}", item.itemKey(), ex.getMessage());
            return entry.fail(false, ex.getMessage());
        }
        TimeSeries fetched;
        try {
            fetched = adapter.fetch(item.getMetricId(), item.getAssignment(), item.getRange(), item.getMode());
        } catch (AdapterException ex) {
            log.warn("Fetch failed for {} ({}): {}", item.itemKey(),
                    ex.isRetryable() ? "retryable" : "terminal", ex.getMessage());
            return entry.fail(ex.isRetryable(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Adapter threw unexpectedly for {}", item.itemKey(), ex);
            return entry.fail(false, "adapter error: " + ex);
        }
        if (fetched == null) {
            return entry.fail(false, "adapter returned no series");
        }
        if (!fetched.isEmpty()
                && (!item.getRange().contains(fetched.firstDay()) || !item.getRange().contains(fetched.lastDay()))) {
            log.warn("Rejected fetch result for {}: {} lies outside {}", item.itemKey(), fetched, item.getRange());
            return entry.fail(false, "fetched days outside " + item.getRange());
        }

        ReentrantLock lock = mergeLocks[Math.floorMod(mergeKey(item).hashCode(), mergeLocks.length)];
        lock.lock();
        try {
            if (!entry.beginMerge()) {
                return entry.cancelledOutcome();
            }
            sliceStore.merge(item.getMetricId(), SlicePatch.builder()
                    .assignment(item.getAssignment())
                    .mode(item.getMode())
                    .signature(sliceSignature)
                    .series(fetched)
                    .fetchedRange(item.getRange())
                    .retrievedAt(clock.instant())
                    .build());
            return entry.merged();
        } catch (RuntimeException ex) {
            log.warn("Merge failed for {}", item.itemKey(), ex);
            return entry.fail(false, "merge failed: " + ex.getMessage());
        } finally {
            lock.unlock();
        }
    }

    private static String mergeKey(FetchPlanItem item) {
        return item.getMetricId() + "|" + item.getAssignment().toDsl() + "|" + item.getMode();
    }

    /**
     * Stops accepting work, cancels queued fetches and interrupts running ones.
     */
    @Override
    public void close() {
        for (Runnable queued : workers.shutdownNow()) {
            if (queued instanceof Future) {
                ((Future<?>) queued).cancel(false);
            }
        }
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Fetch workers did not terminate within 5s");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "slicecache-fetch-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
