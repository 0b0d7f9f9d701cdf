package org.Aayush.slicecache.fetch;

import org.Aayush.slicecache.plan.FetchPlanItem;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle for one dispatch call.
 *
 * <p>Each item moves {@code PENDING -> RUNNING -> MERGING -> DONE}; cancellation wins only
 * before {@code MERGING}, so a cancelled item never leaves days merged.</p>
 */
public final class DispatchHandle {
    private final List<Tracked> tracked;
    private final Duration fetchTimeout;

    DispatchHandle(List<Tracked> tracked, Duration fetchTimeout) {
        this.tracked = List.copyOf(tracked);
        this.fetchTimeout = fetchTimeout;
    }

    /**
     * Cancels every item that has not started merging.
     *
     * @return number of items cancelled by this call.
     */
    public int cancel() {
        int cancelled = 0;
        for (Tracked entry : tracked) {
            if (entry.cancel()) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /**
     * Waits for every item. Each item may run for the fetch timeout, measured from the moment
     * its adapter call starts; time spent queued behind other fetches does not count. Items that
     * time out are cancelled and reported retryable.
     */
    public DispatchReport await() {
        List<ItemOutcome> outcomes = new ArrayList<>(tracked.size());
        for (Tracked entry : tracked) {
            outcomes.add(awaitOne(entry));
        }
        return new DispatchReport(outcomes);
    }

    private ItemOutcome awaitOne(Tracked entry) {
        if (!entry.isDispatched()) {
            return new ItemOutcome(entry.item, ItemOutcome.Status.NOT_DISPATCHED, null);
        }
        long timeoutNanos = fetchTimeout.toNanos();
        try {
            while (true) {
                long remaining = entry.remainingNanos(timeoutNanos);
                if (remaining <= 0L) {
                    if (entry.cancel()) {
                        return entry.timedOutOutcome(fetchTimeout);
                    }
                    return awaitMerge(entry);
                }
                ItemOutcome outcome = poll(entry, remaining);
                if (outcome != null) {
                    return outcome;
                }
            }
        } catch (CancellationException ex) {
            return entry.cancelledOutcome();
        } catch (ExecutionException ex) {
            return new ItemOutcome(entry.item.withStatus(FetchPlanItem.Status.FAILED),
                    ItemOutcome.Status.FAILED_TERMINAL, String.valueOf(ex.getCause()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancel();
            return entry.cancelledOutcome();
        }
    }

    /**
     * Returns the outcome, or {@code null} when the item is still queued or running.
     */
    private static ItemOutcome poll(Tracked entry, long nanos) throws ExecutionException, InterruptedException {
        try {
            return entry.future.get(nanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            return null;
        }
    }

    private ItemOutcome awaitMerge(Tracked entry) {
        try {
            return entry.future.get();
        } catch (ExecutionException ex) {
            return new ItemOutcome(entry.item.withStatus(FetchPlanItem.Status.FAILED),
                    ItemOutcome.Status.FAILED_TERMINAL, String.valueOf(ex.getCause()));
        } catch (CancellationException ex) {
            return entry.cancelledOutcome();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return entry.cancelledOutcome();
        }
    }

    /**
     * Per-item dispatch state.
     */
    static final class Tracked {
        private enum State {
            WITHHELD,
            PENDING,
            RUNNING,
            MERGING,
            DONE,
            CANCELLED
        }

        private final FetchPlanItem item;
        private final AtomicReference<State> state;
        private volatile Future<ItemOutcome> future;
        private volatile long startedAtNanos;
        private volatile boolean started;

        private Tracked(FetchPlanItem item, State initial) {
            this.item = item;
            this.state = new AtomicReference<>(initial);
        }

        static Tracked withheld(FetchPlanItem item) {
            return new Tracked(item, State.WITHHELD);
        }

        static Tracked inFlight(FetchPlanItem item) {
            return new Tracked(item, State.PENDING);
        }

        FetchPlanItem item() {
            return item;
        }

        void future(Future<ItemOutcome> future) {
            this.future = future;
        }

        boolean isDispatched() {
            return state.get() != State.WITHHELD;
        }

        boolean start() {
            if (!state.compareAndSet(State.PENDING, State.RUNNING)) {
                return false;
            }
            startedAtNanos = System.nanoTime();
            started = true;
            return true;
        }

        /**
         * Returns the time left before the item times out; a queued item always has the full
         * timeout left.
         */
        long remainingNanos(long timeoutNanos) {
            if (!started) {
                return timeoutNanos;
            }
            return startedAtNanos + timeoutNanos - System.nanoTime();
        }

        boolean beginMerge() {
            return state.compareAndSet(State.RUNNING, State.MERGING);
        }

        boolean cancel() {
            boolean cancelled = state.compareAndSet(State.PENDING, State.CANCELLED)
                    || state.compareAndSet(State.RUNNING, State.CANCELLED);
            if (cancelled && future != null) {
                future.cancel(true);
            }
            return cancelled;
        }

        ItemOutcome merged() {
            state.set(State.DONE);
            return new ItemOutcome(item, ItemOutcome.Status.MERGED, null);
        }

        ItemOutcome fail(boolean retryable, String detail) {
            if (!state.compareAndSet(State.RUNNING, State.DONE) && !state.compareAndSet(State.MERGING, State.DONE)) {
                return cancelledOutcome();
            }
            return new ItemOutcome(
                    item.withStatus(FetchPlanItem.Status.FAILED),
                    retryable ? ItemOutcome.Status.FAILED_RETRYABLE : ItemOutcome.Status.FAILED_TERMINAL,
                    detail
            );
        }

        ItemOutcome cancelledOutcome() {
            return new ItemOutcome(item.withStatus(FetchPlanItem.Status.NEEDED), ItemOutcome.Status.CANCELLED, null);
        }

        ItemOutcome timedOutOutcome(Duration timeout) {
            return new ItemOutcome(
                    item.withStatus(FetchPlanItem.Status.FAILED),
                    ItemOutcome.Status.FAILED_RETRYABLE,
                    "timed out after " + timeout.toMillis() + "ms"
            );
        }
    }
}
