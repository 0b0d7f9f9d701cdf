package org.Aayush.slicecache.fetch;

import org.Aayush.slicecache.plan.FetchPlanItem;

/**
 * Outcome of one dispatched or withheld item.
 *
 * @param item item with its resulting lifecycle status.
 * @param status dispatch status.
 * @param detail failure detail, {@code null} on success.
 */
public record ItemOutcome(FetchPlanItem item, Status status, String detail) {

    /**
     * Dispatch status.
     */
    public enum Status {
        /** Fetched and merged; the item is retired. */
        MERGED,
        /** Failed; the caller may retry. */
        FAILED_RETRYABLE,
        /** Failed; retrying will not help. */
        FAILED_TERMINAL,
        /** Cancelled before anything was merged. */
        CANCELLED,
        /** Withheld by the request budget; the item is still needed. */
        NOT_DISPATCHED
    }
}
