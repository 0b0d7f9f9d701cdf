package org.Aayush.slicecache.plan;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Size of a fetch plan.
 *
 * @param itemCount number of items.
 * @param totalDays days requested across all items.
 * @param daysByReason days requested per item reason.
 */
public record PlanSummary(int itemCount, int totalDays, Map<FetchPlanItem.Reason, Integer> daysByReason) {

    public PlanSummary {
        daysByReason = Collections.unmodifiableMap(new EnumMap<>(daysByReason));
    }

    /**
     * Summarises {@code items}.
     */
    public static PlanSummary of(Collection<FetchPlanItem> items) {
        EnumMap<FetchPlanItem.Reason, Integer> byReason = new EnumMap<>(FetchPlanItem.Reason.class);
        int totalDays = 0;
        for (FetchPlanItem item : items) {
            totalDays += item.dayCount();
            byReason.merge(item.getReason(), item.dayCount(), Integer::sum);
        }
        return new PlanSummary(items.size(), totalDays, byReason);
    }
}
