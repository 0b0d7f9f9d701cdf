package org.Aayush.slicecache.fetch;

import org.Aayush.slicecache.plan.FetchPlanItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of one dispatch call, in submission order.
 */
public record DispatchReport(List<ItemOutcome> outcomes) {

    public DispatchReport {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Returns outcome counts per status.
     */
    public Map<ItemOutcome.Status, Integer> counts() {
        EnumMap<ItemOutcome.Status, Integer> counts = new EnumMap<>(ItemOutcome.Status.class);
        for (ItemOutcome outcome : outcomes) {
            counts.merge(outcome.status(), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    public int count(ItemOutcome.Status status) {
        return counts().getOrDefault(status, 0);
    }

    /**
     * Returns the items that are not retired: withheld, failed or cancelled.
     */
    public List<FetchPlanItem> outstanding() {
        List<FetchPlanItem> outstanding = new ArrayList<>();
        for (ItemOutcome outcome : outcomes) {
            if (outcome.status() != ItemOutcome.Status.MERGED) {
                outstanding.add(outcome.item());
            }
        }
        return outstanding;
    }

    public boolean isComplete() {
        return count(ItemOutcome.Status.MERGED) == outcomes.size();
    }
}
