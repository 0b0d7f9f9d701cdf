package org.Aayush.slicecache.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered record of stage decisions so every answer can be explained.
 */
public final class PlanTrace {

    /**
     * Planning stages.
     */
    public enum Stage {
        SIGNATURE_FILTER,
        ISOLATE,
        EXACT_OR_REDUCE,
        COVERAGE_CHECK
    }

    /**
     * One recorded decision.
     *
     * @param stage stage that made the decision.
     * @param reasonCode stable code.
     * @param detail human-readable detail.
     */
    public record Entry(Stage stage, String reasonCode, String detail) {
        @Override
        public String toString() {
            return stage + ":" + reasonCode + (detail == null || detail.isEmpty() ? "" : " (" + detail + ")");
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    void record(Stage stage, String reasonCode, String detail) {
        entries.add(new Entry(stage, reasonCode, detail));
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Returns whether any entry carries {@code reasonCode}.
     */
    public boolean contains(String reasonCode) {
        for (Entry entry : entries) {
            if (entry.reasonCode().equals(reasonCode)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
