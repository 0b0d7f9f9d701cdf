package org.Aayush.slicecache.coverage;

import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntCollection;
import org.Aayush.slicecache.slice.DateRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collapses a set of epoch days into the minimal list of contiguous ranges.
 */
public final class GapCoalescer {

    private GapCoalescer() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Coalesces days in any order, duplicates allowed.
     *
     * @return ascending maximal runs; one range per run of consecutive days.
     */
    public static List<DateRange> coalesce(IntCollection epochDays) {
        return coalesce(epochDays.toIntArray());
    }

    /**
     * Coalesces days in any order, duplicates allowed. The input array is not modified.
     */
    public static List<DateRange> coalesce(int[] epochDays) {
        if (epochDays.length == 0) {
            return List.of();
        }
        int[] sorted = epochDays.clone();
        IntArrays.quickSort(sorted);
        ArrayList<DateRange> ranges = new ArrayList<>();
        int runStart = sorted[0];
        int runEnd = sorted[0];
        for (int i = 1; i < sorted.length; i++) {
            int day = sorted[i];
            if (day <= runEnd + 1) {
                runEnd = Math.max(runEnd, day);
                continue;
            }
            ranges.add(DateRange.ofEpochDays(runStart, runEnd));
            runStart = day;
            runEnd = day;
        }
        ranges.add(DateRange.ofEpochDays(runStart, runEnd));
        return Collections.unmodifiableList(ranges);
    }
}
