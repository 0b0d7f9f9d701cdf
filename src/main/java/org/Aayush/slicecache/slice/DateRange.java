package org.Aayush.slicecache.slice;

import org.Aayush.core.time.DayUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive contiguous day range.
 *
 * @param start first day.
 * @param end last day, never before {@code start}.
 */
public record DateRange(LocalDate start, LocalDate end) implements Comparable<DateRange> {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " is before start " + start);
        }
    }

    /**
     * Parses both ends with {@link DayUtils#parseDay(String)}.
     */
    public static DateRange of(String start, String end) {
        return new DateRange(DayUtils.parseDay(start), DayUtils.parseDay(end));
    }

    public static DateRange ofEpochDays(int startEpochDay, int endEpochDay) {
        return new DateRange(DayUtils.fromEpochDay(startEpochDay), DayUtils.fromEpochDay(endEpochDay));
    }

    public static DateRange singleDay(LocalDate day) {
        return new DateRange(day, day);
    }

    /**
     * Merges overlapping and adjacent ranges.
     *
     * @return ascending, pairwise disjoint and non-adjacent ranges.
     */
    public static List<DateRange> union(Collection<DateRange> ranges) {
        if (ranges.isEmpty()) {
            return List.of();
        }
        List<DateRange> sorted = new ArrayList<>(ranges);
        Collections.sort(sorted);
        List<DateRange> merged = new ArrayList<>(sorted.size());
        DateRange current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            DateRange next = sorted.get(i);
            if (next.startEpochDay() <= current.endEpochDay() + 1) {
                if (next.end.isAfter(current.end)) {
                    current = new DateRange(current.start, next.end);
                }
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return Collections.unmodifiableList(merged);
    }

    public int startEpochDay() {
        return DayUtils.toEpochDay(start);
    }

    public int endEpochDay() {
        return DayUtils.toEpochDay(end);
    }

    public int dayCount() {
        return DayUtils.inclusiveDayCount(start, end);
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }

    public boolean contains(DateRange other) {
        return contains(other.start) && contains(other.end);
    }

    @Override
    public int compareTo(DateRange other) {
        int byStart = start.compareTo(other.start);
        return byStart != 0 ? byStart : end.compareTo(other.end);
    }

    @Override
    public String toString() {
        return DayUtils.formatIso(start) + ".." + DayUtils.formatIso(end);
    }
}
