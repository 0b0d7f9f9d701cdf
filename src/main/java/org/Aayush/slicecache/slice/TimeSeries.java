package org.Aayush.slicecache.slice;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.Aayush.core.time.DayUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable day-indexed series of {@code (date, n, k)} triples.
 *
 * <p>Stored column-wise as epoch days plus two count columns. Dates are strictly increasing
 * with no duplicates.</p>
 */
public final class TimeSeries {
    private static final TimeSeries EMPTY = new TimeSeries(new int[0], new long[0], new long[0]);

    private final int[] epochDays;
    private final long[] n;
    private final long[] k;

    private TimeSeries(int[] epochDays, long[] n, long[] k) {
        this.epochDays = epochDays;
        this.n = n;
        this.k = k;
    }

    public static TimeSeries empty() {
        return EMPTY;
    }

    /**
     * Creates a series from points already in strictly increasing date order.
     *
     * @throws IllegalArgumentException when dates are unsorted or repeated.
     */
    public static TimeSeries of(Collection<DailyCount> points) {
        Builder builder = builder();
        for (DailyCount point : Objects.requireNonNull(points, "points")) {
            builder.add(point.date(), point.n(), point.k());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return epochDays.length;
    }

    public boolean isEmpty() {
        return epochDays.length == 0;
    }

    public LocalDate day(int index) {
        return DayUtils.fromEpochDay(epochDays[index]);
    }

    public int epochDay(int index) {
        return epochDays[index];
    }

    public long n(int index) {
        return n[index];
    }

    public long k(int index) {
        return k[index];
    }

    /**
     * Returns a copy of the epoch-day column.
     */
    public int[] epochDays() {
        return epochDays.clone();
    }

    public LocalDate firstDay() {
        return isEmpty() ? null : day(0);
    }

    public LocalDate lastDay() {
        return isEmpty() ? null : day(epochDays.length - 1);
    }

    /**
     * Returns the index of {@code day}, or a negative value when absent.
     */
    public int indexOf(LocalDate day) {
        return Arrays.binarySearch(epochDays, DayUtils.toEpochDay(day));
    }

    public boolean containsDay(LocalDate day) {
        return indexOf(day) >= 0;
    }

    public long totalN() {
        long total = 0L;
        for (long value : n) {
            total += value;
        }
        return total;
    }

    public long totalK() {
        long total = 0L;
        for (long value : k) {
            total += value;
        }
        return total;
    }

    /**
     * Returns whether both series carry exactly the same dates.
     */
    public boolean hasSameDates(TimeSeries other) {
        return Arrays.equals(epochDays, other.epochDays);
    }

    /**
     * Returns whether both series report the same counts on every day they share.
     */
    public boolean agreesOnSharedDays(TimeSeries other) {
        int i = 0;
        int j = 0;
        while (i < epochDays.length && j < other.epochDays.length) {
            if (epochDays[i] < other.epochDays[j]) {
                i++;
            } else if (epochDays[i] > other.epochDays[j]) {
                j++;
            } else {
                if (n[i] != other.n[j] || k[i] != other.k[j]) {
                    return false;
                }
                i++;
                j++;
            }
        }
        return true;
    }

    /**
     * Returns all points as records.
     */
    public List<DailyCount> points() {
        ArrayList<DailyCount> points = new ArrayList<>(epochDays.length);
        for (int i = 0; i < epochDays.length; i++) {
            points.add(new DailyCount(day(i), n[i], k[i]));
        }
        return Collections.unmodifiableList(points);
    }

    /**
     * Returns the sub-series whose dates fall inside {@code range}.
     */
    public TimeSeries restrictTo(DateRange range) {
        int from = lowerBound(range.startEpochDay());
        int to = lowerBound(range.endEpochDay() + 1);
        if (from == 0 && to == epochDays.length) {
            return this;
        }
        if (from >= to) {
            return EMPTY;
        }
        return new TimeSeries(
                Arrays.copyOfRange(epochDays, from, to),
                Arrays.copyOfRange(n, from, to),
                Arrays.copyOfRange(k, from, to)
        );
    }

    /**
     * Merges {@code patch} into this series. Days already present keep their existing counts;
     * new days are inserted in order. Merging the same patch twice is a no-op the second time.
     */
    public TimeSeries merge(TimeSeries patch) {
        Objects.requireNonNull(patch, "patch");
        if (patch.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return patch;
        }
        int capacity = epochDays.length + patch.epochDays.length;
        IntArrayList days = new IntArrayList(capacity);
        LongArrayList ns = new LongArrayList(capacity);
        LongArrayList ks = new LongArrayList(capacity);
        int i = 0;
        int j = 0;
        boolean added = false;
        while (i < epochDays.length || j < patch.epochDays.length) {
            if (j >= patch.epochDays.length
                    || (i < epochDays.length && epochDays[i] <= patch.epochDays[j])) {
                if (j < patch.epochDays.length && epochDays[i] == patch.epochDays[j]) {
                    j++;
                }
                days.add(epochDays[i]);
                ns.add(n[i]);
                ks.add(k[i]);
                i++;
            } else {
                days.add(patch.epochDays[j]);
                ns.add(patch.n[j]);
                ks.add(patch.k[j]);
                added = true;
                j++;
            }
        }
        if (!added) {
            return this;
        }
        return new TimeSeries(days.toIntArray(), ns.toLongArray(), ks.toLongArray());
    }

    /**
     * Adds counts day by day.
     *
     * @throws IllegalArgumentException when the date columns differ.
     */
    public TimeSeries plus(TimeSeries other) {
        if (!hasSameDates(other)) {
            throw new IllegalArgumentException("cannot add series with different date arrays");
        }
        long[] sumN = new long[n.length];
        long[] sumK = new long[k.length];
        for (int i = 0; i < n.length; i++) {
            sumN[i] = n[i] + other.n[i];
            sumK[i] = k[i] + other.k[i];
        }
        return new TimeSeries(epochDays, sumN, sumK);
    }

    private int lowerBound(int epochDay) {
        int index = Arrays.binarySearch(epochDays, epochDay);
        return index >= 0 ? index : -index - 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSeries)) {
            return false;
        }
        TimeSeries other = (TimeSeries) o;
        return Arrays.equals(epochDays, other.epochDays)
                && Arrays.equals(n, other.n)
                && Arrays.equals(k, other.k);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(epochDays);
        result = 31 * result + Arrays.hashCode(n);
        result = 31 * result + Arrays.hashCode(k);
        return result;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "TimeSeries[]";
        }
        return "TimeSeries[" + firstDay() + ".." + lastDay() + ", days=" + size()
                + ", n=" + totalN() + ", k=" + totalK() + "]";
    }

    /**
     * Append-only builder that enforces strictly increasing dates.
     */
    public static final class Builder {
        private final IntArrayList days = new IntArrayList();
        private final LongArrayList ns = new LongArrayList();
        private final LongArrayList ks = new LongArrayList();

        private Builder() {
        }

        public Builder add(LocalDate date, long n, long k) {
            DailyCount point = new DailyCount(date, n, k);
            int epochDay = DayUtils.toEpochDay(point.date());
            if (!days.isEmpty() && epochDay <= days.getInt(days.size() - 1)) {
                throw new IllegalArgumentException(
                        "dates must be strictly increasing: " + date + " after "
                                + DayUtils.fromEpochDay(days.getInt(days.size() - 1))
                );
            }
            days.add(epochDay);
            ns.add(n);
            ks.add(k);
            return this;
        }

        public Builder add(String date, long n, long k) {
            return add(DayUtils.parseDay(date), n, k);
        }

        public TimeSeries build() {
            if (days.isEmpty()) {
                return EMPTY;
            }
            return new TimeSeries(days.toIntArray(), ns.toLongArray(), ks.toLongArray());
        }
    }
}
