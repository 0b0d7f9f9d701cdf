package org.Aayush.slicecache.slice;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of additive counts: {@code n} is the denominator, {@code k} the numerator.
 */
public record DailyCount(LocalDate date, long n, long k) {

    public DailyCount {
        Objects.requireNonNull(date, "date");
        if (n < 0 || k < 0) {
            throw new IllegalArgumentException("counts must be non-negative on " + date + ": n=" + n + ", k=" + k);
        }
    }
}
