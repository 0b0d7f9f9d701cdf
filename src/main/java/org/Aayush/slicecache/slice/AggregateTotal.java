package org.Aayush.slicecache.slice;

import java.util.Objects;

/**
 * Window-level totals reported by an aggregate-only source.
 */
public record AggregateTotal(DateRange window, long n, long k) {

    public AggregateTotal {
        Objects.requireNonNull(window, "window");
        if (n < 0 || k < 0) {
            throw new IllegalArgumentException("counts must be non-negative: n=" + n + ", k=" + k);
        }
    }
}
