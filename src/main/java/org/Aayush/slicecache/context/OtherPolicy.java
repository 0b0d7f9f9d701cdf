package org.Aayush.slicecache.context;

/**
 * Aggregation policy of one context dimension.
 *
 * <p>Describes whether the enumerated values of a dimension partition the population, and how
 * the catch-all value participates. Every decision on these variants is an exhaustive
 * {@code switch}; adding a variant forces every such site to be revisited.</p>
 */
public enum OtherPolicy {
    /** Enumerated values without a catch-all are asserted complete. */
    CLOSED,
    /** Enumerated values plus a synthesized catch-all derived by negation. */
    COMPUTED_OTHER,
    /** Enumerated values plus a catch-all that carries its own explicit definition. */
    EXPLICIT_OTHER,
    /** Enumerated values are known to be incomplete; sums are never a valid total. */
    OPEN;

    /**
     * Returns whether the catch-all value is part of the expected value set.
     */
    public boolean includesCatchAll() {
        return switch (this) {
            case COMPUTED_OTHER, EXPLICIT_OTHER -> true;
            case CLOSED, OPEN -> false;
        };
    }

    /**
     * Returns whether a full value set may be reported as a complete total.
     */
    public boolean canBeComplete() {
        return switch (this) {
            case CLOSED, COMPUTED_OTHER, EXPLICIT_OTHER -> true;
            case OPEN -> false;
        };
    }
}
