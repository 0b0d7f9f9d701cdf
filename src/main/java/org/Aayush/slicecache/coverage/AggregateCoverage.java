package org.Aayush.slicecache.coverage;

/**
 * Coverage of a requested window by a cached window total.
 *
 * @param status coverage status.
 * @param n denominator, scaled when {@link Status#PRORATED}; zero when not covered.
 * @param k numerator, scaled when {@link Status#PRORATED}; zero when not covered.
 */
public record AggregateCoverage(Status status, long n, long k) {
    private static final AggregateCoverage NOT_COVERED = new AggregateCoverage(Status.NOT_COVERED, 0L, 0L);

    /**
     * Aggregate coverage status.
     */
    public enum Status {
        /** Cached window equals the requested window. */
        EXACT,
        /** Cached window strictly contains the request; counts are scaled by day share. */
        PRORATED,
        /** The cached window does not contain the request. */
        NOT_COVERED
    }

    public static AggregateCoverage notCovered() {
        return NOT_COVERED;
    }

    public boolean isCovered() {
        return status != Status.NOT_COVERED;
    }
}
