package org.Aayush.slicecache.plan;

/**
 * Resolution at which the external source reports counts.
 */
public enum SourceGranularity {
    /** Daily {@code (date, n, k)} points. */
    DAILY,
    /** One total per fetched window. */
    AGGREGATE
}
