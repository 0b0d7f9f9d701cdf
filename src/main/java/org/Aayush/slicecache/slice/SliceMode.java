package org.Aayush.slicecache.slice;

/**
 * Date semantics of a slice.
 *
 * <p>Window slices count events by event day; cohort slices count outcomes by the day the
 * cohort entered. The two never answer each other's questions.</p>
 */
public enum SliceMode {
    WINDOW,
    COHORT
}
