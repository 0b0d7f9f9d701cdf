package org.Aayush.slicecache.fetch;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Dispatcher bounds.
 *
 * <p>Non-positive or unparsable values normalise to defaults.</p>
 */
@Value
@Builder
public class DispatchConfig {
    public static final int DEFAULT_MAX_CONCURRENT_FETCHES = 4;
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(60);

    static final String PROP_MAX_CONCURRENT_FETCHES = "slicecache.dispatch.maxConcurrentFetches";
    static final String PROP_REQUEST_BUDGET = "slicecache.dispatch.requestBudget";
    static final String PROP_FETCH_TIMEOUT_MILLIS = "slicecache.dispatch.fetchTimeoutMillis";

    /** Worker pool size. */
    int maxConcurrentFetches;
    /** Maximum items dispatched per call; the rest stay {@code NEEDED}. */
    int requestBudget;
    /** Per-item wait bound when awaiting a dispatch. */
    Duration fetchTimeout;

    public int effectiveMaxConcurrentFetches() {
        return maxConcurrentFetches <= 0 ? DEFAULT_MAX_CONCURRENT_FETCHES : maxConcurrentFetches;
    }

    public int effectiveRequestBudget() {
        return requestBudget <= 0 ? UNBOUNDED : requestBudget;
    }

    public Duration effectiveFetchTimeout() {
        return fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()
                ? DEFAULT_FETCH_TIMEOUT
                : fetchTimeout;
    }

    /**
     * Loads bounds from system properties.
     */
    public static DispatchConfig defaults() {
        long timeoutMillis = readLong(PROP_FETCH_TIMEOUT_MILLIS, DEFAULT_FETCH_TIMEOUT.toMillis());
        return DispatchConfig.builder()
                .maxConcurrentFetches(readInt(PROP_MAX_CONCURRENT_FETCHES, DEFAULT_MAX_CONCURRENT_FETCHES))
                .requestBudget(readInt(PROP_REQUEST_BUDGET, UNBOUNDED))
                .fetchTimeout(Duration.ofMillis(timeoutMillis))
                .build();
    }

    private static int readInt(String property, int fallback) {
        return (int) Math.min(Integer.MAX_VALUE, readLong(property, fallback));
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
