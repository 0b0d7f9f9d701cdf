package org.Aayush.slicecache.testutil;

import org.Aayush.slicecache.context.ContextDefinition;
import org.Aayush.slicecache.context.InMemoryContextRegistry;
import org.Aayush.slicecache.context.OtherPolicy;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.signature.CacheSignature;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.Slice;
import org.Aayush.slicecache.slice.TimeSeries;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared builders for slice-cache tests.
 *
 * <p>Days are addressed by day-of-month in November 2025, so {@code day(1)} is 2025-11-01.</p>
 */
public final class SliceFixtures {
    public static final String METRIC = "checkout-conversion";
    public static final String CORE = "core-abc";
    public static final String CHANNEL_HASH = "channel-def-v1";
    public static final String DEVICE_HASH = "device-def-v1";

    private SliceFixtures() {
    }

    public static LocalDate day(int dayOfMonth) {
        return LocalDate.of(2025, 11, dayOfMonth);
    }

    public static DateRange days(int firstDay, int lastDay) {
        return new DateRange(day(firstDay), day(lastDay));
    }

    /**
     * Series with {@code n = base + day} and {@code k = day} on every listed day.
     */
    public static TimeSeries series(long base, int... daysOfMonth) {
        TimeSeries.Builder builder = TimeSeries.builder();
        for (int d : daysOfMonth) {
            builder.add(day(d), base + d, d);
        }
        return builder.build();
    }

    /**
     * Series with constant counts over an inclusive run of days.
     */
    public static TimeSeries constant(int firstDay, int lastDay, long n, long k) {
        TimeSeries.Builder builder = TimeSeries.builder();
        for (int d = firstDay; d <= lastDay; d++) {
            builder.add(day(d), n, k);
        }
        return builder.build();
    }

    /**
     * Signature carrying definition hashes for the given dimension keys.
     */
    public static CacheSignature signature(String... dims) {
        Map<String, String> hashes = new LinkedHashMap<>();
        for (String dim : dims) {
            hashes.put(dim, dim + "-def-v1");
        }
        return CacheSignature.of(CORE, hashes);
    }

    public static Slice slice(DimensionAssignment assignment, TimeSeries series) {
        return Slice.builder()
                .assignment(assignment)
                .series(series)
                .signature(signature(assignment.keys().toArray(new String[0])))
                .build();
    }

    public static ContextDefinition channel(OtherPolicy policy) {
        return ContextDefinition.builder()
                .key("channel")
                .value("google")
                .value("meta")
                .otherPolicy(policy)
                .build();
    }

    public static ContextDefinition device(OtherPolicy policy) {
        return ContextDefinition.builder()
                .key("device")
                .value("mobile")
                .value("desktop")
                .otherPolicy(policy)
                .build();
    }

    public static InMemoryContextRegistry registry(ContextDefinition... definitions) {
        return new InMemoryContextRegistry(List.of(definitions));
    }
}
