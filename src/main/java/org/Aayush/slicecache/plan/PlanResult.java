package org.Aayush.slicecache.plan;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.slicecache.dimension.DimensionAssignment;
import org.Aayush.slicecache.slice.DateRange;
import org.Aayush.slicecache.slice.TimeSeries;

import java.util.List;

/**
 * Terminal planning answer: either a value with disclosures, or work to fetch.
 *
 * <p>Integrity faults are listed on either outcome; a fault never silently changes a value.</p>
 */
@Value
@Builder
public class PlanResult {

    /**
     * Terminal outcome.
     */
    public enum Outcome {
        SATISFIED,
        NEEDS_FETCH
    }

    Outcome outcome;
    String metricId;
    DimensionAssignment assignment;
    DateRange window;
    /** Summed denominator; zero when {@link Outcome#NEEDS_FETCH}. */
    long n;
    /** Summed numerator; zero when {@link Outcome#NEEDS_FETCH}. */
    long k;
    /** Daily values for daily sources, empty otherwise. */
    TimeSeries series;
    @Singular
    List<Disclosure> disclosures;
    /** Other complete dimension sets that would have produced the same value. */
    @Singular
    List<List<String>> alternativeReductions;
    @Singular
    List<FetchPlanItem> items;
    @Singular
    List<IntegrityFault> faults;
    PlanTrace trace;

    public boolean isSatisfied() {
        return outcome == Outcome.SATISFIED;
    }

    /**
     * Returns {@code k / n}, or {@code 0.0} when {@code n} is zero.
     */
    public double mean() {
        return n == 0L ? 0.0d : (double) k / (double) n;
    }

    /**
     * Returns whether a disclosure of {@code kind} is attached.
     */
    public boolean hasDisclosure(Disclosure.Kind kind) {
        for (Disclosure disclosure : disclosures) {
            if (disclosure.kind() == kind) {
                return true;
            }
        }
        return false;
    }
}
