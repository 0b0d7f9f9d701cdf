package org.Aayush.slicecache.context;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of evaluating the values present for one dimension against its definition.
 */
@Value
@Builder
public class MeceCheck {

    /**
     * Partition status for one dimension.
     */
    public enum Status {
        /** Every expected value is present and the policy allows a complete total. */
        COMPLETE,
        /** Values are recognised and additive but do not form a guaranteed total. */
        PARTIAL_BUT_AGGREGABLE,
        /** Values cannot be summed at all (unknown definition or unrecognised value). */
        NOT_MECE
    }

    /** Dimension key that was evaluated. */
    String key;
    /** Partition status. */
    Status status;
    /** Policy the status was derived from, or {@code null} when the definition is unknown. */
    OtherPolicy policy;
    /** Reason code for {@link Status#NOT_MECE}, {@code null} otherwise. */
    String reasonCode;
    /** Canonical values present, sorted. */
    @Singular("presentValue")
    List<String> presentValues;
    /** Expected values that are absent, sorted. */
    @Singular("missingValue")
    List<String> missingValues;
    /** Raw values that are not part of the expected set, sorted. */
    @Singular("unrecognisedValue")
    List<String> unrecognisedValues;

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }

    public boolean isAggregable() {
        return status != Status.NOT_MECE;
    }
}
