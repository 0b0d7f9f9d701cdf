package org.Aayush.slicecache.plan;

import lombok.Builder;
import lombok.Value;
import org.Aayush.slicecache.reduction.DimensionalReducer;

/**
 * Planner tuning.
 *
 * <p>Non-positive or unparsable values normalise to defaults.</p>
 */
@Value
@Builder
public class PlannerConfig {
    static final String PROP_MAX_JOINT_DIMENSIONS = "slicecache.reduction.maxJointDimensions";

    /** Upper bound on unspecified dimensions reduced jointly. */
    int maxJointDimensions;

    /**
     * Returns the effective joint-dimension limit.
     */
    public int effectiveMaxJointDimensions() {
        return maxJointDimensions <= 0 ? DimensionalReducer.DEFAULT_MAX_JOINT_DIMENSIONS : maxJointDimensions;
    }

    /**
     * Loads configuration from system properties.
     */
    public static PlannerConfig defaults() {
        return PlannerConfig.builder()
                .maxJointDimensions(readPositive(PROP_MAX_JOINT_DIMENSIONS, DimensionalReducer.DEFAULT_MAX_JOINT_DIMENSIONS))
                .build();
    }

    static int readPositive(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
