package org.Aayush.slicecache.plan;

import org.Aayush.slicecache.reduction.DimensionalReducer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("PlannerConfig Tests")
class PlannerConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(PlannerConfig.PROP_MAX_JOINT_DIMENSIONS);
    }

    @Test
    @DisplayName("Non-positive limit normalises to the default")
    void testNormalisation() {
        assertEquals(DimensionalReducer.DEFAULT_MAX_JOINT_DIMENSIONS,
                PlannerConfig.builder().maxJointDimensions(0).build().effectiveMaxJointDimensions());
        assertEquals(2, PlannerConfig.builder().maxJointDimensions(2).build().effectiveMaxJointDimensions());
    }

    @Test
    @DisplayName("System property sets the joint-dimension limit")
    void testSystemProperty() {
        System.setProperty(PlannerConfig.PROP_MAX_JOINT_DIMENSIONS, "6");
        assertEquals(6, PlannerConfig.defaults().effectiveMaxJointDimensions());

        System.setProperty(PlannerConfig.PROP_MAX_JOINT_DIMENSIONS, "six");
        assertEquals(DimensionalReducer.DEFAULT_MAX_JOINT_DIMENSIONS, PlannerConfig.defaults().effectiveMaxJointDimensions());
    }
}
