package org.Aayush.slicecache.coverage;

import java.util.List;

/**
 * Intersection coverage across several series that will be summed together.
 *
 * @param joint days present in every member.
 * @param members per-member coverage, in input order.
 */
public record JointCoverage(CoverageResult joint, List<CoverageResult> members) {

    public JointCoverage {
        members = List.copyOf(members);
    }

    public boolean isFullyCovered() {
        return joint.isFullyCovered();
    }
}
