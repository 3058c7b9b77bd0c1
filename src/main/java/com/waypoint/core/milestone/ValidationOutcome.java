package com.waypoint.core.milestone;

import com.waypoint.core.model.MilestoneStatus;

import java.util.List;

/**
 * Effect of a recorded validation result.
 *
 * @param milestoneId        the validated milestone
 * @param status             milestone status after the result was applied
 * @param remediationTaskIds tasks inserted because validation failed; empty when it passed
 * @param nextMilestoneId    milestone work continues in, null when the sprint is finished
 */
public record ValidationOutcome(
    String milestoneId,
    MilestoneStatus status,
    List<String> remediationTaskIds,
    String nextMilestoneId
) {

    public ValidationOutcome {
        remediationTaskIds = remediationTaskIds == null ? List.of() : List.copyOf(remediationTaskIds);
    }
}
