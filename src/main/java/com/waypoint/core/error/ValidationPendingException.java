package com.waypoint.core.error;

import java.util.Map;

/**
 * Thrown when work is requested past a milestone that is complete but not yet validated.
 */
public class ValidationPendingException extends WaypointException {

    private final String milestoneId;

    public ValidationPendingException(String milestoneId, String taskId) {
        super(ErrorCode.VALIDATION_PENDING,
                "Milestone " + milestoneId + " is complete and awaiting validation; task " + taskId
                        + " cannot start until it is validated",
                Map.of("milestone_id", milestoneId, "task_id", taskId));
        this.milestoneId = milestoneId;
    }

    public String milestoneId() {
        return milestoneId;
    }
}
