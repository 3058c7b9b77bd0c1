package com.waypoint.core.engine;

import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.SprintStatus;
import com.waypoint.core.scheduler.NextTaskResult;

import java.util.List;

/**
 * Read-only overview returned by {@code get-current-status}.
 */
public record SprintStatusView(
    String sprintId,
    SprintStatus status,
    String currentMilestoneId,
    boolean validationPending,
    int completedTasks,
    int totalTasks,
    List<String> inProgressTaskIds,
    int deferredFeatures,
    List<MilestoneSummary> milestones,
    NextTaskResult next
) {

    public record MilestoneSummary(
        String id,
        String title,
        MilestoneStatus status,
        int workTasks,
        int maxTasks,
        int completedTasks,
        int totalTasks
    ) {
    }
}
