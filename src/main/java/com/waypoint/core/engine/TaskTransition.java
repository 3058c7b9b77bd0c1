package com.waypoint.core.engine;

import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.Task;
import com.waypoint.core.scope.ScopeBrief;

/**
 * Result of starting or completing a task.
 *
 * @param scope boundaries for the executor; present when a task is started
 */
public record TaskTransition(
    Task task,
    String milestoneId,
    MilestoneStatus milestoneStatus,
    boolean validationPending,
    ScopeBrief scope
) {
}
