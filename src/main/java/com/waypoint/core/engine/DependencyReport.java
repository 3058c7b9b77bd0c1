package com.waypoint.core.engine;

import com.waypoint.core.model.TaskStatus;

import java.util.List;
import java.util.Map;

/**
 * Dependency check for one task: each dependency's status and which ones are unmet.
 */
public record DependencyReport(
    String taskId,
    boolean satisfied,
    Map<String, TaskStatus> dependencies,
    List<String> unmet,
    String gatingMilestoneId
) {
}
