package com.waypoint.core.engine;

import com.waypoint.core.model.Task;
import com.waypoint.core.scope.ScopeBrief;

import java.util.List;

/**
 * A task together with its scheduling context.
 *
 * @param gatingMilestoneId milestone awaiting validation that keeps this task from starting, or null
 */
public record TaskDetails(
    Task task,
    boolean eligible,
    List<String> unmetDependencies,
    List<String> dependents,
    String gatingMilestoneId,
    ScopeBrief scope
) {
}
