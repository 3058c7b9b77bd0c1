package com.waypoint.core.model;

import java.io.Serializable;

/**
 * Default capacity bounds applied to milestones that do not declare their own.
 */
public record MilestoneStrategy(
    Integer minTasksPerMilestone,
    Integer maxTasksPerMilestone
) implements Serializable {

    public static final int DEFAULT_MIN_TASKS = 3;
    public static final int DEFAULT_MAX_TASKS = 5;

    public MilestoneStrategy {
        minTasksPerMilestone = minTasksPerMilestone == null ? DEFAULT_MIN_TASKS : minTasksPerMilestone;
        maxTasksPerMilestone = maxTasksPerMilestone == null ? DEFAULT_MAX_TASKS : maxTasksPerMilestone;
    }

    public static MilestoneStrategy defaults() {
        return new MilestoneStrategy(DEFAULT_MIN_TASKS, DEFAULT_MAX_TASKS);
    }
}
