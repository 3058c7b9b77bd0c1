package com.waypoint.core.error;

import java.util.Map;

/**
 * Thrown when a task or milestone ID does not exist in the graph.
 */
public class TaskNotFoundException extends WaypointException {

    public TaskNotFoundException(String taskId) {
        super(ErrorCode.TASK_NOT_FOUND, "Task not found: " + taskId, Map.of("task_id", taskId));
    }

    private TaskNotFoundException(String kind, String id) {
        super(ErrorCode.TASK_NOT_FOUND, kind + " not found: " + id, Map.of(kind.toLowerCase() + "_id", id));
    }

    public static TaskNotFoundException milestone(String milestoneId) {
        return new TaskNotFoundException("Milestone", milestoneId);
    }

    public static TaskNotFoundException deferredFeature(String featureId) {
        return new TaskNotFoundException("Feature", featureId);
    }

    public static TaskNotFoundException backup(String backupId) {
        return new TaskNotFoundException("Backup", backupId);
    }
}
