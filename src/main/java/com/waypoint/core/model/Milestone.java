package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered, capacity-bounded slice of the sprint whose last task validates it.
 *
 * @param id       unique identifier (e.g., "M1")
 * @param title    human-readable name
 * @param taskIds  ordered task IDs; the last one is the validation task
 * @param status   lifecycle status
 * @param minTasks lower capacity bound, null for the graph's strategy default
 * @param maxTasks upper capacity bound, null for the graph's strategy default
 */
public record Milestone(
    String id,
    String title,
    List<String> taskIds,
    MilestoneStatus status,
    Integer minTasks,
    Integer maxTasks
) implements Serializable {

    public Milestone {
        taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
        status = status == null ? MilestoneStatus.NOT_STARTED : status;
    }

    @JsonIgnore
    public String validationTaskId() {
        return taskIds.isEmpty() ? null : taskIds.get(taskIds.size() - 1);
    }

    public Milestone withStatus(MilestoneStatus newStatus) {
        return new Milestone(id, title, taskIds, newStatus, minTasks, maxTasks);
    }

    /**
     * Returns a copy with the given tasks inserted just before the trailing validation task.
     */
    public Milestone withTasksBeforeValidation(List<String> newTaskIds) {
        var ids = new ArrayList<>(taskIds);
        int insertAt = ids.isEmpty() ? 0 : ids.size() - 1;
        ids.addAll(insertAt, newTaskIds);
        return new Milestone(id, title, ids, status, minTasks, maxTasks);
    }
}
