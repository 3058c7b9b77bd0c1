package com.waypoint.core.milestone;

import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.model.ValidationRecord;

import java.util.List;

/**
 * Snapshot of one milestone for {@code waypoint milestone <id>}.
 *
 * @param workTasks        work tasks, the ones counted against capacity
 * @param remediationTasks tasks inserted after failed validations
 * @param totalTasks       every task listed, the validation task included
 * @param completedTasks   completed tasks among {@code totalTasks}
 * @param current          whether work is currently drawn from this milestone
 */
public record MilestoneReport(
    String milestoneId,
    String title,
    MilestoneStatus status,
    int index,
    int workTasks,
    int remediationTasks,
    int totalTasks,
    int completedTasks,
    int minTasks,
    int maxTasks,
    String validationTaskId,
    TaskStatus validationTaskStatus,
    boolean current,
    boolean validationPending,
    List<String> taskIds,
    List<ValidationRecord> validations
) {

    public MilestoneReport {
        taskIds = taskIds == null ? List.of() : List.copyOf(taskIds);
        validations = validations == null ? List.of() : List.copyOf(validations);
    }
}
