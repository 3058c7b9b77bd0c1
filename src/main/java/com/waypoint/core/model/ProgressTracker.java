package com.waypoint.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted sprint progress, reloaded from disk on every invocation.
 *
 * @param sprintId           sprint this tracker belongs to
 * @param status             sprint lifecycle status
 * @param currentMilestoneId milestone work is being drawn from
 * @param validationPending  gate flag: a milestone is complete and awaits external validation
 * @param completedTasks     completed task count, recomputed on every write
 * @param totalTasks         total task count, recomputed on every write
 * @param history            append-only event log
 * @param validations        append-only validator reports
 */
public record ProgressTracker(
    String sprintId,
    SprintStatus status,
    String currentMilestoneId,
    boolean validationPending,
    int completedTasks,
    int totalTasks,
    List<HistoryEntry> history,
    List<ValidationRecord> validations
) implements Serializable {

    public ProgressTracker {
        status = status == null ? SprintStatus.PLANNED : status;
        history = history == null ? List.of() : List.copyOf(history);
        validations = validations == null ? List.of() : List.copyOf(validations);
    }

    public ProgressTracker withStatus(SprintStatus newStatus) {
        return new ProgressTracker(sprintId, newStatus, currentMilestoneId, validationPending,
                completedTasks, totalTasks, history, validations);
    }

    public ProgressTracker withCurrentMilestone(String milestoneId) {
        return new ProgressTracker(sprintId, status, milestoneId, validationPending,
                completedTasks, totalTasks, history, validations);
    }

    public ProgressTracker withValidationPending(boolean pending) {
        return new ProgressTracker(sprintId, status, currentMilestoneId, pending,
                completedTasks, totalTasks, history, validations);
    }

    public ProgressTracker withCounts(int completed, int total) {
        return new ProgressTracker(sprintId, status, currentMilestoneId, validationPending,
                completed, total, history, validations);
    }

    public ProgressTracker append(HistoryEntry entry) {
        var copy = new ArrayList<>(history);
        copy.add(entry);
        return new ProgressTracker(sprintId, status, currentMilestoneId, validationPending,
                completedTasks, totalTasks, copy, validations);
    }

    public ProgressTracker append(ValidationRecord record) {
        var copy = new ArrayList<>(validations);
        copy.add(record);
        return new ProgressTracker(sprintId, status, currentMilestoneId, validationPending,
                completedTasks, totalTasks, history, copy);
    }
}
