package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A single unit of work in the sprint graph.
 *
 * @param id           unique identifier (e.g., "T-001")
 * @param title        short summary shown in listings
 * @param description  longer explanation for the executor
 * @param type         work, remediation, or the milestone's trailing validation task
 * @param dependencies IDs of tasks that must be completed first, in declared order
 * @param status       current execution status
 * @param milestoneId  the milestone that lists this task
 * @param scope        declared boundaries checked by the scope guard
 * @param enhancement  provenance when the task was added after planning, otherwise null
 * @param startedAt    when the task moved to in_progress
 * @param completedAt  when the task was completed
 */
public record Task(
    String id,
    String title,
    String description,
    TaskType type,
    List<String> dependencies,
    TaskStatus status,
    String milestoneId,
    ScopeBoundary scope,
    EnhancementMetadata enhancement,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public Task {
        type = type == null ? TaskType.WORK : type;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        status = status == null ? TaskStatus.PENDING : status;
        scope = scope == null ? ScopeBoundary.unbounded() : scope;
    }

    @JsonIgnore
    public boolean isValidation() {
        return type == TaskType.VALIDATION;
    }

    public Task started(Instant at) {
        return new Task(id, title, description, type, dependencies, TaskStatus.IN_PROGRESS,
                milestoneId, scope, enhancement, at, completedAt);
    }

    public Task completed(Instant at) {
        return new Task(id, title, description, type, dependencies, TaskStatus.COMPLETED,
                milestoneId, scope, enhancement, startedAt == null ? at : startedAt, at);
    }

    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, title, description, type, newDependencies, status,
                milestoneId, scope, enhancement, startedAt, completedAt);
    }
}
