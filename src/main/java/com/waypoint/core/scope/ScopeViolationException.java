package com.waypoint.core.scope;

import com.waypoint.core.error.ErrorCode;
import com.waypoint.core.error.WaypointException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown by a post-check that found changes outside the task's boundary.
 */
public class ScopeViolationException extends WaypointException {

    private final List<ScopeViolation> violations;

    public ScopeViolationException(String taskId, List<ScopeViolation> violations) {
        super(ErrorCode.SCOPE_VIOLATION,
                "Task " + taskId + " violates its scope: "
                        + violations.stream().map(ScopeViolation::message).collect(Collectors.joining("; ")),
                Map.of("task_id", taskId, "violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public List<ScopeViolation> violations() {
        return violations;
    }
}
