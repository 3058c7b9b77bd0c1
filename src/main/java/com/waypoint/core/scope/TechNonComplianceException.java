package com.waypoint.core.scope;

import com.waypoint.core.error.ErrorCode;
import com.waypoint.core.error.WaypointException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when a task references technologies outside the approved stack.
 */
public class TechNonComplianceException extends WaypointException {

    private final List<TechViolation> violations;

    public TechNonComplianceException(String taskId, List<TechViolation> violations) {
        super(ErrorCode.TECH_NON_COMPLIANCE,
                "Task " + taskId + " is not tech-compliant: "
                        + violations.stream().map(TechViolation::message).collect(Collectors.joining("; ")),
                Map.of("task_id", taskId, "violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public List<TechViolation> violations() {
        return violations;
    }
}
