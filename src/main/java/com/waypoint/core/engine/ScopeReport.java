package com.waypoint.core.engine;

import com.waypoint.core.scope.ScopeBrief;
import com.waypoint.core.scope.ScopeViolation;
import com.waypoint.core.scope.TechViolation;

import java.util.List;

/**
 * Scope and technology compliance of a task's changes.
 */
public record ScopeReport(
    String taskId,
    boolean compliant,
    int changedFiles,
    ScopeBrief brief,
    List<ScopeViolation> violations,
    List<TechViolation> techViolations
) {
}
