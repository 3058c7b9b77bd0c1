package com.waypoint.core.scope;

import com.waypoint.core.model.ForbiddenPattern;

import java.util.List;
import java.util.Map;

/**
 * Boundaries handed to the execution collaborator before a task runs.
 */
public record ScopeBrief(
    String taskId,
    List<String> mustImplement,
    List<String> mustNotImplement,
    int maxFileChanges,
    Map<String, String> technologies,
    List<ForbiddenPattern> forbiddenPatterns
) {
}
