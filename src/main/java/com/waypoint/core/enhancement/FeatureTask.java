package com.waypoint.core.enhancement;

import com.waypoint.core.model.ScopeBoundary;

import java.util.List;

/**
 * A task proposed by an enhancement request, before it is placed in the graph.
 *
 * @param id           requested id, or null to have one assigned ({@code ENH-001}, ...)
 * @param dependencies existing tasks or other feature tasks this one needs first
 * @param requiredBy   existing tasks that must wait for this one
 */
public record FeatureTask(
    String id,
    String title,
    String description,
    List<String> dependencies,
    List<String> requiredBy,
    ScopeBoundary scope
) {

    public FeatureTask {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        requiredBy = requiredBy == null ? List.of() : List.copyOf(requiredBy);
        scope = scope == null ? ScopeBoundary.unbounded() : scope;
    }

    FeatureTask withId(String newId) {
        return new FeatureTask(newId, title, description, dependencies, requiredBy, scope);
    }
}
