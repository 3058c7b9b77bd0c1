package com.waypoint.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared boundaries of a task.
 *
 * @param mustImplement    features or files the task is expected to deliver
 * @param mustNotImplement markers the task must not touch: a glob ({@code src/auth/**})
 *                         or a plain path fragment ({@code payment})
 * @param maxFileChanges   file-change budget; {@code null} falls back to the graph default
 * @param technologies     technologies the task references, name to exact version
 */
public record ScopeBoundary(
    List<String> mustImplement,
    List<String> mustNotImplement,
    Integer maxFileChanges,
    Map<String, String> technologies
) implements Serializable {

    public ScopeBoundary {
        mustImplement = mustImplement == null ? List.of() : List.copyOf(mustImplement);
        mustNotImplement = mustNotImplement == null ? List.of() : List.copyOf(mustNotImplement);
        technologies = technologies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(technologies));
    }

    public static ScopeBoundary unbounded() {
        return new ScopeBoundary(List.of(), List.of(), null, Map.of());
    }
}
