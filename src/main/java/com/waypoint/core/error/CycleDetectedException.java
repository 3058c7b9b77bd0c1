package com.waypoint.core.error;

import java.util.List;
import java.util.Map;

/**
 * Thrown when the dependency relation contains a cycle.
 */
public class CycleDetectedException extends WaypointException {

    private final List<String> cycle;

    /**
     * @param cycle cycle members in dependency order, first member repeated at the end
     */
    public CycleDetectedException(List<String> cycle) {
        super(ErrorCode.CYCLE_DETECTED, "Dependency cycle detected: " + String.join(" -> ", cycle),
                Map.of("cycle", List.copyOf(cycle)));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
