package com.waypoint.core.enhancement;

import java.util.List;

/**
 * Outcome of an applied enhancement.
 *
 * @param resolvedDeferredId deferred feature removed from the backlog by this request, or null
 */
public record EnhancementResult(
    String requestId,
    String description,
    Placement placement,
    List<String> taskIds,
    List<String> updatedTaskIds,
    String resolvedDeferredId
) {

    public EnhancementResult {
        taskIds = List.copyOf(taskIds);
        updatedTaskIds = List.copyOf(updatedTaskIds);
    }
}
