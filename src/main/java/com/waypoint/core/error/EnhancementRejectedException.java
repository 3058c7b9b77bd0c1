package com.waypoint.core.error;

import java.util.Map;

/**
 * Thrown when no placement exists for a set of new tasks.
 */
public class EnhancementRejectedException extends WaypointException {

    public EnhancementRejectedException(String reason) {
        super(ErrorCode.ENHANCEMENT_REJECTED, "Enhancement rejected: " + reason, Map.of("reason", reason));
    }
}
