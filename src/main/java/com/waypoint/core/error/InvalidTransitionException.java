package com.waypoint.core.error;

import java.util.Map;

/**
 * Thrown when a task or milestone is asked to move to a state its lifecycle does not allow.
 */
public class InvalidTransitionException extends WaypointException {

    public InvalidTransitionException(String subject, String from, String to) {
        super(ErrorCode.INVALID_TRANSITION,
                subject + " cannot move from " + from + " to " + to,
                Map.of("subject", subject, "from", from, "to", to));
    }

    public InvalidTransitionException(String subject, String reason) {
        super(ErrorCode.INVALID_TRANSITION, subject + ": " + reason,
                Map.of("subject", subject, "reason", reason));
    }
}
