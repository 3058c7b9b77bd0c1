package com.waypoint.core.engine;

import com.waypoint.core.error.ErrorCode;
import com.waypoint.core.error.WaypointException;

import java.util.Map;

/**
 * Error part of an {@link OperationResult}.
 */
public record ErrorInfo(
    String code,
    String message,
    boolean fatal,
    int exitCode,
    Map<String, Object> details
) {

    public static ErrorInfo from(WaypointException e) {
        return of(e.code(), e.getMessage(), e.details());
    }

    public static ErrorInfo of(ErrorCode code, String message, Map<String, Object> details) {
        return new ErrorInfo(code.name(), message, code.fatal(), code.exitCode(), details == null ? Map.of() : details);
    }

    public static ErrorInfo internal(Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return of(ErrorCode.INTERNAL_ERROR, "Unexpected failure: " + message,
                Map.of("exception", e.getClass().getName()));
    }
}
