package com.waypoint.core.error;

import java.util.Map;

/**
 * Base class for classified Waypoint failures.
 * <p>
 * The message always names the precise unmet condition; {@link #details()} carries the
 * same facts in structured form for {@code --json} output.
 */
public abstract class WaypointException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    protected WaypointException(ErrorCode code, String message, Map<String, Object> details) {
        super(message);
        this.code = code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    protected WaypointException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorCode code() {
        return code;
    }

    public Map<String, Object> details() {
        return details;
    }
}
