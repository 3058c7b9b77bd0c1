package com.waypoint.core.error;

import java.util.List;
import java.util.Map;

/**
 * Thrown when state files are unreadable or violate referential integrity.
 * Carries every violation found, not just the first.
 */
public class SchemaValidationException extends WaypointException {

    private final List<String> violations;

    public SchemaValidationException(List<String> violations) {
        super(ErrorCode.SCHEMA_ERROR,
                "Task graph failed validation with " + violations.size() + " violation(s): "
                        + String.join("; ", violations),
                Map.of("violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public SchemaValidationException(String file, String problem, Throwable cause) {
        super(ErrorCode.SCHEMA_ERROR, "Cannot read " + file + ": " + problem,
                Map.of("file", file, "violations", List.of(problem)), cause);
        this.violations = List.of(file + ": " + problem);
    }

    public List<String> violations() {
        return violations;
    }
}
