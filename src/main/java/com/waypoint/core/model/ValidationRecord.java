package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Result reported by the external validator for a milestone. Never mutated once appended.
 */
public record ValidationRecord(
    String milestoneId,
    Instant timestamp,
    ValidationStatus status,
    List<String> issues
) implements Serializable {

    public ValidationRecord {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
