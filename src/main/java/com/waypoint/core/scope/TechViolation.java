package com.waypoint.core.scope;

/**
 * A technology referenced by a task that the approved stack does not allow.
 *
 * @param approvedVersion the allowed version, null when the technology is not approved at all
 */
public record TechViolation(
    String technology,
    String referencedVersion,
    String approvedVersion,
    String message
) {
}
