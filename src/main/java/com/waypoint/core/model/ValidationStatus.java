package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome reported by the external validator for a milestone.
 */
public enum ValidationStatus {
    @JsonProperty("passed") PASSED,
    @JsonProperty("failed") FAILED
}
