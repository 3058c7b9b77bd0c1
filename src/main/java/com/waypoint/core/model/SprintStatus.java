package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle status of the sprint as a whole.
 */
public enum SprintStatus {
    @JsonProperty("planned") PLANNED,
    @JsonProperty("in_progress") IN_PROGRESS,
    @JsonProperty("awaiting_validation") AWAITING_VALIDATION,
    @JsonProperty("completed") COMPLETED
}
