package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status of an individual task within the sprint graph.
 */
public enum TaskStatus {
    @JsonProperty("pending") PENDING,
    @JsonProperty("in_progress") IN_PROGRESS,
    @JsonProperty("completed") COMPLETED
}
