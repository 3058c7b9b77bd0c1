package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kind of task. Only {@link #WORK} tasks count against milestone capacity.
 */
public enum TaskType {
    @JsonProperty("work") WORK,
    @JsonProperty("remediation") REMEDIATION,  // inserted when a milestone fails validation
    @JsonProperty("validation") VALIDATION
}
