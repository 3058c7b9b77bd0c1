package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Event types appended to the progress tracker history.
 */
public enum HistoryEvent {
    @JsonProperty("task_started") TASK_STARTED,
    @JsonProperty("task_completed") TASK_COMPLETED,
    @JsonProperty("milestone_started") MILESTONE_STARTED,
    @JsonProperty("milestone_completed") MILESTONE_COMPLETED,
    @JsonProperty("milestone_validated") MILESTONE_VALIDATED,
    @JsonProperty("milestone_reopened") MILESTONE_REOPENED,
    @JsonProperty("enhancement_applied") ENHANCEMENT_APPLIED,
    @JsonProperty("feature_deferred") FEATURE_DEFERRED
}
