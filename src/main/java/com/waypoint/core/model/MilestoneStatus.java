package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle status of a milestone.
 * <p>
 * Milestones move strictly forward, except that a {@link #COMPLETE} milestone
 * whose validation failed is reopened to {@link #IN_PROGRESS}.
 */
public enum MilestoneStatus {
    @JsonProperty("not_started") NOT_STARTED,
    @JsonProperty("in_progress") IN_PROGRESS,
    @JsonProperty("complete") COMPLETE,
    @JsonProperty("validated") VALIDATED;

    public boolean canTransitionTo(MilestoneStatus target) {
        return switch (this) {
            case NOT_STARTED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETE;
            case COMPLETE -> target == VALIDATED || target == IN_PROGRESS;
            case VALIDATED -> false;
        };
    }

    /**
     * Open milestones still accept new tasks.
     */
    public boolean isOpen() {
        return switch (this) {
            case NOT_STARTED, IN_PROGRESS -> true;
            case COMPLETE, VALIDATED -> false;
        };
    }
}
