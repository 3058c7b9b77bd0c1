package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a forbidden pattern is matched against.
 */
public enum PatternTarget {
    @JsonProperty("path") PATH,
    @JsonProperty("content") CONTENT
}
