package com.waypoint.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a post-planning task came from.
 */
public enum EnhancementSource {
    @JsonProperty("enhancement") ENHANCEMENT,
    @JsonProperty("deferred") DEFERRED,
    @JsonProperty("remediation") REMEDIATION
}
