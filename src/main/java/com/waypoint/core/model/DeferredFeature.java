package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A feature request parked for a later enhancement pass.
 */
public record DeferredFeature(
    String id,
    String description,
    String reason,
    Instant deferredAt
) implements Serializable {
}
