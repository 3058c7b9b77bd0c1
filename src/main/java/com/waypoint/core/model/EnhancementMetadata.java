package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Provenance of a task added after the initial plan.
 *
 * @param requestId   id shared by every task inserted by the same request
 * @param description the enhancement or remediation request text
 * @param addedAt     when the task was inserted
 * @param source      what produced the task
 */
public record EnhancementMetadata(
    String requestId,
    String description,
    Instant addedAt,
    EnhancementSource source
) implements Serializable {
}
