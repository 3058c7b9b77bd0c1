package com.waypoint.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One line of the append-only progress history.
 */
public record HistoryEntry(
    Instant timestamp,
    HistoryEvent event,
    String taskId,
    String milestoneId,
    String detail
) implements Serializable {
}
