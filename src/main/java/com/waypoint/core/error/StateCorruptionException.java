package com.waypoint.core.error;

import java.util.Map;

/**
 * Thrown when writing state failed part-way. The files have already been restored
 * from {@code backupId} by the time this surfaces.
 */
public class StateCorruptionException extends WaypointException {

    private final String backupId;

    public StateCorruptionException(String backupId, Throwable cause) {
        super(ErrorCode.STATE_CORRUPTION_ON_WRITE,
                "Writing state failed (" + cause.getMessage() + "); restored backup " + backupId,
                Map.of("restored_backup", backupId), cause);
        this.backupId = backupId;
    }

    public String backupId() {
        return backupId;
    }
}
