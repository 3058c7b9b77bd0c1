package com.waypoint.core.error;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Thrown when the state lock cannot be acquired within the configured timeout.
 */
public class LockContentionException extends WaypointException {

    public LockContentionException(Path lockFile, Duration waited, String holder) {
        super(ErrorCode.LOCK_CONTENTION,
                "State lock " + lockFile + " is held by " + (holder == null ? "another process" : holder)
                        + "; gave up after " + waited.toMillis() + "ms",
                Map.of("lock_file", lockFile.toString(),
                        "waited_ms", waited.toMillis(),
                        "holder", holder == null ? "unknown" : holder));
    }
}
