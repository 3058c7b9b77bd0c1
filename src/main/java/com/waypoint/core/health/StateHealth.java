package com.waypoint.core.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Result of one health check on the state directory.
 *
 * @param check    which part of the state directory was inspected
 * @param status   outcome of the check
 * @param detail   one-line description for the console
 * @param metadata machine-readable facts such as the lock holder or the latest backup id
 */
public record StateHealth(
    Check check,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /**
     * The checks {@code waypoint health} runs, in the order it runs them.
     */
    public enum Check {
        @JsonProperty("state_directory") STATE_DIRECTORY,
        @JsonProperty("lock") LOCK,
        @JsonProperty("state_files") STATE_FILES,
        @JsonProperty("backups") BACKUPS;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Ordered by severity. DEGRADED means operations still work but something needs attention;
     * DOWN means operations will fail.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public StateHealth {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static StateHealth up(Check check, String detail, Map<String, String> metadata) {
        return new StateHealth(check, Status.UP, detail, metadata);
    }

    public static StateHealth degraded(Check check, String detail, Map<String, String> metadata) {
        return new StateHealth(check, Status.DEGRADED, detail, metadata);
    }

    public static StateHealth down(Check check, String detail, Map<String, String> metadata) {
        return new StateHealth(check, Status.DOWN, detail, metadata);
    }

    /**
     * The most severe status among {@code checks}, UP when there are none.
     */
    public static Status overall(List<StateHealth> checks) {
        return checks.stream()
                .map(StateHealth::status)
                .max(Comparator.naturalOrder())
                .orElse(Status.UP);
    }
}
