package com.waypoint.core.error;

/**
 * Closed set of failure classes reported by Waypoint operations.
 * <p>
 * Each code maps to a process exit code; {@code fatal} codes need a manual fix
 * or a restore, the others are recoverable by the caller.
 */
public enum ErrorCode {
    SCHEMA_ERROR(2, true),
    CYCLE_DETECTED(3, true),
    DEPENDENCY_UNSATISFIED(4, false),
    VALIDATION_PENDING(5, false),
    SCOPE_VIOLATION(6, false),
    TECH_NON_COMPLIANCE(7, false),
    LOCK_CONTENTION(8, false),
    STATE_CORRUPTION_ON_WRITE(9, true),
    TASK_NOT_FOUND(10, false),
    INVALID_TRANSITION(11, false),
    ENHANCEMENT_REJECTED(12, false),
    INTERNAL_ERROR(1, true);

    private final int exitCode;
    private final boolean fatal;

    ErrorCode(int exitCode, boolean fatal) {
        this.exitCode = exitCode;
        this.fatal = fatal;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean fatal() {
        return fatal;
    }
}
