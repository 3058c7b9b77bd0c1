package com.waypoint.core.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Uniform envelope returned by every {@link SprintEngine} operation.
 *
 * @param operation operation name, e.g. {@code start-task}
 * @param ok        false for failures and for blocking outcomes
 * @param data      operation payload; may accompany an error (a blocked next-task answer)
 * @param error     absent on success
 */
public record OperationResult(
    String operation,
    boolean ok,
    Object data,
    ErrorInfo error
) {

    public static OperationResult success(String operation, Object data) {
        return new OperationResult(operation, true, data, null);
    }

    public static OperationResult failure(String operation, ErrorInfo error) {
        return new OperationResult(operation, false, null, error);
    }

    public static OperationResult failure(String operation, Object data, ErrorInfo error) {
        return new OperationResult(operation, false, data, error);
    }

    @JsonIgnore
    public int exitCode() {
        return ok ? 0 : error.exitCode();
    }
}
