package com.waypoint.core.model;

import java.io.Serializable;

/**
 * Graph-wide scope limits.
 *
 * @param defaultMaxFileChanges file-change budget for tasks that do not declare one
 */
public record ScopeEnforcement(Integer defaultMaxFileChanges) implements Serializable {

    public static final int DEFAULT_MAX_FILE_CHANGES = 10;

    public ScopeEnforcement {
        defaultMaxFileChanges = defaultMaxFileChanges == null ? DEFAULT_MAX_FILE_CHANGES : defaultMaxFileChanges;
    }

    public static ScopeEnforcement defaults() {
        return new ScopeEnforcement(DEFAULT_MAX_FILE_CHANGES);
    }
}
