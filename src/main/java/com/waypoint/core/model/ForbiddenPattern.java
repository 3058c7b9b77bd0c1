package com.waypoint.core.model;

import java.io.Serializable;

/**
 * A guardrail pattern that must not appear in a task's changes.
 *
 * @param id          short name reported in violations (e.g., "prerelease-version")
 * @param regex       Java regular expression
 * @param description why the pattern is forbidden
 * @param target      whether the regex applies to file paths or file content
 */
public record ForbiddenPattern(
    String id,
    String regex,
    String description,
    PatternTarget target
) implements Serializable {

    public ForbiddenPattern {
        target = target == null ? PatternTarget.CONTENT : target;
    }
}
