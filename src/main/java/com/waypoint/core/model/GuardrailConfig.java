package com.waypoint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Guardrail configuration loaded from {@code guardrails.json}.
 */
public record GuardrailConfig(List<ForbiddenPattern> forbiddenPatterns) implements Serializable {

    /** Prerelease qualifiers such as 1.2.0-beta.1, 3.0.0-RC2, 2.1-SNAPSHOT, 6.0.0-M3. */
    public static final ForbiddenPattern PRERELEASE_VERSION = new ForbiddenPattern(
            "prerelease-version",
            "(?i)\\b\\d+(?:\\.\\d+)+[-.](?:alpha|beta|rc|snapshot|preview|canary|nightly|m\\d)[\\w.-]*",
            "Prerelease dependency versions are not allowed",
            PatternTarget.CONTENT);

    public GuardrailConfig {
        forbiddenPatterns = forbiddenPatterns == null ? List.of() : List.copyOf(forbiddenPatterns);
    }

    public static GuardrailConfig defaults() {
        return new GuardrailConfig(List.of(PRERELEASE_VERSION));
    }
}
