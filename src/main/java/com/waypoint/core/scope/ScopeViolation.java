package com.waypoint.core.scope;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One breach of a task's scope boundary.
 *
 * @param kind    which rule was broken
 * @param files   offending files; for a budget breach, every file past the budget
 * @param rule    the marker, pattern id or budget that was broken
 * @param match   matched text for forbidden patterns, otherwise null
 * @param message human-readable description naming the files and the rule
 */
public record ScopeViolation(
    Kind kind,
    List<String> files,
    String rule,
    String match,
    String message
) {

    public ScopeViolation {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public enum Kind {
        @JsonProperty("file_budget") FILE_BUDGET,
        @JsonProperty("forbidden_marker") FORBIDDEN_MARKER,
        @JsonProperty("forbidden_pattern") FORBIDDEN_PATTERN;

        public String tag() {
            return switch (this) {
                case FILE_BUDGET -> "file_budget";
                case FORBIDDEN_MARKER -> "forbidden_marker";
                case FORBIDDEN_PATTERN -> "forbidden_pattern";
            };
        }
    }
}
