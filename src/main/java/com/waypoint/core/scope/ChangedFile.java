package com.waypoint.core.scope;

/**
 * A file touched by a task's execution.
 *
 * @param path    path relative to the workspace root, forward slashes
 * @param content file content when the caller supplied it, otherwise null; content
 *                patterns are only checked when present
 */
public record ChangedFile(String path, String content) {

    public ChangedFile {
        path = normalize(path);
    }

    public static ChangedFile of(String path) {
        return new ChangedFile(path, null);
    }

    static String normalize(String path) {
        String p = path == null ? "" : path.trim().replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        return p;
    }
}
