package com.waypoint.core.persistence;

import java.nio.file.Path;
import java.util.List;

/**
 * Layout of the state directory.
 */
public record StateFiles(Path directory) {

    public static final String TASK_GRAPH = "task_graph.json";
    public static final String PROGRESS_TRACKER = "progress_tracker.json";
    public static final String DEFERRED_FEATURES = "deferred_features.json";
    public static final String GUARDRAILS = "guardrails.json";
    public static final String APPROVED_STACK = "approved_stack.json";

    /** Every file captured by a backup, in write order. */
    public static final List<String> MANAGED = List.of(
            TASK_GRAPH, PROGRESS_TRACKER, DEFERRED_FEATURES, GUARDRAILS, APPROVED_STACK);

    public Path taskGraph() {
        return directory.resolve(TASK_GRAPH);
    }

    public Path progressTracker() {
        return directory.resolve(PROGRESS_TRACKER);
    }

    public Path deferredFeatures() {
        return directory.resolve(DEFERRED_FEATURES);
    }

    public Path guardrails() {
        return directory.resolve(GUARDRAILS);
    }

    public Path approvedStack() {
        return directory.resolve(APPROVED_STACK);
    }

    public Path backups() {
        return directory.resolve("backups");
    }

    public Path lockFile() {
        return directory.resolve(".waypoint.lock");
    }

    public Path resolve(String name) {
        return directory.resolve(name);
    }
}
