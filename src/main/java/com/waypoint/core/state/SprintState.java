package com.waypoint.core.state;

import com.waypoint.core.model.ApprovedStack;
import com.waypoint.core.model.DeferredFeature;
import com.waypoint.core.model.GuardrailConfig;
import com.waypoint.core.model.HistoryEntry;
import com.waypoint.core.model.ProgressTracker;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything read from the state directory for one invocation.
 * <p>
 * A fresh instance is loaded per call and never cached. Mutations passed to
 * {@code TaskGraphStore.atomicUpdate} work on this object; guardrails and the
 * approved stack are configuration and stay read-only.
 */
public final class SprintState {

    private TaskGraph graph;
    private ProgressTracker tracker;
    private List<DeferredFeature> deferredFeatures;
    private final GuardrailConfig guardrails;
    private final ApprovedStack approvedStack;

    public SprintState(TaskGraph graph, ProgressTracker tracker, List<DeferredFeature> deferredFeatures,
                       GuardrailConfig guardrails, ApprovedStack approvedStack) {
        this.graph = graph;
        this.tracker = tracker;
        this.deferredFeatures = deferredFeatures == null ? List.of() : List.copyOf(deferredFeatures);
        this.guardrails = guardrails == null ? GuardrailConfig.defaults() : guardrails;
        this.approvedStack = approvedStack == null ? ApprovedStack.empty() : approvedStack;
    }

    public TaskGraph graph() {
        return graph;
    }

    public void graph(TaskGraph graph) {
        this.graph = graph;
    }

    public ProgressTracker tracker() {
        return tracker;
    }

    public void tracker(ProgressTracker tracker) {
        this.tracker = tracker;
    }

    public List<DeferredFeature> deferredFeatures() {
        return deferredFeatures;
    }

    public void deferredFeatures(List<DeferredFeature> features) {
        this.deferredFeatures = List.copyOf(features);
    }

    public GuardrailConfig guardrails() {
        return guardrails;
    }

    public ApprovedStack approvedStack() {
        return approvedStack;
    }

    public void record(HistoryEntry entry) {
        tracker = tracker.append(entry);
    }

    public void addDeferredFeature(DeferredFeature feature) {
        var copy = new ArrayList<>(deferredFeatures);
        copy.add(feature);
        deferredFeatures = List.copyOf(copy);
    }

    /**
     * Recomputes the tracker counters from the graph so they never drift.
     */
    public void refreshCounters() {
        int completed = (int) graph.countByStatus(TaskStatus.COMPLETED);
        tracker = tracker.withCounts(completed, graph.tasks().size());
    }
}
