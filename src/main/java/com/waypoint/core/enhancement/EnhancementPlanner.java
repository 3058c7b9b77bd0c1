package com.waypoint.core.enhancement;

import com.waypoint.core.error.DependencyUnsatisfiedException;
import com.waypoint.core.error.EnhancementRejectedException;
import com.waypoint.core.error.TaskNotFoundException;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.DeferredFeature;
import com.waypoint.core.model.EnhancementMetadata;
import com.waypoint.core.model.EnhancementSource;
import com.waypoint.core.model.HistoryEntry;
import com.waypoint.core.model.HistoryEvent;
import com.waypoint.core.model.Milestone;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.ScopeBoundary;
import com.waypoint.core.model.SprintStatus;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.model.TaskType;
import com.waypoint.core.persistence.TaskGraphStore;
import com.waypoint.core.state.SprintState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inserts new work into a planned sprint without breaking its ordering or capacity.
 * <p>
 * Feature tasks go into the earliest open milestone that sits after all of their
 * dependencies, no later than the first task that needs them, and still has room.
 * When no such milestone exists a new one is created between those bounds, split into
 * several when the feature is larger than a milestone's capacity. The whole change is
 * one store transaction: any failure leaves the state files untouched.
 */
@Service
public class EnhancementPlanner {

    private static final Logger log = LoggerFactory.getLogger(EnhancementPlanner.class);

    private static final Pattern MILESTONE_NUMBER = Pattern.compile("M(\\d+)");
    private static final Pattern ENHANCEMENT_NUMBER = Pattern.compile("ENH-(\\d+)");
    private static final Pattern DEFERRED_NUMBER = Pattern.compile("DEF-(\\d+)");
    private static final int MAX_TITLE_LENGTH = 60;

    private final TaskGraphStore store;
    private final WaypointMetrics metrics;
    private final Clock clock;

    public EnhancementPlanner(TaskGraphStore store, WaypointMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Applies an enhancement atomically.
     *
     * @param description  what the enhancement delivers; may be blank when {@code deferredId} is given
     * @param featureTasks proposed tasks; when empty a single task is derived from the description
     * @param deferredId   deferred feature this request implements, or null
     */
    public EnhancementResult apply(String description, List<FeatureTask> featureTasks, String deferredId) {
        return store.atomicUpdate(state -> insert(state, description, featureTasks, deferredId));
    }

    /**
     * Parks a feature request for a later enhancement pass.
     */
    public DeferredFeature defer(String description, String reason) {
        if (description == null || description.isBlank()) {
            throw new EnhancementRejectedException("a deferred feature needs a description");
        }
        return store.atomicUpdate(state -> {
            Instant now = clock.instant();
            int next = nextNumber(DEFERRED_NUMBER, state.deferredFeatures().stream().map(DeferredFeature::id).toList());
            var feature = new DeferredFeature(String.format(Locale.ROOT, "DEF-%03d", next), description.trim(),
                    reason == null || reason.isBlank() ? null : reason.trim(), now);
            state.addDeferredFeature(feature);
            state.record(new HistoryEntry(now, HistoryEvent.FEATURE_DEFERRED, null, null,
                    feature.id() + ": " + feature.description()));
            log.info("Deferred feature {}: {}", feature.id(), feature.description());
            return feature;
        });
    }

    /**
     * Computes where the feature tasks would go, without changing anything.
     *
     * @throws EnhancementRejectedException if no position satisfies the dependency and required-by bounds
     */
    public Placement placement(List<FeatureTask> featureTasks, TaskGraph graph) {
        Set<String> internal = new HashSet<>();
        featureTasks.stream().map(FeatureTask::id).filter(id -> id != null).forEach(internal::add);

        int floor = -1;
        String floorTask = null;
        int ceiling = -1;
        String ceilingTask = null;
        for (var feature : featureTasks) {
            for (var dep : feature.dependencies()) {
                if (internal.contains(dep)) {
                    continue;
                }
                var task = graph.findTask(dep);
                if (task.isPresent()) {
                    int index = graph.milestoneIndex(task.get().milestoneId());
                    if (index > floor) {
                        floor = index;
                        floorTask = dep;
                    }
                }
            }
            for (var needed : feature.requiredBy()) {
                var task = graph.findTask(needed);
                if (task.isPresent()) {
                    int index = graph.milestoneIndex(task.get().milestoneId());
                    if (ceiling < 0 || index < ceiling) {
                        ceiling = index;
                        ceilingTask = needed;
                    }
                }
            }
        }

        int size = featureTasks.size();
        int upper = ceiling < 0 ? graph.milestones().size() - 1 : ceiling;
        for (int i = Math.max(floor, 0); i <= upper; i++) {
            Milestone candidate = graph.milestones().get(i);
            if (candidate.status().isOpen() && graph.workload(candidate) + size <= graph.maxTasks(candidate)) {
                return new Placement(Placement.Kind.EXISTING_MILESTONE, List.of(candidate.id()), i,
                        "milestone " + candidate.id() + " is open and has room for " + size + " more task(s)");
            }
        }

        int lastClosed = -1;
        for (int i = 0; i < graph.milestones().size(); i++) {
            if (!graph.milestones().get(i).status().isOpen()) {
                lastClosed = i;
            }
        }
        // as late as the bounds allow, so planned work keeps its order
        int earliest = Math.max(floor + 1, lastClosed + 1);
        int position = ceiling < 0 ? graph.milestones().size() : ceiling;
        if (position < earliest) {
            String neededIn = graph.milestones().get(ceiling).id();
            String why = floor >= ceiling
                    ? "dependency " + floorTask + " (milestone " + graph.milestones().get(floor).id()
                            + ") is not before required-by task " + ceilingTask + " (milestone " + neededIn + ")"
                    : "required-by task " + ceilingTask + " is in milestone " + neededIn
                            + ", which has no room and no open position before it";
            throw new EnhancementRejectedException(why);
        }

        int max = graph.milestoneStrategy().maxTasksPerMilestone();
        int parts = (size + max - 1) / max;
        var ids = newMilestoneIds(graph, parts);
        return new Placement(Placement.Kind.NEW_MILESTONE, ids, position,
                parts > 1
                        ? size + " task(s) exceed milestone capacity " + max + "; split into " + parts + " new milestones"
                        : "no open milestone between the bounds has room; new milestone at position " + position);
    }

    EnhancementResult insert(SprintState state, String description, List<FeatureTask> featureTasks, String deferredId) {
        Instant now = clock.instant();
        String text = description == null ? "" : description.trim();

        if (deferredId != null) {
            var deferred = state.deferredFeatures().stream()
                    .filter(f -> f.id().equals(deferredId))
                    .findFirst()
                    .orElseThrow(() -> TaskNotFoundException.deferredFeature(deferredId));
            if (text.isEmpty()) {
                text = deferred.description();
            }
            state.deferredFeatures(state.deferredFeatures().stream().filter(f -> f != deferred).toList());
        }
        if (text.isEmpty()) {
            throw new EnhancementRejectedException("an enhancement needs a description");
        }

        TaskGraph graph = state.graph();
        List<FeatureTask> features = normalize(graph, text, featureTasks);
        checkReferences(graph, features);
        Placement placement = placement(features, graph);

        int requests = (int) state.tracker().history().stream()
                .filter(h -> h.event() == HistoryEvent.ENHANCEMENT_APPLIED)
                .count();
        String requestId = String.format(Locale.ROOT, "REQ-%03d", requests + 1);
        var metadata = new EnhancementMetadata(requestId, text,
                now, deferredId != null ? EnhancementSource.DEFERRED : EnhancementSource.ENHANCEMENT);

        graph = switch (placement.kind()) {
            case EXISTING_MILESTONE -> intoExisting(graph, placement.milestoneIds().get(0), features, metadata);
            case NEW_MILESTONE -> intoNew(graph, placement, features, metadata, text);
        };

        var updated = new ArrayList<String>();
        for (var feature : features) {
            for (var needed : feature.requiredBy()) {
                Task target = graph.requireTask(needed);
                if (!target.dependencies().contains(feature.id())) {
                    var deps = new ArrayList<>(target.dependencies());
                    deps.add(feature.id());
                    graph = graph.withTask(target.withDependencies(deps));
                    if (!updated.contains(needed)) {
                        updated.add(needed);
                    }
                }
            }
        }
        state.graph(graph);

        if (placement.kind() == Placement.Kind.NEW_MILESTONE) {
            var tracker = state.tracker();
            String first = placement.milestoneIds().get(0);
            if (tracker.status() == SprintStatus.COMPLETED) {
                state.tracker(tracker.withStatus(SprintStatus.IN_PROGRESS).withCurrentMilestone(first));
            } else if (tracker.currentMilestoneId() != null
                    && graph.milestoneIndex(first) < graph.milestoneIndex(tracker.currentMilestoneId())) {
                // work is drawn from the earliest unvalidated milestone
                state.tracker(tracker.withCurrentMilestone(first));
            }
        }

        var taskIds = features.stream().map(FeatureTask::id).toList();
        state.record(new HistoryEntry(now, HistoryEvent.ENHANCEMENT_APPLIED, null, placement.milestoneIds().get(0),
                requestId + ": added " + String.join(", ", taskIds) + " to " + String.join(", ", placement.milestoneIds())));
        metrics.recordEnhancementPlacement(
                placement.kind() == Placement.Kind.EXISTING_MILESTONE ? "existing" : "new_milestone", taskIds.size());
        log.info("Enhancement {} placed {} task(s) in {} ({})", requestId, taskIds.size(),
                placement.milestoneIds(), placement.reason());
        return new EnhancementResult(requestId, text, placement, taskIds, updated, deferredId);
    }

    private static TaskGraph intoExisting(TaskGraph graph, String milestoneId, List<FeatureTask> features,
                                          EnhancementMetadata metadata) {
        var tasks = features.stream().map(f -> toTask(f, milestoneId, metadata)).toList();
        Milestone target = graph.requireMilestone(milestoneId);
        return graph.withTasksAdded(tasks)
                .withMilestone(target.withTasksBeforeValidation(tasks.stream().map(Task::id).toList()));
    }

    private static TaskGraph intoNew(TaskGraph graph, Placement placement, List<FeatureTask> features,
                                     EnhancementMetadata metadata, String description) {
        int max = graph.milestoneStrategy().maxTasksPerMilestone();
        var ordered = dependencyOrder(features);
        int parts = placement.milestoneIds().size();
        for (int part = 0; part < parts; part++) {
            String milestoneId = placement.milestoneIds().get(part);
            var chunk = ordered.subList(part * max, Math.min(ordered.size(), (part + 1) * max));
            String title = title(description) + (parts > 1 ? " (part " + (part + 1) + "/" + parts + ")" : "");

            var tasks = new ArrayList<Task>();
            chunk.forEach(f -> tasks.add(toTask(f, milestoneId, metadata)));
            tasks.add(new Task(milestoneId + "-VAL", "Validate " + title,
                    "External validation of milestone " + milestoneId, TaskType.VALIDATION, List.of(),
                    TaskStatus.PENDING, milestoneId, ScopeBoundary.unbounded(), metadata, null, null));

            var milestone = new Milestone(milestoneId, title, tasks.stream().map(Task::id).toList(),
                    MilestoneStatus.NOT_STARTED, null, null);
            graph = graph.withTasksAdded(tasks).withMilestoneAt(placement.position() + part, milestone);
        }
        return graph;
    }

    private static Task toTask(FeatureTask feature, String milestoneId, EnhancementMetadata metadata) {
        return new Task(feature.id(), feature.title(), feature.description(), TaskType.WORK, feature.dependencies(),
                TaskStatus.PENDING, milestoneId, feature.scope(), metadata, null, null);
    }

    private static List<FeatureTask> normalize(TaskGraph graph, String description, List<FeatureTask> featureTasks) {
        var proposed = featureTasks == null || featureTasks.isEmpty()
                ? List.of(new FeatureTask(null, title(description), description, List.of(), List.of(), null))
                : featureTasks;

        var taken = new HashSet<String>();
        graph.tasks().forEach(t -> taken.add(t.id()));
        var explicit = new HashSet<String>();
        for (var feature : proposed) {
            if (feature.id() == null || feature.id().isBlank()) {
                continue;
            }
            if (taken.contains(feature.id()) || !explicit.add(feature.id())) {
                throw new EnhancementRejectedException("task id " + feature.id() + " is already in use");
            }
        }
        taken.addAll(explicit);

        var existing = new ArrayList<>(taken);
        int next = nextNumber(ENHANCEMENT_NUMBER, existing);
        var result = new ArrayList<FeatureTask>();
        for (var feature : proposed) {
            FeatureTask named = feature;
            if (feature.id() == null || feature.id().isBlank()) {
                String id;
                do {
                    id = String.format(Locale.ROOT, "ENH-%03d", next++);
                } while (taken.contains(id));
                taken.add(id);
                named = feature.withId(id);
            }
            String text = named.description() != null && !named.description().isBlank()
                    ? named.description() : description;
            if (named.title() == null || named.title().isBlank() || named.description() == null) {
                String title = named.title() == null || named.title().isBlank() ? title(text) : named.title();
                named = new FeatureTask(named.id(), title, text, named.dependencies(), named.requiredBy(), named.scope());
            }
            result.add(named);
        }
        return result;
    }

    private static void checkReferences(TaskGraph graph, List<FeatureTask> features) {
        Set<String> internal = new HashSet<>();
        features.forEach(f -> internal.add(f.id()));
        for (var feature : features) {
            var missing = feature.dependencies().stream()
                    .filter(dep -> !internal.contains(dep) && graph.findTask(dep).isEmpty())
                    .toList();
            if (!missing.isEmpty()) {
                throw DependencyUnsatisfiedException.unknown(feature.id(), missing);
            }
            for (var needed : feature.requiredBy()) {
                Task target = graph.requireTask(needed);
                if (target.isValidation()) {
                    throw new EnhancementRejectedException("validation task " + needed + " cannot take new dependencies");
                }
                if (target.status() != TaskStatus.PENDING) {
                    throw new EnhancementRejectedException("required-by task " + needed + " is already "
                            + target.status().name().toLowerCase(Locale.ROOT) + " and cannot take new dependencies");
                }
            }
        }
    }

    /**
     * Feature tasks reordered so internal dependencies come first, otherwise keeping the given order.
     * A cycle among them is left in place for the cycle check to report.
     */
    private static List<FeatureTask> dependencyOrder(List<FeatureTask> features) {
        Map<String, FeatureTask> remaining = new LinkedHashMap<>();
        features.forEach(f -> remaining.put(f.id(), f));
        var ordered = new ArrayList<FeatureTask>();
        Set<String> placed = new LinkedHashSet<>();
        boolean progress = true;
        while (!remaining.isEmpty() && progress) {
            progress = false;
            for (var it = remaining.values().iterator(); it.hasNext(); ) {
                var feature = it.next();
                boolean ready = feature.dependencies().stream()
                        .noneMatch(dep -> remaining.containsKey(dep) && !placed.contains(dep));
                if (ready) {
                    ordered.add(feature);
                    placed.add(feature.id());
                    it.remove();
                    progress = true;
                    break;
                }
            }
        }
        ordered.addAll(remaining.values());
        return ordered;
    }

    private static List<String> newMilestoneIds(TaskGraph graph, int count) {
        int next = nextNumber(MILESTONE_NUMBER, graph.milestones().stream().map(Milestone::id).toList());
        var ids = new ArrayList<String>();
        for (int i = 0; i < count; i++) {
            ids.add("M" + (next + i));
        }
        return ids;
    }

    private static int nextNumber(Pattern pattern, List<String> ids) {
        int max = 0;
        for (var id : ids) {
            Matcher m = pattern.matcher(id);
            if (m.matches()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return max + 1;
    }

    private static String title(String text) {
        String oneLine = text.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= MAX_TITLE_LENGTH ? oneLine : oneLine.substring(0, MAX_TITLE_LENGTH - 3) + "...";
    }
}
