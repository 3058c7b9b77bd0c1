package com.waypoint.core.persistence;

import com.waypoint.core.error.SchemaValidationException;
import com.waypoint.core.model.DeferredFeature;
import com.waypoint.core.model.Milestone;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.ProgressTracker;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.model.TaskType;
import com.waypoint.core.state.SprintState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Referential-integrity checks over the loaded state.
 * <p>
 * Collects every violation before failing so a broken plan can be fixed in one pass.
 * Acyclicity is checked separately by the dependency resolver once the graph is
 * referentially sound.
 */
@Component
public class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    /**
     * @throws SchemaValidationException listing every violation found
     */
    public void check(SprintState state) {
        var violations = validate(state);
        if (!violations.isEmpty()) {
            log.warn("State failed validation with {} violation(s)", violations.size());
            throw new SchemaValidationException(violations);
        }
    }

    public List<String> validate(SprintState state) {
        var violations = new ArrayList<String>();
        TaskGraph graph = state.graph();
        ProgressTracker tracker = state.tracker();

        if (isBlank(graph.sprintId())) {
            violations.add("task graph has no sprint_id");
        }
        if (tracker.sprintId() != null && graph.sprintId() != null && !tracker.sprintId().equals(graph.sprintId())) {
            violations.add("progress tracker sprint_id '" + tracker.sprintId()
                    + "' does not match task graph sprint_id '" + graph.sprintId() + "'");
        }
        checkStrategy(graph, violations);

        Map<String, Task> tasks = checkTasks(graph, violations);
        Map<String, String> listedBy = checkMilestones(graph, tasks, violations);

        for (var task : graph.tasks()) {
            if (isBlank(task.id())) {
                continue;
            }
            String owner = listedBy.get(task.id());
            if (owner == null) {
                violations.add("task " + task.id() + " is not listed by any milestone");
            } else if (!owner.equals(task.milestoneId())) {
                violations.add("task " + task.id() + " declares milestone_id '" + task.milestoneId()
                        + "' but is listed by milestone " + owner);
            }
        }

        checkTracker(graph, tracker, violations);
        checkDeferred(state.deferredFeatures(), violations);
        return violations;
    }

    private static void checkStrategy(TaskGraph graph, List<String> violations) {
        var strategy = graph.milestoneStrategy();
        if (strategy.maxTasksPerMilestone() < 1) {
            violations.add("milestone_strategy.max_tasks_per_milestone must be at least 1");
        }
        if (strategy.minTasksPerMilestone() < 0 || strategy.minTasksPerMilestone() > strategy.maxTasksPerMilestone()) {
            violations.add("milestone_strategy.min_tasks_per_milestone must be between 0 and max_tasks_per_milestone");
        }
        if (graph.scopeEnforcement().defaultMaxFileChanges() < 0) {
            violations.add("scope_enforcement.default_max_file_changes must not be negative");
        }
    }

    private static Map<String, Task> checkTasks(TaskGraph graph, List<String> violations) {
        Map<String, Task> byId = new HashMap<>();
        for (var task : graph.tasks()) {
            if (isBlank(task.id())) {
                violations.add("task with blank id (title '" + task.title() + "')");
                continue;
            }
            if (byId.putIfAbsent(task.id(), task) != null) {
                violations.add("duplicate task id " + task.id());
            }
            if (isBlank(task.title())) {
                violations.add("task " + task.id() + " has no title");
            }
            if (task.scope().maxFileChanges() != null && task.scope().maxFileChanges() < 0) {
                violations.add("task " + task.id() + " has a negative max_file_changes");
            }
        }
        for (var task : graph.tasks()) {
            if (isBlank(task.id())) {
                continue;
            }
            Set<String> seen = new HashSet<>();
            for (var dep : task.dependencies()) {
                if (dep.equals(task.id())) {
                    violations.add("task " + task.id() + " depends on itself");
                } else if (!byId.containsKey(dep)) {
                    violations.add("task " + task.id() + " depends on unknown task " + dep);
                }
                if (!seen.add(dep)) {
                    violations.add("task " + task.id() + " lists dependency " + dep + " more than once");
                }
            }
        }
        return byId;
    }

    private static Map<String, String> checkMilestones(TaskGraph graph, Map<String, Task> tasks, List<String> violations) {
        Map<String, String> listedBy = new HashMap<>();
        Set<String> milestoneIds = new HashSet<>();
        for (var milestone : graph.milestones()) {
            if (isBlank(milestone.id())) {
                violations.add("milestone with blank id (title '" + milestone.title() + "')");
                continue;
            }
            if (!milestoneIds.add(milestone.id())) {
                violations.add("duplicate milestone id " + milestone.id());
            }
            if (milestone.taskIds().isEmpty()) {
                violations.add("milestone " + milestone.id() + " lists no tasks");
                continue;
            }
            for (var id : milestone.taskIds()) {
                if (!tasks.containsKey(id)) {
                    violations.add("milestone " + milestone.id() + " lists unknown task " + id);
                    continue;
                }
                String previous = listedBy.putIfAbsent(id, milestone.id());
                if (previous != null) {
                    violations.add("task " + id + " is listed by both milestone " + previous
                            + " and milestone " + milestone.id());
                }
            }
            checkValidationTask(milestone, tasks, violations);
            checkCapacity(graph, milestone, violations);
            checkStatus(milestone, tasks, violations);
        }
        return listedBy;
    }

    private static void checkValidationTask(Milestone milestone, Map<String, Task> tasks, List<String> violations) {
        Task last = tasks.get(milestone.validationTaskId());
        if (last != null && last.type() != TaskType.VALIDATION) {
            violations.add("milestone " + milestone.id() + " must end with a validation task, but ends with "
                    + last.type().name().toLowerCase() + " task " + last.id());
        }
        var ids = milestone.taskIds();
        for (int i = 0; i < ids.size() - 1; i++) {
            Task task = tasks.get(ids.get(i));
            if (task != null && task.type() == TaskType.VALIDATION) {
                violations.add("milestone " + milestone.id() + " has validation task " + task.id()
                        + " before its last position");
            }
        }
    }

    private static void checkCapacity(TaskGraph graph, Milestone milestone, List<String> violations) {
        int max = graph.maxTasks(milestone);
        int min = graph.minTasks(milestone);
        if (max < 1) {
            violations.add("milestone " + milestone.id() + " has max_tasks " + max + "; must be at least 1");
        }
        if (min > max) {
            violations.add("milestone " + milestone.id() + " has min_tasks " + min + " above max_tasks " + max);
        }
        int workload = graph.workload(milestone);
        if (workload > max) {
            violations.add("milestone " + milestone.id() + " holds " + workload
                    + " work tasks, above its capacity of " + max);
        }
    }

    private static void checkStatus(Milestone milestone, Map<String, Task> tasks, List<String> violations) {
        var members = milestone.taskIds().stream().map(tasks::get).filter(t -> t != null).toList();
        Task validation = members.stream().filter(Task::isValidation).findFirst().orElse(null);
        switch (milestone.status()) {
            case NOT_STARTED -> members.stream()
                    .filter(t -> t.status() != TaskStatus.PENDING)
                    .forEach(t -> violations.add("milestone " + milestone.id() + " is not_started but task "
                            + t.id() + " is " + t.status().name().toLowerCase()));
            case IN_PROGRESS -> {
                if (validation != null && validation.status() == TaskStatus.COMPLETED) {
                    violations.add("milestone " + milestone.id() + " is in_progress but its validation task "
                            + validation.id() + " is completed");
                }
            }
            case COMPLETE -> {
                members.stream()
                        .filter(t -> !t.isValidation() && t.status() != TaskStatus.COMPLETED)
                        .forEach(t -> violations.add("milestone " + milestone.id() + " is complete but task "
                                + t.id() + " is " + t.status().name().toLowerCase()));
                if (validation != null && validation.status() == TaskStatus.COMPLETED) {
                    violations.add("milestone " + milestone.id() + " is complete but its validation task "
                            + validation.id() + " is already completed");
                }
            }
            case VALIDATED -> members.stream()
                    .filter(t -> t.status() != TaskStatus.COMPLETED)
                    .forEach(t -> violations.add("milestone " + milestone.id() + " is validated but task "
                            + t.id() + " is " + t.status().name().toLowerCase()));
        }
    }

    private static void checkTracker(TaskGraph graph, ProgressTracker tracker, List<String> violations) {
        String current = tracker.currentMilestoneId();
        if (current != null && graph.findMilestone(current).isEmpty()) {
            violations.add("progress tracker current_milestone_id references unknown milestone " + current);
        }
        if (tracker.validationPending()) {
            boolean gated = graph.milestones().stream().anyMatch(m -> m.status() == MilestoneStatus.COMPLETE);
            if (!gated) {
                violations.add("progress tracker has validation_pending set but no milestone is complete");
            }
        } else {
            graph.milestones().stream()
                    .filter(m -> m.status() == MilestoneStatus.COMPLETE)
                    .forEach(m -> violations.add("milestone " + m.id()
                            + " is complete but progress tracker has validation_pending unset"));
        }
    }

    private static void checkDeferred(List<DeferredFeature> deferred, List<String> violations) {
        Set<String> ids = new HashSet<>();
        for (var feature : deferred) {
            if (isBlank(feature.id())) {
                violations.add("deferred feature with blank id");
            } else if (!ids.add(feature.id())) {
                violations.add("duplicate deferred feature id " + feature.id());
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
