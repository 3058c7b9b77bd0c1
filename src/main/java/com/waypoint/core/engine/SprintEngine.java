package com.waypoint.core.engine;

import com.waypoint.core.enhancement.EnhancementPlanner;
import com.waypoint.core.enhancement.FeatureTask;
import com.waypoint.core.error.ErrorCode;
import com.waypoint.core.error.InvalidTransitionException;
import com.waypoint.core.error.WaypointException;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.milestone.MilestoneStateMachine;
import com.waypoint.core.model.HistoryEntry;
import com.waypoint.core.model.Milestone;
import com.waypoint.core.model.ScopeBoundary;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.persistence.TaskGraphStore;
import com.waypoint.core.scheduler.DependencyResolver;
import com.waypoint.core.scheduler.NextTaskResult;
import com.waypoint.core.scope.ChangedFile;
import com.waypoint.core.scope.ScopeBrief;
import com.waypoint.core.scope.ScopeGuard;
import com.waypoint.core.state.SprintState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The operation surface of Waypoint.
 * <p>
 * Every call reloads state from disk, delegates to the components and wraps the outcome in an
 * {@link OperationResult}. Classified failures and blocking answers come back as results with
 * an error; nothing is thrown to the caller.
 */
@Service
public class SprintEngine {

    private static final Logger log = LoggerFactory.getLogger(SprintEngine.class);

    private final TaskGraphStore store;
    private final DependencyResolver resolver;
    private final MilestoneStateMachine milestones;
    private final ScopeGuard scopeGuard;
    private final EnhancementPlanner planner;
    private final WaypointMetrics metrics;
    private final Clock clock;

    public SprintEngine(TaskGraphStore store,
                        DependencyResolver resolver,
                        MilestoneStateMachine milestones,
                        ScopeGuard scopeGuard,
                        EnhancementPlanner planner,
                        WaypointMetrics metrics,
                        Clock clock) {
        this.store = store;
        this.resolver = resolver;
        this.milestones = milestones;
        this.scopeGuard = scopeGuard;
        this.planner = planner;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── Reads ────────────────────────────────────────────────────────

    public OperationResult getCurrentStatus() {
        return run("get-current-status", () -> {
            SprintState state = store.load();
            MdcContext.setSprint(state.graph().sprintId());
            TaskGraph graph = state.graph();
            var summaries = graph.milestones().stream()
                    .map(m -> summarize(graph, m))
                    .toList();
            var inProgress = graph.inSequence().stream()
                    .filter(t -> t.status() == TaskStatus.IN_PROGRESS)
                    .map(Task::id)
                    .toList();
            var tracker = state.tracker();
            var view = new SprintStatusView(graph.sprintId(), tracker.status(),
                    resolver.currentMilestone(graph, tracker).map(Milestone::id).orElse(tracker.currentMilestoneId()),
                    tracker.validationPending(), tracker.completedTasks(), tracker.totalTasks(), inProgress,
                    state.deferredFeatures().size(), summaries, resolver.nextTask(graph, tracker, null));
            return OperationResult.success("get-current-status", view);
        });
    }

    public OperationResult getNextTask(String requestedId) {
        return run("get-next-task", () -> {
            SprintState state = store.load();
            MdcContext.setSprint(state.graph().sprintId());
            NextTaskResult next = resolver.nextTask(state.graph(), state.tracker(), blankToNull(requestedId));
            return switch (next.outcome()) {
                case READY, ALL_COMPLETE -> OperationResult.success("get-next-task", next);
                case BLOCKED -> OperationResult.failure("get-next-task", next, ErrorInfo.of(
                        next.reason() == NextTaskResult.BlockReason.VALIDATION_PENDING
                                ? ErrorCode.VALIDATION_PENDING
                                : ErrorCode.DEPENDENCY_UNSATISFIED,
                        next.message(),
                        Map.of("milestone_id", String.valueOf(next.milestoneId()), "waiting_on", next.waitingOn())));
            };
        });
    }

    public OperationResult getTaskDetails(String taskId) {
        return run("get-task-details", () -> {
            SprintState state = store.load();
            TaskGraph graph = state.graph();
            Task task = graph.requireTask(taskId);
            MdcContext.setTask(graph.sprintId(), task.id(), task.milestoneId());
            String gate = resolver.gatingMilestone(graph, graph.milestoneIndex(task.milestoneId()) - 1)
                    .map(Milestone::id)
                    .orElse(null);
            var details = new TaskDetails(task, resolver.isEligible(task, graph) && gate == null,
                    resolver.unmetDependencies(task, graph), resolver.dependents(task.id(), graph), gate,
                    scopeGuard.preCheck(graph, task, state.guardrails()));
            return OperationResult.success("get-task-details", details);
        });
    }

    public OperationResult validateDependencies(String taskId) {
        return run("validate-dependencies", () -> {
            SprintState state = store.load();
            TaskGraph graph = state.graph();
            Task task = graph.requireTask(taskId);
            MdcContext.setTask(graph.sprintId(), task.id(), task.milestoneId());
            Map<String, TaskStatus> statuses = new LinkedHashMap<>();
            for (var dep : task.dependencies()) {
                statuses.put(dep, graph.requireTask(dep).status());
            }
            var unmet = resolver.unmetDependencies(task, graph);
            String gate = resolver.gatingMilestone(graph, graph.milestoneIndex(task.milestoneId()) - 1)
                    .map(Milestone::id)
                    .orElse(null);
            var report = new DependencyReport(task.id(), unmet.isEmpty() && gate == null, statuses, unmet, gate);
            if (!unmet.isEmpty()) {
                return OperationResult.failure("validate-dependencies", report, ErrorInfo.of(
                        ErrorCode.DEPENDENCY_UNSATISFIED,
                        "Task " + task.id() + " has unmet dependencies: " + String.join(", ", unmet),
                        Map.of("task_id", task.id(), "unmet_dependencies", unmet)));
            }
            if (gate != null) {
                return OperationResult.failure("validate-dependencies", report, ErrorInfo.of(
                        ErrorCode.VALIDATION_PENDING,
                        "Milestone " + gate + " is complete and awaiting validation; task " + task.id() + " is gated",
                        Map.of("task_id", task.id(), "milestone_id", gate)));
            }
            return OperationResult.success("validate-dependencies", report);
        });
    }

    /**
     * Checks changed files and referenced technologies against the task's boundary.
     *
     * @param extraTechnologies technologies the change references beyond those the task declares
     */
    public OperationResult checkScopeCompliance(String taskId, List<ChangedFile> changedFiles,
                                                Map<String, String> extraTechnologies) {
        return run("check-scope-compliance", () -> {
            SprintState state = store.load();
            TaskGraph graph = state.graph();
            Task task = graph.requireTask(taskId);
            MdcContext.setTask(graph.sprintId(), task.id(), task.milestoneId());

            var files = changedFiles == null ? List.<ChangedFile>of() : changedFiles;
            var violations = scopeGuard.violations(graph, task, files, state.guardrails());
            var techViolations = scopeGuard.techViolations(withTechnologies(task, extraTechnologies),
                    state.approvedStack());
            var report = new ScopeReport(task.id(), violations.isEmpty() && techViolations.isEmpty(), files.size(),
                    scopeGuard.preCheck(graph, task, state.guardrails()), violations, techViolations);
            if (!violations.isEmpty()) {
                return OperationResult.failure("check-scope-compliance", report, ErrorInfo.of(ErrorCode.SCOPE_VIOLATION,
                        "Task " + task.id() + " has " + violations.size() + " scope violation(s)",
                        Map.of("task_id", task.id(), "violations", violations)));
            }
            if (!techViolations.isEmpty()) {
                return OperationResult.failure("check-scope-compliance", report, ErrorInfo.of(ErrorCode.TECH_NON_COMPLIANCE,
                        "Task " + task.id() + " references " + techViolations.size() + " non-compliant technolog(ies)",
                        Map.of("task_id", task.id(), "violations", techViolations)));
            }
            return OperationResult.success("check-scope-compliance", report);
        });
    }

    public OperationResult getMilestoneStatus(String milestoneId) {
        return run("get-milestone-status", () -> {
            SprintState state = store.load();
            MdcContext.setMilestone(state.graph().sprintId(), milestoneId);
            return OperationResult.success("get-milestone-status",
                    milestones.report(state.graph(), state.tracker(), milestoneId));
        });
    }

    /**
     * The most recent history entries, oldest first.
     *
     * @param limit maximum number of entries, or 0 for all
     */
    public OperationResult history(int limit) {
        return run("history", () -> {
            SprintState state = store.load();
            List<HistoryEntry> entries = state.tracker().history();
            if (limit > 0 && entries.size() > limit) {
                entries = entries.subList(entries.size() - limit, entries.size());
            }
            return OperationResult.success("history", entries);
        });
    }

    public OperationResult listBackups() {
        return run("list-backups", () -> OperationResult.success("list-backups", store.listBackups()));
    }

    // ── Mutations ────────────────────────────────────────────────────

    /**
     * Moves a task to in_progress. The task must belong to the first unvalidated milestone, and
     * when an approved stack is configured its technologies must comply with it.
     */
    public OperationResult startTask(String taskId) {
        return run("start-task", () -> {
            var transition = store.atomicUpdate(state -> {
                TaskGraph graph = state.graph();
                MdcContext.setTask(graph.sprintId(), taskId, graph.findTask(taskId).map(Task::milestoneId).orElse(null));
                Task task = resolver.requireRunnable(graph, state.tracker(), taskId);
                scopeGuard.techCompliance(task, state.approvedStack());
                Task started = task.started(now());
                state.graph(graph.withTask(started));
                milestones.onTaskStarted(state, started);
                log.info("Started task {} in milestone {}", started.id(), started.milestoneId());
                return transition(state, started, scopeGuard.preCheck(state.graph(), started, state.guardrails()));
            });
            return OperationResult.success("start-task", transition);
        });
    }

    /**
     * Completes an in-progress task. When changed files are given they are post-checked first
     * and any violation leaves the task in progress.
     */
    public OperationResult completeTask(String taskId, List<ChangedFile> changedFiles) {
        return run("complete-task", () -> {
            var transition = store.atomicUpdate(state -> {
                TaskGraph graph = state.graph();
                Task task = graph.requireTask(taskId);
                MdcContext.setTask(graph.sprintId(), task.id(), task.milestoneId());
                if (task.isValidation()) {
                    throw new InvalidTransitionException("Task " + taskId,
                            "validation tasks are completed by recording the milestone's validation result");
                }
                if (task.status() != TaskStatus.IN_PROGRESS) {
                    throw new InvalidTransitionException("Task " + taskId,
                            task.status().name().toLowerCase(Locale.ROOT), TaskStatus.COMPLETED.name().toLowerCase(Locale.ROOT));
                }
                if (changedFiles != null && !changedFiles.isEmpty()) {
                    scopeGuard.postCheck(graph, task, changedFiles, state.guardrails());
                }
                Task completed = task.completed(now());
                state.graph(graph.withTask(completed));
                milestones.onTaskCompleted(state, completed);
                log.info("Completed task {}", completed.id());
                return transition(state, completed, null);
            });
            return OperationResult.success("complete-task", transition);
        });
    }

    /**
     * Applies an enhancement.
     *
     * @param dependsOn  extra dependencies added to every feature task
     * @param requiredBy existing tasks that must wait for every feature task
     */
    public OperationResult applyEnhancement(String description, List<FeatureTask> featureTasks,
                                            List<String> dependsOn, List<String> requiredBy, String deferredId) {
        return run("apply-enhancement", () -> {
            var tasks = featureTasks == null || featureTasks.isEmpty()
                    ? List.of(new FeatureTask(null, null, description, List.of(), List.of(), null))
                    : featureTasks;
            var merged = tasks.stream().map(t -> merge(t, dependsOn, requiredBy)).toList();
            return OperationResult.success("apply-enhancement", planner.apply(description, merged, blankToNull(deferredId)));
        });
    }

    public OperationResult recordValidation(String milestoneId, boolean passed, List<String> issues) {
        return run("record-validation", () -> {
            var outcome = store.atomicUpdate(state -> {
                MdcContext.setMilestone(state.graph().sprintId(), milestoneId);
                return milestones.recordValidation(state, milestoneId, passed, issues);
            });
            return OperationResult.success("record-validation", outcome);
        });
    }

    public OperationResult deferFeature(String description, String reason) {
        return run("defer-feature", () -> OperationResult.success("defer-feature", planner.defer(description, reason)));
    }

    public OperationResult restoreBackup(String backupId) {
        return run("restore-backup", () -> {
            String previous = store.restore(backupId);
            return OperationResult.success("restore-backup", Map.of("restored", backupId, "previous_state_backup", previous));
        });
    }

    // ── Internals ────────────────────────────────────────────────────

    private OperationResult run(String operation, Supplier<OperationResult> body) {
        MdcContext.setOperation(operation);
        try {
            OperationResult result = body.get();
            metrics.recordOperation(operation, result.ok() ? "ok" : result.error().code().toLowerCase(Locale.ROOT));
            return result;
        } catch (WaypointException e) {
            log.warn("{} failed [{}]: {}", operation, e.code(), e.getMessage());
            metrics.recordOperation(operation, e.code().name().toLowerCase(Locale.ROOT));
            return OperationResult.failure(operation, ErrorInfo.from(e));
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", operation, e);
            metrics.recordOperation(operation, "internal_error");
            return OperationResult.failure(operation, ErrorInfo.internal(e));
        } finally {
            MdcContext.clear();
        }
    }

    private static TaskTransition transition(SprintState state, Task task, ScopeBrief brief) {
        Milestone milestone = state.graph().requireMilestone(task.milestoneId());
        return new TaskTransition(task, milestone.id(), milestone.status(), state.tracker().validationPending(), brief);
    }

    private static SprintStatusView.MilestoneSummary summarize(TaskGraph graph, Milestone milestone) {
        var tasks = graph.tasksOf(milestone);
        int completed = (int) tasks.stream().filter(t -> t.status() == TaskStatus.COMPLETED).count();
        return new SprintStatusView.MilestoneSummary(milestone.id(), milestone.title(), milestone.status(),
                graph.workload(milestone), graph.maxTasks(milestone), completed, tasks.size());
    }

    private static Task withTechnologies(Task task, Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) {
            return task;
        }
        var technologies = new LinkedHashMap<>(task.scope().technologies());
        technologies.putAll(extra);
        var scope = new ScopeBoundary(task.scope().mustImplement(),
                task.scope().mustNotImplement(), task.scope().maxFileChanges(), technologies);
        return new Task(task.id(), task.title(), task.description(), task.type(), task.dependencies(), task.status(),
                task.milestoneId(), scope, task.enhancement(), task.startedAt(), task.completedAt());
    }

    private static FeatureTask merge(FeatureTask task, List<String> dependsOn, List<String> requiredBy) {
        var deps = new LinkedHashSet<>(task.dependencies());
        if (dependsOn != null) {
            deps.addAll(dependsOn);
        }
        var needed = new LinkedHashSet<>(task.requiredBy());
        if (requiredBy != null) {
            needed.addAll(requiredBy);
        }
        return new FeatureTask(task.id(), task.title(), task.description(), new ArrayList<>(deps),
                new ArrayList<>(needed), task.scope());
    }

    private Instant now() {
        return clock.instant();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
