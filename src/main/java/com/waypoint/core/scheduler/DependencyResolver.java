package com.waypoint.core.scheduler;

import com.waypoint.core.error.CycleDetectedException;
import com.waypoint.core.error.DependencyUnsatisfiedException;
import com.waypoint.core.error.InvalidTransitionException;
import com.waypoint.core.error.ValidationPendingException;
import com.waypoint.core.model.Milestone;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.ProgressTracker;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.scheduler.NextTaskResult.BlockReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes task eligibility and selects the next runnable task.
 * <p>
 * Selection draws only from the current milestone, in declared sequence, and never
 * looks past a milestone that is complete but not yet validated.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private enum Mark { VISITING, DONE }

    /**
     * A task is eligible iff it is pending and every dependency is completed.
     */
    public boolean isEligible(Task task, TaskGraph graph) {
        return task.status() == TaskStatus.PENDING && unmetDependencies(task, graph).isEmpty();
    }

    /**
     * Dependency IDs of {@code task} that are not completed, in declared order.
     * Unknown IDs count as unmet.
     */
    public List<String> unmetDependencies(Task task, TaskGraph graph) {
        var unmet = new ArrayList<String>();
        for (var dep : task.dependencies()) {
            boolean done = graph.findTask(dep).map(t -> t.status() == TaskStatus.COMPLETED).orElse(false);
            if (!done) {
                unmet.add(dep);
            }
        }
        return unmet;
    }

    /**
     * IDs of tasks that declare {@code taskId} as a dependency, in declared sequence.
     */
    public List<String> dependents(String taskId, TaskGraph graph) {
        return graph.inSequence().stream()
                .filter(t -> t.dependencies().contains(taskId))
                .map(Task::id)
                .toList();
    }

    /**
     * Depth-first search over the dependency adjacency map.
     *
     * @throws CycleDetectedException naming the cycle members, first member repeated at the end
     */
    public void cycleCheck(TaskGraph graph) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (var task : graph.inSequence()) {
            adjacency.put(task.id(), task.dependencies());
        }
        Map<String, Mark> marks = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        for (var id : adjacency.keySet()) {
            if (!marks.containsKey(id)) {
                visit(id, adjacency, marks, path);
            }
        }
        log.debug("Cycle check passed for {} tasks", adjacency.size());
    }

    private void visit(String id, Map<String, List<String>> adjacency, Map<String, Mark> marks, Deque<String> path) {
        marks.put(id, Mark.VISITING);
        path.addLast(id);
        for (var dep : adjacency.getOrDefault(id, List.of())) {
            if (!adjacency.containsKey(dep)) {
                continue; // unknown ids are reported by the graph validator
            }
            Mark mark = marks.get(dep);
            if (mark == Mark.VISITING) {
                var cycle = new ArrayList<String>();
                boolean inCycle = false;
                for (var member : path) {
                    if (member.equals(dep)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(member);
                    }
                }
                cycle.add(dep);
                log.warn("Dependency cycle detected: {}", cycle);
                throw new CycleDetectedException(cycle);
            }
            if (mark == null) {
                visit(dep, adjacency, marks, path);
            }
        }
        path.removeLast();
        marks.put(id, Mark.DONE);
    }

    /**
     * The milestone work is currently drawn from: the tracker's current milestone, or the
     * first milestone not yet validated. Empty when every milestone is validated.
     */
    public Optional<Milestone> currentMilestone(TaskGraph graph, ProgressTracker tracker) {
        if (tracker.currentMilestoneId() != null) {
            var current = graph.findMilestone(tracker.currentMilestoneId());
            if (current.isPresent() && current.get().status() != MilestoneStatus.VALIDATED) {
                return current;
            }
        }
        return graph.milestones().stream()
                .filter(m -> m.status() != MilestoneStatus.VALIDATED)
                .findFirst();
    }

    /**
     * The first milestone at or before {@code index} that is complete but unvalidated.
     */
    public Optional<Milestone> gatingMilestone(TaskGraph graph, int index) {
        for (int i = 0; i <= index && i < graph.milestones().size(); i++) {
            var milestone = graph.milestones().get(i);
            if (milestone.status() == MilestoneStatus.COMPLETE) {
                return Optional.of(milestone);
            }
        }
        return Optional.empty();
    }

    /**
     * Selects the next task to run.
     *
     * @param requestedId a concrete task the caller wants, or null to let the resolver choose
     * @throws DependencyUnsatisfiedException if the requested task has unmet dependencies
     * @throws ValidationPendingException     if the requested task sits behind the validation gate
     */
    public NextTaskResult nextTask(TaskGraph graph, ProgressTracker tracker, String requestedId) {
        var current = currentMilestone(graph, tracker);
        if (tracker.validationPending()) {
            Milestone gated = current.flatMap(m -> gatingMilestone(graph, graph.milestoneIndex(m.id())))
                    .or(() -> current)
                    .orElse(null);
            if (gated != null) {
                return validationBlock(gated);
            }
        }
        if (requestedId != null) {
            return NextTaskResult.ready(requireRunnable(graph, tracker, requestedId));
        }
        if (current.isEmpty()) {
            return NextTaskResult.allComplete();
        }
        Milestone milestone = current.get();

        var gate = gatingMilestone(graph, graph.milestoneIndex(milestone.id()));
        if (gate.isPresent()) {
            return validationBlock(gate.get());
        }

        var waiting = new ArrayList<String>();
        for (var task : graph.tasksOf(milestone)) {
            if (task.isValidation() || task.status() == TaskStatus.COMPLETED) {
                continue;
            }
            if (isEligible(task, graph)) {
                log.debug("Next task in {}: {}", milestone.id(), task.id());
                return NextTaskResult.ready(task);
            }
            waiting.add(task.id());
        }

        log.info("No eligible task in milestone {}; waiting on {}", milestone.id(), waiting);
        return NextTaskResult.blocked(milestone.id(), BlockReason.DEPENDENCIES, waiting,
                waiting.isEmpty()
                        ? "Milestone " + milestone.id() + " has no outstanding work"
                        : "No eligible task in milestone " + milestone.id() + "; waiting on " + String.join(", ", waiting));
    }

    private static NextTaskResult validationBlock(Milestone gated) {
        log.info("Next task blocked: milestone {} awaits validation", gated.id());
        return NextTaskResult.blocked(gated.id(), BlockReason.VALIDATION_PENDING,
                gated.validationTaskId() == null ? List.of() : List.of(gated.validationTaskId()),
                "Milestone " + gated.id() + " is complete and awaiting validation");
    }

    /**
     * Checks that a specific task may start now and returns it.
     * <p>
     * Milestones run strictly in plan order: a task may start only when it belongs to the first
     * milestone that is not yet validated, and never while the validation gate is up.
     *
     * @throws ValidationPendingException     if a milestone is complete and awaiting validation
     * @throws DependencyUnsatisfiedException if an earlier milestone is unvalidated or dependencies are unmet
     */
    public Task requireRunnable(TaskGraph graph, ProgressTracker tracker, String taskId) {
        Task task = graph.requireTask(taskId);
        if (task.isValidation()) {
            throw new InvalidTransitionException("Task " + taskId,
                    "validation tasks are completed by recording the milestone's validation result");
        }
        if (task.status() != TaskStatus.PENDING) {
            throw new InvalidTransitionException("Task " + taskId, task.status().name(), TaskStatus.IN_PROGRESS.name());
        }
        int index = graph.milestoneIndex(task.milestoneId());
        var gate = tracker.validationPending()
                ? gatingMilestone(graph, graph.milestones().size() - 1)
                : gatingMilestone(graph, index);
        if (gate.isPresent()) {
            throw new ValidationPendingException(gate.get().id(), taskId);
        }
        for (int i = 0; i < index; i++) {
            var earlier = graph.milestones().get(i);
            if (earlier.status() != MilestoneStatus.VALIDATED) {
                var outstanding = graph.tasksOf(earlier).stream()
                        .filter(t -> t.status() != TaskStatus.COMPLETED)
                        .map(Task::id)
                        .toList();
                log.info("Task {} refused: milestone {} is not validated yet", taskId, earlier.id());
                throw DependencyUnsatisfiedException.earlierMilestone(taskId, earlier.id(), outstanding);
            }
        }
        var unmet = unmetDependencies(task, graph);
        if (!unmet.isEmpty()) {
            throw new DependencyUnsatisfiedException(taskId, unmet);
        }
        return task;
    }
}
