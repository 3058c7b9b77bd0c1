package com.waypoint.core.model;

import com.waypoint.core.error.TaskNotFoundException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The sprint plan: ordered milestones and the tasks they list.
 * <p>
 * Declared sequence is the order of task IDs across milestones, milestones in file order.
 * It is the stable tie-break used whenever several tasks are eligible.
 */
public record TaskGraph(
    String sprintId,
    MilestoneStrategy milestoneStrategy,
    ScopeEnforcement scopeEnforcement,
    List<Milestone> milestones,
    List<Task> tasks
) implements Serializable {

    public TaskGraph {
        milestoneStrategy = milestoneStrategy == null ? MilestoneStrategy.defaults() : milestoneStrategy;
        scopeEnforcement = scopeEnforcement == null ? ScopeEnforcement.defaults() : scopeEnforcement;
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public Optional<Task> findTask(String taskId) {
        return tasks.stream().filter(t -> Objects.equals(t.id(), taskId)).findFirst();
    }

    public Task requireTask(String taskId) {
        return findTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public Optional<Milestone> findMilestone(String milestoneId) {
        return milestones.stream().filter(m -> Objects.equals(m.id(), milestoneId)).findFirst();
    }

    public Milestone requireMilestone(String milestoneId) {
        return findMilestone(milestoneId).orElseThrow(() -> TaskNotFoundException.milestone(milestoneId));
    }

    /**
     * Position of the milestone in plan order, or -1 when unknown.
     */
    public int milestoneIndex(String milestoneId) {
        for (int i = 0; i < milestones.size(); i++) {
            if (Objects.equals(milestones.get(i).id(), milestoneId)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Tasks in declared sequence. Tasks not listed by any milestone are appended in file order.
     */
    public List<Task> inSequence() {
        var ordered = new ArrayList<Task>(tasks.size());
        for (var milestone : milestones) {
            for (var id : milestone.taskIds()) {
                findTask(id).filter(t -> !ordered.contains(t)).ifPresent(ordered::add);
            }
        }
        for (var task : tasks) {
            if (!ordered.contains(task)) {
                ordered.add(task);
            }
        }
        return ordered;
    }

    public List<Task> tasksOf(Milestone milestone) {
        var result = new ArrayList<Task>();
        for (var id : milestone.taskIds()) {
            findTask(id).ifPresent(result::add);
        }
        return result;
    }

    public int maxTasks(Milestone milestone) {
        return milestone.maxTasks() != null ? milestone.maxTasks() : milestoneStrategy.maxTasksPerMilestone();
    }

    public int minTasks(Milestone milestone) {
        return milestone.minTasks() != null ? milestone.minTasks() : milestoneStrategy.minTasksPerMilestone();
    }

    /**
     * Number of tasks counted against capacity: work tasks only.
     */
    public int workload(Milestone milestone) {
        return (int) tasksOf(milestone).stream().filter(t -> t.type() == TaskType.WORK).count();
    }

    public int effectiveMaxFileChanges(Task task) {
        Integer declared = task.scope().maxFileChanges();
        return declared != null ? declared : scopeEnforcement.defaultMaxFileChanges();
    }

    public TaskGraph withTask(Task updated) {
        var copy = new ArrayList<Task>(tasks.size());
        boolean replaced = false;
        for (var task : tasks) {
            if (Objects.equals(task.id(), updated.id())) {
                copy.add(updated);
                replaced = true;
            } else {
                copy.add(task);
            }
        }
        if (!replaced) {
            throw new TaskNotFoundException(updated.id());
        }
        return new TaskGraph(sprintId, milestoneStrategy, scopeEnforcement, milestones, copy);
    }

    public TaskGraph withMilestone(Milestone updated) {
        var copy = new ArrayList<Milestone>(milestones.size());
        for (var milestone : milestones) {
            copy.add(Objects.equals(milestone.id(), updated.id()) ? updated : milestone);
        }
        return new TaskGraph(sprintId, milestoneStrategy, scopeEnforcement, copy, tasks);
    }

    public TaskGraph withMilestoneAt(int index, Milestone inserted) {
        var copy = new ArrayList<>(milestones);
        copy.add(index, inserted);
        return new TaskGraph(sprintId, milestoneStrategy, scopeEnforcement, copy, tasks);
    }

    public TaskGraph withTasksAdded(List<Task> added) {
        var copy = new ArrayList<>(tasks);
        copy.addAll(added);
        return new TaskGraph(sprintId, milestoneStrategy, scopeEnforcement, milestones, copy);
    }

    public long countByStatus(TaskStatus status) {
        return tasks.stream().filter(t -> t.status() == status).count();
    }
}
