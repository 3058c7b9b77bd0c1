package com.waypoint.support;

import com.waypoint.core.model.Milestone;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.MilestoneStrategy;
import com.waypoint.core.model.ProgressTracker;
import com.waypoint.core.model.ScopeBoundary;
import com.waypoint.core.model.ScopeEnforcement;
import com.waypoint.core.model.SprintStatus;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.model.TaskType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for sprint graphs used across tests.
 */
public final class Fixtures {

    public static final String SPRINT = "SPRINT-1";

    private Fixtures() {}

    public static Task work(String id, String milestoneId, String... dependencies) {
        return new Task(id, "Do " + id, "", TaskType.WORK, List.of(dependencies), TaskStatus.PENDING,
                milestoneId, ScopeBoundary.unbounded(), null, null, null);
    }

    public static Task scoped(String id, String milestoneId, ScopeBoundary scope) {
        return new Task(id, "Do " + id, "", TaskType.WORK, List.of(), TaskStatus.PENDING,
                milestoneId, scope, null, null, null);
    }

    public static Task validation(String milestoneId) {
        return new Task(milestoneId + "-VAL", "Validate " + milestoneId, "", TaskType.VALIDATION, List.of(),
                TaskStatus.PENDING, milestoneId, ScopeBoundary.unbounded(), null, null, null);
    }

    public static Task withStatus(Task task, TaskStatus status) {
        return new Task(task.id(), task.title(), task.description(), task.type(), task.dependencies(), status,
                task.milestoneId(), task.scope(), task.enhancement(), task.startedAt(), task.completedAt());
    }

    /**
     * A not-started milestone listing {@code taskIds} followed by its validation task.
     */
    public static Milestone milestone(String id, String... taskIds) {
        var ids = new ArrayList<>(Arrays.asList(taskIds));
        ids.add(id + "-VAL");
        return new Milestone(id, "Milestone " + id, ids, MilestoneStatus.NOT_STARTED, null, null);
    }

    public static TaskGraph graph(List<Milestone> milestones, List<Task> tasks) {
        return new TaskGraph(SPRINT, MilestoneStrategy.defaults(), ScopeEnforcement.defaults(), milestones, tasks);
    }

    public static TaskGraph graph(int maxTasks, List<Milestone> milestones, List<Task> tasks) {
        return new TaskGraph(SPRINT, new MilestoneStrategy(1, maxTasks), ScopeEnforcement.defaults(), milestones, tasks);
    }

    public static ProgressTracker tracker() {
        return new ProgressTracker(SPRINT, SprintStatus.PLANNED, null, false, 0, 0, List.of(), List.of());
    }

    /**
     * Two milestones: M1 holds T1..T4 where T2 and T3 depend on T1 and T4 on both; M2 holds
     * T5 (after T4) and T6.
     */
    public static TaskGraph twoMilestones() {
        return graph(
                List.of(milestone("M1", "T1", "T2", "T3", "T4"), milestone("M2", "T5", "T6")),
                List.of(
                        work("T1", "M1"),
                        work("T2", "M1", "T1"),
                        work("T3", "M1", "T1"),
                        work("T4", "M1", "T2", "T3"),
                        validation("M1"),
                        work("T5", "M2", "T4"),
                        work("T6", "M2"),
                        validation("M2")));
    }
}
