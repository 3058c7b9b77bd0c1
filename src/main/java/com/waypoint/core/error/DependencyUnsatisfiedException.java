package com.waypoint.core.error;

import java.util.List;
import java.util.Map;

/**
 * Thrown when a task is requested whose dependencies are not all completed,
 * or when new tasks reference tasks that do not exist.
 */
public class DependencyUnsatisfiedException extends WaypointException {

    private final String taskId;
    private final List<String> unmet;

    public DependencyUnsatisfiedException(String taskId, List<String> unmet) {
        super(ErrorCode.DEPENDENCY_UNSATISFIED,
                "Task " + taskId + " has unmet dependencies: " + String.join(", ", unmet),
                Map.of("task_id", taskId, "unmet_dependencies", List.copyOf(unmet)));
        this.taskId = taskId;
        this.unmet = List.copyOf(unmet);
    }

    /**
     * The task sits in a milestone after {@code milestoneId}, which is not validated yet.
     */
    public static DependencyUnsatisfiedException earlierMilestone(String taskId, String milestoneId,
                                                                  List<String> outstanding) {
        return new DependencyUnsatisfiedException(taskId, milestoneId, outstanding);
    }

    private DependencyUnsatisfiedException(String taskId, String milestoneId, List<String> outstanding) {
        super(ErrorCode.DEPENDENCY_UNSATISFIED,
                "Task " + taskId + " cannot start before milestone " + milestoneId + " is validated; outstanding: "
                        + String.join(", ", outstanding),
                Map.of("task_id", taskId, "blocking_milestone_id", milestoneId,
                        "unmet_dependencies", List.copyOf(outstanding)));
        this.taskId = taskId;
        this.unmet = List.copyOf(outstanding);
    }

    public static DependencyUnsatisfiedException unknown(String taskId, List<String> missing) {
        return new DependencyUnsatisfiedException(taskId, missing, true);
    }

    private DependencyUnsatisfiedException(String taskId, List<String> missing, boolean unknown) {
        super(ErrorCode.DEPENDENCY_UNSATISFIED,
                "Task " + taskId + " depends on unknown task(s): " + String.join(", ", missing),
                Map.of("task_id", taskId, "unknown_dependencies", List.copyOf(missing)));
        this.taskId = taskId;
        this.unmet = List.copyOf(missing);
    }

    public String taskId() {
        return taskId;
    }

    public List<String> unmet() {
        return unmet;
    }
}
