package com.waypoint.core.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.core.model.Task;

import java.util.List;

/**
 * Answer to "what should run next".
 *
 * @param outcome     READY with a task, BLOCKED with a reason, or ALL_COMPLETE
 * @param task        the selected task when READY, otherwise null
 * @param milestoneId milestone the answer refers to
 * @param reason      why nothing can run when BLOCKED, otherwise null
 * @param waitingOn   task IDs that must finish (or be validated) before work can continue
 * @param message     one-line explanation
 */
public record NextTaskResult(
    Outcome outcome,
    Task task,
    String milestoneId,
    BlockReason reason,
    List<String> waitingOn,
    String message
) {

    public NextTaskResult {
        waitingOn = waitingOn == null ? List.of() : List.copyOf(waitingOn);
    }

    public enum Outcome {
        @JsonProperty("ready") READY,
        @JsonProperty("blocked") BLOCKED,
        @JsonProperty("all_complete") ALL_COMPLETE
    }

    public enum BlockReason {
        @JsonProperty("validation_pending") VALIDATION_PENDING,
        @JsonProperty("dependencies") DEPENDENCIES
    }

    static NextTaskResult ready(Task task) {
        return new NextTaskResult(Outcome.READY, task, task.milestoneId(), null, List.of(),
                "Task " + task.id() + " is ready");
    }

    static NextTaskResult blocked(String milestoneId, BlockReason reason, List<String> waitingOn, String message) {
        return new NextTaskResult(Outcome.BLOCKED, null, milestoneId, reason, waitingOn, message);
    }

    static NextTaskResult allComplete() {
        return new NextTaskResult(Outcome.ALL_COMPLETE, null, null, null, List.of(),
                "All milestones are validated");
    }
}
