package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.persistence.StateMapper;
import com.waypoint.core.scheduler.NextTaskResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: waypoint next [task-id]
 * <p>
 * Exits 0 when a task is ready or everything is validated, 4 when blocked on
 * dependencies and 5 when blocked on a pending validation.
 */
@Command(name = "next", mixinStandardHelpOptions = true, description = "Show the next runnable task")
@Component
public class NextCommand extends OperationCommand {

    @Parameters(index = "0", arity = "0..1", description = "Check a specific task instead of letting Waypoint choose")
    private String taskId;

    private final SprintEngine engine;

    public NextCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "get-next-task";
    }

    @Override
    protected OperationResult execute() {
        return engine.getNextTask(taskId);
    }

    @Override
    protected void render(Object data) {
        var next = (NextTaskResult) data;
        if (next.outcome() == NextTaskResult.Outcome.ALL_COMPLETE) {
            ConsoleOutput.success(next.message());
            return;
        }
        var task = next.task();
        ConsoleOutput.success("Ready: " + task.id() + " " + task.title());
        ConsoleOutput.field("Milestone", task.milestoneId());
        ConsoleOutput.field("Type", ConsoleOutput.label(task.type()));
        ConsoleOutput.list("Dependencies", task.dependencies());
        if (task.description() != null && !task.description().isBlank()) {
            ConsoleOutput.field("Description", task.description());
        }
    }

    @Override
    protected void renderUnsuccessful(Object data) {
        var next = (NextTaskResult) data;
        ConsoleOutput.field("Milestone", next.milestoneId());
        ConsoleOutput.list("Waiting on", next.waitingOn());
    }
}
