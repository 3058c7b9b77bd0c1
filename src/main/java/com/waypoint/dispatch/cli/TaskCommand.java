package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.engine.TaskDetails;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: waypoint task &lt;task-id&gt;
 */
@Command(name = "task", mixinStandardHelpOptions = true, description = "Show task details")
@Component
public class TaskCommand extends OperationCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final SprintEngine engine;

    public TaskCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "get-task-details";
    }

    @Override
    protected OperationResult execute() {
        return engine.getTaskDetails(taskId);
    }

    @Override
    protected void render(Object data) {
        var details = (TaskDetails) data;
        var task = details.task();
        System.out.println("TASK " + task.id() + "  " + task.title());
        ConsoleOutput.field("Status", ConsoleOutput.label(task.status()));
        ConsoleOutput.field("Type", ConsoleOutput.label(task.type()));
        ConsoleOutput.field("Milestone", task.milestoneId());
        ConsoleOutput.field("Description", task.description());
        ConsoleOutput.list("Dependencies", task.dependencies());
        ConsoleOutput.list("Unmet", details.unmetDependencies());
        ConsoleOutput.list("Dependents", details.dependents());
        ConsoleOutput.field("Eligible", details.eligible() ? "yes" : "no");
        if (details.gatingMilestoneId() != null) {
            ConsoleOutput.warn("Gated: milestone " + details.gatingMilestoneId() + " awaits validation");
        }
        ConsoleOutput.list("Must implement", details.scope().mustImplement());
        ConsoleOutput.list("Must not implement", details.scope().mustNotImplement());
        ConsoleOutput.field("Max file changes", details.scope().maxFileChanges());
        if (!details.scope().technologies().isEmpty()) {
            ConsoleOutput.field("Technologies", details.scope().technologies());
        }
        if (task.enhancement() != null) {
            ConsoleOutput.field("Added by", task.enhancement().requestId() + " ("
                    + ConsoleOutput.label(task.enhancement().source()) + ")");
        }
    }
}
