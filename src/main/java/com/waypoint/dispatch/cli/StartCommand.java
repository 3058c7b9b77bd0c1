package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.engine.TaskTransition;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: waypoint start &lt;task-id&gt;
 * <p>
 * Prints the task's scope brief for the executor once the task is started.
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start a task")
@Component
public class StartCommand extends OperationCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final SprintEngine engine;

    public StartCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "start-task";
    }

    @Override
    protected OperationResult execute() {
        return engine.startTask(taskId);
    }

    @Override
    protected void render(Object data) {
        var transition = (TaskTransition) data;
        ConsoleOutput.success("Started " + transition.task().id() + " " + transition.task().title()
                + " (milestone " + transition.milestoneId() + " " + ConsoleOutput.label(transition.milestoneStatus()) + ")");
        var brief = transition.scope();
        if (brief != null) {
            ConsoleOutput.list("Must implement", brief.mustImplement());
            ConsoleOutput.list("Must not implement", brief.mustNotImplement());
            ConsoleOutput.field("Max file changes", brief.maxFileChanges());
            if (!brief.technologies().isEmpty()) {
                ConsoleOutput.field("Technologies", brief.technologies());
            }
            ConsoleOutput.list("Guardrails", brief.forbiddenPatterns().stream().map(p -> p.id()).toList());
        }
    }
}
