package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.engine.TaskTransition;
import com.waypoint.core.persistence.StateMapper;
import com.waypoint.core.scope.ChangedFiles;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: waypoint complete &lt;task-id&gt; [--changed-file f]... [--workspace dir]
 * <p>
 * Changed files are post-checked first; a scope violation leaves the task in progress.
 */
@Command(name = "complete", mixinStandardHelpOptions = true, description = "Complete a task")
@Component
public class CompleteCommand extends OperationCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--changed-file", "-f"}, paramLabel = "<path>", description = "Changed file, relative to the workspace")
    private List<String> changedFiles = new ArrayList<>();

    @Option(names = "--workspace", paramLabel = "<dir>", description = "Workspace root; enables content checks")
    private Path workspace;

    private final SprintEngine engine;

    public CompleteCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "complete-task";
    }

    @Override
    protected OperationResult execute() {
        return engine.completeTask(taskId, ChangedFiles.fromWorkspace(workspace, changedFiles));
    }

    @Override
    protected void render(Object data) {
        var transition = (TaskTransition) data;
        ConsoleOutput.success("Completed " + transition.task().id() + " " + transition.task().title());
        if (transition.validationPending()) {
            ConsoleOutput.warn("Milestone " + transition.milestoneId() + " is complete and awaits validation: "
                    + "waypoint validate " + transition.milestoneId() + " --passed|--failed");
        }
    }
}
