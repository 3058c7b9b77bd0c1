package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.ScopeReport;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.persistence.StateMapper;
import com.waypoint.core.scope.ChangedFiles;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: waypoint scope &lt;task-id&gt; [--changed-file f]... [--workspace dir] [--tech name=version]...
 * <p>
 * Without changed files only the task's technologies are checked.
 */
@Command(name = "scope", mixinStandardHelpOptions = true, description = "Check changes against a task's scope boundary")
@Component
public class ScopeCommand extends OperationCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--changed-file", "-f"}, paramLabel = "<path>", description = "Changed file, relative to the workspace")
    private List<String> changedFiles = new ArrayList<>();

    @Option(names = "--workspace", paramLabel = "<dir>", description = "Workspace root; enables content checks")
    private Path workspace;

    @Option(names = "--tech", paramLabel = "<name=version>", description = "Technology referenced by the change")
    private Map<String, String> technologies = new LinkedHashMap<>();

    private final SprintEngine engine;

    public ScopeCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "check-scope-compliance";
    }

    @Override
    protected OperationResult execute() {
        return engine.checkScopeCompliance(taskId, ChangedFiles.fromWorkspace(workspace, changedFiles), technologies);
    }

    @Override
    protected void render(Object data) {
        var report = (ScopeReport) data;
        ConsoleOutput.success("Task " + report.taskId() + " is within scope ("
                + report.changedFiles() + "/" + report.brief().maxFileChanges() + " files)");
    }

    @Override
    protected void renderUnsuccessful(Object data) {
        var report = (ScopeReport) data;
        ConsoleOutput.field("Changed files", report.changedFiles() + " (budget " + report.brief().maxFileChanges() + ")");
        // file violations are listed by the error; tech ones too when they are the only failure
        if (!report.violations().isEmpty()) {
            report.techViolations().forEach(v -> ConsoleOutput.error(v.message()));
        }
    }
}
