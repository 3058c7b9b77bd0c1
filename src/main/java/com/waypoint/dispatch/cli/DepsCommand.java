package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.DependencyReport;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: waypoint deps &lt;task-id&gt;
 */
@Command(name = "deps", mixinStandardHelpOptions = true, description = "Check whether a task's dependencies are met")
@Component
public class DepsCommand extends OperationCommand {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final SprintEngine engine;

    public DepsCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "validate-dependencies";
    }

    @Override
    protected OperationResult execute() {
        return engine.validateDependencies(taskId);
    }

    @Override
    protected void render(Object data) {
        var report = (DependencyReport) data;
        printTable(report);
        ConsoleOutput.success("All dependencies of " + report.taskId() + " are completed");
    }

    @Override
    protected void renderUnsuccessful(Object data) {
        printTable((DependencyReport) data);
    }

    private static void printTable(DependencyReport report) {
        if (report.dependencies().isEmpty()) {
            ConsoleOutput.info(report.taskId() + " has no dependencies");
            return;
        }
        System.out.printf("  %-12s %s%n", "DEPENDENCY", "STATUS");
        System.out.println("  " + "-".repeat(28));
        report.dependencies().forEach((id, status) ->
                System.out.printf("  %-12s %s%n", id, ConsoleOutput.label(status)));
    }
}
