package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.milestone.MilestoneReport;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: waypoint milestone &lt;milestone-id&gt;
 */
@Command(name = "milestone", mixinStandardHelpOptions = true, description = "Show milestone status")
@Component
public class MilestoneCommand extends OperationCommand {

    @Parameters(index = "0", description = "Milestone ID")
    private String milestoneId;

    private final SprintEngine engine;

    public MilestoneCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "get-milestone-status";
    }

    @Override
    protected OperationResult execute() {
        return engine.getMilestoneStatus(milestoneId);
    }

    @Override
    protected void render(Object data) {
        var report = (MilestoneReport) data;
        System.out.println("MILESTONE " + report.milestoneId() + "  " + report.title()
                + (report.current() ? "  (current)" : ""));
        ConsoleOutput.field("Status", ConsoleOutput.label(report.status()));
        ConsoleOutput.field("Progress", report.completedTasks() + "/" + report.totalTasks() + " tasks");
        ConsoleOutput.field("Capacity", report.workTasks() + " work task(s), "
                + report.minTasks() + "-" + report.maxTasks() + " allowed");
        if (report.remediationTasks() > 0) {
            ConsoleOutput.field("Remediation", report.remediationTasks());
        }
        ConsoleOutput.field("Validation task", report.validationTaskId() + " ("
                + ConsoleOutput.label(report.validationTaskStatus()) + ")");
        ConsoleOutput.list("Tasks", report.taskIds());
        for (var validation : report.validations()) {
            String line = validation.timestamp() + " " + ConsoleOutput.label(validation.status())
                    + (validation.issues().isEmpty() ? "" : ": " + String.join("; ", validation.issues()));
            ConsoleOutput.field("Validation", line);
        }
        if (report.validationPending()) {
            ConsoleOutput.warn("Awaiting validation: waypoint validate " + report.milestoneId() + " --passed|--failed");
        }
    }
}
