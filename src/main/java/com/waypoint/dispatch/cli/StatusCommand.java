package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.engine.SprintStatusView;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: waypoint status
 * <p>
 * Sprint overview: progress counters, the milestone table and what runs next.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show sprint progress")
@Component
public class StatusCommand extends OperationCommand {

    private final SprintEngine engine;

    public StatusCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "get-current-status";
    }

    @Override
    protected OperationResult execute() {
        return engine.getCurrentStatus();
    }

    @Override
    protected void render(Object data) {
        var view = (SprintStatusView) data;
        ConsoleOutput.printBanner();
        System.out.println("SPRINT " + view.sprintId());
        ConsoleOutput.info("Status: " + ConsoleOutput.label(view.status())
                + " | Tasks: " + view.completedTasks() + "/" + view.totalTasks() + " completed"
                + " | Current milestone: " + (view.currentMilestoneId() == null ? "-" : view.currentMilestoneId()));
        if (view.validationPending()) {
            ConsoleOutput.warn("Validation pending: record a result with 'waypoint validate <milestone> --passed|--failed'");
        }
        if (!view.inProgressTaskIds().isEmpty()) {
            ConsoleOutput.info("In progress: " + String.join(", ", view.inProgressTaskIds()));
        }

        System.out.println();
        System.out.printf("  %-9s %-13s %-9s %-9s %s%n", "MILESTONE", "STATUS", "WORK/MAX", "DONE", "TITLE");
        System.out.println("  " + "-".repeat(64));
        for (var m : view.milestones()) {
            System.out.printf("  %-9s %-13s %-9s %-9s %s%n",
                    m.id(), ConsoleOutput.label(m.status()),
                    m.workTasks() + "/" + m.maxTasks(),
                    m.completedTasks() + "/" + m.totalTasks(),
                    ConsoleOutput.truncate(m.title(), 30));
        }

        System.out.println();
        var next = view.next();
        switch (next.outcome()) {
            case READY -> ConsoleOutput.success("Next: " + next.task().id() + " " + next.task().title());
            case BLOCKED -> ConsoleOutput.warn("Next: blocked (" + ConsoleOutput.label(next.reason()) + ") " + next.message());
            case ALL_COMPLETE -> ConsoleOutput.success("Next: nothing, all milestones validated");
        }
        if (view.deferredFeatures() > 0) {
            ConsoleOutput.info(view.deferredFeatures() + " deferred feature(s) waiting for an enhancement pass");
        }
    }
}
