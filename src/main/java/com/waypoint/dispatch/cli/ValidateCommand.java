package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.milestone.ValidationOutcome;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: waypoint validate &lt;milestone-id&gt; (--passed | --failed [--issue text]...)
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Record a milestone validation result")
@Component
public class ValidateCommand extends OperationCommand {

    @Parameters(index = "0", description = "Milestone ID")
    private String milestoneId;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Verdict verdict;

    @Option(names = "--issue", paramLabel = "<text>", description = "Issue found; becomes a remediation task")
    private List<String> issues = new ArrayList<>();

    private final SprintEngine engine;

    public ValidateCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    static class Verdict {
        @Option(names = "--passed", required = true, description = "Validation passed")
        boolean passed;

        @Option(names = "--failed", required = true, description = "Validation failed")
        boolean failed;
    }

    @Override
    protected String operation() {
        return "record-validation";
    }

    @Override
    protected OperationResult execute() {
        return engine.recordValidation(milestoneId, verdict.passed, issues);
    }

    @Override
    protected void render(Object data) {
        var outcome = (ValidationOutcome) data;
        if (outcome.remediationTaskIds().isEmpty()) {
            ConsoleOutput.success("Milestone " + outcome.milestoneId() + " " + ConsoleOutput.label(outcome.status()));
            if (outcome.nextMilestoneId() == null) {
                ConsoleOutput.success("Sprint complete");
            } else {
                ConsoleOutput.info("Work continues in milestone " + outcome.nextMilestoneId());
            }
        } else {
            ConsoleOutput.warn("Milestone " + outcome.milestoneId() + " reopened ("
                    + ConsoleOutput.label(outcome.status()) + ")");
            ConsoleOutput.list("Remediation", outcome.remediationTaskIds());
        }
    }
}
