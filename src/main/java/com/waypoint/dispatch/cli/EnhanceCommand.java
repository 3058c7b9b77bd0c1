package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.enhancement.EnhancementResult;
import com.waypoint.core.enhancement.FeatureTask;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: waypoint enhance [description] [--tasks-file f] [--depends-on ids] [--required-by ids] [--deferred id]
 * <p>
 * Without a tasks file the description becomes a single feature task.
 */
@Command(name = "enhance", mixinStandardHelpOptions = true, description = "Insert an enhancement into the plan")
@Component
public class EnhanceCommand extends OperationCommand {

    @Parameters(index = "0", arity = "0..1", description = "Enhancement description")
    private String description;

    @Option(names = "--tasks-file", paramLabel = "<file>", description = "JSON array of feature tasks")
    private Path tasksFile;

    @Option(names = "--depends-on", split = ",", paramLabel = "<task-id>", description = "Existing tasks the feature needs")
    private List<String> dependsOn = new ArrayList<>();

    @Option(names = "--required-by", split = ",", paramLabel = "<task-id>", description = "Pending tasks that need the feature")
    private List<String> requiredBy = new ArrayList<>();

    @Option(names = "--deferred", paramLabel = "<id>", description = "Deferred feature this enhancement resolves")
    private String deferredId;

    private final SprintEngine engine;

    public EnhanceCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "apply-enhancement";
    }

    @Override
    protected OperationResult execute() {
        List<FeatureTask> featureTasks = tasksFile == null ? List.of() : mapper().readFeatureTasks(tasksFile);
        return engine.applyEnhancement(description, featureTasks, dependsOn, requiredBy, deferredId);
    }

    @Override
    protected void render(Object data) {
        var result = (EnhancementResult) data;
        ConsoleOutput.success("Applied " + result.requestId() + ": " + ConsoleOutput.truncate(result.description(), 60));
        ConsoleOutput.field("Placement", ConsoleOutput.label(result.placement().kind())
                + " " + String.join(", ", result.placement().milestoneIds())
                + " at position " + result.placement().position());
        ConsoleOutput.field("Reason", result.placement().reason());
        ConsoleOutput.list("New tasks", result.taskIds());
        ConsoleOutput.list("Updated tasks", result.updatedTaskIds());
        if (result.resolvedDeferredId() != null) {
            ConsoleOutput.field("Resolved", result.resolvedDeferredId());
        }
    }
}
