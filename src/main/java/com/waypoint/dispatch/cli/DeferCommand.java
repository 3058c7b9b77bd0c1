package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.model.DeferredFeature;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: waypoint defer &lt;description&gt; [--reason text]
 */
@Command(name = "defer", mixinStandardHelpOptions = true, description = "Park a feature request for later")
@Component
public class DeferCommand extends OperationCommand {

    @Parameters(index = "0", description = "Feature description")
    private String description;

    @Option(names = "--reason", paramLabel = "<text>", description = "Why the feature is deferred")
    private String reason;

    private final SprintEngine engine;

    public DeferCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "defer-feature";
    }

    @Override
    protected OperationResult execute() {
        return engine.deferFeature(description, reason);
    }

    @Override
    protected void render(Object data) {
        var feature = (DeferredFeature) data;
        ConsoleOutput.success("Deferred " + feature.id() + ": " + ConsoleOutput.truncate(feature.description(), 60));
        ConsoleOutput.info("Apply it later with: waypoint enhance --deferred " + feature.id());
    }
}
