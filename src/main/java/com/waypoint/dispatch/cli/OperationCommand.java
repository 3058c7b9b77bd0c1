package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.ErrorInfo;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.error.WaypointException;
import com.waypoint.core.persistence.StateMapper;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Base for commands that run one operation and report its {@link OperationResult}.
 * <p>
 * Applies {@code --state-dir}, prints the result as JSON or in human form, and
 * returns the result's exit code.
 */
public abstract class OperationCommand implements Callable<Integer> {

    @Mixin
    CommonOptions options = new CommonOptions();

    private final WaypointProperties properties;
    private final StateMapper mapper;
    private OperationResult lastResult;

    protected OperationCommand(WaypointProperties properties, StateMapper mapper) {
        this.properties = properties;
        this.mapper = mapper;
    }

    @Override
    public Integer call() {
        if (options.stateDir != null) {
            properties.setStateDir(options.stateDir.toString());
        }
        OperationResult result;
        try {
            result = execute();
        } catch (WaypointException e) {
            // input files read by the command itself, before the engine is involved
            result = OperationResult.failure(operation(), ErrorInfo.from(e));
        }
        lastResult = result;

        if (options.json) {
            System.out.println(mapper.toJson(result));
        } else if (result.ok()) {
            render(result.data());
        } else {
            if (result.data() != null) {
                renderUnsuccessful(result.data());
            }
            ConsoleOutput.failure(result.error());
        }
        return result.exitCode();
    }

    protected abstract String operation();

    protected abstract OperationResult execute();

    protected abstract void render(Object data);

    /**
     * Renders the payload that accompanies a blocked or failed result. Most operations have none.
     */
    protected void renderUnsuccessful(Object data) {
    }

    /**
     * Result of the last {@link #call()}, null before the command ran.
     */
    OperationResult lastResult() {
        return lastResult;
    }

    protected StateMapper mapper() {
        return mapper;
    }
}
