package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.ErrorInfo;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.error.ErrorCode;
import com.waypoint.core.health.HealthCheckService;
import com.waypoint.core.health.StateHealth;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.Map;

/**
 * CLI command: waypoint health
 * <p>
 * Runs every health check and displays the results with colored output.
 * Exits non-zero when any check is down; degraded checks still exit 0.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check state directory health")
@Component
public class HealthCommand extends OperationCommand {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.healthCheckService = healthCheckService;
    }

    @Override
    protected String operation() {
        return "health";
    }

    @Override
    protected OperationResult execute() {
        List<StateHealth> checks = healthCheckService.checkAll();
        var down = checks.stream()
                .filter(c -> c.status() == StateHealth.Status.DOWN)
                .map(c -> c.check().label())
                .toList();
        if (down.isEmpty()) {
            return OperationResult.success(operation(), checks);
        }
        return OperationResult.failure(operation(), checks, ErrorInfo.of(ErrorCode.INTERNAL_ERROR,
                "Unhealthy component(s): " + String.join(", ", down), Map.of("down", down)));
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void render(Object data) {
        var checks = (List<StateHealth>) data;
        renderChecks(checks);
        ConsoleOutput.rule();
        if (StateHealth.overall(checks) == StateHealth.Status.UP) {
            ConsoleOutput.success("Overall: healthy");
        } else {
            ConsoleOutput.warn("Overall: degraded");
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void renderUnsuccessful(Object data) {
        renderChecks((List<StateHealth>) data);
        ConsoleOutput.rule();
    }

    private static void renderChecks(List<StateHealth> checks) {
        ConsoleOutput.printBanner();
        for (var check : checks) {
            String label = check.check().label() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }
    }
}
