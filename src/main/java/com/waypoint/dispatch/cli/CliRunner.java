package com.waypoint.dispatch.cli;

import com.waypoint.core.engine.ErrorInfo;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;
import picocli.CommandLine.ParseResult;

/**
 * Runs one {@code waypoint} invocation inside the Spring context and hands its exit code
 * back to Spring Boot.
 * <p>
 * Unexpected exceptions from a command become an {@code INTERNAL_ERROR} report with exit
 * code 1 instead of a stack trace. Each operation's outcome is logged: blocked results at
 * info, fatal ones at warn with the way back to a good state.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final WaypointCommand waypointCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WaypointCommand waypointCommand, IFactory factory) {
        this.waypointCommand = waypointCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        CommandLine commandLine = new CommandLine(waypointCommand, factory)
                .setExecutionExceptionHandler(CliRunner::internalError);
        exitCode = commandLine.execute(args);
        OperationResult result = resultOf(commandLine.getParseResult());
        if (result != null) {
            logOutcome(result);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * The result of the operation the deepest matched subcommand ran, or null when no
     * operation ran (usage errors, help, the bare banner).
     */
    static OperationResult resultOf(ParseResult parsed) {
        if (parsed == null) {
            return null;
        }
        while (parsed.hasSubcommand()) {
            parsed = parsed.subcommand();
        }
        Object command = parsed.commandSpec().userObject();
        return command instanceof OperationCommand operation ? operation.lastResult() : null;
    }

    private static void logOutcome(OperationResult result) {
        if (result.ok()) {
            log.debug("{} succeeded", result.operation());
            return;
        }
        ErrorInfo error = result.error();
        if (error.fatal()) {
            log.warn("{} failed with {} (exit {}); fix the state files or run 'waypoint backups restore <id>'",
                    result.operation(), error.code(), error.exitCode());
        } else {
            log.info("{} blocked with {} (exit {}): {}", result.operation(), error.code(), error.exitCode(),
                    error.message());
        }
    }

    private static int internalError(Exception e, CommandLine commandLine, ParseResult parsed) {
        log.error("Command '{}' failed unexpectedly", commandLine.getCommandName(), e);
        ConsoleOutput.failure(ErrorInfo.internal(e));
        return ErrorCode.INTERNAL_ERROR.exitCode();
    }
}
