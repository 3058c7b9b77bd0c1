package com.waypoint.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Waypoint.
 * One subcommand per engine operation.
 */
@Command(
        name = "waypoint",
        mixinStandardHelpOptions = true,
        version = "Waypoint 0.1.0",
        description = "Sprint task orchestration: dependency scheduling, milestone validation gates, atomic state",
        subcommands = {
                StatusCommand.class,
                NextCommand.class,
                TaskCommand.class,
                DepsCommand.class,
                ScopeCommand.class,
                StartCommand.class,
                CompleteCommand.class,
                MilestoneCommand.class,
                EnhanceCommand.class,
                ValidateCommand.class,
                DeferCommand.class,
                HistoryCommand.class,
                BackupsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WaypointCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
