package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.model.HistoryEntry;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: waypoint history [-n limit]
 * <p>
 * Displays the most recent progress history entries as a table:
 * Timestamp | Event | Task | Milestone | Detail (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "Show progress history")
@Component
public class HistoryCommand extends OperationCommand {

    @Option(names = {"--limit", "-n"}, description = "Number of entries, 0 for all", defaultValue = "20")
    private int limit;

    private final SprintEngine engine;

    public HistoryCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "history";
    }

    @Override
    protected OperationResult execute() {
        return engine.history(limit);
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void render(Object data) {
        var entries = (List<HistoryEntry>) data;
        if (entries.isEmpty()) {
            ConsoleOutput.info("No history recorded.");
            return;
        }
        System.out.printf("  %-24s %-22s %-12s %-9s %s%n", "TIMESTAMP", "EVENT", "TASK", "MILESTONE", "DETAIL");
        System.out.println("  " + "-".repeat(92));
        for (HistoryEntry entry : entries) {
            System.out.printf("  %-24s %-22s %-12s %-9s %s%n",
                    entry.timestamp(),
                    ConsoleOutput.label(entry.event()),
                    entry.taskId() == null ? "-" : entry.taskId(),
                    entry.milestoneId() == null ? "-" : entry.milestoneId(),
                    ConsoleOutput.truncate(entry.detail(), 30));
        }
    }
}
