package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.persistence.BackupInfo;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List backups, newest first")
@Component
public class ListBackupsCommand extends OperationCommand {

    private final SprintEngine engine;

    public ListBackupsCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "list-backups";
    }

    @Override
    protected OperationResult execute() {
        return engine.listBackups();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected void render(Object data) {
        var backups = (List<BackupInfo>) data;
        if (backups.isEmpty()) {
            ConsoleOutput.info("No backups found.");
            return;
        }
        System.out.printf("  %-24s %s%n", "BACKUP ID", "FILES");
        System.out.println("  " + "-".repeat(60));
        for (BackupInfo backup : backups) {
            System.out.printf("  %-24s %s%n", backup.id(), String.join(", ", backup.files()));
        }
    }
}
