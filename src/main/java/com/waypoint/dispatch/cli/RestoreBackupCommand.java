package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.OperationResult;
import com.waypoint.core.engine.SprintEngine;
import com.waypoint.core.persistence.StateMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Map;

/**
 * CLI command: waypoint backups restore &lt;backup-id&gt;
 * <p>
 * The state being replaced is itself backed up first and its id is printed.
 */
@Command(name = "restore", mixinStandardHelpOptions = true, description = "Restore state from a backup")
@Component
public class RestoreBackupCommand extends OperationCommand {

    @Parameters(index = "0", description = "Backup ID")
    private String backupId;

    private final SprintEngine engine;

    public RestoreBackupCommand(SprintEngine engine, WaypointProperties properties, StateMapper mapper) {
        super(properties, mapper);
        this.engine = engine;
    }

    @Override
    protected String operation() {
        return "restore-backup";
    }

    @Override
    protected OperationResult execute() {
        return engine.restoreBackup(backupId);
    }

    @Override
    protected void render(Object data) {
        var restored = (Map<?, ?>) data;
        ConsoleOutput.success("Restored backup " + restored.get("restored"));
        ConsoleOutput.field("Previous state", restored.get("previous_state_backup"));
    }
}
