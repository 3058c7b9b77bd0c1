package com.waypoint.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command group: waypoint backups (list | restore &lt;id&gt;)
 */
@Command(name = "backups", mixinStandardHelpOptions = true, description = "List or restore state backups",
        subcommands = {ListBackupsCommand.class, RestoreBackupCommand.class})
@Component
public class BackupsCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
