package com.waypoint.dispatch.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every engine-backed command.
 */
public class CommonOptions {

    @Option(names = "--json", description = "Print the operation result as JSON")
    boolean json;

    @Option(names = "--state-dir", paramLabel = "<dir>",
            description = "State directory (default: waypoint.state-dir, .waypoint)")
    Path stateDir;
}
