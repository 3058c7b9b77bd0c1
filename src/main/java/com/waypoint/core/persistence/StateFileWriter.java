package com.waypoint.core.persistence;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Replaces a state file so that readers see either the old or the new content, never a mix.
 */
@FunctionalInterface
public interface StateFileWriter {

    void write(Path target, byte[] content) throws IOException;
}
