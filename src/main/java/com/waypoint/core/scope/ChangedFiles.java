package com.waypoint.core.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link ChangedFile} lists from paths reported by the execution collaborator.
 */
public final class ChangedFiles {

    private static final Logger log = LoggerFactory.getLogger(ChangedFiles.class);

    /** Larger files are checked by path only. */
    static final long MAX_CONTENT_BYTES = 1024 * 1024;

    private ChangedFiles() {}

    public static List<ChangedFile> pathsOnly(List<String> paths) {
        return paths == null ? List.of() : paths.stream().map(ChangedFile::of).toList();
    }

    /**
     * Reads each changed file's content from {@code workspace} so content patterns can be checked.
     * Deleted, binary or oversized files are reported by path only.
     */
    public static List<ChangedFile> fromWorkspace(Path workspace, List<String> paths) {
        if (workspace == null) {
            return pathsOnly(paths);
        }
        var result = new ArrayList<ChangedFile>();
        for (String path : paths == null ? List.<String>of() : paths) {
            String normalized = ChangedFile.normalize(path);
            Path file = workspace.resolve(normalized);
            result.add(new ChangedFile(normalized, readText(file)));
        }
        return result;
    }

    private static String readText(Path file) {
        try {
            if (!Files.isRegularFile(file) || Files.size(file) > MAX_CONTENT_BYTES) {
                return null;
            }
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("{} is not UTF-8 text; checking its path only", file);
            return null;
        } catch (IOException e) {
            log.warn("Cannot read changed file {}: {}; checking its path only", file, e.getMessage());
            return null;
        }
    }
}
