package com.waypoint.core.persistence;

import com.waypoint.core.error.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Creates, rotates and restores timestamped snapshots of the state files.
 * <p>
 * Every snapshot holds a full copy of each managed file that existed when it was
 * taken, so any one of them can be restored on its own.
 */
@Component
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    static final DateTimeFormatter BACKUP_ID =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

    /** Ids sharing a timestamp carry a numeric suffix ({@code -1}, {@code -2}, ...). */
    static final Comparator<BackupInfo> NEWEST_FIRST = Comparator
            .comparing((BackupInfo b) -> timestampOf(b.id()))
            .thenComparingInt(b -> suffixOf(b.id()))
            .reversed();

    private final Clock clock;

    public BackupManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Copies every existing state file into a new snapshot directory.
     *
     * @return the snapshot id
     */
    public String create(StateFiles files) {
        String base = BACKUP_ID.format(clock.instant());
        try {
            Files.createDirectories(files.backups());
            String id = base;
            int suffix = 1;
            while (Files.exists(files.backups().resolve(id))) {
                id = base + "-" + suffix++;
            }
            Path target = files.backups().resolve(id);
            Files.createDirectory(target);
            int copied = 0;
            for (String name : StateFiles.MANAGED) {
                Path source = files.resolve(name);
                if (Files.exists(source)) {
                    Files.copy(source, target.resolve(name), StandardCopyOption.COPY_ATTRIBUTES);
                    copied++;
                }
            }
            log.debug("Created backup {} ({} files)", id, copied);
            return id;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create backup in " + files.backups(), e);
        }
    }

    /**
     * Snapshots, newest first.
     */
    public List<BackupInfo> list(StateFiles files) {
        if (!Files.isDirectory(files.backups())) {
            return List.of();
        }
        var result = new ArrayList<BackupInfo>();
        for (Path dir : backupDirectories(files)) {
            var names = new ArrayList<String>();
            for (String name : StateFiles.MANAGED) {
                if (Files.exists(dir.resolve(name))) {
                    names.add(name);
                }
            }
            result.add(new BackupInfo(dir.getFileName().toString(), names));
        }
        result.sort(NEWEST_FIRST);
        return result;
    }

    /**
     * Deletes all but the {@code retain} most recent snapshots.
     */
    public void rotate(StateFiles files, int retain) {
        var snapshots = list(files);
        for (int i = Math.max(retain, 1); i < snapshots.size(); i++) {
            Path dir = files.backups().resolve(snapshots.get(i).id());
            try {
                deleteRecursively(dir);
                log.debug("Rotated out backup {}", snapshots.get(i).id());
            } catch (IOException e) {
                log.warn("Failed to delete old backup {}: {}", dir, e.getMessage());
            }
        }
    }

    /**
     * Removes one snapshot. Used when a transaction that took it never committed.
     */
    public void delete(StateFiles files, String backupId) {
        Path dir = files.backups().resolve(backupId);
        try {
            deleteRecursively(dir);
            log.debug("Discarded backup {}", backupId);
        } catch (IOException e) {
            log.warn("Failed to discard backup {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Puts every state file back to its content in the snapshot. Files that did not exist
     * when the snapshot was taken are removed.
     */
    public void restore(StateFiles files, String backupId, StateFileWriter writer) throws IOException {
        Path source = files.backups().resolve(backupId);
        if (backupId.isBlank() || backupId.contains("/") || backupId.contains("..") || !Files.isDirectory(source)) {
            throw TaskNotFoundException.backup(backupId);
        }
        for (String name : StateFiles.MANAGED) {
            Path saved = source.resolve(name);
            Path live = files.resolve(name);
            if (Files.exists(saved)) {
                writer.write(live, Files.readAllBytes(saved));
            } else {
                Files.deleteIfExists(live);
            }
        }
        log.info("Restored state files from backup {}", backupId);
    }

    private static String timestampOf(String id) {
        int dash = id.indexOf('-');
        return dash < 0 ? id : id.substring(0, dash);
    }

    private static int suffixOf(String id) {
        int dash = id.indexOf('-');
        if (dash < 0) {
            return 0;
        }
        try {
            return Integer.parseInt(id.substring(dash + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static List<Path> backupDirectories(StateFiles files) {
        try (Stream<Path> entries = Files.list(files.backups())) {
            return entries.filter(Files::isDirectory).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list backups in " + files.backups(), e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
