package com.waypoint.core.persistence;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.error.InvalidTransitionException;
import com.waypoint.core.error.SchemaValidationException;
import com.waypoint.core.error.StateCorruptionException;
import com.waypoint.core.error.TaskNotFoundException;
import com.waypoint.core.error.WaypointException;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.scheduler.DependencyResolver;
import com.waypoint.core.state.SprintState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads, validates and atomically persists the sprint state.
 * <p>
 * Nothing is cached between calls: every read and every transaction starts from the
 * files on disk. Transactions run under the state lock, are preceded by a full backup,
 * and write each file through {@link StateFileWriter} only after the changed model
 * passes every integrity check.
 */
@Service
public class TaskGraphStore {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphStore.class);

    private final WaypointProperties properties;
    private final StateMapper mapper;
    private final GraphValidator validator;
    private final DependencyResolver resolver;
    private final StateLock lock;
    private final BackupManager backups;
    private final StateFileWriter writer;
    private final WaypointMetrics metrics;

    public TaskGraphStore(WaypointProperties properties,
                          StateMapper mapper,
                          GraphValidator validator,
                          DependencyResolver resolver,
                          StateLock lock,
                          BackupManager backups,
                          StateFileWriter writer,
                          WaypointMetrics metrics) {
        this.properties = properties;
        this.mapper = mapper;
        this.validator = validator;
        this.resolver = resolver;
        this.lock = lock;
        this.backups = backups;
        this.writer = writer;
        this.metrics = metrics;
    }

    /**
     * The state directory as currently configured.
     */
    public StateFiles files() {
        return new StateFiles(Path.of(properties.getStateDir()));
    }

    /**
     * Reads and validates all state files.
     * <p>
     * Runs under the state lock so the graph and tracker always come from the same transaction.
     *
     * @throws SchemaValidationException if a file is missing, malformed or inconsistent
     * @throws com.waypoint.core.error.CycleDetectedException if the dependency relation has a cycle
     */
    public SprintState load() {
        StateFiles files = requireDirectory();
        try (var held = lock.acquire(files)) {
            SprintState state = read(files);
            verify(state);
            return state;
        }
    }

    /**
     * Applies {@code mutation} to freshly loaded state and persists the result atomically.
     * <p>
     * Classified failures from loading, from the mutation or from re-validation surface unchanged
     * with no state file touched and no backup taken. The backup is taken only once the new state
     * has validated; an I/O failure while writing restores every file from it and surfaces as
     * {@link StateCorruptionException}. Old backups are rotated out only after a commit.
     */
    public <T> T atomicUpdate(StateMutation<T> mutation) {
        StateFiles files = requireDirectory();
        try (var held = lock.acquire(files)) {
            SprintState state = read(files);
            verify(state);
            TaskGraph graphBefore = state.graph();
            var historyBefore = state.tracker().history();
            var validationsBefore = state.tracker().validations();

            T result = mutation.apply(state);

            state.refreshCounters();
            checkAppendOnly("Progress history", historyBefore, state.tracker().history());
            checkAppendOnly("Validation records", validationsBefore, state.tracker().validations());
            checkNoTaskRemoved(graphBefore, state.graph());
            verify(state);

            Map<Path, byte[]> payload = serialize(files, state);
            String backupId = backups.create(files);
            write(files, payload, backupId);
            backups.rotate(files, properties.getBackup().getRetain());
            log.debug("Committed state transaction (backup {})", backupId);
            return result;
        }
    }

    public List<BackupInfo> listBackups() {
        return backups.list(files());
    }

    /**
     * Restores every state file from the given snapshot.
     * <p>
     * The current state is backed up first so the restore itself can be undone. A snapshot
     * that fails validation is rolled back and the validation error surfaces.
     *
     * @return id of the backup taken just before restoring
     */
    public String restore(String backupId) {
        StateFiles files = requireDirectory();
        try (var held = lock.acquire(files)) {
            boolean known = backups.list(files).stream().anyMatch(b -> b.id().equals(backupId));
            if (!known) {
                throw TaskNotFoundException.backup(backupId);
            }
            String safetyId = backups.create(files);
            try {
                backups.restore(files, backupId, writer);
                verify(read(files));
            } catch (WaypointException e) {
                log.warn("Backup {} does not hold valid state, rolling back to {}: {}", backupId, safetyId, e.getMessage());
                if (rollback(files, safetyId, e)) {
                    backups.delete(files, safetyId);
                }
                throw e;
            } catch (IOException | UncheckedIOException e) {
                log.error("Restoring backup {} failed, rolling back to {}", backupId, safetyId, e);
                rollback(files, safetyId, e);
                throw new StateCorruptionException(safetyId, e);
            }
            backups.rotate(files, properties.getBackup().getRetain());
            metrics.recordRestore("requested");
            log.info("Restored backup {} (previous state saved as {})", backupId, safetyId);
            return safetyId;
        }
    }

    private StateFiles requireDirectory() {
        StateFiles files = files();
        if (!Files.isDirectory(files.directory())) {
            throw new SchemaValidationException(files.directory().toString(), "state directory not found", null);
        }
        return files;
    }

    private SprintState read(StateFiles files) {
        return new SprintState(
                mapper.readGraph(files.taskGraph()),
                mapper.readTracker(files.progressTracker()),
                mapper.readDeferredFeatures(files.deferredFeatures()),
                mapper.readGuardrails(files.guardrails()),
                mapper.readApprovedStack(files.approvedStack()));
    }

    private void verify(SprintState state) {
        validator.check(state);
        resolver.cycleCheck(state.graph());
    }

    private static <E> void checkAppendOnly(String subject, List<E> before, List<E> after) {
        if (after.size() < before.size() || !after.subList(0, before.size()).equals(before)) {
            throw new InvalidTransitionException(subject, "entries are append-only and earlier entries may not change");
        }
    }

    private static void checkNoTaskRemoved(TaskGraph before, TaskGraph after) {
        Set<String> remaining = after.tasks().stream().map(Task::id).collect(Collectors.toSet());
        for (var task : before.tasks()) {
            if (!remaining.contains(task.id())) {
                throw new InvalidTransitionException("Task " + task.id(), "tasks are never deleted");
            }
        }
    }

    private Map<Path, byte[]> serialize(StateFiles files, SprintState state) {
        Map<Path, byte[]> payload = new LinkedHashMap<>();
        payload.put(files.taskGraph(), mapper.toBytes(state.graph()));
        payload.put(files.progressTracker(), mapper.toBytes(state.tracker()));
        if (!state.deferredFeatures().isEmpty() || Files.exists(files.deferredFeatures())) {
            payload.put(files.deferredFeatures(), mapper.toBytes(state.deferredFeatures()));
        }
        return payload;
    }

    private void write(StateFiles files, Map<Path, byte[]> payload, String backupId) {
        try {
            for (var entry : payload.entrySet()) {
                writer.write(entry.getKey(), entry.getValue());
            }
        } catch (IOException | UncheckedIOException e) {
            log.error("Writing state failed, restoring backup {}", backupId, e);
            rollback(files, backupId, e);
            metrics.recordRestore("write_failure");
            throw new StateCorruptionException(backupId, e);
        }
    }

    private boolean rollback(StateFiles files, String backupId, Exception failure) {
        try {
            backups.restore(files, backupId, writer);
            return true;
        } catch (IOException | RuntimeException restoreFailure) {
            log.error("Rollback to backup {} failed; restore it manually with 'waypoint backups restore {}'",
                    backupId, backupId, restoreFailure);
            failure.addSuppressed(restoreFailure);
            return false;
        }
    }
}
