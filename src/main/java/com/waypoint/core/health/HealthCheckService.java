package com.waypoint.core.health;

import com.waypoint.core.error.WaypointException;
import com.waypoint.core.health.StateHealth.Check;
import com.waypoint.core.health.StateHealth.Status;
import com.waypoint.core.persistence.StateFiles;
import com.waypoint.core.persistence.StateLock;
import com.waypoint.core.persistence.TaskGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Inspects the state directory for {@code waypoint health}.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskGraphStore store;
    private final StateLock lock;

    public HealthCheckService(TaskGraphStore store, StateLock lock) {
        this.store = store;
        this.lock = lock;
    }

    public List<StateHealth> checkAll() {
        StateFiles files = store.files();
        var results = new ArrayList<StateHealth>();
        if (!Files.isDirectory(files.directory())) {
            results.add(StateHealth.down(Check.STATE_DIRECTORY,
                    "State directory " + files.directory() + " not found", Map.of("path", files.directory().toString())));
            return results;
        }
        results.add(StateHealth.up(Check.STATE_DIRECTORY,
                "State directory " + files.directory() + " present", Map.of("path", files.directory().toString())));

        StateHealth lockHealth = checkLock(files);
        results.add(lockHealth);
        results.add(lockHealth.status() == Status.UP
                ? checkState()
                : StateHealth.degraded(Check.STATE_FILES, "Skipped while the state lock is held", Map.of()));
        results.add(checkBackups());
        log.debug("Health checks finished: {}", StateHealth.overall(results));
        return results;
    }

    private StateHealth checkLock(StateFiles files) {
        try {
            String holder = lock.holder(files);
            if (holder == null) {
                return StateHealth.up(Check.LOCK, "State lock is free", Map.of());
            }
            return StateHealth.degraded(Check.LOCK, "State lock held by " + holder, Map.of("holder", holder));
        } catch (UncheckedIOException e) {
            log.warn("Lock health check failed: {}", e.getMessage());
            return StateHealth.down(Check.LOCK, "Lock error: " + e.getMessage(), Map.of());
        }
    }

    private StateHealth checkState() {
        try {
            var state = store.load();
            var graph = state.graph();
            return StateHealth.up(Check.STATE_FILES,
                    "Sprint " + graph.sprintId() + " loaded: " + graph.milestones().size()
                            + " milestones, " + graph.tasks().size() + " tasks",
                    Map.of("sprint_id", graph.sprintId(),
                            "status", state.tracker().status().name().toLowerCase(Locale.ROOT),
                            "validation_pending", String.valueOf(state.tracker().validationPending())));
        } catch (WaypointException e) {
            log.warn("State health check failed: {}", e.getMessage());
            return StateHealth.down(Check.STATE_FILES, e.code() + ": " + e.getMessage(),
                    Map.of("code", e.code().name()));
        }
    }

    private StateHealth checkBackups() {
        try {
            var backups = store.listBackups();
            if (backups.isEmpty()) {
                return StateHealth.degraded(Check.BACKUPS,
                        "No backups yet; one is taken with the first committed change", Map.of("count", "0"));
            }
            return StateHealth.up(Check.BACKUPS,
                    backups.size() + " backup(s), latest " + backups.get(0).id(),
                    Map.of("latest", backups.get(0).id(), "count", String.valueOf(backups.size())));
        } catch (UncheckedIOException e) {
            log.warn("Backup health check failed: {}", e.getMessage());
            return StateHealth.down(Check.BACKUPS, "Backup error: " + e.getMessage(), Map.of());
        }
    }
}
