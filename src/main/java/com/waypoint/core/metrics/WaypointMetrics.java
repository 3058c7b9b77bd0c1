package com.waypoint.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for sprint orchestration.
 */
@Service
public class WaypointMetrics {

    private final MeterRegistry registry;

    public WaypointMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome) {
        Counter.builder("waypoint.operations.total")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordLockWait(long ms, boolean acquired) {
        Timer.builder("waypoint.lock.wait")
                .tag("acquired", String.valueOf(acquired))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordMilestoneTransition(String from, String to) {
        Counter.builder("waypoint.milestone.transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    /**
     * Records scope violations found by a post-check.
     *
     * @param kind  violation kind, e.g. "file_budget" or "forbidden_pattern"
     * @param count number of violations of that kind
     */
    public void recordScopeViolations(String kind, int count) {
        Counter.builder("waypoint.scope.violations")
                .description("Scope violations reported by post-checks")
                .tag("kind", kind)
                .register(registry)
                .increment(count);
    }

    /**
     * Records where an enhancement landed.
     *
     * @param placement "existing" or "new_milestone"
     * @param taskCount number of tasks inserted
     */
    public void recordEnhancementPlacement(String placement, int taskCount) {
        Counter.builder("waypoint.enhancement.placements")
                .tag("placement", placement)
                .register(registry)
                .increment();

        DistributionSummary.builder("waypoint.enhancement.task_count")
                .description("Tasks inserted per enhancement")
                .register(registry)
                .record(taskCount);
    }

    public void recordRestore(String reason) {
        Counter.builder("waypoint.state.restores")
                .description("State files restored from a backup")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
