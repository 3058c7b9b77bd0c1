package com.waypoint.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WaypointMetricsTest {

    private SimpleMeterRegistry registry;
    private WaypointMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new WaypointMetrics(registry);
    }

    @Test
    @DisplayName("recordOperation counts by operation and outcome")
    void recordOperation() {
        metrics.recordOperation("start-task", "ok");
        metrics.recordOperation("start-task", "ok");
        metrics.recordOperation("start-task", "dependency_unsatisfied");

        var ok = registry.find("waypoint.operations.total")
                .tag("operation", "start-task").tag("outcome", "ok").counter();
        var blocked = registry.find("waypoint.operations.total")
                .tag("outcome", "dependency_unsatisfied").counter();

        assertNotNull(ok);
        assertNotNull(blocked);
        assertEquals(2.0, ok.count());
        assertEquals(1.0, blocked.count());
    }

    @Test
    @DisplayName("recordLockWait creates a timer tagged by outcome")
    void recordLockWait() {
        metrics.recordLockWait(120, true);
        var timer = registry.find("waypoint.lock.wait").tag("acquired", "true").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNull(registry.find("waypoint.lock.wait").tag("acquired", "false").timer());
    }

    @Test
    @DisplayName("recordMilestoneTransition tags from and to")
    void recordMilestoneTransition() {
        metrics.recordMilestoneTransition("in_progress", "complete");
        var counter = registry.find("waypoint.milestone.transitions")
                .tag("from", "in_progress").tag("to", "complete").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordScopeViolations increments by the violation count")
    void recordScopeViolations() {
        metrics.recordScopeViolations("forbidden_marker", 3);
        var counter = registry.find("waypoint.scope.violations").tag("kind", "forbidden_marker").counter();
        assertNotNull(counter);
        assertEquals(3.0, counter.count());
    }

    @Test
    @DisplayName("recordEnhancementPlacement counts placements and task sizes")
    void recordEnhancementPlacement() {
        metrics.recordEnhancementPlacement("existing", 1);
        metrics.recordEnhancementPlacement("new_milestone", 4);

        assertEquals(1.0, registry.find("waypoint.enhancement.placements")
                .tag("placement", "new_milestone").counter().count());
        var summary = registry.find("waypoint.enhancement.task_count").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(5.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordRestore counts by reason")
    void recordRestore() {
        metrics.recordRestore("requested");
        var counter = registry.find("waypoint.state.restores").tag("reason", "requested").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
