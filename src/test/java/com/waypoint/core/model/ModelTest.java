package com.waypoint.core.model;

import com.waypoint.core.error.TaskNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.waypoint.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("MilestoneStatus")
    class MilestoneStatusTests {

        @Test
        @DisplayName("moves forward one step at a time")
        void forwardTransitions() {
            assertTrue(MilestoneStatus.NOT_STARTED.canTransitionTo(MilestoneStatus.IN_PROGRESS));
            assertTrue(MilestoneStatus.IN_PROGRESS.canTransitionTo(MilestoneStatus.COMPLETE));
            assertTrue(MilestoneStatus.COMPLETE.canTransitionTo(MilestoneStatus.VALIDATED));
        }

        @Test
        @DisplayName("complete may be reopened, nothing else moves backwards")
        void backwardTransitions() {
            assertTrue(MilestoneStatus.COMPLETE.canTransitionTo(MilestoneStatus.IN_PROGRESS));
            assertFalse(MilestoneStatus.IN_PROGRESS.canTransitionTo(MilestoneStatus.NOT_STARTED));
            assertFalse(MilestoneStatus.NOT_STARTED.canTransitionTo(MilestoneStatus.COMPLETE));
            for (var target : MilestoneStatus.values()) {
                assertFalse(MilestoneStatus.VALIDATED.canTransitionTo(target), "validated -> " + target);
            }
        }

        @Test
        @DisplayName("only not_started and in_progress are open")
        void openStatuses() {
            assertTrue(MilestoneStatus.NOT_STARTED.isOpen());
            assertTrue(MilestoneStatus.IN_PROGRESS.isOpen());
            assertFalse(MilestoneStatus.COMPLETE.isOpen());
            assertFalse(MilestoneStatus.VALIDATED.isOpen());
        }
    }

    @Nested
    @DisplayName("TaskGraph")
    class TaskGraphTests {

        @Test
        @DisplayName("declared sequence follows milestone order, not task list order")
        void declaredSequence() {
            var graph = graph(
                    List.of(milestone("M1", "B", "A"), milestone("M2", "C")),
                    List.of(work("C", "M2"), work("A", "M1"), work("B", "M1"), validation("M1"), validation("M2")));

            var ids = graph.inSequence().stream().map(Task::id).toList();

            assertEquals(List.of("B", "A", "M1-VAL", "C", "M2-VAL"), ids);
        }

        @Test
        @DisplayName("workload counts work tasks only")
        void workloadCountsWorkOnly() {
            var remediation = new Task("M1-REM-1", "Fix", "", TaskType.REMEDIATION, List.of(), TaskStatus.PENDING,
                    "M1", null, null, null, null);
            var m1 = new Milestone("M1", "One", List.of("A", "M1-REM-1", "M1-VAL"), MilestoneStatus.IN_PROGRESS, null, null);
            var graph = graph(List.of(m1), List.of(work("A", "M1"), remediation, validation("M1")));

            assertEquals(1, graph.workload(m1));
            assertEquals(3, graph.tasksOf(m1).size());
        }

        @Test
        @DisplayName("milestone bounds fall back to the strategy defaults")
        void capacityDefaults() {
            var own = new Milestone("M1", "One", List.of("M1-VAL"), null, 1, 2);
            var inherited = milestone("M2");
            var graph = graph(List.of(own, inherited), List.of(validation("M1"), validation("M2")));

            assertEquals(2, graph.maxTasks(own));
            assertEquals(1, graph.minTasks(own));
            assertEquals(MilestoneStrategy.DEFAULT_MAX_TASKS, graph.maxTasks(inherited));
            assertEquals(MilestoneStrategy.DEFAULT_MIN_TASKS, graph.minTasks(inherited));
        }

        @Test
        @DisplayName("withTask rejects unknown tasks")
        void withTaskUnknown() {
            var graph = twoMilestones();
            assertThrows(TaskNotFoundException.class, () -> graph.withTask(work("NOPE", "M1")));
        }

        @Test
        @DisplayName("new tasks go before the validation task")
        void insertBeforeValidation() {
            var m1 = milestone("M1", "A");
            assertEquals(List.of("A", "X", "Y", "M1-VAL"), m1.withTasksBeforeValidation(List.of("X", "Y")).taskIds());
        }

        @Test
        @DisplayName("task budget falls back to the graph default")
        void effectiveBudget() {
            var graph = twoMilestones();
            var bounded = scoped("S", "M1", new ScopeBoundary(List.of(), List.of(), 3, null));

            assertEquals(3, graph.effectiveMaxFileChanges(bounded));
            assertEquals(ScopeEnforcement.DEFAULT_MAX_FILE_CHANGES, graph.effectiveMaxFileChanges(work("T", "M1")));
        }
    }

    @Test
    @DisplayName("tracker appends never touch earlier entries")
    void trackerAppend() {
        var entry = new HistoryEntry(Instant.EPOCH, HistoryEvent.TASK_STARTED, "T1", "M1", null);
        var before = tracker();
        var after = before.append(entry);

        assertTrue(before.history().isEmpty());
        assertEquals(List.of(entry), after.history());
        assertThrows(UnsupportedOperationException.class, () -> after.history().clear());
    }
}
