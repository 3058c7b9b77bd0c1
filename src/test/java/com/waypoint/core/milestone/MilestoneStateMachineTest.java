package com.waypoint.core.milestone;

import com.waypoint.core.error.InvalidTransitionException;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.EnhancementSource;
import com.waypoint.core.model.HistoryEvent;
import com.waypoint.core.model.HistoryEntry;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.SprintStatus;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.model.TaskType;
import com.waypoint.core.model.ValidationStatus;
import com.waypoint.core.persistence.GraphValidator;
import com.waypoint.core.scheduler.DependencyResolver;
import com.waypoint.core.scheduler.NextTaskResult;
import com.waypoint.core.state.SprintState;
import com.waypoint.support.TickingClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.waypoint.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MilestoneStateMachineTest {

    private SimpleMeterRegistry registry;
    private MilestoneStateMachine machine;
    private final DependencyResolver resolver = new DependencyResolver();
    private final GraphValidator validator = new GraphValidator();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        machine = new MilestoneStateMachine(new WaypointMetrics(registry), TickingClock.startingAt("2026-01-18T10:00:00Z"));
    }

    private static SprintState state(TaskGraph graph) {
        return new SprintState(graph, tracker(), List.of(), null, null);
    }

    /** Starts then completes a task the way the engine does. */
    private void run(SprintState state, String taskId) {
        Task started = state.graph().requireTask(taskId).started(Instant.EPOCH);
        state.graph(state.graph().withTask(started));
        machine.onTaskStarted(state, started);
        Task done = started.completed(Instant.EPOCH);
        state.graph(state.graph().withTask(done));
        machine.onTaskCompleted(state, done);
        state.refreshCounters();
    }

    private static List<HistoryEvent> events(SprintState state) {
        return state.tracker().history().stream().map(HistoryEntry::event).toList();
    }

    @Test
    @DisplayName("first started task starts the milestone and the sprint")
    void firstTaskStartsMilestone() {
        var state = state(twoMilestones());
        Task started = state.graph().requireTask("T1").started(Instant.EPOCH);
        state.graph(state.graph().withTask(started));

        machine.onTaskStarted(state, started);

        assertEquals(MilestoneStatus.IN_PROGRESS, state.graph().requireMilestone("M1").status());
        assertEquals(SprintStatus.IN_PROGRESS, state.tracker().status());
        assertEquals("M1", state.tracker().currentMilestoneId());
        assertEquals(List.of(HistoryEvent.MILESTONE_STARTED, HistoryEvent.TASK_STARTED), events(state));
        assertTrue(validator.validate(state).isEmpty());
    }

    @Test
    @DisplayName("4 work tasks done -> M1 complete, gate raised, M2 blocked")
    void completingWorkRaisesGate() {
        var state = state(twoMilestones());
        for (String id : List.of("T1", "T2", "T3")) {
            run(state, id);
            assertEquals(MilestoneStatus.IN_PROGRESS, state.graph().requireMilestone("M1").status());
        }
        run(state, "T4");

        assertEquals(MilestoneStatus.COMPLETE, state.graph().requireMilestone("M1").status());
        assertTrue(state.tracker().validationPending());
        assertEquals(SprintStatus.AWAITING_VALIDATION, state.tracker().status());
        assertEquals(TaskStatus.PENDING, state.graph().requireTask("M1-VAL").status());
        assertTrue(validator.validate(state).isEmpty());

        var next = resolver.nextTask(state.graph(), state.tracker(), null);
        assertEquals(NextTaskResult.Outcome.BLOCKED, next.outcome());
        assertEquals(NextTaskResult.BlockReason.VALIDATION_PENDING, next.reason());
        assertEquals("M1", next.milestoneId());
    }

    @Nested
    @DisplayName("recordValidation")
    class RecordValidation {

        private SprintState completedM1() {
            var state = state(twoMilestones());
            for (String id : List.of("T1", "T2", "T3", "T4")) {
                run(state, id);
            }
            return state;
        }

        @Test
        @DisplayName("passed: milestone validated, gate lowered, work moves to M2")
        void passed() {
            var state = completedM1();

            var outcome = machine.recordValidation(state, "M1", true, List.of());

            assertEquals(MilestoneStatus.VALIDATED, outcome.status());
            assertEquals("M2", outcome.nextMilestoneId());
            assertTrue(outcome.remediationTaskIds().isEmpty());
            assertEquals(MilestoneStatus.VALIDATED, state.graph().requireMilestone("M1").status());
            assertEquals(TaskStatus.COMPLETED, state.graph().requireTask("M1-VAL").status());
            assertFalse(state.tracker().validationPending());
            assertEquals("M2", state.tracker().currentMilestoneId());
            assertEquals(ValidationStatus.PASSED, state.tracker().validations().get(0).status());
            assertEquals("T5", resolver.nextTask(state.graph(), state.tracker(), null).task().id());
            state.refreshCounters();
            assertTrue(validator.validate(state).isEmpty());
        }

        @Test
        @DisplayName("failed: remediation tasks inserted before the validation task and the gate re-arms")
        void failed() {
            var state = completedM1();

            var outcome = machine.recordValidation(state, "M1", false, List.of("Login page crashes", "  "));

            assertEquals(MilestoneStatus.IN_PROGRESS, outcome.status());
            assertEquals(List.of("M1-REM-1"), outcome.remediationTaskIds());
            var m1 = state.graph().requireMilestone("M1");
            assertEquals(List.of("T1", "T2", "T3", "T4", "M1-REM-1", "M1-VAL"), m1.taskIds());
            Task remediation = state.graph().requireTask("M1-REM-1");
            assertEquals(TaskType.REMEDIATION, remediation.type());
            assertEquals(EnhancementSource.REMEDIATION, remediation.enhancement().source());
            assertEquals("Login page crashes", remediation.description());
            assertFalse(state.tracker().validationPending());
            assertEquals(List.of("Login page crashes"), state.tracker().validations().get(0).issues());

            var next = resolver.nextTask(state.graph(), state.tracker(), null);
            assertEquals("M1-REM-1", next.task().id());

            run(state, "M1-REM-1");
            assertEquals(MilestoneStatus.COMPLETE, state.graph().requireMilestone("M1").status());
            assertTrue(state.tracker().validationPending());
            assertTrue(validator.validate(state).isEmpty());
        }

        @Test
        @DisplayName("failed without issues creates one generic remediation task")
        void failedWithoutIssues() {
            var state = completedM1();
            var outcome = machine.recordValidation(state, "M1", false, null);
            assertEquals(1, outcome.remediationTaskIds().size());
            assertTrue(state.graph().requireTask("M1-REM-1").description().contains("M1"));
        }

        @Test
        @DisplayName("a second failure numbers remediation tasks after the first")
        void secondFailure() {
            var state = completedM1();
            machine.recordValidation(state, "M1", false, List.of("first"));
            run(state, "M1-REM-1");

            var outcome = machine.recordValidation(state, "M1", false, List.of("second"));

            assertEquals(List.of("M1-REM-2"), outcome.remediationTaskIds());
            assertEquals(2, state.tracker().validations().size());
            assertEquals("validation-M1-2", state.graph().requireTask("M1-REM-2").enhancement().requestId());
        }

        @Test
        @DisplayName("the gate stays up while another milestone still awaits validation")
        void twoCompleteMilestones() {
            var state = state(graph(List.of(milestone("M1", "A"), milestone("M2", "B")),
                    List.of(work("A", "M1"), validation("M1"), work("B", "M2"), validation("M2"))));
            run(state, "B");
            run(state, "A");

            machine.recordValidation(state, "M2", false, List.of("x"));
            assertTrue(state.tracker().validationPending());
            assertTrue(validator.validate(state).isEmpty(), () -> validator.validate(state).toString());

            machine.recordValidation(state, "M1", true, List.of());
            assertFalse(state.tracker().validationPending());
            assertTrue(validator.validate(state).isEmpty(), () -> validator.validate(state).toString());
            assertEquals("M2-REM-1", resolver.nextTask(state.graph(), state.tracker(), null).task().id());
        }

        @Test
        @DisplayName("only a complete milestone can be validated")
        void notComplete() {
            var state = state(twoMilestones());
            assertThrows(InvalidTransitionException.class,
                    () -> machine.recordValidation(state, "M1", true, List.of()));
            assertTrue(state.tracker().validations().isEmpty());
        }

        @Test
        @DisplayName("last milestone validated -> sprint completed")
        void lastMilestone() {
            var state = completedM1();
            machine.recordValidation(state, "M1", true, List.of());
            run(state, "T5");
            run(state, "T6");

            var outcome = machine.recordValidation(state, "M2", true, List.of());

            assertNull(outcome.nextMilestoneId());
            assertEquals(SprintStatus.COMPLETED, state.tracker().status());
            assertEquals(NextTaskResult.Outcome.ALL_COMPLETE,
                    resolver.nextTask(state.graph(), state.tracker(), null).outcome());
        }
    }

    @Test
    @DisplayName("transitions are counted by from/to")
    void transitionMetrics() {
        var state = state(twoMilestones());
        run(state, "T1");

        var counter = registry.find("waypoint.milestone.transitions")
                .tag("from", "not_started").tag("to", "in_progress").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("report counts work, remediation and completed tasks")
    void report() {
        var state = state(twoMilestones());
        run(state, "T1");

        var report = machine.report(state.graph(), state.tracker(), "M1");

        assertEquals(MilestoneStatus.IN_PROGRESS, report.status());
        assertEquals(4, report.workTasks());
        assertEquals(5, report.totalTasks());
        assertEquals(1, report.completedTasks());
        assertEquals("M1-VAL", report.validationTaskId());
        assertTrue(report.current());
        assertFalse(report.validationPending());
    }
}
