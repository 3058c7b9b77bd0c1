package com.waypoint.core.persistence;

import com.waypoint.core.error.SchemaValidationException;
import com.waypoint.core.model.DeferredFeature;
import com.waypoint.core.model.Milestone;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.ProgressTracker;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.state.SprintState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.waypoint.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphValidatorTest {

    private final GraphValidator validator = new GraphValidator();

    private List<String> violations(TaskGraph graph) {
        return violations(graph, tracker());
    }

    private List<String> violations(TaskGraph graph, ProgressTracker tracker) {
        return validator.validate(new SprintState(graph, tracker, List.of(), null, null));
    }

    private static boolean mentions(List<String> violations, String text) {
        return violations.stream().anyMatch(v -> v.contains(text));
    }

    @Test
    @DisplayName("a well-formed plan has no violations")
    void valid() {
        assertTrue(violations(twoMilestones()).isEmpty());
    }

    @Test
    @DisplayName("unknown dependencies and duplicate ids are all reported at once")
    void collectsEverything() {
        var graph = graph(List.of(milestone("M1", "A", "B")),
                List.of(work("A", "M1", "GHOST"), work("B", "M1", "B"), work("B", "M1"), validation("M1")));

        var found = violations(graph);

        assertTrue(mentions(found, "depends on unknown task GHOST"), found.toString());
        assertTrue(mentions(found, "B depends on itself"), found.toString());
        assertTrue(mentions(found, "duplicate task id B"), found.toString());
    }

    @Test
    @DisplayName("milestones must end with their validation task")
    void trailingValidationTask() {
        var m1 = new Milestone("M1", "One", List.of("M1-VAL", "A"), MilestoneStatus.NOT_STARTED, null, null);
        var graph = graph(List.of(m1), List.of(work("A", "M1"), validation("M1")));

        var found = violations(graph);

        assertTrue(mentions(found, "must end with a validation task"), found.toString());
        assertTrue(mentions(found, "before its last position"), found.toString());
    }

    @Test
    @DisplayName("more work tasks than max_tasks is a capacity violation")
    void capacity() {
        var graph = graph(2, List.of(milestone("M1", "A", "B", "C")),
                List.of(work("A", "M1"), work("B", "M1"), work("C", "M1"), validation("M1")));

        assertTrue(mentions(violations(graph), "holds 3 work tasks, above its capacity of 2"));
    }

    @Test
    @DisplayName("every task belongs to exactly one milestone")
    void membership() {
        var graph = graph(List.of(milestone("M1", "A"), milestone("M2", "A")),
                List.of(work("A", "M1"), work("ORPHAN", "M1"), validation("M1"), validation("M2")));

        var found = violations(graph);

        assertTrue(mentions(found, "listed by both milestone M1 and milestone M2"), found.toString());
        assertTrue(mentions(found, "ORPHAN is not listed by any milestone"), found.toString());
    }

    @Test
    @DisplayName("milestone status must agree with its tasks")
    void statusConsistency() {
        var graph = twoMilestones();
        graph = graph.withTask(withStatus(graph.requireTask("T1"), TaskStatus.COMPLETED));
        graph = graph.withMilestone(graph.requireMilestone("M1").withStatus(MilestoneStatus.COMPLETE));

        var found = violations(graph, tracker().withValidationPending(true));

        assertTrue(mentions(found, "M1 is complete but task T2 is pending"), found.toString());
        assertFalse(mentions(found, "M1 is complete but task T1"), found.toString());
    }

    @Test
    @DisplayName("validation_pending must match a complete milestone")
    void gateFlag() {
        var pendingWithoutComplete = violations(twoMilestones(), tracker().withValidationPending(true));
        assertTrue(mentions(pendingWithoutComplete, "no milestone is complete"));

        var graph = twoMilestones();
        for (String id : List.of("T1", "T2", "T3", "T4")) {
            graph = graph.withTask(withStatus(graph.requireTask(id), TaskStatus.COMPLETED));
        }
        graph = graph.withMilestone(graph.requireMilestone("M1").withStatus(MilestoneStatus.COMPLETE));
        assertTrue(mentions(violations(graph), "validation_pending unset"));
        assertTrue(violations(graph, tracker().withValidationPending(true)).isEmpty());
    }

    @Test
    @DisplayName("a task without an id is reported, not a crash")
    void taskWithoutId() {
        var graph = graph(List.of(milestone("M1", "A")),
                List.of(work(null, "M1"), work("A", "M1"), validation("M1")));

        var found = assertDoesNotThrow(() -> violations(graph));

        assertTrue(mentions(found, "task with blank id (title 'Do null')"), found.toString());
        assertFalse(mentions(found, "holds"), found.toString());
    }

    @Test
    @DisplayName("a milestone without an id is reported, not a crash")
    void milestoneWithoutId() {
        var anonymous = new Milestone(null, "Nameless", List.of("M2-VAL"), MilestoneStatus.COMPLETE, null, null);
        var graph = graph(List.of(milestone("M1", "A"), anonymous),
                List.of(work("A", "M1"), validation("M1"), validation("M2")));
        var tracker = new ProgressTracker(SPRINT, null, "M1", false, 0, 0, List.of(), List.of());

        var found = assertDoesNotThrow(() -> violations(graph, tracker));

        assertTrue(mentions(found, "milestone with blank id (title 'Nameless')"), found.toString());
        assertTrue(mentions(found, "validation_pending unset"), found.toString());
    }

    @Test
    @DisplayName("tracker must point at a known milestone of the same sprint")
    void trackerReferences() {
        var tracker = new ProgressTracker("OTHER", null, "M9", false, 0, 0, List.of(), List.of());

        var found = violations(twoMilestones(), tracker);

        assertTrue(mentions(found, "does not match task graph sprint_id"), found.toString());
        assertTrue(mentions(found, "unknown milestone M9"), found.toString());
    }

    @Test
    @DisplayName("deferred feature ids are unique")
    void deferredIds() {
        var feature = new DeferredFeature("DEF-001", "Dark mode", null, Instant.EPOCH);
        var state = new SprintState(twoMilestones(), tracker(), List.of(feature, feature), null, null);

        assertTrue(mentions(validator.validate(state), "duplicate deferred feature id DEF-001"));
    }

    @Test
    @DisplayName("check throws with every violation")
    void checkThrows() {
        var graph = graph(List.of(milestone("M1", "A")), List.of(work("A", "M1", "X", "Y"), validation("M1")));
        var state = new SprintState(graph, tracker(), List.of(), null, null);

        var ex = assertThrows(SchemaValidationException.class, () -> validator.check(state));

        assertEquals(2, ex.violations().size());
    }
}
