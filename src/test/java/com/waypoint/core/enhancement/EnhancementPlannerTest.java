package com.waypoint.core.enhancement;

import com.waypoint.core.error.DependencyUnsatisfiedException;
import com.waypoint.core.error.EnhancementRejectedException;
import com.waypoint.core.error.TaskNotFoundException;
import com.waypoint.core.model.DeferredFeature;
import com.waypoint.core.model.EnhancementSource;
import com.waypoint.core.model.HistoryEvent;
import com.waypoint.core.model.Milestone;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.ProgressTracker;
import com.waypoint.core.model.SprintStatus;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.support.Workspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.waypoint.support.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class EnhancementPlannerTest {

    @TempDir
    Path root;

    private Workspace ws;

    @BeforeEach
    void setUp() {
        ws = new Workspace(root).with(twoMilestones());
    }

    private static FeatureTask feature(String id, List<String> dependencies, List<String> requiredBy) {
        return new FeatureTask(id, "Feature " + id, "", dependencies, requiredBy, null);
    }

    private static List<FeatureTask> features(int count, List<String> dependencies, List<String> requiredBy) {
        var result = new ArrayList<FeatureTask>();
        for (int i = 1; i <= count; i++) {
            result.add(feature("F" + i, dependencies, requiredBy));
        }
        return result;
    }

    /**
     * M1 validated with every task done, M2 not started and current.
     */
    private static TaskGraph firstMilestoneValidated() {
        var graph = twoMilestones();
        for (String id : List.of("T1", "T2", "T3", "T4", "M1-VAL")) {
            graph = graph.withTask(withStatus(graph.requireTask(id), TaskStatus.COMPLETED));
        }
        return graph.withMilestone(graph.requireMilestone("M1").withStatus(MilestoneStatus.VALIDATED));
    }

    private static ProgressTracker trackerAt(SprintStatus status, String milestoneId) {
        return new ProgressTracker(SPRINT, status, milestoneId, false, 0, 0, List.of(), List.of());
    }

    // ── Placement ────────────────────────────────────────────────────

    @Nested
    class PlacementTests {

        @Test
        @DisplayName("a single task fills the last free slot of the first milestone")
        void intoFirstMilestone() {
            var placement = ws.planner.placement(List.of(feature("F1", List.of(), List.of())), twoMilestones());

            assertEquals(Placement.Kind.EXISTING_MILESTONE, placement.kind());
            assertEquals(List.of("M1"), placement.milestoneIds());
            assertEquals(0, placement.position());
        }

        @Test
        @DisplayName("tasks that do not fit skip to the next open milestone with room")
        void skipsFullMilestone() {
            var placement = ws.planner.placement(features(2, List.of(), List.of()), twoMilestones());

            assertEquals(Placement.Kind.EXISTING_MILESTONE, placement.kind());
            assertEquals(List.of("M2"), placement.milestoneIds());
        }

        @Test
        @DisplayName("dependencies set the earliest milestone")
        void dependencyFloor() {
            var placement = ws.planner.placement(List.of(feature("F1", List.of("T5"), List.of())), twoMilestones());

            assertEquals(List.of("M2"), placement.milestoneIds());
        }

        @Test
        @DisplayName("when no milestone has room a new one is appended")
        void newMilestoneAtEnd() {
            var placement = ws.planner.placement(features(4, List.of("T5"), List.of()), twoMilestones());

            assertEquals(Placement.Kind.NEW_MILESTONE, placement.kind());
            assertEquals(List.of("M3"), placement.milestoneIds());
            assertEquals(2, placement.position());
        }

        @Test
        @DisplayName("a required-by task pulls the new milestone in front of its own")
        void newMilestoneBeforeRequiredBy() {
            var placement = ws.planner.placement(features(4, List.of(), List.of("T5")), twoMilestones());

            assertEquals(Placement.Kind.NEW_MILESTONE, placement.kind());
            assertEquals(1, placement.position());
        }

        @Test
        @DisplayName("a feature larger than the milestone capacity is split")
        void split() {
            var placement = ws.planner.placement(features(7, List.of("T5"), List.of()), twoMilestones());

            assertEquals(Placement.Kind.NEW_MILESTONE, placement.kind());
            assertEquals(List.of("M3", "M4"), placement.milestoneIds());
            assertTrue(placement.reason().contains("split into 2"));
        }

        @Test
        @DisplayName("a dependency after the required-by task is rejected")
        void contradictoryBounds() {
            var ex = assertThrows(EnhancementRejectedException.class, () -> ws.planner.placement(
                    List.of(feature("F1", List.of("T5"), List.of("T2"))), twoMilestones()));

            assertTrue(ex.getMessage().contains("is not before required-by task T2"));
        }

        @Test
        @DisplayName("closed milestones never receive new work")
        void closedMilestoneSkipped() {
            var placement = ws.planner.placement(List.of(feature("F1", List.of(), List.of())), firstMilestoneValidated());

            assertEquals(List.of("M2"), placement.milestoneIds());
        }
    }

    // ── Apply ────────────────────────────────────────────────────────

    @Nested
    class Apply {

        @Test
        @DisplayName("inserts the task before the milestone's validation task")
        void beforeValidation() {
            var result = ws.planner.apply("Add CSV export", List.of(), null);

            assertEquals("REQ-001", result.requestId());
            assertEquals(List.of("ENH-001"), result.taskIds());

            var graph = ws.graph();
            Milestone m1 = graph.requireMilestone("M1");
            assertEquals(List.of("T1", "T2", "T3", "T4", "ENH-001", "M1-VAL"), m1.taskIds());
            Task added = graph.requireTask("ENH-001");
            assertEquals("Add CSV export", added.title());
            assertEquals(TaskStatus.PENDING, added.status());
            assertEquals(EnhancementSource.ENHANCEMENT, added.enhancement().source());
            assertEquals("REQ-001", added.enhancement().requestId());

            var last = ws.tracker().history().get(ws.tracker().history().size() - 1);
            assertEquals(HistoryEvent.ENHANCEMENT_APPLIED, last.event());
            assertEquals(9, ws.tracker().totalTasks());
        }

        @Test
        @DisplayName("required-by tasks gain a dependency on the new task")
        void requiredByEdges() {
            var result = ws.planner.apply("Audit log", List.of(feature("AUD-1", List.of("T1"), List.of("T5", "T6"))),
                    null);

            assertEquals(List.of("T5", "T6"), result.updatedTaskIds());
            var graph = ws.graph();
            assertEquals(List.of("T4", "AUD-1"), graph.requireTask("T5").dependencies());
            assertEquals(List.of("AUD-1"), graph.requireTask("T6").dependencies());
        }

        @Test
        @DisplayName("a new milestone gets its own validation task")
        void newMilestoneHasValidation() {
            ws.planner.apply("Reporting", features(4, List.of("T5"), List.of()), null);

            var graph = ws.graph();
            Milestone m3 = graph.requireMilestone("M3");
            assertEquals(List.of("F1", "F2", "F3", "F4", "M3-VAL"), m3.taskIds());
            assertEquals(MilestoneStatus.NOT_STARTED, m3.status());
            assertTrue(graph.requireTask("M3-VAL").isValidation());
            assertEquals(2, graph.milestoneIndex("M3"));
        }

        @Test
        @DisplayName("a rejected enhancement leaves the state files untouched")
        void rejectionIsAtomic() {
            var before = ws.snapshot();

            assertThrows(EnhancementRejectedException.class, () -> ws.planner.apply("Bad",
                    List.of(feature("F1", List.of("T5"), List.of("T2"))), null));
            assertTrue(Workspace.sameBytes(before, ws.snapshot()));
        }

        @Test
        @DisplayName("an unknown dependency is reported as unsatisfied")
        void unknownDependency() {
            var before = ws.snapshot();

            var ex = assertThrows(DependencyUnsatisfiedException.class, () -> ws.planner.apply("Ghost",
                    List.of(feature("F1", List.of("T99"), List.of())), null));
            assertEquals(List.of("T99"), ex.unmet());
            assertTrue(Workspace.sameBytes(before, ws.snapshot()));
        }

        @Test
        @DisplayName("an id already in the graph is rejected")
        void duplicateId() {
            assertThrows(EnhancementRejectedException.class, () -> ws.planner.apply("Dup",
                    List.of(feature("T3", List.of(), List.of())), null));
        }

        @Test
        @DisplayName("a started task cannot take a new dependency")
        void requiredByStarted() {
            ws.store.atomicUpdate(state -> {
                var graph = state.graph();
                state.graph(graph.withTask(graph.requireTask("T1").started(Instant.EPOCH))
                        .withMilestone(graph.requireMilestone("M1").withStatus(MilestoneStatus.IN_PROGRESS)));
                return null;
            });

            var ex = assertThrows(EnhancementRejectedException.class, () -> ws.planner.apply("Late",
                    List.of(feature("F1", List.of(), List.of("T1"))), null));
            assertTrue(ex.getMessage().contains("already in_progress"));
        }

        @Test
        @DisplayName("a blank request without tasks is rejected")
        void blankDescription() {
            assertThrows(EnhancementRejectedException.class, () -> ws.planner.apply("  ", List.of(), null));
        }

        @Test
        @DisplayName("new placements are counted by kind")
        void metrics() {
            ws.planner.apply("One", List.of(), null);

            assertEquals(1.0, ws.registry.get("waypoint.enhancement.placements")
                    .tag("placement", "existing").counter().count());
        }
    }

    // ── Deferred features ────────────────────────────────────────────

    @Nested
    class Deferred {

        @Test
        @DisplayName("defer assigns sequential ids")
        void defer() {
            var first = ws.planner.defer("Dark mode", "not this sprint");
            var second = ws.planner.defer("Offline sync", null);

            assertEquals("DEF-001", first.id());
            assertEquals("not this sprint", first.reason());
            assertEquals("DEF-002", second.id());
            assertNull(second.reason());
            assertEquals(2, ws.store.load().deferredFeatures().size());
        }

        @Test
        @DisplayName("implementing a deferred feature removes it from the backlog")
        void implementDeferred() {
            ws.withDeferred(List.of(new DeferredFeature("DEF-001", "Dark mode", null, Instant.EPOCH)));

            var result = ws.planner.apply(null, List.of(), "DEF-001");

            assertEquals("Dark mode", result.description());
            assertEquals("DEF-001", result.resolvedDeferredId());
            assertTrue(ws.store.load().deferredFeatures().isEmpty());
            assertEquals(EnhancementSource.DEFERRED,
                    ws.graph().requireTask(result.taskIds().get(0)).enhancement().source());
        }

        @Test
        @DisplayName("an unknown deferred id is not found")
        void unknownDeferred() {
            assertThrows(TaskNotFoundException.class, () -> ws.planner.apply(null, List.of(), "DEF-404"));
        }
    }

    // ── Tracker ──────────────────────────────────────────────────────

    @Nested
    class TrackerFollowsNewMilestone {

        @Test
        @DisplayName("a milestone inserted before the current one becomes current")
        void insertedBeforeCurrent() {
            ws.with(firstMilestoneValidated(), trackerAt(SprintStatus.IN_PROGRESS, "M2"));

            var result = ws.planner.apply("Hardening", features(4, List.of(), List.of("T5")), null);

            assertEquals(Placement.Kind.NEW_MILESTONE, result.placement().kind());
            assertEquals(1, ws.graph().milestoneIndex("M3"));
            assertEquals("M3", ws.tracker().currentMilestoneId());
        }

        @Test
        @DisplayName("a completed sprint reopens on the new milestone")
        void reopensCompletedSprint() {
            var graph = firstMilestoneValidated();
            for (String id : List.of("T5", "T6", "M2-VAL")) {
                graph = graph.withTask(withStatus(graph.requireTask(id), TaskStatus.COMPLETED));
            }
            graph = graph.withMilestone(graph.requireMilestone("M2").withStatus(MilestoneStatus.VALIDATED));
            ws.with(graph, trackerAt(SprintStatus.COMPLETED, "M2"));

            ws.planner.apply("Follow-up", List.of(), null);

            assertEquals(SprintStatus.IN_PROGRESS, ws.tracker().status());
            assertEquals("M3", ws.tracker().currentMilestoneId());
        }

        @Test
        @DisplayName("a milestone appended after the current one leaves the tracker alone")
        void appendedAfterCurrent() {
            ws.with(twoMilestones(), trackerAt(SprintStatus.IN_PROGRESS, "M1"));

            ws.planner.apply("Reporting", features(4, List.of("T5"), List.of()), null);

            assertEquals("M1", ws.tracker().currentMilestoneId());
        }
    }
}
