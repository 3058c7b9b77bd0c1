package com.waypoint.core.persistence;

import com.waypoint.core.error.SchemaValidationException;
import com.waypoint.core.model.GuardrailConfig;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.waypoint.support.Fixtures.twoMilestones;
import static org.junit.jupiter.api.Assertions.*;

class StateMapperTest {

    @TempDir
    Path dir;

    private final StateMapper mapper = new StateMapper();

    private Path file(String name, String json) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("reads a snake_case task graph")
    void readsGraph() throws IOException {
        Path file = file("task_graph.json", """
                {
                  "sprint_id": "S-1",
                  "milestone_strategy": {"min_tasks_per_milestone": 1, "max_tasks_per_milestone": 4},
                  "milestones": [{"id": "M1", "title": "One", "task_ids": ["A", "M1-VAL"], "status": "in_progress"}],
                  "tasks": [
                    {"id": "A", "title": "Build A", "milestone_id": "M1",
                     "scope": {"max_file_changes": 2, "must_not_implement": ["payment"]}},
                    {"id": "M1-VAL", "title": "Validate", "type": "validation", "milestone_id": "M1"}
                  ]
                }
                """);

        var graph = mapper.readGraph(file);

        assertEquals("S-1", graph.sprintId());
        assertEquals(4, graph.milestoneStrategy().maxTasksPerMilestone());
        assertEquals(MilestoneStatus.IN_PROGRESS, graph.milestones().get(0).status());
        assertEquals(TaskType.WORK, graph.requireTask("A").type());
        assertEquals(2, graph.requireTask("A").scope().maxFileChanges());
        assertEquals(TaskType.VALIDATION, graph.requireTask("M1-VAL").type());
    }

    @Test
    @DisplayName("unknown fields are rejected with their location")
    void unknownField() throws IOException {
        Path file = file("task_graph.json", """
                {"sprint_id": "S-1", "tasks": [{"id": "A", "title": "A", "priority": 1}]}
                """);

        var ex = assertThrows(SchemaValidationException.class, () -> mapper.readGraph(file));

        assertTrue(ex.getMessage().contains("task_graph.json"));
        assertTrue(ex.getMessage().contains("priority"));
    }

    @Test
    @DisplayName("unknown enum values are rejected")
    void unknownStatus() throws IOException {
        Path file = file("task_graph.json", """
                {"sprint_id": "S-1", "tasks": [{"id": "A", "title": "A", "status": "done"}]}
                """);
        assertThrows(SchemaValidationException.class, () -> mapper.readGraph(file));
    }

    @Test
    @DisplayName("malformed JSON is a schema error")
    void malformed() throws IOException {
        Path file = file("progress_tracker.json", "{\"sprint_id\": ");
        var ex = assertThrows(SchemaValidationException.class, () -> mapper.readTracker(file));
        assertTrue(ex.getMessage().contains("progress_tracker.json"));
    }

    @Test
    @DisplayName("missing required file is a schema error")
    void missingFile() {
        assertThrows(SchemaValidationException.class, () -> mapper.readGraph(dir.resolve("task_graph.json")));
    }

    @Test
    @DisplayName("optional files fall back to defaults")
    void optionalFiles() {
        assertEquals(GuardrailConfig.defaults(), mapper.readGuardrails(dir.resolve("guardrails.json")));
        assertTrue(mapper.readApprovedStack(dir.resolve("approved_stack.json")).technologies().isEmpty());
        assertTrue(mapper.readDeferredFeatures(dir.resolve("deferred_features.json")).isEmpty());
    }

    @Test
    @DisplayName("serialization is stable and snake_case")
    void stableOutput() throws IOException {
        String first = mapper.toJson(twoMilestones());
        String second = mapper.toJson(mapper.readGraph(file("task_graph.json", first)));

        assertEquals(first, second);
        assertTrue(first.contains("\"sprint_id\""));
        assertTrue(first.contains("\"task_ids\""));
        assertTrue(first.contains("\"not_started\""));
    }
}
