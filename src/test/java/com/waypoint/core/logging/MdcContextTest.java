package com.waypoint.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setOperation puts operation in MDC")
    void setOperation() {
        MdcContext.setOperation("start-task");
        assertEquals("start-task", MDC.get("operation"));
    }

    @Test
    @DisplayName("setSprint ignores a null sprint")
    void setSprintNull() {
        MdcContext.setSprint(null);
        assertNull(MDC.get("sprintId"));
    }

    @Test
    @DisplayName("setTask puts sprintId, taskId, and milestoneId in MDC")
    void setTask() {
        MdcContext.setTask("SPRINT-1", "T1", "M1");
        assertEquals("SPRINT-1", MDC.get("sprintId"));
        assertEquals("T1", MDC.get("taskId"));
        assertEquals("M1", MDC.get("milestoneId"));
    }

    @Test
    @DisplayName("setTask without a milestone leaves milestoneId unset")
    void setTaskWithoutMilestone() {
        MdcContext.setTask("SPRINT-1", "T404", null);
        assertEquals("T404", MDC.get("taskId"));
        assertNull(MDC.get("milestoneId"));
    }

    @Test
    @DisplayName("setMilestone puts sprintId and milestoneId in MDC")
    void setMilestone() {
        MdcContext.setMilestone("SPRINT-1", "M2");
        assertEquals("SPRINT-1", MDC.get("sprintId"));
        assertEquals("M2", MDC.get("milestoneId"));
    }

    @Test
    @DisplayName("clear removes all waypoint MDC keys")
    void clear() {
        MdcContext.setOperation("complete-task");
        MdcContext.setTask("SPRINT-1", "T1", "M1");
        MDC.put("unrelated", "kept");
        MdcContext.clear();
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("sprintId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("milestoneId"));
        assertEquals("kept", MDC.get("unrelated"));
        MDC.remove("unrelated");
    }
}
