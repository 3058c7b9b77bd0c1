package com.waypoint.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Waypoint-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operation) {
        MDC.put("operation", operation);
    }

    public static void setSprint(String sprintId) {
        if (sprintId != null) {
            MDC.put("sprintId", sprintId);
        }
    }

    public static void setTask(String sprintId, String taskId, String milestoneId) {
        setSprint(sprintId);
        MDC.put("taskId", taskId);
        if (milestoneId != null) {
            MDC.put("milestoneId", milestoneId);
        }
    }

    public static void setMilestone(String sprintId, String milestoneId) {
        setSprint(sprintId);
        MDC.put("milestoneId", milestoneId);
    }

    public static void clear() {
        MDC.remove("operation");
        MDC.remove("sprintId");
        MDC.remove("taskId");
        MDC.remove("milestoneId");
    }
}
