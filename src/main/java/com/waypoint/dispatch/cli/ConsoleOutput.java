package com.waypoint.dispatch.cli;

import com.waypoint.core.engine.ErrorInfo;
import com.waypoint.core.scope.ScopeViolation;
import com.waypoint.core.scope.TechViolation;
import picocli.CommandLine;

import java.util.Collection;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Waypoint CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WAYPOINT v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WAYPOINT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void field(String label, Object value) {
        System.out.printf("  %-20s %s%n", label, value == null ? "-" : value);
    }

    public static void list(String label, Collection<?> values) {
        field(label, values == null || values.isEmpty() ? "-" : String.join(", ", values.stream().map(String::valueOf).toList()));
    }

    /**
     * Renders a failed or blocked operation: code, exit code and message, then any listed violations.
     */
    public static void failure(ErrorInfo error) {
        String label = error.fatal() ? "@|fg(red),bold " : "@|fg(yellow),bold ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                label + "[" + error.code() + "]|@ " + error.message()));
        Object violations = error.details().get("violations");
        if (violations instanceof Collection<?> items && !items.isEmpty()) {
            for (Object item : items) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("    @|fg(red) -|@ " + describe(item)));
            }
        }
    }

    /**
     * Lowercase display form of an enum constant, e.g. {@code IN_PROGRESS -> in_progress}.
     */
    public static String label(Enum<?> value) {
        return value == null ? "-" : value.name().toLowerCase();
    }

    public static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String describe(Object item) {
        if (item instanceof ScopeViolation v) {
            return v.message();
        }
        if (item instanceof TechViolation v) {
            return v.message();
        }
        if (item instanceof Map<?, ?> map && map.containsKey("message")) {
            return String.valueOf(map.get("message"));
        }
        return String.valueOf(item);
    }
}
