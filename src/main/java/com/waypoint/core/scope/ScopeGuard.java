package com.waypoint.core.scope;

import com.waypoint.core.error.SchemaValidationException;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.ApprovedStack;
import com.waypoint.core.model.ForbiddenPattern;
import com.waypoint.core.model.GuardrailConfig;
import com.waypoint.core.model.PatternTarget;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.persistence.StateFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a task's changes against its declared boundary and the sprint guardrails.
 * <p>
 * Violations are reported in full and never corrected.
 */
@Service
public class ScopeGuard {

    private static final Logger log = LoggerFactory.getLogger(ScopeGuard.class);

    private static final String GLOB_CHARS = "*?[{";

    private final WaypointMetrics metrics;

    public ScopeGuard(WaypointMetrics metrics) {
        this.metrics = metrics;
    }

    public ScopeBrief preCheck(TaskGraph graph, Task task, GuardrailConfig guardrails) {
        return new ScopeBrief(
                task.id(),
                task.scope().mustImplement(),
                task.scope().mustNotImplement(),
                graph.effectiveMaxFileChanges(task),
                task.scope().technologies(),
                guardrails.forbiddenPatterns());
    }

    /**
     * @throws ScopeViolationException listing every violation found
     */
    public void postCheck(TaskGraph graph, Task task, List<ChangedFile> changedFiles, GuardrailConfig guardrails) {
        var violations = violations(graph, task, changedFiles, guardrails);
        if (!violations.isEmpty()) {
            throw new ScopeViolationException(task.id(), violations);
        }
    }

    /**
     * Every scope violation in {@code changedFiles}, budget first, then per file in the given order.
     */
    public List<ScopeViolation> violations(TaskGraph graph, Task task, List<ChangedFile> changedFiles,
                                           GuardrailConfig guardrails) {
        var files = distinct(changedFiles);
        var violations = new ArrayList<ScopeViolation>();

        int budget = graph.effectiveMaxFileChanges(task);
        if (files.size() > budget) {
            var excess = files.subList(budget, files.size()).stream().map(ChangedFile::path).toList();
            violations.add(new ScopeViolation(ScopeViolation.Kind.FILE_BUDGET, excess, "max_file_changes=" + budget, null,
                    files.size() + " files changed against a budget of " + budget + " (" + excess.size()
                            + " over): " + String.join(", ", excess)));
        }

        var patterns = compile(guardrails);
        for (var file : files) {
            for (var marker : task.scope().mustNotImplement()) {
                if (matchesMarker(marker, file.path())) {
                    violations.add(new ScopeViolation(ScopeViolation.Kind.FORBIDDEN_MARKER, List.of(file.path()), marker, null,
                            file.path() + " matches must_not_implement marker '" + marker + "'"));
                }
            }
            for (var entry : patterns.entrySet()) {
                var violation = matchPattern(entry.getKey(), entry.getValue(), file);
                if (violation != null) {
                    violations.add(violation);
                }
            }
        }

        record(violations);
        if (!violations.isEmpty()) {
            log.warn("Task {} post-check found {} scope violation(s)", task.id(), violations.size());
        }
        return violations;
    }

    /**
     * @throws TechNonComplianceException if any referenced technology is unapproved or not pinned
     *                                    to exactly the approved version
     */
    public void techCompliance(Task task, ApprovedStack approvedStack) {
        var violations = techViolations(task, approvedStack);
        if (!violations.isEmpty()) {
            throw new TechNonComplianceException(task.id(), violations);
        }
    }

    /**
     * Technologies the task references that the approved stack does not allow. An empty or
     * missing registry means none is configured and nothing is checked.
     */
    public List<TechViolation> techViolations(Task task, ApprovedStack approvedStack) {
        if (approvedStack == null || approvedStack.technologies().isEmpty()) {
            log.debug("No approved stack configured; skipping technology check for task {}", task.id());
            return List.of();
        }
        var violations = new ArrayList<TechViolation>();
        for (var entry : task.scope().technologies().entrySet()) {
            String name = entry.getKey();
            String version = entry.getValue();
            String approved = approvedStack.technologies().get(name);
            if (approved == null) {
                violations.add(new TechViolation(name, version, null,
                        name + " " + version + " is not in the approved stack"));
            } else if (!approved.equals(version)) {
                String why = isRange(version)
                        ? "version ranges are not allowed, pin " + approved
                        : "approved version is " + approved;
                violations.add(new TechViolation(name, version, approved, name + " " + version + ": " + why));
            }
        }
        if (!violations.isEmpty()) {
            metrics.recordScopeViolations("tech_non_compliance", violations.size());
            log.warn("Task {} references {} non-compliant technolog(ies)", task.id(), violations.size());
        }
        return violations;
    }

    static boolean matchesMarker(String marker, String path) {
        if (marker == null || marker.isBlank()) {
            return false;
        }
        if (isGlob(marker)) {
            try {
                PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + marker);
                return matcher.matches(Paths.get(path));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unusable must_not_implement glob '{}': {}", marker, e.getMessage());
                return false;
            }
        }
        return path.toLowerCase(Locale.ROOT).contains(marker.toLowerCase(Locale.ROOT));
    }

    private static boolean isGlob(String marker) {
        return marker.chars().anyMatch(c -> GLOB_CHARS.indexOf(c) >= 0);
    }

    private static boolean isRange(String version) {
        String v = version.trim();
        return v.startsWith("^") || v.startsWith("~") || v.startsWith(">") || v.startsWith("<")
                || v.startsWith("=") || v.contains("*") || v.contains(" ") || v.contains(",")
                || v.matches(".*\\.[xX](\\..*)?") || v.startsWith("[") || v.startsWith("(");
    }

    private static ScopeViolation matchPattern(ForbiddenPattern pattern, Pattern regex, ChangedFile file) {
        String subject = pattern.target() == PatternTarget.PATH ? file.path() : file.content();
        if (subject == null) {
            return null;
        }
        Matcher matcher = regex.matcher(subject);
        if (!matcher.find()) {
            return null;
        }
        String where = pattern.target() == PatternTarget.PATH
                ? file.path()
                : file.path() + ":" + lineOf(subject, matcher.start());
        return new ScopeViolation(ScopeViolation.Kind.FORBIDDEN_PATTERN, List.of(file.path()), pattern.id(), matcher.group(),
                where + " matches forbidden pattern '" + pattern.id() + "': " + matcher.group());
    }

    private static int lineOf(String content, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static Map<ForbiddenPattern, Pattern> compile(GuardrailConfig guardrails) {
        Map<ForbiddenPattern, Pattern> compiled = new LinkedHashMap<>();
        for (var pattern : guardrails.forbiddenPatterns()) {
            if (pattern.regex() == null || pattern.regex().isEmpty()) {
                throw new SchemaValidationException(StateFiles.GUARDRAILS,
                        "forbidden pattern '" + pattern.id() + "' has no regex", null);
            }
            try {
                compiled.put(pattern, Pattern.compile(pattern.regex()));
            } catch (PatternSyntaxException e) {
                throw new SchemaValidationException(StateFiles.GUARDRAILS,
                        "forbidden pattern '" + pattern.id() + "' has an invalid regex: " + e.getMessage(), e);
            }
        }
        return compiled;
    }

    private static List<ChangedFile> distinct(List<ChangedFile> changedFiles) {
        Map<String, ChangedFile> byPath = new LinkedHashMap<>();
        for (var file : changedFiles) {
            if (!file.path().isEmpty()) {
                byPath.merge(file.path(), file, (a, b) -> a.content() != null ? a : b);
            }
        }
        return new ArrayList<>(byPath.values());
    }

    private void record(List<ScopeViolation> violations) {
        Map<ScopeViolation.Kind, Integer> counts = new EnumMap<>(ScopeViolation.Kind.class);
        for (var violation : violations) {
            counts.merge(violation.kind(), 1, Integer::sum);
        }
        counts.forEach((kind, count) -> metrics.recordScopeViolations(kind.tag(), count));
    }
}
