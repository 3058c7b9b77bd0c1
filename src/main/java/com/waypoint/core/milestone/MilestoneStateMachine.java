package com.waypoint.core.milestone;

import com.waypoint.core.error.InvalidTransitionException;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.EnhancementMetadata;
import com.waypoint.core.model.EnhancementSource;
import com.waypoint.core.model.HistoryEntry;
import com.waypoint.core.model.HistoryEvent;
import com.waypoint.core.model.Milestone;
import com.waypoint.core.model.MilestoneStatus;
import com.waypoint.core.model.ProgressTracker;
import com.waypoint.core.model.ScopeBoundary;
import com.waypoint.core.model.SprintStatus;
import com.waypoint.core.model.Task;
import com.waypoint.core.model.TaskGraph;
import com.waypoint.core.model.TaskStatus;
import com.waypoint.core.model.TaskType;
import com.waypoint.core.model.ValidationRecord;
import com.waypoint.core.model.ValidationStatus;
import com.waypoint.core.state.SprintState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Milestone lifecycle and the human-validation gate.
 * <p>
 * Reacts to task transitions made inside a store transaction and records the external
 * validator's verdict. A milestone whose work is done becomes COMPLETE and raises the
 * gate; only a passing validation lowers it and moves work on to the next milestone.
 */
@Service
public class MilestoneStateMachine {

    private static final Logger log = LoggerFactory.getLogger(MilestoneStateMachine.class);

    private static final int MAX_TITLE_LENGTH = 60;

    private final WaypointMetrics metrics;
    private final Clock clock;

    public MilestoneStateMachine(WaypointMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Called after {@code task} moved to in_progress. Starts its milestone on the first task.
     */
    public void onTaskStarted(SprintState state, Task task) {
        Instant now = clock.instant();
        Milestone milestone = state.graph().requireMilestone(task.milestoneId());
        if (milestone.status() == MilestoneStatus.NOT_STARTED) {
            transition(state, milestone, MilestoneStatus.IN_PROGRESS);
            state.record(new HistoryEntry(now, HistoryEvent.MILESTONE_STARTED, null, milestone.id(), milestone.title()));
        }
        ProgressTracker tracker = state.tracker();
        if (tracker.status() == SprintStatus.PLANNED) {
            tracker = tracker.withStatus(SprintStatus.IN_PROGRESS);
        }
        if (tracker.currentMilestoneId() == null) {
            tracker = tracker.withCurrentMilestone(milestone.id());
        }
        state.tracker(tracker);
        state.record(new HistoryEntry(now, HistoryEvent.TASK_STARTED, task.id(), milestone.id(), task.title()));
    }

    /**
     * Called after {@code task} moved to completed. Completes its milestone once every
     * non-validation task is done, which raises the validation gate.
     */
    public void onTaskCompleted(SprintState state, Task task) {
        Instant now = clock.instant();
        state.record(new HistoryEntry(now, HistoryEvent.TASK_COMPLETED, task.id(), task.milestoneId(), task.title()));
        Milestone milestone = state.graph().requireMilestone(task.milestoneId());
        if (milestone.status() == MilestoneStatus.IN_PROGRESS && workDone(state.graph(), milestone)) {
            complete(state, milestone, now);
        }
    }

    /**
     * Applies the external validator's verdict for a COMPLETE milestone.
     * <p>
     * Passed: the validation task is completed, the milestone becomes VALIDATED and work
     * moves to the next unvalidated milestone. Failed: the milestone is reopened with one
     * remediation task per issue (a single generic one when no issue was given), inserted
     * before the validation task.
     *
     * @throws InvalidTransitionException if the milestone is not COMPLETE
     */
    public ValidationOutcome recordValidation(SprintState state, String milestoneId, boolean passed, List<String> issues) {
        Instant now = clock.instant();
        Milestone milestone = state.graph().requireMilestone(milestoneId);
        if (milestone.status() != MilestoneStatus.COMPLETE) {
            throw new InvalidTransitionException("Milestone " + milestoneId,
                    "validation can only be recorded for a complete milestone, but it is "
                            + milestone.status().name().toLowerCase(Locale.ROOT));
        }
        List<String> reported = issues == null ? List.of() : issues.stream()
                .filter(i -> i != null && !i.isBlank())
                .map(String::trim)
                .toList();
        state.tracker(state.tracker()
                .append(new ValidationRecord(milestoneId, now,
                        passed ? ValidationStatus.PASSED : ValidationStatus.FAILED, reported))
                .withValidationPending(false));

        ValidationOutcome outcome = passed ? pass(state, milestone, now) : fail(state, milestone, reported, now);
        keepGateWhileComplete(state);
        return outcome;
    }

    private ValidationOutcome pass(SprintState state, Milestone milestone, Instant now) {
        Task validation = state.graph().requireTask(milestone.validationTaskId());
        Task done = validation.completed(now);
        state.graph(state.graph().withTask(done));
        transition(state, milestone, MilestoneStatus.VALIDATED);
        state.record(new HistoryEntry(now, HistoryEvent.MILESTONE_VALIDATED, validation.id(), milestone.id(), null));

        Milestone next = state.graph().milestones().stream()
                .filter(m -> m.status() != MilestoneStatus.VALIDATED)
                .findFirst()
                .orElse(null);
        if (next == null) {
            state.tracker(state.tracker().withStatus(SprintStatus.COMPLETED));
            log.info("Milestone {} validated; all milestones are validated", milestone.id());
            return new ValidationOutcome(milestone.id(), MilestoneStatus.VALIDATED, List.of(), null);
        }

        state.tracker(state.tracker().withCurrentMilestone(next.id()).withStatus(SprintStatus.IN_PROGRESS));
        log.info("Milestone {} validated; work moves to {}", milestone.id(), next.id());
        if (next.status() == MilestoneStatus.NOT_STARTED && workDone(state.graph(), next)) {
            // nothing to execute, so the gate goes straight back up for this one
            transition(state, next, MilestoneStatus.IN_PROGRESS);
            state.record(new HistoryEntry(now, HistoryEvent.MILESTONE_STARTED, null, next.id(), next.title()));
            complete(state, state.graph().requireMilestone(next.id()), now);
        }
        return new ValidationOutcome(milestone.id(), MilestoneStatus.VALIDATED, List.of(), next.id());
    }

    private ValidationOutcome fail(SprintState state, Milestone milestone, List<String> issues, Instant now) {
        List<String> toRemediate = issues.isEmpty()
                ? List.of("Address validation failure of milestone " + milestone.id())
                : issues;

        String requestId = "validation-" + milestone.id() + "-" + state.tracker().validations().size();
        var created = new ArrayList<Task>();
        int n = 1;
        for (String issue : toRemediate) {
            String id;
            do {
                id = milestone.id() + "-REM-" + n++;
            } while (exists(state.graph(), id, created));
            created.add(new Task(id, title("Remediate: " + issue), issue, TaskType.REMEDIATION, List.of(),
                    TaskStatus.PENDING, milestone.id(), ScopeBoundary.unbounded(),
                    new EnhancementMetadata(requestId, issue, now, EnhancementSource.REMEDIATION), null, null));
        }
        var ids = created.stream().map(Task::id).toList();

        TaskGraph graph = state.graph().withTasksAdded(created);
        state.graph(graph.withMilestone(milestone.withTasksBeforeValidation(ids)));
        transition(state, state.graph().requireMilestone(milestone.id()), MilestoneStatus.IN_PROGRESS);
        state.tracker(state.tracker().withCurrentMilestone(milestone.id()).withStatus(SprintStatus.IN_PROGRESS));
        state.record(new HistoryEntry(now, HistoryEvent.MILESTONE_REOPENED, null, milestone.id(),
                "remediation tasks " + String.join(", ", ids)));
        log.warn("Milestone {} failed validation with {} issue(s); reopened with {}", milestone.id(), issues.size(), ids);
        return new ValidationOutcome(milestone.id(), MilestoneStatus.IN_PROGRESS, ids, milestone.id());
    }

    /**
     * Status, counts and validation history of one milestone.
     */
    public MilestoneReport report(TaskGraph graph, ProgressTracker tracker, String milestoneId) {
        Milestone milestone = graph.requireMilestone(milestoneId);
        var tasks = graph.tasksOf(milestone);
        Task validation = graph.findTask(milestone.validationTaskId()).orElse(null);
        int remediation = (int) tasks.stream().filter(t -> t.type() == TaskType.REMEDIATION).count();
        int completed = (int) tasks.stream().filter(t -> t.status() == TaskStatus.COMPLETED).count();
        var validations = tracker.validations().stream()
                .filter(v -> milestoneId.equals(v.milestoneId()))
                .toList();
        return new MilestoneReport(
                milestone.id(),
                milestone.title(),
                milestone.status(),
                graph.milestoneIndex(milestoneId),
                graph.workload(milestone),
                remediation,
                tasks.size(),
                completed,
                graph.minTasks(milestone),
                graph.maxTasks(milestone),
                validation == null ? null : validation.id(),
                validation == null ? null : validation.status(),
                milestoneId.equals(tracker.currentMilestoneId()),
                tracker.validationPending() && milestone.status() == MilestoneStatus.COMPLETE,
                milestone.taskIds(),
                validations);
    }

    private void complete(SprintState state, Milestone milestone, Instant now) {
        transition(state, milestone, MilestoneStatus.COMPLETE);
        state.tracker(state.tracker()
                .withValidationPending(true)
                .withStatus(SprintStatus.AWAITING_VALIDATION));
        state.record(new HistoryEntry(now, HistoryEvent.MILESTONE_COMPLETED, null, milestone.id(),
                "awaiting validation"));
        log.info("Milestone {} complete; awaiting validation", milestone.id());
    }

    /**
     * The gate stays up while any milestone is still complete and unvalidated.
     */
    private static void keepGateWhileComplete(SprintState state) {
        var stillComplete = state.graph().milestones().stream()
                .filter(m -> m.status() == MilestoneStatus.COMPLETE)
                .map(Milestone::id)
                .toList();
        if (!stillComplete.isEmpty() && !state.tracker().validationPending()) {
            state.tracker(state.tracker().withValidationPending(true).withStatus(SprintStatus.AWAITING_VALIDATION));
            log.warn("Milestone(s) {} still await validation; keeping the validation gate up", stillComplete);
        }
    }

    private void transition(SprintState state, Milestone milestone, MilestoneStatus target) {
        MilestoneStatus from = milestone.status();
        if (!from.canTransitionTo(target)) {
            throw new InvalidTransitionException("Milestone " + milestone.id(),
                    from.name().toLowerCase(Locale.ROOT), target.name().toLowerCase(Locale.ROOT));
        }
        state.graph(state.graph().withMilestone(milestone.withStatus(target)));
        metrics.recordMilestoneTransition(from.name().toLowerCase(Locale.ROOT), target.name().toLowerCase(Locale.ROOT));
        log.debug("Milestone {}: {} -> {}", milestone.id(), from, target);
    }

    private static boolean workDone(TaskGraph graph, Milestone milestone) {
        return graph.tasksOf(milestone).stream()
                .filter(t -> !t.isValidation())
                .allMatch(t -> t.status() == TaskStatus.COMPLETED);
    }

    private static boolean exists(TaskGraph graph, String id, List<Task> pending) {
        return graph.findTask(id).isPresent() || pending.stream().anyMatch(t -> t.id().equals(id));
    }

    private static String title(String text) {
        String oneLine = text.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= MAX_TITLE_LENGTH ? oneLine : oneLine.substring(0, MAX_TITLE_LENGTH - 3) + "...";
    }
}
